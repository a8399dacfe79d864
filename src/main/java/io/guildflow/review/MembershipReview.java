package io.guildflow.review;

import io.guildflow.engine.OutcomeKind;
import io.guildflow.platform.ChatPlatform;
import io.guildflow.platform.Member;
import io.guildflow.platform.OutboundMessage;
import io.guildflow.platform.PlatformResult;
import io.guildflow.platform.RoleRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class MembershipReview {
    private static final Logger log = LoggerFactory.getLogger(MembershipReview.class);

    static final String ROLE_REMEDIATION =
            "The bot cannot assign this role. Move the bot's role above the target role and make sure it has Manage Roles.";
    static final String BAN_REMEDIATION =
            "The bot cannot ban this member. Grant the bot the Ban Members permission and move its role above the member's highest role.";

    private final ChatPlatform platform;

    public MembershipReview(ChatPlatform platform) {
        this.platform = platform;
    }

    public ReviewOutcome accept(long guildId, Member target, RoleRef role, Member reviewer) {
        if (target == null || role == null) {
            return ReviewOutcome.of(OutcomeKind.INVALID_INPUT, null);
        }
        PlatformResult<Void> assigned = platform.assignRole(guildId, target.id(), role);
        if (!assigned.isOk()) {
            log.error("Role {} ({}) not assigned to {} ({}) by {}: {} {}",
                    role.name(), role.id(), target.name(), target.id(), reviewer.name(), assigned.status(), assigned.detail());
            return assigned.status() == PlatformResult.Status.FORBIDDEN
                    ? ReviewOutcome.of(OutcomeKind.EXTERNAL_FORBIDDEN, ROLE_REMEDIATION)
                    : ReviewOutcome.of(OutcomeKind.TRANSIENT_IO, null);
        }
        log.info("Application of {} ({}) accepted by {} with role {}", target.name(), target.id(), reviewer.name(), role.name());
        return new ReviewOutcome(OutcomeKind.OK, true, null);
    }

    public ReviewOutcome deny(long guildId, Member target, Member reviewer) {
        if (target == null) {
            return ReviewOutcome.of(OutcomeKind.INVALID_INPUT, null);
        }
        PlatformResult<Void> notified = platform.sendDirectMessage(target.id(), OutboundMessage.text(
                "Your application was denied by " + reviewer.displayName() + "."
        ));
        boolean dmDelivered = notified.isOk();
        if (!dmDelivered) {
            log.warn("Denial notice to {} ({}) not delivered: {} {}", target.name(), target.id(), notified.status(), notified.detail());
        }
        PlatformResult<Void> banned = platform.banUser(guildId, target.id(), "Application denied by " + reviewer.displayName());
        if (!banned.isOk()) {
            log.error("Ban of {} ({}) by {} failed: {} {}",
                    target.name(), target.id(), reviewer.name(), banned.status(), banned.detail());
            OutcomeKind kind = banned.status() == PlatformResult.Status.FORBIDDEN
                    ? OutcomeKind.EXTERNAL_FORBIDDEN
                    : OutcomeKind.TRANSIENT_IO;
            return new ReviewOutcome(kind, dmDelivered, kind == OutcomeKind.EXTERNAL_FORBIDDEN ? BAN_REMEDIATION : null);
        }
        log.info("Application of {} ({}) denied by {}, notified={}", target.name(), target.id(), reviewer.name(), dmDelivered);
        return new ReviewOutcome(OutcomeKind.OK, dmDelivered, null);
    }

    public record ReviewOutcome(OutcomeKind kind, boolean dmDelivered, String remediation) {
        static ReviewOutcome of(OutcomeKind kind, String remediation) {
            return new ReviewOutcome(kind, false, remediation);
        }
    }
}
