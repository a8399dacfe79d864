package io.guildflow.ticket;

import io.guildflow.engine.OutcomeKind;
import io.guildflow.engine.SideEffect;
import io.guildflow.gate.TicketOwnership;
import io.guildflow.platform.Channel;
import io.guildflow.platform.ChannelSpec;
import io.guildflow.platform.ChannelSpec.Permission;
import io.guildflow.platform.ChannelSpec.PermissionOverride;
import io.guildflow.platform.ChatMessage;
import io.guildflow.platform.ChatPlatform;
import io.guildflow.platform.Member;
import io.guildflow.platform.OutboundMessage;
import io.guildflow.platform.PlatformResult;
import io.guildflow.storage.RecordSet;
import io.guildflow.storage.RecordStore;
import io.guildflow.storage.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

public final class TicketWorkflow implements TicketOwnership {
    public static final String RECORD_SET = "tickets";
    public static final String DEFAULT_REASON = "No reason given";

    private static final Logger log = LoggerFactory.getLogger(TicketWorkflow.class);
    private static final Set<Permission> MEMBER_ACCESS = Set.of(Permission.VIEW, Permission.SEND, Permission.READ_HISTORY);
    private static final Set<Permission> STAFF_ACCESS = Set.of(
            Permission.VIEW, Permission.SEND, Permission.READ_HISTORY, Permission.MANAGE_CHANNEL
    );

    private final RecordSet<TicketRecord> tickets;
    private final ChatPlatform platform;
    private final Set<String> privilegedRoles;
    private final String channelPrefix;
    private final String archiveChannelName;
    private final Duration deleteDelay;
    private final TranscriptRenderer transcripts;
    private final Clock clock;

    public TicketWorkflow(
            RecordStore store,
            ChatPlatform platform,
            Set<String> privilegedRoles,
            String channelPrefix,
            String archiveChannelName,
            Duration deleteDelay,
            Clock clock
    ) {
        this.tickets = RecordSet.open(store, RECORD_SET, TicketRecord.class);
        this.platform = platform;
        this.privilegedRoles = Set.copyOf(privilegedRoles);
        this.channelPrefix = channelPrefix;
        this.archiveChannelName = archiveChannelName;
        this.deleteDelay = deleteDelay;
        this.transcripts = new TranscriptRenderer(clock.getZone());
        this.clock = clock;
    }

    public CreateOutcome create(Member creator, String reason, long guildId) {
        String resolvedReason = reason == null || reason.isBlank() ? DEFAULT_REASON : reason.trim();
        long number;
        try {
            number = tickets.nextSequence();
        } catch (StoreException e) {
            log.error("Ticket number for {} not drawn: {}", creator.id(), e.getMessage(), e);
            return CreateOutcome.failed(OutcomeKind.TRANSIENT_IO);
        }
        String label = String.format("%04d", number);
        PlatformResult<Channel> created = platform.createChannel(guildId, channelSpec(label, creator));
        if (!created.isOk()) {
            log.error("Ticket #{} channel for {} not created: {} {}", label, creator.id(), created.status(), created.detail());
            return CreateOutcome.failed(created.status() == PlatformResult.Status.FORBIDDEN
                    ? OutcomeKind.EXTERNAL_FORBIDDEN
                    : OutcomeKind.TRANSIENT_IO);
        }
        Channel channel = created.value();
        TicketRecord record = new TicketRecord(
                channel.id(), number, creator.id(), creator.displayName(), resolvedReason,
                TicketStatus.OPEN, Instant.now(clock), null, null, List.of()
        );
        try {
            tickets.update(key(channel.id()), current -> RecordSet.Change.put(record, record));
        } catch (StoreException e) {
            log.error("Ticket #{} record for channel {} not persisted, removing channel: {}",
                    label, channel.id(), e.getMessage(), e);
            PlatformResult<Void> removed = platform.deleteChannel(channel.id(), "Ticket record could not be saved");
            if (!removed.isOk()) {
                log.error("Orphaned ticket channel {} could not be removed: {}", channel.id(), removed.detail());
            }
            return CreateOutcome.failed(OutcomeKind.TRANSIENT_IO);
        }
        log.info("Ticket #{} created by {} in {}", label, creator.name(), channel.name());
        return new CreateOutcome(
                OutcomeKind.OK,
                record,
                channel,
                List.of(new SideEffect.SendMessage(channel.id(), welcomeCard(record, creator)))
        );
    }

    public OutcomeKind addParticipant(long channelId, Member user) {
        try {
            OutcomeKind kind = tickets.update(key(channelId), current -> {
                if (current == null || !current.open()) {
                    return RecordSet.Change.none(OutcomeKind.NOT_TICKET_CHANNEL);
                }
                PlatformResult<Void> granted = platform.setChannelPermissions(channelId, user.id(), MEMBER_ACCESS);
                if (!granted.isOk()) {
                    log.error("Access for {} to ticket channel {} not granted: {} {}",
                            user.id(), channelId, granted.status(), granted.detail());
                    return RecordSet.Change.none(granted.status() == PlatformResult.Status.FORBIDDEN
                            ? OutcomeKind.EXTERNAL_FORBIDDEN
                            : OutcomeKind.TRANSIENT_IO);
                }
                return RecordSet.Change.put(current.withParticipant(user.id()), OutcomeKind.OK);
            });
            if (kind.ok()) {
                log.info("User {} added to ticket channel {}", user.name(), channelId);
            }
            return kind;
        } catch (StoreException e) {
            log.error("Participant {} for ticket channel {} not recorded: {}", user.id(), channelId, e.getMessage(), e);
            return OutcomeKind.TRANSIENT_IO;
        }
    }

    public CloseOutcome close(Channel channel, Member closer) {
        if (!isTicketChannel(channel)) {
            return CloseOutcome.of(OutcomeKind.NOT_TICKET_CHANNEL, null);
        }
        try {
            CloseOutcome outcome = tickets.update(key(channel.id()), current -> {
                if (current == null) {
                    return RecordSet.Change.none(CloseOutcome.of(OutcomeKind.NOT_FOUND, null));
                }
                if (!current.open()) {
                    return RecordSet.Change.none(CloseOutcome.of(OutcomeKind.ALREADY_RESOLVED, current));
                }
                TicketRecord closed = current.closed(closer.id(), Instant.now(clock));
                List<SideEffect> effects = new ArrayList<>(transcriptEffects(channel, closed));
                effects.add(new SideEffect.DeleteChannelLater(
                        channel.id(), "Ticket closed by " + closer.displayName(), deleteDelay
                ));
                return RecordSet.Change.put(closed, new CloseOutcome(OutcomeKind.OK, closed, effects));
            });
            if (outcome.kind().ok()) {
                log.info("Ticket #{} closed by {}", outcome.record().label(), closer.name());
            }
            return outcome;
        } catch (StoreException e) {
            log.error("Close of ticket channel {} by {} abandoned: {}", channel.id(), closer.id(), e.getMessage(), e);
            return CloseOutcome.of(OutcomeKind.TRANSIENT_IO, null);
        }
    }

    @Override
    public boolean isTicketChannel(Channel channel) {
        if (channel == null) {
            return false;
        }
        return (channel.name() != null && channel.name().startsWith(channelPrefix))
                || tickets.get(key(channel.id())).isPresent();
    }

    @Override
    public OptionalLong creatorOf(long channelId) {
        return tickets.get(key(channelId))
                .map(record -> OptionalLong.of(record.creatorId()))
                .orElse(OptionalLong.empty());
    }

    public Optional<TicketRecord> find(long channelId) {
        return tickets.get(key(channelId));
    }

    public Map<String, TicketRecord> all() {
        return tickets.snapshot();
    }

    public long lastNumber() {
        return tickets.currentSequence();
    }

    private List<SideEffect> transcriptEffects(Channel channel, TicketRecord ticket) {
        Optional<Channel> archive = platform.findChannelByName(channel.guildId(), archiveChannelName);
        if (archive.isEmpty()) {
            log.error("Transcript channel '{}' not found, ticket #{} closes without transcript",
                    archiveChannelName, ticket.label());
            return List.of();
        }
        PlatformResult<List<ChatMessage>> history = platform.fetchHistory(channel.id());
        List<String> lines = List.of();
        if (history.isOk()) {
            lines = transcripts.lines(history.value());
        } else {
            log.warn("History of ticket #{} unavailable: {} {}", ticket.label(), history.status(), history.detail());
        }
        long archiveId = archive.get().id();
        List<SideEffect> effects = new ArrayList<>();
        effects.add(new SideEffect.SendMessage(archiveId, transcripts.summary(ticket, lines.size())));
        if (!lines.isEmpty()) {
            effects.add(new SideEffect.UploadFile(archiveId, transcripts.fileName(ticket), transcripts.document(ticket, lines)));
        }
        return effects;
    }

    private ChannelSpec channelSpec(String label, Member creator) {
        List<PermissionOverride> overrides = new ArrayList<>();
        overrides.add(PermissionOverride.denyEveryone(Set.of(Permission.VIEW)));
        overrides.add(PermissionOverride.allowMember(creator.id(), MEMBER_ACCESS));
        overrides.add(PermissionOverride.allowSelf(STAFF_ACCESS));
        for (String role : privilegedRoles) {
            overrides.add(PermissionOverride.allowRole(role, STAFF_ACCESS));
        }
        return new ChannelSpec(
                channelPrefix + label,
                "Ticket #" + label + " - opened by " + creator.displayName(),
                0,
                overrides
        );
    }

    private static OutboundMessage welcomeCard(TicketRecord record, Member creator) {
        return OutboundMessage.embed(new OutboundMessage.Embed(
                "🎟️ Ticket #" + record.label(),
                "**Opened by:** " + creator.mention() + "\n**Reason:** " + record.reason(),
                0x00ff00,
                List.of(new OutboundMessage.Field(
                        "📋 Instructions",
                        """
                                • Only staff can reply here
                                • Staff can use `/ticket add @user` to bring someone in
                                • Only staff can close the ticket with `/ticket close`
                                • A transcript is generated automatically on close""",
                        false
                )),
                "Ticket opened"
        ));
    }

    private static String key(long channelId) {
        return Long.toString(channelId);
    }

    public record CreateOutcome(OutcomeKind kind, TicketRecord record, Channel channel, List<SideEffect> effects) {
        static CreateOutcome failed(OutcomeKind kind) {
            return new CreateOutcome(kind, null, null, List.of());
        }
    }

    public record CloseOutcome(OutcomeKind kind, TicketRecord record, List<SideEffect> effects) {
        static CloseOutcome of(OutcomeKind kind, TicketRecord record) {
            return new CloseOutcome(kind, record, List.of());
        }
    }
}
