package io.guildflow.engine;

import io.guildflow.config.BotSettings;
import io.guildflow.counter.CounterService;
import io.guildflow.counter.FireReminder;
import io.guildflow.gate.AccessGate;
import io.guildflow.gate.Action;
import io.guildflow.observability.AuditLogger;
import io.guildflow.platform.ChatMessage;
import io.guildflow.platform.ChatPlatform;
import io.guildflow.platform.CommandInvocation;
import io.guildflow.platform.Member;
import io.guildflow.platform.OutboundMessage;
import io.guildflow.platform.PlatformResult;
import io.guildflow.platform.RoleRef;
import io.guildflow.review.MembershipReview;
import io.guildflow.storage.StoreException;
import io.guildflow.strike.Severity;
import io.guildflow.strike.StrikeLedger;
import io.guildflow.suggestion.Resolution;
import io.guildflow.suggestion.SuggestionCards;
import io.guildflow.suggestion.SuggestionWorkflow;
import io.guildflow.ticket.TicketWorkflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public final class CommandRouter {
    private static final Logger log = LoggerFactory.getLogger(CommandRouter.class);

    private final BotSettings settings;
    private final ChatPlatform platform;
    private final AccessGate gate;
    private final CounterService counters;
    private final StrikeLedger strikes;
    private final SuggestionWorkflow suggestions;
    private final TicketWorkflow tickets;
    private final MembershipReview review;
    private final SideEffectExecutor effects;
    private final AuditLogger audit;

    public CommandRouter(
            BotSettings settings,
            ChatPlatform platform,
            AccessGate gate,
            CounterService counters,
            StrikeLedger strikes,
            SuggestionWorkflow suggestions,
            TicketWorkflow tickets,
            MembershipReview review,
            SideEffectExecutor effects,
            AuditLogger audit
    ) {
        this.settings = settings;
        this.platform = platform;
        this.gate = gate;
        this.counters = counters;
        this.strikes = strikes;
        this.suggestions = suggestions;
        this.tickets = tickets;
        this.review = review;
        this.effects = effects;
        this.audit = audit;
    }

    public OutcomeKind route(CommandInvocation invocation) {
        Optional<Action> action = actionFor(invocation);
        if (action.isEmpty()) {
            log.warn("Unknown command '{}' from {}", invocation.path(), invocation.actor().name());
            replyPrivately(invocation, "❌ Unknown command: " + invocation.path());
            return OutcomeKind.INVALID_INPUT;
        }
        if (!gate.permits(invocation.actor(), action.get())) {
            replyPrivately(invocation, Replies.PERMISSION_DENIED);
            record(invocation, "-", OutcomeKind.PERMISSION, Map.of());
            return OutcomeKind.PERMISSION;
        }
        try {
            return switch (action.get()) {
                case SUGGEST_CREATE -> suggestCreate(invocation);
                case SUGGEST_RESOLVE -> suggestResolve(invocation);
                case TICKET_CREATE -> ticketCreate(invocation);
                case TICKET_CLOSE -> ticketClose(invocation);
                case TICKET_ADD_PARTICIPANT -> ticketAdd(invocation);
                case STRIKE_MANAGE -> strike(invocation);
                case MEMBER_REVIEW -> memberReview(invocation);
                case COUNTER_RESET -> counterReset(invocation);
            };
        } catch (StoreException e) {
            log.error("Command '{}' from {} abandoned: {}", invocation.path(), invocation.actor().id(), e.getMessage(), e);
            replyPrivately(invocation, Replies.TRANSIENT);
            return OutcomeKind.TRANSIENT_IO;
        }
    }

    static Optional<Action> actionFor(CommandInvocation invocation) {
        String sub = invocation.subcommand();
        Action action = switch (invocation.name()) {
            case "suggest" -> switch (sub) {
                case "create" -> Action.SUGGEST_CREATE;
                case "accept", "deny" -> Action.SUGGEST_RESOLVE;
                default -> null;
            };
            case "ticket" -> switch (sub) {
                case "create" -> Action.TICKET_CREATE;
                case "close" -> Action.TICKET_CLOSE;
                case "add" -> Action.TICKET_ADD_PARTICIPANT;
                default -> null;
            };
            case "strike" -> switch (sub) {
                case "add", "check", "remove" -> Action.STRIKE_MANAGE;
                default -> null;
            };
            case "accept", "deny" -> Action.MEMBER_REVIEW;
            case "counter" -> "reset".equals(sub) ? Action.COUNTER_RESET : null;
            default -> null;
        };
        return Optional.ofNullable(action);
    }

    private OutcomeKind suggestCreate(CommandInvocation invocation) {
        Optional<String> text = invocation.option("text");
        if (text.isEmpty()) {
            replyPrivately(invocation, "❌ Please describe your suggestion.");
            return OutcomeKind.INVALID_INPUT;
        }
        Member author = invocation.actor();
        long channelId = settings.suggestionChannelId();
        PlatformResult<ChatMessage> posted = platform.sendMessage(channelId, SuggestionCards.pending(
                author, text.get(), suggestions.upvoteEmoji(), suggestions.downvoteEmoji()
        ));
        if (!posted.isOk()) {
            log.error("Suggestion card for {} not posted in {}: {} {}", author.id(), channelId, posted.status(), posted.detail());
            replyPrivately(invocation, Replies.TRANSIENT);
            return OutcomeKind.TRANSIENT_IO;
        }
        long messageId = posted.value().id();
        SuggestionWorkflow.CreateOutcome outcome = suggestions.create(messageId, author, text.get(), channelId);
        if (!outcome.kind().ok()) {
            if (outcome.kind() != OutcomeKind.ALREADY_RESOLVED) {
                removeCard(channelId, messageId, author);
            }
            replyPrivately(invocation, Replies.forOutcome(outcome.kind(), "Suggestion"));
            return outcome.kind();
        }
        react(channelId, messageId, suggestions.upvoteEmoji());
        react(channelId, messageId, suggestions.downvoteEmoji());
        replyPrivately(invocation, "✅ Your suggestion has been posted in <#" + channelId + ">.");
        outcome.reminder().ifPresent(reminder -> fireSuggestionReminder(channelId, reminder));
        record(invocation, "suggestion:" + messageId, OutcomeKind.OK, Map.of());
        return OutcomeKind.OK;
    }

    private void removeCard(long channelId, long messageId, Member author) {
        PlatformResult<Void> removed = platform.deleteMessage(channelId, messageId);
        if (removed.isOk()) {
            log.info("Removed card {} of unrecorded suggestion by {}", messageId, author.id());
        } else {
            log.error("Card {} of unrecorded suggestion by {} left in {}: {} {}",
                    messageId, author.id(), channelId, removed.status(), removed.detail());
        }
    }

    private void react(long channelId, long messageId, String emoji) {
        PlatformResult<Void> reacted = platform.addReaction(channelId, messageId, emoji);
        if (!reacted.isOk()) {
            log.warn("Seed reaction {} on suggestion {} failed, its tally will undercount by one: {} {}",
                    emoji, messageId, reacted.status(), reacted.detail());
        }
    }

    private void fireSuggestionReminder(long channelId, FireReminder reminder) {
        log.info("Suggestion reminder fired after {} suggestions", reminder.threshold());
        effects.execute(new SideEffect.SendMessage(channelId, OutboundMessage.text(settings.reminderMessage())));
    }

    private OutcomeKind suggestResolve(CommandInvocation invocation) {
        Resolution resolution = "accept".equals(invocation.subcommand()) ? Resolution.ACCEPT : Resolution.DENY;
        Optional<String> rawId = invocation.option("message_id");
        if (rawId.isEmpty()) {
            replyPrivately(invocation, "❌ A message id is required.");
            return OutcomeKind.INVALID_INPUT;
        }
        long messageId;
        try {
            messageId = Long.parseLong(rawId.get());
        } catch (NumberFormatException e) {
            replyPrivately(invocation, Replies.forOutcome(OutcomeKind.NOT_FOUND, "Suggestion " + rawId.get()));
            return OutcomeKind.NOT_FOUND;
        }
        SuggestionWorkflow.ResolveOutcome outcome = suggestions.resolve(messageId, resolution, invocation.actor());
        record(invocation, "suggestion:" + messageId, outcome.kind(), Map.of("resolution", resolution.name()));
        if (!outcome.kind().ok()) {
            replyPrivately(invocation, Replies.forOutcome(outcome.kind(), "Suggestion " + messageId));
            return outcome.kind();
        }
        effects.executeAll(outcome.effects());
        String verb = resolution == Resolution.ACCEPT ? "accepted" : "denied";
        replyPrivately(invocation, "✅ Suggestion " + verb + " ("
                + suggestions.upvoteEmoji() + " " + outcome.record().finalVotes().upvotes() + " / "
                + suggestions.downvoteEmoji() + " " + outcome.record().finalVotes().downvotes() + ").");
        return OutcomeKind.OK;
    }

    private OutcomeKind ticketCreate(CommandInvocation invocation) {
        long guildId = invocation.channel() == null ? 0L : invocation.channel().guildId();
        TicketWorkflow.CreateOutcome outcome = tickets.create(
                invocation.actor(), invocation.option("reason").orElse(null), guildId
        );
        if (!outcome.kind().ok()) {
            record(invocation, "ticket:-", outcome.kind(), Map.of());
            replyPrivately(invocation, outcome.kind() == OutcomeKind.EXTERNAL_FORBIDDEN
                    ? "❌ The bot is not allowed to create channels. Grant it Manage Channels."
                    : Replies.forOutcome(outcome.kind(), "Ticket"));
            return outcome.kind();
        }
        effects.executeAll(outcome.effects());
        record(invocation, "ticket:" + outcome.record().label(), OutcomeKind.OK,
                Map.of("channel_id", outcome.channel().id()));
        replyPrivately(invocation, "✅ Ticket created: " + outcome.channel().mention());
        return OutcomeKind.OK;
    }

    private OutcomeKind ticketClose(CommandInvocation invocation) {
        if (invocation.channel() == null) {
            replyPrivately(invocation, Replies.NOT_TICKET_CHANNEL);
            return OutcomeKind.NOT_TICKET_CHANNEL;
        }
        TicketWorkflow.CloseOutcome outcome = tickets.close(invocation.channel(), invocation.actor());
        record(invocation, "ticket-channel:" + invocation.channel().id(), outcome.kind(), Map.of());
        if (!outcome.kind().ok()) {
            replyPrivately(invocation, Replies.forOutcome(outcome.kind(), "Ticket"));
            return outcome.kind();
        }
        long seconds = Math.max(1L, settings.ticketDeleteDelay().toSeconds());
        platform.reply(invocation, OutboundMessage.text(
                "🔒 Ticket #" + outcome.record().label() + " closed by " + invocation.actor().mention()
                        + ". This channel will be deleted in " + seconds + " seconds."
        ), false);
        effects.executeAll(outcome.effects());
        return OutcomeKind.OK;
    }

    private OutcomeKind ticketAdd(CommandInvocation invocation) {
        Optional<Member> user = invocation.member("user");
        if (user.isEmpty() || invocation.channel() == null) {
            replyPrivately(invocation, "❌ Choose a member to add.");
            return OutcomeKind.INVALID_INPUT;
        }
        OutcomeKind kind = tickets.addParticipant(invocation.channel().id(), user.get());
        record(invocation, "ticket-channel:" + invocation.channel().id(), kind, Map.of("user_id", user.get().id()));
        if (!kind.ok()) {
            replyPrivately(invocation, Replies.forOutcome(kind, "Ticket"));
            return kind;
        }
        platform.reply(invocation, OutboundMessage.text("✅ " + user.get().mention() + " has been added to this ticket."), false);
        return OutcomeKind.OK;
    }

    private OutcomeKind strike(CommandInvocation invocation) {
        Optional<Member> user = invocation.member("user");
        if (user.isEmpty()) {
            replyPrivately(invocation, "❌ Choose a member.");
            return OutcomeKind.INVALID_INPUT;
        }
        Member target = user.get();
        switch (invocation.subcommand()) {
            case "add" -> {
                Severity severity;
                try {
                    severity = Severity.fromString(invocation.option("severity").orElse(null));
                } catch (IllegalArgumentException e) {
                    replyPrivately(invocation, "❌ " + e.getMessage() + ". Use minor, moderate or severe.");
                    return OutcomeKind.INVALID_INPUT;
                }
                StrikeLedger.AddOutcome outcome = strikes.addStrike(
                        target, severity, invocation.option("reason").orElse(null), invocation.actor()
                );
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("severity", severity.name());
                details.put("escalation", outcome.escalation().name());
                record(invocation, "user:" + target.id(), outcome.kind(), details);
                if (!outcome.kind().ok()) {
                    replyPrivately(invocation, Replies.forOutcome(outcome.kind(), "Strike"));
                    return outcome.kind();
                }
                platform.reply(invocation, Replies.strikeAdded(target.displayName(), outcome), false);
                return OutcomeKind.OK;
            }
            case "check" -> {
                platform.reply(invocation, Replies.strikeSummary(target.displayName(), strikes.summarize(target.id())), true);
                return OutcomeKind.OK;
            }
            default -> {
                StrikeLedger.RemoveOutcome outcome = strikes.removeLastStrike(target.id());
                record(invocation, "user:" + target.id(), outcome.kind(), Map.of());
                if (!outcome.kind().ok()) {
                    replyPrivately(invocation, outcome.kind() == OutcomeKind.NOT_FOUND
                            ? "ℹ️ " + target.displayName() + " has no strikes to remove."
                            : Replies.forOutcome(outcome.kind(), "Strike"));
                    return outcome.kind();
                }
                replyPrivately(invocation, "✅ Removed the most recent strike ("
                        + outcome.removed().severity().label() + ": " + outcome.removed().reason() + ") from "
                        + target.displayName() + ".");
                return OutcomeKind.OK;
            }
        }
    }

    private OutcomeKind memberReview(CommandInvocation invocation) {
        Optional<Member> user = invocation.member("user");
        if (user.isEmpty()) {
            replyPrivately(invocation, "❌ Choose a member.");
            return OutcomeKind.INVALID_INPUT;
        }
        long guildId = invocation.channel() == null ? 0L : invocation.channel().guildId();
        Member target = user.get();
        MembershipReview.ReviewOutcome outcome;
        String announcement;
        if ("accept".equals(invocation.name())) {
            Optional<RoleRef> role = invocation.role("role");
            if (role.isEmpty()) {
                replyPrivately(invocation, "❌ Choose a role to assign.");
                return OutcomeKind.INVALID_INPUT;
            }
            outcome = review.accept(guildId, target, role.get(), invocation.actor());
            announcement = "✅ " + target.mention() + " has been accepted and given " + role.get().mention() + ".";
        } else {
            outcome = review.deny(guildId, target, invocation.actor());
            announcement = "⛔ " + target.displayName() + "'s application was denied"
                    + (outcome.dmDelivered() ? "." : " (could not be notified by DM).");
        }
        record(invocation, "user:" + target.id(), outcome.kind(), Map.of("dm_delivered", outcome.dmDelivered()));
        if (!outcome.kind().ok()) {
            replyPrivately(invocation, outcome.remediation() != null
                    ? "❌ " + outcome.remediation()
                    : Replies.forOutcome(outcome.kind(), target.displayName()));
            return outcome.kind();
        }
        platform.reply(invocation, OutboundMessage.text(announcement), false);
        return OutcomeKind.OK;
    }

    private OutcomeKind counterReset(CommandInvocation invocation) {
        Optional<String> rawChannel = invocation.option("channel");
        if (rawChannel.isEmpty()) {
            Map<Long, Integer> previous = counters.resetAll();
            record(invocation, "counters:*", OutcomeKind.OK, Map.of("reset", previous.size()));
            replyPrivately(invocation, "✅ Reset " + previous.size() + " channel counters.");
            return OutcomeKind.OK;
        }
        long channelId;
        try {
            channelId = Long.parseLong(rawChannel.get());
        } catch (NumberFormatException e) {
            replyPrivately(invocation, "❌ Invalid channel id: " + rawChannel.get());
            return OutcomeKind.INVALID_INPUT;
        }
        Optional<Integer> previous = counters.resetChannel(channelId);
        OutcomeKind kind = previous.isPresent() ? OutcomeKind.OK : OutcomeKind.NOT_FOUND;
        record(invocation, "counter:" + channelId, kind, Map.of());
        replyPrivately(invocation, previous
                .map(count -> "✅ Counter for <#" + channelId + "> reset (was " + count + ").")
                .orElse("ℹ️ No counter exists for <#" + channelId + ">."));
        return kind;
    }

    private void replyPrivately(CommandInvocation invocation, String text) {
        PlatformResult<Void> replied = platform.reply(invocation, OutboundMessage.text(text), true);
        if (!replied.isOk()) {
            log.warn("Reply to {} for '{}' not delivered: {} {}",
                    invocation.actor().id(), invocation.path(), replied.status(), replied.detail());
        }
    }

    private void record(CommandInvocation invocation, String resource, OutcomeKind kind, Map<String, Object> details) {
        audit.log(new AuditLogger.AuditEvent(
                invocation.path().replace(' ', '.'),
                invocation.actor().name() + "#" + invocation.actor().id(),
                resource,
                kind.name(),
                details
        ));
    }
}
