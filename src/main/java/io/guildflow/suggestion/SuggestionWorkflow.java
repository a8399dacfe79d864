package io.guildflow.suggestion;

import io.guildflow.counter.CounterService;
import io.guildflow.counter.FireReminder;
import io.guildflow.engine.OutcomeKind;
import io.guildflow.engine.SideEffect;
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
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class SuggestionWorkflow {
    public static final String RECORD_SET = "suggestions";

    private static final Logger log = LoggerFactory.getLogger(SuggestionWorkflow.class);

    private final RecordSet<SuggestionRecord> suggestions;
    private final CounterService counters;
    private final ChatPlatform platform;
    private final long resultsChannelId;
    private final String upvoteEmoji;
    private final String downvoteEmoji;
    private final Clock clock;

    public SuggestionWorkflow(
            RecordStore store,
            CounterService counters,
            ChatPlatform platform,
            long resultsChannelId,
            String upvoteEmoji,
            String downvoteEmoji,
            Clock clock
    ) {
        this.suggestions = RecordSet.open(store, RECORD_SET, SuggestionRecord.class);
        this.counters = counters;
        this.platform = platform;
        this.resultsChannelId = resultsChannelId;
        this.upvoteEmoji = upvoteEmoji;
        this.downvoteEmoji = downvoteEmoji;
        this.clock = clock;
    }

    public String upvoteEmoji() {
        return upvoteEmoji;
    }

    public String downvoteEmoji() {
        return downvoteEmoji;
    }

    public CreateOutcome create(long messageId, Member author, String text, long channelId) {
        if (text == null || text.isBlank()) {
            return new CreateOutcome(OutcomeKind.INVALID_INPUT, null, Optional.empty());
        }
        SuggestionRecord record = SuggestionRecord.pending(
                messageId, author.id(), author.displayName(), text.trim(), Instant.now(clock), channelId
        );
        try {
            boolean created = suggestions.update(key(messageId), current -> current == null
                    ? RecordSet.Change.put(record, true)
                    : RecordSet.Change.none(false));
            if (!created) {
                return new CreateOutcome(OutcomeKind.ALREADY_RESOLVED, suggestions.get(key(messageId)).orElse(null), Optional.empty());
            }
        } catch (StoreException e) {
            log.error("Suggestion {} by {} not recorded: {}", messageId, author.id(), e.getMessage(), e);
            return new CreateOutcome(OutcomeKind.TRANSIENT_IO, null, Optional.empty());
        }
        Optional<FireReminder> reminder = counters.recordSuggestionCreated();
        log.info("Suggestion {} created by {}: {}", messageId, author.name(), abbreviate(record.text()));
        return new CreateOutcome(OutcomeKind.OK, record, reminder);
    }

    public ResolveOutcome resolve(long messageId, Resolution resolution, Member reviewer) {
        try {
            ResolveOutcome outcome = suggestions.update(key(messageId), current -> transition(current, resolution, reviewer));
            if (outcome.kind().ok()) {
                log.info("Suggestion {} {} by {} with votes {}",
                        messageId, outcome.record().status(), reviewer.name(), outcome.record().finalVotes());
            }
            return outcome;
        } catch (StoreException e) {
            log.error("Resolution of suggestion {} by {} abandoned: {}", messageId, reviewer.id(), e.getMessage(), e);
            return ResolveOutcome.of(OutcomeKind.TRANSIENT_IO, null);
        }
    }

    private RecordSet.Change<SuggestionRecord, ResolveOutcome> transition(
            SuggestionRecord current,
            Resolution resolution,
            Member reviewer
    ) {
        if (current == null) {
            return RecordSet.Change.none(ResolveOutcome.of(OutcomeKind.NOT_FOUND, null));
        }
        if (current.status().terminal()) {
            return RecordSet.Change.none(ResolveOutcome.of(OutcomeKind.ALREADY_RESOLVED, current));
        }
        PlatformResult<ChatMessage> fetched = platform.fetchMessage(current.channelId(), current.messageId());
        if (!fetched.isOk()) {
            log.warn("Card for suggestion {} unavailable: {} {}", current.messageId(), fetched.status(), fetched.detail());
            OutcomeKind kind = fetched.status() == PlatformResult.Status.NOT_FOUND
                    ? OutcomeKind.NOT_FOUND
                    : OutcomeKind.TRANSIENT_IO;
            return RecordSet.Change.none(ResolveOutcome.of(kind, current));
        }
        ChatMessage card = fetched.value();
        VoteTally tally = new VoteTally(
                Math.max(0, card.reactionCount(upvoteEmoji) - 1),
                Math.max(0, card.reactionCount(downvoteEmoji) - 1)
        );
        boolean resultsAvailable = resultsChannelId > 0L && platform.findChannel(resultsChannelId).isPresent();
        SuggestionRecord next = current.resolved(
                resolution.target(), reviewer.id(), Instant.now(clock), tally, resultsAvailable
        );
        OutboundMessage resolvedCard = SuggestionCards.resolved(next, upvoteEmoji, downvoteEmoji);
        List<SideEffect> effects;
        if (resultsAvailable) {
            effects = List.of(
                    new SideEffect.SendMessage(resultsChannelId, resolvedCard),
                    new SideEffect.DeleteMessage(current.channelId(), current.messageId())
            );
        } else {
            log.warn("Results channel {} not found, suggestion {} stays in place", resultsChannelId, current.messageId());
            effects = List.of(new SideEffect.EditMessage(current.channelId(), current.messageId(), resolvedCard));
        }
        return RecordSet.Change.put(next, new ResolveOutcome(OutcomeKind.OK, next, effects));
    }

    public Optional<SuggestionRecord> find(long messageId) {
        return suggestions.get(key(messageId));
    }

    public Map<String, SuggestionRecord> all() {
        return suggestions.snapshot();
    }

    private static String key(long messageId) {
        return Long.toString(messageId);
    }

    private static String abbreviate(String text) {
        return text.length() <= 50 ? text : text.substring(0, 50) + "...";
    }

    public record CreateOutcome(OutcomeKind kind, SuggestionRecord record, Optional<FireReminder> reminder) {
    }

    public record ResolveOutcome(OutcomeKind kind, SuggestionRecord record, List<SideEffect> effects) {
        static ResolveOutcome of(OutcomeKind kind, SuggestionRecord record) {
            return new ResolveOutcome(kind, record, List.of());
        }
    }
}
