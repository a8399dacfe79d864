package io.guildflow.strike;

import io.guildflow.engine.OutcomeKind;
import io.guildflow.platform.Member;
import io.guildflow.storage.RecordSet;
import io.guildflow.storage.RecordStore;
import io.guildflow.storage.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class StrikeLedger {
    public static final String RECORD_SET = "strikes";
    public static final int RECENT_LIMIT = 5;

    private static final Logger log = LoggerFactory.getLogger(StrikeLedger.class);

    private final RecordSet<StrikeRecord> strikes;
    private final Clock clock;

    public StrikeLedger(RecordStore store, Clock clock) {
        this.strikes = RecordSet.open(store, RECORD_SET, StrikeRecord.class);
        this.clock = clock;
    }

    public AddOutcome addStrike(Member target, Severity severity, String reason, Member issuer) {
        if (severity == null || reason == null || reason.isBlank()) {
            return new AddOutcome(OutcomeKind.INVALID_INPUT, null, null, Escalation.NONE);
        }
        StrikeEntry entry = new StrikeEntry(severity, reason.trim(), LocalDate.now(clock), issuer.displayName());
        try {
            StrikeRecord updated = strikes.update(key(target.id()), current -> {
                StrikeRecord base = current == null ? StrikeRecord.empty(target.id()) : current;
                StrikeRecord next = base.append(entry);
                return RecordSet.Change.put(next, next);
            });
            Escalation escalation = EscalationPolicy.classify(updated.counts());
            log.info("Strike {} added to {} ({}) by {}: {} -> {}",
                    severity, target.name(), target.id(), issuer.name(), entry.reason(), escalation);
            return new AddOutcome(OutcomeKind.OK, updated, entry, escalation);
        } catch (StoreException e) {
            log.error("Strike for {} by {} not recorded: {}", target.id(), issuer.id(), e.getMessage(), e);
            return new AddOutcome(OutcomeKind.TRANSIENT_IO, null, null, Escalation.NONE);
        }
    }

    public RemoveOutcome removeLastStrike(long userId) {
        try {
            RemoveOutcome outcome = strikes.update(key(userId), current -> {
                if (current == null || current.entries().isEmpty()) {
                    return RecordSet.Change.none(new RemoveOutcome(OutcomeKind.NOT_FOUND, null));
                }
                StrikeEntry removed = current.last();
                return RecordSet.Change.put(current.withoutLast(), new RemoveOutcome(OutcomeKind.OK, removed));
            });
            if (outcome.kind().ok()) {
                log.info("Removed last strike of {}: {}", userId, outcome.removed());
            }
            return outcome;
        } catch (StoreException e) {
            log.error("Strike removal for {} abandoned: {}", userId, e.getMessage(), e);
            return new RemoveOutcome(OutcomeKind.TRANSIENT_IO, null);
        }
    }

    public StrikeSummary summarize(long userId) {
        StrikeRecord record = strikes.get(key(userId)).orElse(StrikeRecord.empty(userId));
        SeverityCounts counts = record.counts();
        List<StrikeEntry> recent = new ArrayList<>();
        List<StrikeEntry> entries = record.entries();
        for (int i = entries.size() - 1; i >= 0 && recent.size() < RECENT_LIMIT; i--) {
            recent.add(entries.get(i));
        }
        return new StrikeSummary(userId, counts, EscalationPolicy.classify(counts), recent);
    }

    public Map<String, StrikeRecord> all() {
        return strikes.snapshot();
    }

    private static String key(long userId) {
        return Long.toString(userId);
    }

    public record AddOutcome(OutcomeKind kind, StrikeRecord record, StrikeEntry entry, Escalation escalation) {
    }

    public record RemoveOutcome(OutcomeKind kind, StrikeEntry removed) {
    }

    public record StrikeSummary(long userId, SeverityCounts counts, Escalation escalation, List<StrikeEntry> recent) {
        public boolean empty() {
            return counts.total() == 0;
        }
    }
}
