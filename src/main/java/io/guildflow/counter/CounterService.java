package io.guildflow.counter;

import io.guildflow.storage.RecordSet;
import io.guildflow.storage.RecordStore;
import io.guildflow.storage.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public final class CounterService {
    public static final String CHANNEL_SET = "channel-counters";
    public static final String GLOBAL_SET = "global-counters";

    private static final Logger log = LoggerFactory.getLogger(CounterService.class);

    private final RecordSet<ChannelCounter> channels;
    private final RecordSet<GlobalCounter> globals;
    private final int channelThreshold;
    private final Map<String, Integer> globalThresholds;

    public CounterService(RecordStore store, int channelThreshold, int helpThreshold, int suggestionReminderThreshold) {
        requirePositive("channel threshold", channelThreshold);
        requirePositive("help threshold", helpThreshold);
        requirePositive("suggestion reminder threshold", suggestionReminderThreshold);
        this.channels = RecordSet.open(store, CHANNEL_SET, ChannelCounter.class);
        this.globals = RecordSet.open(store, GLOBAL_SET, GlobalCounter.class);
        this.channelThreshold = channelThreshold;
        this.globalThresholds = Map.of(
                GlobalCounter.HELP_PROMPT, helpThreshold,
                GlobalCounter.SUGGESTION_REMINDER, suggestionReminderThreshold
        );
        log.info("Loaded {} channel counters and {} global counters", channels.size(), globals.size());
    }

    public Optional<FireReminder> recordMessage(long channelId) {
        String key = Long.toString(channelId);
        try {
            return channels.update(key, current -> {
                int next = (current == null ? 0 : current.count()) + 1;
                if (next >= channelThreshold) {
                    return RecordSet.Change.put(
                            new ChannelCounter(channelId, 0),
                            Optional.of(new FireReminder(key, channelThreshold))
                    );
                }
                return RecordSet.Change.put(new ChannelCounter(channelId, next), Optional.<FireReminder>empty());
            });
        } catch (StoreException e) {
            log.error("Counter update abandoned for channel {}: {}", channelId, e.getMessage(), e);
            return Optional.empty();
        }
    }

    public Optional<FireReminder> recordHelpCandidate() {
        return recordGlobal(GlobalCounter.HELP_PROMPT);
    }

    public Optional<FireReminder> recordSuggestionCreated() {
        return recordGlobal(GlobalCounter.SUGGESTION_REMINDER);
    }

    private Optional<FireReminder> recordGlobal(String name) {
        int threshold = globalThresholds.get(name);
        try {
            return globals.update(name, current -> {
                int next = (current == null ? 0 : current.count()) + 1;
                if (next >= threshold) {
                    return RecordSet.Change.put(
                            new GlobalCounter(name, 0, threshold),
                            Optional.of(new FireReminder(name, threshold))
                    );
                }
                return RecordSet.Change.put(new GlobalCounter(name, next, threshold), Optional.<FireReminder>empty());
            });
        } catch (StoreException e) {
            log.error("Counter update abandoned for {}: {}", name, e.getMessage(), e);
            return Optional.empty();
        }
    }

    public Optional<Integer> resetChannel(long channelId) {
        String key = Long.toString(channelId);
        Optional<Integer> previous = channels.update(key, current -> {
            if (current == null) {
                return RecordSet.Change.none(Optional.<Integer>empty());
            }
            return RecordSet.Change.put(new ChannelCounter(channelId, 0), Optional.of(current.count()));
        });
        if (previous.isPresent()) {
            log.info("Reset counter for channel {} (was {})", channelId, previous.get());
        } else {
            log.warn("No counter found for channel {}", channelId);
        }
        return previous;
    }

    public Map<Long, Integer> resetAll() {
        Map<Long, Integer> previous = new LinkedHashMap<>();
        for (String key : channels.snapshot().keySet()) {
            long channelId = Long.parseLong(key);
            resetChannel(channelId).ifPresent(count -> previous.put(channelId, count));
        }
        log.info("Reset all channel counters (were {})", previous);
        return previous;
    }

    public int count(long channelId) {
        return channels.get(Long.toString(channelId)).map(ChannelCounter::count).orElse(0);
    }

    public int globalCount(String name) {
        return globals.get(name).map(GlobalCounter::count).orElse(0);
    }

    public Map<String, ChannelCounter> channelCounters() {
        return channels.snapshot();
    }

    public Map<String, GlobalCounter> globalCounters() {
        return globals.snapshot();
    }

    private static void requirePositive(String field, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(field + " must be greater than 0, got " + value);
        }
    }
}
