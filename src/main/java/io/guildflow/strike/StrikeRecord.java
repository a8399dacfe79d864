package io.guildflow.strike;

import java.util.ArrayList;
import java.util.List;

public record StrikeRecord(long userId, List<StrikeEntry> entries) {
    public StrikeRecord {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public static StrikeRecord empty(long userId) {
        return new StrikeRecord(userId, List.of());
    }

    public StrikeRecord append(StrikeEntry entry) {
        List<StrikeEntry> next = new ArrayList<>(entries);
        next.add(entry);
        return new StrikeRecord(userId, next);
    }

    public StrikeRecord withoutLast() {
        if (entries.isEmpty()) {
            return this;
        }
        return new StrikeRecord(userId, entries.subList(0, entries.size() - 1));
    }

    public StrikeEntry last() {
        return entries.isEmpty() ? null : entries.get(entries.size() - 1);
    }

    public SeverityCounts counts() {
        return SeverityCounts.of(entries);
    }
}
