package io.guildflow.suggestion;

import java.time.Instant;

public record SuggestionRecord(
        long messageId,
        long authorId,
        String authorName,
        String text,
        SuggestionStatus status,
        Instant createdAt,
        long channelId,
        Long reviewedBy,
        Instant reviewedAt,
        VoteTally finalVotes,
        boolean movedToResults
) {
    public static SuggestionRecord pending(long messageId, long authorId, String authorName, String text, Instant createdAt, long channelId) {
        return new SuggestionRecord(messageId, authorId, authorName, text, SuggestionStatus.PENDING,
                createdAt, channelId, null, null, null, false);
    }

    public SuggestionRecord resolved(SuggestionStatus next, long reviewer, Instant at, VoteTally tally, boolean moved) {
        return new SuggestionRecord(messageId, authorId, authorName, text, next,
                createdAt, channelId, reviewer, at, tally, moved);
    }
}
