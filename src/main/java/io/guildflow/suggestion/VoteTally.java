package io.guildflow.suggestion;

public record VoteTally(int upvotes, int downvotes) {
}
