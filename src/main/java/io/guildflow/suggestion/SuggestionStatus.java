package io.guildflow.suggestion;

public enum SuggestionStatus {
    PENDING,
    ACCEPTED,
    DENIED;

    public boolean terminal() {
        return this != PENDING;
    }
}
