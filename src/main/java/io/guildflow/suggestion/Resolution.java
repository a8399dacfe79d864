package io.guildflow.suggestion;

public enum Resolution {
    ACCEPT(SuggestionStatus.ACCEPTED),
    DENY(SuggestionStatus.DENIED);

    private final SuggestionStatus target;

    Resolution(SuggestionStatus target) {
        this.target = target;
    }

    public SuggestionStatus target() {
        return target;
    }
}
