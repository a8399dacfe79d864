package io.guildflow.counter;

public record GlobalCounter(String name, int count, int threshold) {
    public static final String HELP_PROMPT = "help-prompt";
    public static final String SUGGESTION_REMINDER = "suggestion-reminder";
}
