package io.guildflow.engine;

public enum OutcomeKind {
    OK,
    PERMISSION,
    NOT_FOUND,
    ALREADY_RESOLVED,
    NOT_TICKET_CHANNEL,
    EXTERNAL_FORBIDDEN,
    TRANSIENT_IO,
    INVALID_INPUT;

    public boolean ok() {
        return this == OK;
    }
}
