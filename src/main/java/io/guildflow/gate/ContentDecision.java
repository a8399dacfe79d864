package io.guildflow.gate;

public enum ContentDecision {
    ALLOWED,
    COMMANDS_ONLY,
    TICKET_STAFF_ONLY;

    public boolean allowed() {
        return this == ALLOWED;
    }
}
