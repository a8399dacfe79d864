package io.guildflow.gate;

public enum Action {
    SUGGEST_CREATE(false),
    SUGGEST_RESOLVE(true),
    TICKET_CREATE(false),
    TICKET_CLOSE(true),
    TICKET_ADD_PARTICIPANT(true),
    STRIKE_MANAGE(true),
    MEMBER_REVIEW(true),
    COUNTER_RESET(true);

    private final boolean privileged;

    Action(boolean privileged) {
        this.privileged = privileged;
    }

    public boolean privileged() {
        return privileged;
    }
}
