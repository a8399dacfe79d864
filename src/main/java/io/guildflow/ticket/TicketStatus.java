package io.guildflow.ticket;

public enum TicketStatus {
    OPEN,
    CLOSED
}
