package io.guildflow.ticket;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public record TicketRecord(
        long channelId,
        long number,
        long creatorId,
        String creatorName,
        String reason,
        TicketStatus status,
        Instant createdAt,
        Long closedBy,
        Instant closedAt,
        List<Long> participantIds
) {
    public TicketRecord {
        participantIds = participantIds == null ? List.of() : List.copyOf(participantIds);
    }

    public boolean open() {
        return status == TicketStatus.OPEN;
    }

    public String label() {
        return String.format("%04d", number);
    }

    public TicketRecord withParticipant(long userId) {
        if (participantIds.contains(userId)) {
            return this;
        }
        List<Long> next = new ArrayList<>(participantIds);
        next.add(userId);
        return new TicketRecord(channelId, number, creatorId, creatorName, reason, status, createdAt, closedBy, closedAt, next);
    }

    public TicketRecord closed(long closer, Instant at) {
        return new TicketRecord(channelId, number, creatorId, creatorName, reason, TicketStatus.CLOSED,
                createdAt, closer, at, participantIds);
    }
}
