package io.guildflow.ticket;

import io.guildflow.platform.ChatMessage;
import io.guildflow.platform.OutboundMessage;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

public final class TranscriptRenderer {
    private static final DateTimeFormatter LINE_TIME = DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss");
    private static final DateTimeFormatter CARD_TIME = DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm");
    private static final String NO_TEXT = "[embed/attachment]";

    private final ZoneId zone;

    public TranscriptRenderer(ZoneId zone) {
        this.zone = zone;
    }

    // Human messages plus bot embeds, oldest first.
    public List<String> lines(List<ChatMessage> history) {
        List<String> out = new ArrayList<>();
        for (ChatMessage message : history) {
            if (message.author().bot() && !message.hasEmbeds()) {
                continue;
            }
            String timestamp = LINE_TIME.format(message.createdAt().atZone(zone));
            String content = message.content().isBlank() ? NO_TEXT : message.content();
            out.add("[" + timestamp + "] " + message.author().displayName() + ": " + content);
        }
        return out;
    }

    public String document(TicketRecord ticket, List<String> lines) {
        StringBuilder sb = new StringBuilder();
        sb.append("TRANSCRIPT TICKET #").append(ticket.label()).append('\n');
        sb.append("Creator: ").append(ticket.creatorName()).append('\n');
        sb.append("Reason: ").append(ticket.reason()).append('\n');
        sb.append("Created: ").append(ticket.createdAt()).append('\n');
        sb.append("Closed: ").append(ticket.closedAt()).append('\n');
        sb.append("=".repeat(50)).append("\n\n");
        sb.append(String.join("\n", lines));
        return sb.toString();
    }

    public String fileName(TicketRecord ticket) {
        return "ticket-" + ticket.label() + "-transcript.txt";
    }

    public OutboundMessage summary(TicketRecord ticket, int messageCount) {
        return OutboundMessage.embed(new OutboundMessage.Embed(
                "📄 Transcript ticket #" + ticket.label(),
                null,
                0x2f3136,
                List.of(
                        new OutboundMessage.Field("Creator", "<@" + ticket.creatorId() + ">", true),
                        new OutboundMessage.Field("Reason", ticket.reason(), true),
                        new OutboundMessage.Field("Closed by", "<@" + ticket.closedBy() + ">", true),
                        new OutboundMessage.Field("Created", CARD_TIME.format(ticket.createdAt().atZone(zone)), true),
                        new OutboundMessage.Field("Closed", CARD_TIME.format(ticket.closedAt().atZone(zone)), true),
                        new OutboundMessage.Field("Total messages", Integer.toString(messageCount), true)
                ),
                null
        ));
    }
}
