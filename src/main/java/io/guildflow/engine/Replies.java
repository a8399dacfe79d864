package io.guildflow.engine;

import io.guildflow.platform.OutboundMessage;
import io.guildflow.strike.Escalation;
import io.guildflow.strike.StrikeEntry;
import io.guildflow.strike.StrikeLedger;

import java.time.format.DateTimeFormatter;

public final class Replies {
    public static final String PERMISSION_DENIED = "❌ You do not have permission to use this command.";
    public static final String COMMANDS_ONLY = "❌ Only commands are allowed in this channel. Use `/suggest create` to post a suggestion.";
    public static final String TICKET_STAFF_ONLY = "❌ Only staff can reply in this ticket.";
    public static final String NOT_TICKET_CHANNEL = "❌ This command can only be used in an open ticket channel.";
    public static final String TRANSIENT = "⚠️ Something went wrong, please try again later.";

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    private Replies() {
    }

    public static OutboundMessage plain(String text) {
        return OutboundMessage.text(text);
    }

    public static String forOutcome(OutcomeKind kind, String subject) {
        return switch (kind) {
            case OK -> "✅ Done.";
            case PERMISSION -> PERMISSION_DENIED;
            case NOT_FOUND -> "❌ " + subject + " not found.";
            case ALREADY_RESOLVED -> "ℹ️ " + subject + " has already been handled.";
            case NOT_TICKET_CHANNEL -> NOT_TICKET_CHANNEL;
            case EXTERNAL_FORBIDDEN -> "❌ The platform refused this action for " + subject + ".";
            case TRANSIENT_IO -> TRANSIENT;
            case INVALID_INPUT -> "❌ Invalid input for " + subject + ".";
        };
    }

    public static OutboundMessage strikeSummary(String userName, StrikeLedger.StrikeSummary summary) {
        if (summary.empty()) {
            return OutboundMessage.text("✅ " + userName + " has no strikes.");
        }
        StringBuilder recent = new StringBuilder();
        for (StrikeEntry entry : summary.recent()) {
            recent.append("• **").append(entry.severity().label()).append("** ")
                    .append(entry.date().format(DATE)).append(" - ").append(entry.reason())
                    .append(" (").append(entry.issuer()).append(")\n");
        }
        Escalation escalation = summary.escalation();
        OutboundMessage.Embed embed = new OutboundMessage.Embed(
                "📋 Strikes for " + userName,
                null,
                escalation.escalated() ? 0xff0000 : 0x00ff00,
                null,
                null
        )
                .withField("Minor", Integer.toString(summary.counts().minor()), true)
                .withField("Moderate", Integer.toString(summary.counts().moderate()), true)
                .withField("Severe", Integer.toString(summary.counts().severe()), true)
                .withField("Status", escalation.message(), false)
                .withField("Recent", recent.toString().strip(), false);
        return OutboundMessage.embed(embed);
    }

    public static OutboundMessage strikeAdded(String userName, StrikeLedger.AddOutcome outcome) {
        OutboundMessage.Embed embed = new OutboundMessage.Embed(
                "⚠️ Strike added",
                userName + " received a **" + outcome.entry().severity().label() + "** strike.",
                0xffa500,
                null,
                "Issued by " + outcome.entry().issuer()
        )
                .withField("Reason", outcome.entry().reason(), false)
                .withField("Total", Integer.toString(outcome.record().entries().size()), true);
        if (outcome.escalation().escalated()) {
            embed = embed.withField("🚨 Escalation", outcome.escalation().message(), false);
        }
        return OutboundMessage.embed(embed);
    }
}
