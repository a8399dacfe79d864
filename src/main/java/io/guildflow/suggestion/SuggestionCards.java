package io.guildflow.suggestion;

import io.guildflow.platform.Member;
import io.guildflow.platform.OutboundMessage;

import java.time.Instant;
import java.util.List;

public final class SuggestionCards {
    static final int PENDING_COLOR = 0x3498db;
    static final int ACCEPTED_COLOR = 0x2ecc71;
    static final int DENIED_COLOR = 0xe74c3c;

    private SuggestionCards() {
    }

    public static OutboundMessage pending(Member author, String text, String upvote, String downvote) {
        return OutboundMessage.embed(new OutboundMessage.Embed(
                "💡 New suggestion",
                text,
                PENDING_COLOR,
                List.of(new OutboundMessage.Field("Author", author.displayName(), true)),
                "React with " + upvote + " or " + downvote + " to vote • Status: Pending"
        ));
    }

    public static OutboundMessage resolved(SuggestionRecord record, String upvote, String downvote) {
        boolean accepted = record.status() == SuggestionStatus.ACCEPTED;
        VoteTally tally = record.finalVotes() == null ? new VoteTally(0, 0) : record.finalVotes();
        Instant reviewedAt = record.reviewedAt() == null ? Instant.EPOCH : record.reviewedAt();
        OutboundMessage.Embed embed = new OutboundMessage.Embed(
                "💡 Suggestion",
                record.text(),
                accepted ? ACCEPTED_COLOR : DENIED_COLOR,
                List.of(new OutboundMessage.Field("Author", record.authorName(), true)),
                accepted ? "Status: ✅ ACCEPTED" : "Status: ❌ DENIED"
        )
                .withField("Reviewed by", "<@" + record.reviewedBy() + ">", true)
                .withField("Reviewed", "<t:" + reviewedAt.getEpochSecond() + ":R>", true)
                .withField("Votes", upvote + " " + tally.upvotes() + " | " + downvote + " " + tally.downvotes(), true);
        return OutboundMessage.embed(embed);
    }
}
