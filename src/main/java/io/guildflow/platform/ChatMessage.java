package io.guildflow.platform;

import java.time.Instant;
import java.util.List;

public record ChatMessage(
        long id,
        long channelId,
        Member author,
        String content,
        Instant createdAt,
        boolean hasEmbeds,
        List<Reaction> reactions
) {
    public ChatMessage {
        content = content == null ? "" : content;
        reactions = reactions == null ? List.of() : List.copyOf(reactions);
    }

    public int reactionCount(String emoji) {
        for (Reaction reaction : reactions) {
            if (reaction.emoji().equals(emoji)) {
                return reaction.count();
            }
        }
        return 0;
    }

    public record Reaction(String emoji, int count) {
    }
}
