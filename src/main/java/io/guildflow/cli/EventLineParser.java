package io.guildflow.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.guildflow.platform.Channel;
import io.guildflow.platform.ChatMessage;
import io.guildflow.platform.CommandInvocation;
import io.guildflow.platform.Member;
import io.guildflow.platform.PlatformEvent;
import io.guildflow.platform.RoleRef;
import io.guildflow.util.Jsons;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

final class EventLineParser {
    private final Clock clock;
    private long syntheticIds;

    EventLineParser(Clock clock) {
        this.clock = clock;
    }

    Optional<PlatformEvent> parse(String line, int lineNumber) {
        if (line == null || line.isBlank() || line.strip().startsWith("#")) {
            return Optional.empty();
        }
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(line);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Line " + lineNumber + ": invalid JSON: " + e.getOriginalMessage(), e);
        }
        String type = node.path("type").asText("");
        try {
            return Optional.of(switch (type) {
                case "message" -> message(node);
                case "member_joined" -> new PlatformEvent.MemberJoined(node.path("guild_id").asLong(), member(node, "member"));
                case "member_left" -> new PlatformEvent.MemberLeft(node.path("guild_id").asLong(), member(node, "member"));
                case "reaction" -> new PlatformEvent.ReactionAdded(
                        requiredLong(node, "channel_id"),
                        requiredLong(node, "message_id"),
                        member(node, "actor"),
                        requiredText(node, "emoji")
                );
                case "command" -> new PlatformEvent.CommandInvoked(command(node, lineNumber));
                default -> throw new IllegalArgumentException("unknown event type '" + type + "'");
            });
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Line " + lineNumber + ": " + e.getMessage(), e);
        }
    }

    List<PlatformEvent> parseAll(List<String> lines) {
        List<PlatformEvent> events = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            parse(lines.get(i), i + 1).ifPresent(events::add);
        }
        return events;
    }

    private PlatformEvent message(JsonNode node) {
        Channel channel = channel(node.path("channel"));
        Member author = member(node, "author");
        long id = node.hasNonNull("id") ? node.path("id").asLong() : nextSyntheticId();
        ChatMessage message = new ChatMessage(
                id,
                channel.id(),
                author,
                node.path("content").asText(""),
                instant(node.path("created_at")),
                node.path("embeds").asBoolean(false),
                List.of()
        );
        return new PlatformEvent.MessagePosted(channel, message);
    }

    private CommandInvocation command(JsonNode node, int lineNumber) {
        Map<String, String> options = new LinkedHashMap<>();
        fields(node.path("options")).forEach((key, value) -> options.put(key, value.asText()));
        Map<String, Member> members = new LinkedHashMap<>();
        fields(node.path("members")).forEach((key, value) -> members.put(key, member(value)));
        Map<String, RoleRef> roles = new LinkedHashMap<>();
        fields(node.path("roles")).forEach((key, value) -> roles.put(
                key, new RoleRef(value.path("id").asLong(), value.path("name").asText(""))
        ));
        return new CommandInvocation(
                node.path("interaction_id").asText("replay-" + lineNumber),
                requiredText(node, "name"),
                node.path("subcommand").asText(""),
                member(node, "actor"),
                node.hasNonNull("channel") ? channel(node.path("channel")) : null,
                options,
                members,
                roles
        );
    }

    private Instant instant(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return Instant.now(clock);
        }
        try {
            return Instant.parse(node.asText());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid created_at '" + node.asText() + "'", e);
        }
    }

    private synchronized long nextSyntheticId() {
        return ++syntheticIds;
    }

    private static Channel channel(JsonNode node) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("channel object is required");
        }
        return new Channel(requiredLong(node, "id"), node.path("name").asText(""), node.path("guild_id").asLong());
    }

    private static Member member(JsonNode parent, String field) {
        JsonNode node = parent.path(field);
        if (!node.isObject()) {
            throw new IllegalArgumentException(field + " object is required");
        }
        return member(node);
    }

    private static Member member(JsonNode node) {
        List<String> roles = new ArrayList<>();
        node.path("roles").forEach(role -> roles.add(role.asText()));
        return new Member(
                requiredLong(node, "id"),
                requiredText(node, "name"),
                node.path("display_name").asText(null),
                roles,
                node.path("bot").asBoolean(false)
        );
    }

    private static Map<String, JsonNode> fields(JsonNode node) {
        Map<String, JsonNode> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            out.put(entry.getKey(), entry.getValue());
        }
        return out;
    }

    private static long requiredLong(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.canConvertToLong()) {
            throw new IllegalArgumentException(field + " must be a number");
        }
        return value.asLong();
    }

    private static String requiredText(JsonNode node, String field) {
        String value = node.path(field).asText("");
        if (value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }
}
