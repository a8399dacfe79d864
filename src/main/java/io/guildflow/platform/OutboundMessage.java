package io.guildflow.platform;

import java.util.ArrayList;
import java.util.List;

public record OutboundMessage(String text, Embed embed) {
    public static OutboundMessage text(String text) {
        return new OutboundMessage(text, null);
    }

    public static OutboundMessage embed(Embed embed) {
        return new OutboundMessage(null, embed);
    }

    public String summary() {
        if (embed == null) {
            return text == null ? "" : text;
        }
        return embed.title() + ": " + (embed.description() == null ? "" : embed.description());
    }

    public record Embed(
            String title,
            String description,
            int color,
            List<Field> fields,
            String footer
    ) {
        public Embed {
            fields = fields == null ? List.of() : List.copyOf(fields);
        }

        public Embed withField(String name, String value, boolean inline) {
            List<Field> next = new ArrayList<>(fields);
            next.add(new Field(name, value, inline));
            return new Embed(title, description, color, next, footer);
        }

        public Embed withFooter(String nextFooter) {
            return new Embed(title, description, color, fields, nextFooter);
        }
    }

    public record Field(String name, String value, boolean inline) {
    }
}
