package io.guildflow.platform;

public record Channel(long id, String name, long guildId) {
    public String mention() {
        return "<#" + id + ">";
    }
}
