package io.guildflow.platform;

public record RoleRef(long id, String name) {
    public String mention() {
        return "<@&" + id + ">";
    }
}
