package io.guildflow.platform;

import java.util.List;

public record Member(
        long id,
        String name,
        String displayName,
        List<String> roleNames,
        boolean bot
) {
    public Member {
        roleNames = roleNames == null ? List.of() : List.copyOf(roleNames);
        if (displayName == null || displayName.isBlank()) {
            displayName = name;
        }
    }

    public static Member human(long id, String name, String... roleNames) {
        return new Member(id, name, name, List.of(roleNames), false);
    }

    public String mention() {
        return "<@" + id + ">";
    }
}
