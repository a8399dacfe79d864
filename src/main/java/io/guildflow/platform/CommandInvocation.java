package io.guildflow.platform;

import java.util.Map;
import java.util.Optional;

public record CommandInvocation(
        String interactionId,
        String name,
        String subcommand,
        Member actor,
        Channel channel,
        Map<String, String> options,
        Map<String, Member> memberOptions,
        Map<String, RoleRef> roleOptions
) {
    public CommandInvocation {
        subcommand = subcommand == null ? "" : subcommand;
        options = options == null ? Map.of() : Map.copyOf(options);
        memberOptions = memberOptions == null ? Map.of() : Map.copyOf(memberOptions);
        roleOptions = roleOptions == null ? Map.of() : Map.copyOf(roleOptions);
    }

    public Optional<String> option(String key) {
        String value = options.get(key);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    public Optional<Member> member(String key) {
        return Optional.ofNullable(memberOptions.get(key));
    }

    public Optional<RoleRef> role(String key) {
        return Optional.ofNullable(roleOptions.get(key));
    }

    public String path() {
        return subcommand.isEmpty() ? name : name + " " + subcommand;
    }
}
