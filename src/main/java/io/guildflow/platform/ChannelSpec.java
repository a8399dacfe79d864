package io.guildflow.platform;

import java.util.List;
import java.util.Set;

public record ChannelSpec(
        String name,
        String topic,
        int position,
        List<PermissionOverride> overrides
) {
    public ChannelSpec {
        overrides = overrides == null ? List.of() : List.copyOf(overrides);
    }

    public enum Permission {
        VIEW,
        SEND,
        READ_HISTORY,
        MANAGE_CHANNEL
    }

    public enum Target {
        EVERYONE,
        MEMBER,
        ROLE_NAME,
        SELF
    }

    public record PermissionOverride(Target target, long memberId, String roleName, Set<Permission> allow, Set<Permission> deny) {
        public PermissionOverride {
            allow = allow == null ? Set.of() : Set.copyOf(allow);
            deny = deny == null ? Set.of() : Set.copyOf(deny);
        }

        public static PermissionOverride denyEveryone(Set<Permission> deny) {
            return new PermissionOverride(Target.EVERYONE, 0L, null, Set.of(), deny);
        }

        public static PermissionOverride allowMember(long memberId, Set<Permission> allow) {
            return new PermissionOverride(Target.MEMBER, memberId, null, allow, Set.of());
        }

        public static PermissionOverride allowRole(String roleName, Set<Permission> allow) {
            return new PermissionOverride(Target.ROLE_NAME, 0L, roleName, allow, Set.of());
        }

        public static PermissionOverride allowSelf(Set<Permission> allow) {
            return new PermissionOverride(Target.SELF, 0L, null, allow, Set.of());
        }
    }
}
