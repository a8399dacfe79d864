package io.guildflow.platform;

public interface PlatformEvent {
    Member actor();

    long channelId();

    record MessagePosted(Channel channel, ChatMessage message) implements PlatformEvent {
        @Override
        public Member actor() {
            return message.author();
        }

        @Override
        public long channelId() {
            return channel.id();
        }
    }

    record MemberJoined(long guildId, Member member) implements PlatformEvent {
        @Override
        public Member actor() {
            return member;
        }

        @Override
        public long channelId() {
            return 0L;
        }
    }

    record MemberLeft(long guildId, Member member) implements PlatformEvent {
        @Override
        public Member actor() {
            return member;
        }

        @Override
        public long channelId() {
            return 0L;
        }
    }

    record ReactionAdded(long channelId, long messageId, Member actor, String emoji) implements PlatformEvent {
    }

    record CommandInvoked(CommandInvocation invocation) implements PlatformEvent {
        @Override
        public Member actor() {
            return invocation.actor();
        }

        @Override
        public long channelId() {
            return invocation.channel() == null ? 0L : invocation.channel().id();
        }
    }
}
