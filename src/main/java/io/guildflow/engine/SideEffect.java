package io.guildflow.engine;

import io.guildflow.platform.OutboundMessage;

import java.time.Duration;

public interface SideEffect {
    String describe();

    record SendMessage(long channelId, OutboundMessage message) implements SideEffect {
        @Override
        public String describe() {
            return "send message to channel " + channelId;
        }
    }

    record SendTransient(long channelId, OutboundMessage message, Duration ttl) implements SideEffect {
        @Override
        public String describe() {
            return "send transient message to channel " + channelId;
        }
    }

    record DeleteMessage(long channelId, long messageId) implements SideEffect {
        @Override
        public String describe() {
            return "delete message " + messageId + " in channel " + channelId;
        }
    }

    record EditMessage(long channelId, long messageId, OutboundMessage message) implements SideEffect {
        @Override
        public String describe() {
            return "edit message " + messageId + " in channel " + channelId;
        }
    }

    record UploadFile(long channelId, String fileName, String content) implements SideEffect {
        @Override
        public String describe() {
            return "upload " + fileName + " to channel " + channelId;
        }
    }

    record DeleteChannelLater(long channelId, String reason, Duration delay) implements SideEffect {
        @Override
        public String describe() {
            return "delete channel " + channelId + " after " + delay.toMillis() + "ms";
        }
    }
}
