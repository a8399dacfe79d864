package io.guildflow.counter;

public record ChannelCounter(long channelId, int count) {
}
