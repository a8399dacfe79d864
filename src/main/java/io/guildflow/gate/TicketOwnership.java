package io.guildflow.gate;

import io.guildflow.platform.Channel;

import java.util.OptionalLong;

public interface TicketOwnership {
    boolean isTicketChannel(Channel channel);

    OptionalLong creatorOf(long channelId);
}
