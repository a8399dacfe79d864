package io.guildflow.platform;

import java.util.List;
import java.util.Optional;
import java.util.Set;

public interface ChatPlatform {
    PlatformResult<ChatMessage> sendMessage(long channelId, OutboundMessage message);

    PlatformResult<Void> deleteMessage(long channelId, long messageId);

    PlatformResult<Void> editMessage(long channelId, long messageId, OutboundMessage message);

    PlatformResult<ChatMessage> fetchMessage(long channelId, long messageId);

    PlatformResult<List<ChatMessage>> fetchHistory(long channelId);

    PlatformResult<Void> addReaction(long channelId, long messageId, String emoji);

    PlatformResult<Channel> createChannel(long guildId, ChannelSpec spec);

    PlatformResult<Void> deleteChannel(long channelId, String reason);

    PlatformResult<Void> setChannelPermissions(long channelId, long userId, Set<ChannelSpec.Permission> allow);

    PlatformResult<Void> assignRole(long guildId, long userId, RoleRef role);

    PlatformResult<Void> banUser(long guildId, long userId, String reason);

    PlatformResult<Void> sendDirectMessage(long userId, OutboundMessage message);

    PlatformResult<Void> uploadFile(long channelId, String fileName, String content);

    PlatformResult<Void> reply(CommandInvocation invocation, OutboundMessage message, boolean ephemeral);

    Optional<Channel> findChannel(long channelId);

    Optional<Channel> findChannelByName(long guildId, String name);
}
