package io.guildflow.cli;

import io.guildflow.platform.Channel;
import io.guildflow.platform.ChannelSpec;
import io.guildflow.platform.ChatMessage;
import io.guildflow.platform.ChatPlatform;
import io.guildflow.platform.CommandInvocation;
import io.guildflow.platform.Member;
import io.guildflow.platform.OutboundMessage;
import io.guildflow.platform.PlatformEvent;
import io.guildflow.platform.PlatformResult;
import io.guildflow.platform.RoleRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

final class ConsolePlatform implements ChatPlatform {
    private static final Logger log = LoggerFactory.getLogger(ConsolePlatform.class);
    private static final Member SELF = new Member(1L, "guildflow", "GuildFlow", List.of(), true);

    private final ConcurrentMap<Long, Channel> channels = new ConcurrentHashMap<>();
    private final ConcurrentMap<Long, ChatMessage> messages = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong(9_000_000_000L);
    private final Clock clock;
    private final long guildId;

    ConsolePlatform(long guildId, Clock clock) {
        this.guildId = guildId;
        this.clock = clock;
    }

    void registerChannel(long channelId, String name) {
        if (channelId > 0L) {
            channels.put(channelId, new Channel(channelId, name, guildId));
        }
    }

    long registerChannel(String name) {
        long channelId = ids.incrementAndGet();
        registerChannel(channelId, name);
        return channelId;
    }

    void observe(PlatformEvent event) {
        if (event instanceof PlatformEvent.MessagePosted posted) {
            channels.putIfAbsent(posted.channel().id(), posted.channel());
            messages.put(posted.message().id(), posted.message());
        } else if (event instanceof PlatformEvent.ReactionAdded reaction) {
            messages.computeIfPresent(reaction.messageId(), (id, message) -> withReaction(message, reaction.emoji()));
        } else if (event instanceof PlatformEvent.CommandInvoked invoked && invoked.invocation().channel() != null) {
            channels.putIfAbsent(invoked.invocation().channel().id(), invoked.invocation().channel());
        }
    }

    @Override
    public PlatformResult<ChatMessage> sendMessage(long channelId, OutboundMessage message) {
        if (!channels.containsKey(channelId)) {
            return PlatformResult.notFound("unknown channel " + channelId);
        }
        ChatMessage sent = new ChatMessage(
                ids.incrementAndGet(), channelId, SELF, message.text() == null ? "" : message.text(),
                Instant.now(clock), message.embed() != null, List.of()
        );
        messages.put(sent.id(), sent);
        log.info("[console] #{} <- {} (message {})", channelName(channelId), message.summary(), sent.id());
        return PlatformResult.ok(sent);
    }

    @Override
    public PlatformResult<Void> deleteMessage(long channelId, long messageId) {
        if (messages.remove(messageId) == null) {
            return PlatformResult.notFound("unknown message " + messageId);
        }
        log.info("[console] #{} deleted message {}", channelName(channelId), messageId);
        return PlatformResult.done();
    }

    @Override
    public PlatformResult<Void> editMessage(long channelId, long messageId, OutboundMessage message) {
        ChatMessage current = messages.get(messageId);
        if (current == null) {
            return PlatformResult.notFound("unknown message " + messageId);
        }
        log.info("[console] #{} edited message {}: {}", channelName(channelId), messageId, message.summary());
        return PlatformResult.done();
    }

    @Override
    public PlatformResult<ChatMessage> fetchMessage(long channelId, long messageId) {
        ChatMessage message = messages.get(messageId);
        return message == null || message.channelId() != channelId
                ? PlatformResult.notFound("unknown message " + messageId)
                : PlatformResult.ok(message);
    }

    @Override
    public PlatformResult<List<ChatMessage>> fetchHistory(long channelId) {
        List<ChatMessage> history = new ArrayList<>();
        for (ChatMessage message : messages.values()) {
            if (message.channelId() == channelId) {
                history.add(message);
            }
        }
        history.sort(Comparator.comparing(ChatMessage::createdAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
                .thenComparingLong(ChatMessage::id));
        return PlatformResult.ok(history);
    }

    @Override
    public PlatformResult<Void> addReaction(long channelId, long messageId, String emoji) {
        ChatMessage updated = messages.computeIfPresent(messageId, (id, message) -> withReaction(message, emoji));
        return updated == null ? PlatformResult.notFound("unknown message " + messageId) : PlatformResult.done();
    }

    @Override
    public PlatformResult<Channel> createChannel(long guildId, ChannelSpec spec) {
        Channel channel = new Channel(ids.incrementAndGet(), spec.name(), guildId);
        channels.put(channel.id(), channel);
        log.info("[console] created channel #{} ({}) with {} overrides", spec.name(), channel.id(), spec.overrides().size());
        return PlatformResult.ok(channel);
    }

    @Override
    public PlatformResult<Void> deleteChannel(long channelId, String reason) {
        Channel removed = channels.remove(channelId);
        if (removed == null) {
            return PlatformResult.notFound("unknown channel " + channelId);
        }
        messages.values().removeIf(message -> message.channelId() == channelId);
        log.info("[console] deleted channel #{}: {}", removed.name(), reason);
        return PlatformResult.done();
    }

    @Override
    public PlatformResult<Void> setChannelPermissions(long channelId, long userId, Set<ChannelSpec.Permission> allow) {
        log.info("[console] #{} granted {} to {}", channelName(channelId), allow, userId);
        return PlatformResult.done();
    }

    @Override
    public PlatformResult<Void> assignRole(long guildId, long userId, RoleRef role) {
        log.info("[console] assigned role {} to {}", role.name(), userId);
        return PlatformResult.done();
    }

    @Override
    public PlatformResult<Void> banUser(long guildId, long userId, String reason) {
        log.info("[console] banned {}: {}", userId, reason);
        return PlatformResult.done();
    }

    @Override
    public PlatformResult<Void> sendDirectMessage(long userId, OutboundMessage message) {
        log.info("[console] DM to {}: {}", userId, message.summary());
        return PlatformResult.done();
    }

    @Override
    public PlatformResult<Void> uploadFile(long channelId, String fileName, String content) {
        log.info("[console] #{} upload {} ({} chars)", channelName(channelId), fileName, content.length());
        return PlatformResult.done();
    }

    @Override
    public PlatformResult<Void> reply(CommandInvocation invocation, OutboundMessage message, boolean ephemeral) {
        log.info("[console] reply to {}{}: {}", invocation.actor().name(), ephemeral ? " (ephemeral)" : "", message.summary());
        return PlatformResult.done();
    }

    @Override
    public Optional<Channel> findChannel(long channelId) {
        return Optional.ofNullable(channels.get(channelId));
    }

    @Override
    public Optional<Channel> findChannelByName(long guildId, String name) {
        return channels.values().stream()
                .filter(channel -> channel.guildId() == guildId && channel.name().equals(name))
                .findFirst();
    }

    private String channelName(long channelId) {
        Channel channel = channels.get(channelId);
        return channel == null ? Long.toString(channelId) : channel.name();
    }

    private static ChatMessage withReaction(ChatMessage message, String emoji) {
        List<ChatMessage.Reaction> reactions = new ArrayList<>();
        boolean found = false;
        for (ChatMessage.Reaction reaction : message.reactions()) {
            if (reaction.emoji().equals(emoji)) {
                reactions.add(new ChatMessage.Reaction(emoji, reaction.count() + 1));
                found = true;
            } else {
                reactions.add(reaction);
            }
        }
        if (!found) {
            reactions.add(new ChatMessage.Reaction(emoji, 1));
        }
        return new ChatMessage(
                message.id(), message.channelId(), message.author(), message.content(),
                message.createdAt(), message.hasEmbeds(), reactions
        );
    }
}
