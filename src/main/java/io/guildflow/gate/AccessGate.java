package io.guildflow.gate;

import io.guildflow.config.BotSettings;
import io.guildflow.platform.Channel;
import io.guildflow.platform.ChatMessage;
import io.guildflow.platform.Member;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalLong;
import java.util.Set;

public final class AccessGate {
    private static final Logger log = LoggerFactory.getLogger(AccessGate.class);

    private final Set<String> privilegedRoles;
    private final long restrictedChannelId;
    private final String commandPrefix;
    private final TicketOwnership tickets;

    public AccessGate(BotSettings settings, TicketOwnership tickets) {
        this(settings.privilegedRoles(), settings.suggestionChannelId(), settings.commandPrefix(), tickets);
    }

    public AccessGate(Set<String> privilegedRoles, long restrictedChannelId, String commandPrefix, TicketOwnership tickets) {
        this.privilegedRoles = Set.copyOf(privilegedRoles);
        this.restrictedChannelId = restrictedChannelId;
        this.commandPrefix = commandPrefix;
        this.tickets = tickets;
    }

    public boolean hasRequiredRole(Member member) {
        if (member == null) {
            return false;
        }
        for (String role : member.roleNames()) {
            if (privilegedRoles.contains(role)) {
                return true;
            }
        }
        return false;
    }

    public boolean permits(Member actor, Action action) {
        boolean permitted = !action.privileged() || hasRequiredRole(actor);
        if (!permitted) {
            log.info("Denied {} for {} ({}): roles={}", action, actor.name(), actor.id(), actor.roleNames());
        }
        return permitted;
    }

    public ContentDecision contentAllowed(Channel channel, ChatMessage message) {
        Member author = message.author();
        if (author.bot() || hasRequiredRole(author)) {
            return ContentDecision.ALLOWED;
        }
        if (channel.id() == restrictedChannelId) {
            return message.content().startsWith(commandPrefix)
                    ? ContentDecision.ALLOWED
                    : ContentDecision.COMMANDS_ONLY;
        }
        if (tickets.isTicketChannel(channel)) {
            OptionalLong creator = tickets.creatorOf(channel.id());
            if (creator.isPresent() && creator.getAsLong() == author.id()) {
                return ContentDecision.ALLOWED;
            }
            return ContentDecision.TICKET_STAFF_ONLY;
        }
        return ContentDecision.ALLOWED;
    }

    public boolean isCommand(String content) {
        return content != null && content.startsWith(commandPrefix);
    }
}
