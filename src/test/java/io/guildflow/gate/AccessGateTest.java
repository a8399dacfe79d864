package io.guildflow.gate;

import io.guildflow.platform.Channel;
import io.guildflow.platform.ChatMessage;
import io.guildflow.platform.Member;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;

final class AccessGateTest {
    private static final long RESTRICTED = 100L;
    private static final Set<String> ROLES = Set.of("Manager", "👑 Manager");

    private final Map<Long, Long> ticketCreators = Map.of(500L, 7L);
    private final TicketOwnership tickets = new TicketOwnership() {
        @Override
        public boolean isTicketChannel(Channel channel) {
            return channel.name().startsWith("ticket-") || ticketCreators.containsKey(channel.id());
        }

        @Override
        public OptionalLong creatorOf(long channelId) {
            Long creator = ticketCreators.get(channelId);
            return creator == null ? OptionalLong.empty() : OptionalLong.of(creator);
        }
    };
    private final AccessGate gate = new AccessGate(ROLES, RESTRICTED, "/", tickets);

    @Test
    void decoratedAndPlainRoleSpellingsBothGrantPrivilege() {
        Assertions.assertTrue(gate.hasRequiredRole(Member.human(1L, "a", "Manager")));
        Assertions.assertTrue(gate.hasRequiredRole(Member.human(2L, "b", "Member", "👑 Manager")));
        Assertions.assertFalse(gate.hasRequiredRole(Member.human(3L, "c", "manager")));
        Assertions.assertFalse(gate.hasRequiredRole(Member.human(4L, "d")));
        Assertions.assertFalse(gate.hasRequiredRole(null));
    }

    @Test
    void privilegedActionsRequireRole() {
        Member staff = Member.human(1L, "staff", "Manager");
        Member user = Member.human(2L, "user");
        Assertions.assertTrue(gate.permits(user, Action.SUGGEST_CREATE));
        Assertions.assertTrue(gate.permits(user, Action.TICKET_CREATE));
        Assertions.assertFalse(gate.permits(user, Action.SUGGEST_RESOLVE));
        Assertions.assertFalse(gate.permits(user, Action.STRIKE_MANAGE));
        Assertions.assertTrue(gate.permits(staff, Action.TICKET_CLOSE));
    }

    @Test
    void restrictedChannelOnlyAcceptsCommandsFromNonPrivileged() {
        Channel restricted = new Channel(RESTRICTED, "suggestions", 1L);
        Member user = Member.human(2L, "user");
        Assertions.assertEquals(ContentDecision.COMMANDS_ONLY, gate.contentAllowed(restricted, message(user, "hello")));
        Assertions.assertEquals(ContentDecision.ALLOWED, gate.contentAllowed(restricted, message(user, "/suggest create")));
        Assertions.assertEquals(ContentDecision.ALLOWED,
                gate.contentAllowed(restricted, message(Member.human(1L, "staff", "Manager"), "hello")));
        Member bot = new Member(9L, "bot", "bot", List.of(), true);
        Assertions.assertEquals(ContentDecision.ALLOWED, gate.contentAllowed(restricted, message(bot, "reminder")));
    }

    @Test
    void ticketChannelOnlyAcceptsCreatorAndStaff() {
        Channel ticket = new Channel(500L, "ticket-0001", 1L);
        Assertions.assertEquals(ContentDecision.ALLOWED,
                gate.contentAllowed(ticket, message(Member.human(7L, "creator"), "help")));
        Assertions.assertEquals(ContentDecision.TICKET_STAFF_ONLY,
                gate.contentAllowed(ticket, message(Member.human(8L, "other"), "me too")));
        Assertions.assertEquals(ContentDecision.ALLOWED,
                gate.contentAllowed(ticket, message(Member.human(1L, "staff", "👑 Manager"), "on it")));

        Channel unrecorded = new Channel(501L, "ticket-0002", 1L);
        Assertions.assertEquals(ContentDecision.TICKET_STAFF_ONLY,
                gate.contentAllowed(unrecorded, message(Member.human(7L, "creator"), "hello")));
    }

    @Test
    void ordinaryChannelsAllowEverything() {
        Channel general = new Channel(200L, "general", 1L);
        Assertions.assertEquals(ContentDecision.ALLOWED, gate.contentAllowed(general, message(Member.human(2L, "u"), "hi")));
        Assertions.assertTrue(gate.isCommand("/ticket create"));
        Assertions.assertFalse(gate.isCommand("ticket create"));
    }

    private static ChatMessage message(Member author, String content) {
        return new ChatMessage(1L, 0L, author, content, Instant.EPOCH, false, List.of());
    }
}
