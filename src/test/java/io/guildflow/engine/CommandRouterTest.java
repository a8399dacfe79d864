package io.guildflow.engine;

import io.guildflow.platform.Channel;
import io.guildflow.platform.ChatMessage;
import io.guildflow.platform.CommandInvocation;
import io.guildflow.platform.Member;
import io.guildflow.platform.PlatformResult;
import io.guildflow.platform.RecordingPlatform;
import io.guildflow.platform.RoleRef;
import io.guildflow.suggestion.SuggestionStatus;
import io.guildflow.ticket.TicketStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static io.guildflow.engine.EngineFixture.STAFF;
import static io.guildflow.engine.EngineFixture.USER;
import static io.guildflow.engine.EngineFixture.command;

final class CommandRouterTest {
    private static final Member TARGET = Member.human(42L, "troll");

    @Test
    void mapsCommandPathsToActions() {
        Assertions.assertTrue(CommandRouter.actionFor(command(USER, null, "suggest", "deny", null, null)).isPresent());
        Assertions.assertTrue(CommandRouter.actionFor(command(USER, null, "accept", null, null, null)).isPresent());
        Assertions.assertTrue(CommandRouter.actionFor(command(USER, null, "suggest", "delete", null, null)).isEmpty());
        Assertions.assertTrue(CommandRouter.actionFor(command(USER, null, "ping", null, null, null)).isEmpty());
    }

    @Test
    void unprivilegedActorIsDeniedWithoutTouchingState() throws Exception {
        try (EngineFixture f = new EngineFixture("router-deny")) {
            CommandInvocation add = command(USER, f.general, "strike", "add",
                    Map.of("severity", "minor", "reason", "spam"), Map.of("user", TARGET));

            Assertions.assertEquals(OutcomeKind.PERMISSION, f.engine.commands().route(add));
            RecordingPlatform.Reply reply = f.platform.lastReply();
            Assertions.assertTrue(reply.ephemeral());
            Assertions.assertEquals(Replies.PERMISSION_DENIED, reply.message().text());
            Assertions.assertTrue(f.engine.strikes().summarize(TARGET.id()).empty());
        }
    }

    @Test
    void unknownCommandIsRejected() throws Exception {
        try (EngineFixture f = new EngineFixture("router-unknown")) {
            Assertions.assertEquals(OutcomeKind.INVALID_INPUT,
                    f.engine.commands().route(command(STAFF, f.general, "dance", null, null, null)));
            Assertions.assertTrue(f.platform.lastReply().ephemeral());
        }
    }

    @Test
    void suggestionIsPostedThenAcceptedIntoResults() throws Exception {
        try (EngineFixture f = new EngineFixture("router-suggest")) {
            CommandInvocation create = command(USER, f.general, "suggest", "create", Map.of("text", "Add a music channel"), null);
            Assertions.assertEquals(OutcomeKind.OK, f.engine.commands().route(create));

            Assertions.assertEquals(1, f.platform.sentTo(EngineFixture.SUGGESTIONS).size());
            long cardId = f.platform.calls(RecordingPlatform.Op.REACT).get(0).target();
            ChatMessage card = f.platform.message(cardId).orElseThrow();
            Assertions.assertEquals(1, card.reactionCount("👍"));
            Assertions.assertEquals(1, card.reactionCount("👎"));
            Assertions.assertTrue(f.platform.lastReply().ephemeral());

            CommandInvocation accept = command(STAFF, f.suggestions, "suggest", "accept",
                    Map.of("message_id", Long.toString(cardId)), null);
            Assertions.assertEquals(OutcomeKind.OK, f.engine.commands().route(accept));
            Assertions.assertEquals(SuggestionStatus.ACCEPTED, f.engine.suggestions().find(cardId).orElseThrow().status());
            Assertions.assertEquals(1, f.platform.sentTo(EngineFixture.RESULTS).size());
            Assertions.assertTrue(f.platform.message(cardId).isEmpty());
            Assertions.assertTrue(f.platform.lastReply().message().text().contains("👍 0 / 👎 0"));

            Assertions.assertEquals(OutcomeKind.ALREADY_RESOLVED, f.engine.commands().route(accept));
        }
    }

    @Test
    void unrecordedSuggestionCardIsRemoved() throws Exception {
        try (EngineFixture f = new EngineFixture("router-suggest-unsaved")) {
            Path blocker = f.root.resolve("store").resolve("suggestions.json.tmp");
            Files.createDirectories(blocker);
            Files.writeString(blocker.resolve("keep"), "x");

            CommandInvocation create = command(USER, f.general, "suggest", "create", Map.of("text", "More emotes"), null);
            Assertions.assertEquals(OutcomeKind.TRANSIENT_IO, f.engine.commands().route(create));

            List<RecordingPlatform.Call> deletes = f.platform.calls(RecordingPlatform.Op.DELETE_MESSAGE);
            Assertions.assertEquals(1, deletes.size());
            Assertions.assertTrue(f.platform.message(deletes.get(0).target()).isEmpty());
            Assertions.assertTrue(f.platform.calls(RecordingPlatform.Op.REACT).isEmpty());
            Assertions.assertTrue(f.engine.suggestions().all().isEmpty());
            Assertions.assertTrue(f.platform.lastReply().ephemeral());
        }
    }

    @Test
    void failedSeedReactionStillRecordsSuggestion() throws Exception {
        try (EngineFixture f = new EngineFixture("router-suggest-react")) {
            f.platform.fail(RecordingPlatform.Op.REACT, PlatformResult.Status.FORBIDDEN);
            CommandInvocation create = command(USER, f.general, "suggest", "create", Map.of("text", "Weekly events"), null);

            Assertions.assertEquals(OutcomeKind.OK, f.engine.commands().route(create));
            Assertions.assertEquals(2, f.platform.calls(RecordingPlatform.Op.REACT).size());
            Assertions.assertEquals(1, f.engine.suggestions().all().size());
        }
    }

    @Test
    void suggestionWithGarbageIdIsNotFound() throws Exception {
        try (EngineFixture f = new EngineFixture("router-suggest-id")) {
            CommandInvocation deny = command(STAFF, f.suggestions, "suggest", "deny", Map.of("message_id", "abc"), null);
            Assertions.assertEquals(OutcomeKind.NOT_FOUND, f.engine.commands().route(deny));
            Assertions.assertTrue(f.platform.sentTo(EngineFixture.RESULTS).isEmpty());
        }
    }

    @Test
    void strikeAddCheckAndRemove() throws Exception {
        try (EngineFixture f = new EngineFixture("router-strike")) {
            Map<String, Member> target = Map.of("user", TARGET);
            Assertions.assertEquals(OutcomeKind.INVALID_INPUT, f.engine.commands().route(
                    command(STAFF, f.general, "strike", "add", Map.of("severity", "huge", "reason", "x"), target)));
            Assertions.assertEquals(OutcomeKind.OK, f.engine.commands().route(
                    command(STAFF, f.general, "strike", "add", Map.of("severity", "severe", "reason", "raid"), target)));
            Assertions.assertFalse(f.platform.lastReply().ephemeral());

            Assertions.assertEquals(OutcomeKind.OK, f.engine.commands().route(
                    command(STAFF, f.general, "strike", "check", null, target)));
            Assertions.assertTrue(f.platform.lastReply().ephemeral());
            Assertions.assertNotNull(f.platform.lastReply().message().embed());

            Assertions.assertEquals(OutcomeKind.OK, f.engine.commands().route(
                    command(STAFF, f.general, "strike", "remove", null, target)));
            Assertions.assertTrue(f.platform.lastReply().message().text().contains("raid"));
            Assertions.assertEquals(OutcomeKind.NOT_FOUND, f.engine.commands().route(
                    command(STAFF, f.general, "strike", "remove", null, target)));
        }
    }

    @Test
    void ticketCreateThenCloseArchivesAndDeletesChannel() throws Exception {
        try (EngineFixture f = new EngineFixture("router-ticket")) {
            Assertions.assertEquals(OutcomeKind.OK, f.engine.commands().route(
                    command(USER, f.general, "ticket", "create", Map.of("reason", "billing"), null)));
            Channel ticket = f.platform.findChannelByName(RecordingPlatform.GUILD, "ticket-0001").orElseThrow();
            Assertions.assertEquals(1, f.platform.sentTo(ticket.id()).size());

            Assertions.assertEquals(OutcomeKind.PERMISSION, f.engine.commands().route(
                    command(USER, ticket, "ticket", "close", null, null)));
            Assertions.assertEquals(OutcomeKind.NOT_TICKET_CHANNEL, f.engine.commands().route(
                    command(STAFF, f.general, "ticket", "close", null, null)));

            Assertions.assertEquals(OutcomeKind.OK, f.engine.commands().route(
                    command(STAFF, ticket, "ticket", "close", null, null)));
            Assertions.assertFalse(f.platform.lastReply().ephemeral());
            Assertions.assertEquals(TicketStatus.CLOSED, f.engine.tickets().find(ticket.id()).orElseThrow().status());
            Assertions.assertFalse(f.platform.sentTo(EngineFixture.TRANSCRIPTS).isEmpty());
            Assertions.assertEquals(1, f.platform.calls(RecordingPlatform.Op.UPLOAD).size());

            EngineFixture.await(() -> f.platform.findChannel(ticket.id()).isEmpty());
            Assertions.assertEquals(OutcomeKind.ALREADY_RESOLVED, f.engine.commands().route(
                    command(STAFF, ticket, "ticket", "close", null, null)));
        }
    }

    @Test
    void ticketAddGrantsParticipantAccess() throws Exception {
        try (EngineFixture f = new EngineFixture("router-ticket-add")) {
            f.engine.commands().route(command(USER, f.general, "ticket", "create", null, null));
            Channel ticket = f.platform.findChannelByName(RecordingPlatform.GUILD, "ticket-0001").orElseThrow();
            Member helper = Member.human(60L, "helper");

            Assertions.assertEquals(OutcomeKind.OK, f.engine.commands().route(
                    command(STAFF, ticket, "ticket", "add", null, Map.of("user", helper))));
            Assertions.assertEquals(1, f.platform.calls(RecordingPlatform.Op.PERMISSIONS).size());
            Assertions.assertTrue(f.engine.tickets().find(ticket.id()).orElseThrow().participantIds().contains(helper.id()));
            Assertions.assertEquals(OutcomeKind.NOT_TICKET_CHANNEL, f.engine.commands().route(
                    command(STAFF, f.general, "ticket", "add", null, Map.of("user", helper))));
        }
    }

    @Test
    void memberReviewAnnouncesOrExplainsRemediation() throws Exception {
        try (EngineFixture f = new EngineFixture("router-review")) {
            CommandInvocation accept = new CommandInvocation("acc", "accept", null, STAFF, f.general, null,
                    Map.of("user", TARGET), Map.of("role", new RoleRef(9L, "Member")));
            Assertions.assertEquals(OutcomeKind.OK, f.engine.commands().route(accept));
            Assertions.assertFalse(f.platform.lastReply().ephemeral());
            Assertions.assertTrue(f.platform.lastReply().message().text().contains("<@&9>"));

            f.platform.fail(RecordingPlatform.Op.BAN, PlatformResult.Status.FORBIDDEN);
            Assertions.assertEquals(OutcomeKind.EXTERNAL_FORBIDDEN, f.engine.commands().route(
                    command(STAFF, f.general, "deny", null, null, Map.of("user", TARGET))));
            Assertions.assertTrue(f.platform.lastReply().ephemeral());
            Assertions.assertTrue(f.platform.lastReply().message().text().startsWith("❌ "));
        }
    }

    @Test
    void counterResetSingleAndAll() throws Exception {
        try (EngineFixture f = new EngineFixture("router-counter")) {
            f.engine.dispatch(f.post(f.suggestions, STAFF, "one"));
            Assertions.assertEquals(1, f.engine.counters().count(EngineFixture.SUGGESTIONS));

            Assertions.assertEquals(OutcomeKind.OK, f.engine.commands().route(command(STAFF, f.general, "counter", "reset",
                    Map.of("channel", Long.toString(EngineFixture.SUGGESTIONS)), null)));
            Assertions.assertEquals(0, f.engine.counters().count(EngineFixture.SUGGESTIONS));
            Assertions.assertEquals(OutcomeKind.NOT_FOUND, f.engine.commands().route(
                    command(STAFF, f.general, "counter", "reset", Map.of("channel", "777"), null)));
            Assertions.assertEquals(OutcomeKind.INVALID_INPUT, f.engine.commands().route(
                    command(STAFF, f.general, "counter", "reset", Map.of("channel", "general"), null)));
            Assertions.assertEquals(OutcomeKind.OK, f.engine.commands().route(
                    command(STAFF, f.general, "counter", "reset", null, null)));
            Assertions.assertEquals("✅ Reset 1 channel counters.", f.platform.lastReply().message().text());
        }
    }
}
