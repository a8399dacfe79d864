package io.guildflow.ticket;

import io.guildflow.engine.OutcomeKind;
import io.guildflow.engine.SideEffect;
import io.guildflow.platform.Channel;
import io.guildflow.platform.ChatMessage;
import io.guildflow.platform.Member;
import io.guildflow.platform.PlatformResult;
import io.guildflow.platform.RecordingPlatform;
import io.guildflow.storage.RecordStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

final class TicketWorkflowTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-10T08:30:00Z"), ZoneOffset.UTC);
    private static final String PREFIX = "ticket-";
    private static final Member CREATOR = Member.human(5L, "ana");
    private static final Member STAFF = Member.human(1L, "boss", "Manager");

    @Test
    void sequenceNumbersStrictlyIncreaseAcrossRestart() throws Exception {
        Path root = Files.createTempDirectory("guildflow-test-ticket-sequence-");
        try {
            RecordingPlatform platform = new RecordingPlatform();
            TicketWorkflow first = workflow(root, platform);
            long a = first.create(CREATOR, "a", RecordingPlatform.GUILD).record().number();
            long b = first.create(CREATOR, "b", RecordingPlatform.GUILD).record().number();

            TicketWorkflow restarted = workflow(root, platform);
            long c = restarted.create(CREATOR, "c", RecordingPlatform.GUILD).record().number();
            Assertions.assertEquals(List.of(1L, 2L, 3L), List.of(a, b, c));
            Assertions.assertEquals(3L, restarted.lastNumber());
            Assertions.assertEquals(3, restarted.all().size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void createProvisionsIsolatedChannel() throws Exception {
        Path root = Files.createTempDirectory("guildflow-test-ticket-create-");
        try {
            RecordingPlatform platform = new RecordingPlatform();
            TicketWorkflow tickets = workflow(root, platform);
            TicketWorkflow.CreateOutcome outcome = tickets.create(CREATOR, "  ", RecordingPlatform.GUILD);

            Assertions.assertEquals(OutcomeKind.OK, outcome.kind());
            Assertions.assertEquals("ticket-0001", outcome.channel().name());
            Assertions.assertEquals(TicketWorkflow.DEFAULT_REASON, outcome.record().reason());
            Assertions.assertEquals(TicketStatus.OPEN, outcome.record().status());
            Assertions.assertEquals(1, outcome.effects().size());
            Assertions.assertEquals(outcome.channel().id(), ((SideEffect.SendMessage) outcome.effects().get(0)).channelId());
            Assertions.assertTrue(tickets.isTicketChannel(outcome.channel()));
            Assertions.assertEquals(CREATOR.id(), tickets.creatorOf(outcome.channel().id()).getAsLong());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void forbiddenChannelCreationIsReportedAndConsumesNoRecord() throws Exception {
        Path root = Files.createTempDirectory("guildflow-test-ticket-forbidden-");
        try {
            RecordingPlatform platform = new RecordingPlatform();
            platform.fail(RecordingPlatform.Op.CREATE_CHANNEL, PlatformResult.Status.FORBIDDEN);
            TicketWorkflow tickets = workflow(root, platform);
            Assertions.assertEquals(OutcomeKind.EXTERNAL_FORBIDDEN, tickets.create(CREATOR, "x", RecordingPlatform.GUILD).kind());
            Assertions.assertTrue(tickets.all().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unsavedRecordRemovesTheNewChannel() throws Exception {
        Path root = Files.createTempDirectory("guildflow-test-ticket-orphan-");
        try {
            RecordingPlatform platform = new RecordingPlatform();
            TicketWorkflow tickets = workflow(root, platform);
            tickets.create(CREATOR, "first", RecordingPlatform.GUILD);

            // The number is drawn first; the record write after channel creation is blocked.
            Path blocker = root.resolve(TicketWorkflow.RECORD_SET + ".json.tmp");
            platform.onCreateChannel(() -> {
                try {
                    Files.createDirectories(blocker);
                    Files.writeString(blocker.resolve("keep"), "x");
                } catch (IOException e) {
                    throw new IllegalStateException(e);
                }
            });

            TicketWorkflow.CreateOutcome outcome = tickets.create(CREATOR, "second", RecordingPlatform.GUILD);
            Assertions.assertEquals(OutcomeKind.TRANSIENT_IO, outcome.kind());
            Assertions.assertEquals(1, tickets.all().size());
            List<RecordingPlatform.Call> deletions = platform.calls(RecordingPlatform.Op.DELETE_CHANNEL);
            Assertions.assertEquals(1, deletions.size());
            Assertions.assertTrue(platform.findChannelByName(RecordingPlatform.GUILD, "ticket-0002").isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void closeArchivesTranscriptThenSchedulesDeletion() throws Exception {
        Path root = Files.createTempDirectory("guildflow-test-ticket-close-");
        try {
            RecordingPlatform platform = new RecordingPlatform();
            Channel archive = platform.addChannel(900L, "transcript");
            TicketWorkflow tickets = workflow(root, platform);
            Channel channel = tickets.create(CREATOR, "billing", RecordingPlatform.GUILD).channel();
            platform.putMessage(new ChatMessage(1L, channel.id(), CREATOR, "hello", CLOCK.instant(), false, List.of()));
            platform.putMessage(new ChatMessage(2L, channel.id(), STAFF, "", CLOCK.instant().plusSeconds(5), true, List.of()));

            TicketWorkflow.CloseOutcome outcome = tickets.close(channel, STAFF);
            Assertions.assertEquals(OutcomeKind.OK, outcome.kind());
            Assertions.assertEquals(TicketStatus.CLOSED, tickets.find(channel.id()).orElseThrow().status());
            Assertions.assertEquals(STAFF.id(), outcome.record().closedBy());

            List<SideEffect> effects = outcome.effects();
            Assertions.assertEquals(3, effects.size());
            Assertions.assertEquals(archive.id(), ((SideEffect.SendMessage) effects.get(0)).channelId());
            SideEffect.UploadFile upload = (SideEffect.UploadFile) effects.get(1);
            Assertions.assertEquals("ticket-0001-transcript.txt", upload.fileName());
            Assertions.assertTrue(upload.content().contains("[10/06/2024 08:30:00] ana: hello"));
            Assertions.assertTrue(upload.content().contains("[10/06/2024 08:30:05] boss: [embed/attachment]"));
            SideEffect.DeleteChannelLater teardown = (SideEffect.DeleteChannelLater) effects.get(2);
            Assertions.assertEquals(channel.id(), teardown.channelId());
            Assertions.assertEquals(Duration.ofSeconds(3), teardown.delay());

            Assertions.assertEquals(OutcomeKind.ALREADY_RESOLVED, tickets.close(channel, STAFF).kind());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void closeWithoutRecordIsNotFoundWithNoEffects() throws Exception {
        Path root = Files.createTempDirectory("guildflow-test-ticket-close-missing-");
        try {
            RecordingPlatform platform = new RecordingPlatform();
            platform.addChannel(900L, "transcript");
            TicketWorkflow tickets = workflow(root, platform);

            TicketWorkflow.CloseOutcome outcome = tickets.close(new Channel(4242L, "ticket-0042", RecordingPlatform.GUILD), STAFF);
            Assertions.assertEquals(OutcomeKind.NOT_FOUND, outcome.kind());
            Assertions.assertTrue(outcome.effects().isEmpty());
            Assertions.assertTrue(platform.calls(RecordingPlatform.Op.HISTORY).isEmpty());

            TicketWorkflow.CloseOutcome general = tickets.close(new Channel(1L, "general", RecordingPlatform.GUILD), STAFF);
            Assertions.assertEquals(OutcomeKind.NOT_TICKET_CHANNEL, general.kind());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void addParticipantOnlyOnOpenTickets() throws Exception {
        Path root = Files.createTempDirectory("guildflow-test-ticket-participant-");
        try {
            RecordingPlatform platform = new RecordingPlatform();
            TicketWorkflow tickets = workflow(root, platform);
            Member guest = Member.human(8L, "guest");
            Assertions.assertEquals(OutcomeKind.NOT_TICKET_CHANNEL, tickets.addParticipant(1L, guest));
            Assertions.assertTrue(platform.calls(RecordingPlatform.Op.PERMISSIONS).isEmpty());

            Channel channel = tickets.create(CREATOR, "x", RecordingPlatform.GUILD).channel();
            Assertions.assertEquals(OutcomeKind.OK, tickets.addParticipant(channel.id(), guest));
            Assertions.assertEquals(List.of(8L), tickets.find(channel.id()).orElseThrow().participantIds());

            tickets.close(channel, STAFF);
            Assertions.assertEquals(OutcomeKind.NOT_TICKET_CHANNEL, tickets.addParticipant(channel.id(), Member.human(9L, "late")));
        } finally {
            deleteRecursively(root);
        }
    }

    private static TicketWorkflow workflow(Path root, RecordingPlatform platform) {
        return new TicketWorkflow(
                new RecordStore(root), platform, Set.of("Manager"), PREFIX, "transcript", Duration.ofSeconds(3), CLOCK
        );
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
