package io.guildflow.engine;

import io.guildflow.platform.ChatMessage;
import io.guildflow.platform.OutboundMessage;
import io.guildflow.platform.PlatformResult;
import io.guildflow.platform.RecordingPlatform;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

final class SideEffectExecutorTest {

    @Test
    void failedEffectDoesNotStopTheRest() {
        RecordingPlatform platform = new RecordingPlatform();
        platform.addChannel(10L, "general");
        try (DelayedActions delayed = new DelayedActions()) {
            SideEffectExecutor executor = new SideEffectExecutor(platform, delayed);
            platform.fail(RecordingPlatform.Op.UPLOAD, PlatformResult.Status.FORBIDDEN);

            executor.executeAll(List.of(
                    new SideEffect.UploadFile(10L, "a.txt", "x"),
                    new SideEffect.SendMessage(10L, OutboundMessage.text("still sent"))
            ));

            Assertions.assertEquals(1, platform.calls(RecordingPlatform.Op.UPLOAD).size());
            Assertions.assertEquals("still sent", platform.sentTo(10L).get(0).text());
        }
    }

    @Test
    void transientMessageExpires() throws Exception {
        RecordingPlatform platform = new RecordingPlatform();
        platform.addChannel(10L, "general");
        try (DelayedActions delayed = new DelayedActions()) {
            SideEffectExecutor executor = new SideEffectExecutor(platform, delayed);
            executor.execute(new SideEffect.SendTransient(10L, OutboundMessage.text("bye"), Duration.ofMillis(20)));

            List<ChatMessage> history = platform.fetchHistory(10L).value();
            Assertions.assertEquals(1, history.size());
            long messageId = history.get(0).id();
            EngineFixture.await(() -> platform.message(messageId).isEmpty());
        }
    }

    @Test
    void failedTransientSendSchedulesNothing() throws Exception {
        RecordingPlatform platform = new RecordingPlatform();
        try (DelayedActions delayed = new DelayedActions()) {
            SideEffectExecutor executor = new SideEffectExecutor(platform, delayed);
            executor.execute(new SideEffect.SendTransient(99L, OutboundMessage.text("lost"), Duration.ZERO));
            executor.execute(new SideEffect.DeleteChannelLater(99L, "cleanup", Duration.ZERO));

            EngineFixture.await(() -> platform.calls(RecordingPlatform.Op.DELETE_CHANNEL).size() == 1);
            Assertions.assertTrue(platform.calls(RecordingPlatform.Op.DELETE_MESSAGE).isEmpty());
        }
    }
}
