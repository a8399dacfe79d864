package io.guildflow.engine;

import io.guildflow.platform.ChatMessage;
import io.guildflow.platform.ChatPlatform;
import io.guildflow.platform.PlatformResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public final class SideEffectExecutor {
    private static final Logger log = LoggerFactory.getLogger(SideEffectExecutor.class);

    private final ChatPlatform platform;
    private final DelayedActions delayed;

    public SideEffectExecutor(ChatPlatform platform, DelayedActions delayed) {
        this.platform = platform;
        this.delayed = delayed;
    }

    public void executeAll(List<SideEffect> effects) {
        for (SideEffect effect : effects) {
            execute(effect);
        }
    }

    public void execute(SideEffect effect) {
        if (effect instanceof SideEffect.SendMessage send) {
            report(effect, platform.sendMessage(send.channelId(), send.message()));
        } else if (effect instanceof SideEffect.SendTransient send) {
            PlatformResult<ChatMessage> sent = platform.sendMessage(send.channelId(), send.message());
            report(effect, sent);
            if (sent.isOk() && sent.value() != null) {
                long messageId = sent.value().id();
                delayed.schedule("expire message " + messageId, send.ttl(),
                        () -> report(effect, platform.deleteMessage(send.channelId(), messageId)));
            }
        } else if (effect instanceof SideEffect.DeleteMessage delete) {
            report(effect, platform.deleteMessage(delete.channelId(), delete.messageId()));
        } else if (effect instanceof SideEffect.EditMessage edit) {
            report(effect, platform.editMessage(edit.channelId(), edit.messageId(), edit.message()));
        } else if (effect instanceof SideEffect.UploadFile upload) {
            report(effect, platform.uploadFile(upload.channelId(), upload.fileName(), upload.content()));
        } else if (effect instanceof SideEffect.DeleteChannelLater teardown) {
            delayed.schedule(effect.describe(), teardown.delay(),
                    () -> report(effect, platform.deleteChannel(teardown.channelId(), teardown.reason())));
        } else {
            log.warn("Unsupported side effect skipped: {}", effect.describe());
        }
    }

    private static void report(SideEffect effect, PlatformResult<?> result) {
        if (result.isOk()) {
            log.debug("Done: {}", effect.describe());
        } else {
            log.warn("Side effect failed, not retried: {}: {} {}", effect.describe(), result.status(), result.detail());
        }
    }
}
