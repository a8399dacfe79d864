package io.guildflow.engine;

import io.guildflow.config.BotSettings;
import io.guildflow.config.GuildFlowConfig;
import io.guildflow.platform.Channel;
import io.guildflow.platform.ChatMessage;
import io.guildflow.platform.CommandInvocation;
import io.guildflow.platform.Member;
import io.guildflow.platform.PlatformEvent;
import io.guildflow.platform.RecordingPlatform;
import org.junit.jupiter.api.Assertions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

/**
 * Shared wiring for engine-level tests: one data root, one recording platform, small thresholds.
 */
final class EngineFixture implements AutoCloseable {
    static final long SUGGESTIONS = 100L;
    static final long GENERAL = 200L;
    static final long RESULTS = 300L;
    static final long WELCOME = 400L;
    static final long TRANSCRIPTS = 500L;

    static final Member STAFF = Member.human(1L, "boss", "👑 Manager");
    static final Member USER = Member.human(5L, "ana");

    final Path root;
    final RecordingPlatform platform;
    final BotSettings settings;
    final GuildFlowEngine engine;
    final Channel suggestions;
    final Channel general;
    private final AtomicLong messageIds = new AtomicLong(10_000L);

    EngineFixture(String name) throws IOException {
        this.root = Files.createTempDirectory("guildflow-test-" + name + "-");
        this.platform = new RecordingPlatform();
        this.suggestions = platform.addChannel(SUGGESTIONS, "suggestions");
        this.general = platform.addChannel(GENERAL, "general");
        platform.addChannel(RESULTS, "results");
        platform.addChannel(WELCOME, "welcome");
        platform.addChannel(TRANSCRIPTS, "transcript");
        this.settings = BotSettings.fromFile(new BotSettings.SettingsFile(
                SUGGESTIONS, null, 2, "reminder!", 3, "need help?", 2, WELCOME, RESULTS,
                null, null, null, "ticket-", null, null, 50L, 20L, 4
        ));
        this.engine = new GuildFlowEngine(GuildFlowConfig.fromRoot(root.toString()), settings, platform, Clock.systemUTC());
    }

    PlatformEvent.MessagePosted post(Channel channel, Member author, String content) {
        ChatMessage message = new ChatMessage(
                messageIds.incrementAndGet(), channel.id(), author, content, Instant.now(), false, List.of()
        );
        platform.putMessage(message);
        return new PlatformEvent.MessagePosted(channel, message);
    }

    static CommandInvocation command(
            Member actor,
            Channel channel,
            String name,
            String sub,
            Map<String, String> options,
            Map<String, Member> members
    ) {
        return new CommandInvocation("it-" + name + "-" + sub, name, sub, actor, channel, options, members, Map.of());
    }

    static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000L;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10L);
        }
        Assertions.assertTrue(condition.getAsBoolean(), "condition not met within 5s");
    }

    @Override
    public void close() throws IOException {
        engine.close();
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
