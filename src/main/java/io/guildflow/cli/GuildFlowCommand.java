package io.guildflow.cli;

import io.guildflow.config.BotSettings;
import io.guildflow.config.GuildFlowConfig;
import io.guildflow.counter.CounterService;
import io.guildflow.engine.GuildFlowEngine;
import io.guildflow.observability.AuditLogger;
import io.guildflow.platform.ChatPlatform;
import io.guildflow.platform.PlatformEvent;
import io.guildflow.storage.RecordSet;
import io.guildflow.storage.RecordStore;
import io.guildflow.strike.StrikeLedger;
import io.guildflow.suggestion.SuggestionRecord;
import io.guildflow.suggestion.SuggestionStatus;
import io.guildflow.suggestion.SuggestionWorkflow;
import io.guildflow.ticket.TicketRecord;
import io.guildflow.ticket.TicketStatus;
import io.guildflow.ticket.TicketWorkflow;
import io.guildflow.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "guildflow",
        mixinStandardHelpOptions = true,
        description = "GuildFlow moderation workflow engine CLI",
        subcommands = {
                GuildFlowCommand.InitCommand.class,
                GuildFlowCommand.SettingsCommand.class,
                GuildFlowCommand.CountersCommand.class,
                GuildFlowCommand.CounterResetCommand.class,
                GuildFlowCommand.StrikesCommand.class,
                GuildFlowCommand.StrikeRemoveCommand.class,
                GuildFlowCommand.SuggestionsCommand.class,
                GuildFlowCommand.TicketsCommand.class,
                GuildFlowCommand.AuditVerifyCommand.class,
                GuildFlowCommand.ReplayCommand.class
        }
)
public final class GuildFlowCommand implements Runnable {
    static final List<String> RECORD_SETS = List.of(
            CounterService.CHANNEL_SET,
            CounterService.GLOBAL_SET,
            StrikeLedger.RECORD_SET,
            SuggestionWorkflow.RECORD_SET,
            TicketWorkflow.RECORD_SET
    );

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = GuildFlowConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | settings | counters | counter-reset | strikes | strike-remove | suggestions | tickets | audit-verify | replay");
    }

    GuildFlowConfig config() {
        return GuildFlowConfig.fromRoot(root);
    }

    BotSettings settings() {
        return BotSettings.load(config().settingsFile());
    }

    GuildFlowEngine engine(ChatPlatform platform) {
        return new GuildFlowEngine(config(), settings(), platform, Clock.systemDefaultZone());
    }

    GuildFlowEngine offlineEngine() {
        return engine(new ConsolePlatform(0L, Clock.systemDefaultZone()));
    }

    @Command(name = "init", description = "Create the data layout, a settings file and empty record sets")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        GuildFlowCommand parent;

        @Option(names = {"--suggestion-channel"}, description = "Suggestion channel id written to a new settings file")
        Long suggestionChannel;

        @Override
        public Integer call() throws IOException {
            GuildFlowConfig config = parent.config();
            Files.createDirectories(config.storeDir());
            Files.createDirectories(config.auditRoot());
            if (!Files.exists(config.settingsFile())) {
                if (suggestionChannel == null) {
                    System.out.println("{\"error\":\"--suggestion-channel is required when no settings file exists\"}");
                    return 1;
                }
                BotSettings defaults = BotSettings.defaults(suggestionChannel);
                Files.writeString(config.settingsFile(), Jsons.toJson(defaults), StandardCharsets.UTF_8);
            }
            RecordStore store = new RecordStore(config.storeDir());
            for (String name : RECORD_SETS) {
                if (!Files.exists(store.pathOf(name))) {
                    store.save(name, new RecordSet.Document<>(0L, Map.of()));
                }
            }
            new AuditLogger(config.auditFile(), Clock.systemUTC());
            System.out.println("Initialized GuildFlow at: " + config.rootDir());
            return 0;
        }
    }

    @Command(name = "settings", description = "Print the resolved settings")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        GuildFlowCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.settings()));
            return 0;
        }
    }

    @Command(name = "counters", description = "Print channel and global counters")
    static final class CountersCommand implements Callable<Integer> {
        @ParentCommand
        GuildFlowCommand parent;

        @Override
        public Integer call() {
            try (GuildFlowEngine engine = parent.offlineEngine()) {
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("channels", engine.counters().channelCounters().values());
                out.put("globals", engine.counters().globalCounters().values());
                System.out.println(Jsons.toJson(out));
            }
            return 0;
        }
    }

    @Command(name = "counter-reset", description = "Reset one channel counter, or all of them")
    static final class CounterResetCommand implements Callable<Integer> {
        @ParentCommand
        GuildFlowCommand parent;

        @Option(names = {"--channel"}, description = "Channel id; omit to reset every channel")
        Long channel;

        @Override
        public Integer call() {
            try (GuildFlowEngine engine = parent.offlineEngine()) {
                if (channel == null) {
                    System.out.println(Jsons.toJson(Map.of("reset", engine.counters().resetAll())));
                    return 0;
                }
                var previous = engine.counters().resetChannel(channel);
                if (previous.isEmpty()) {
                    System.out.println("{\"error\":\"no counter for channel\"}");
                    return 1;
                }
                System.out.println(Jsons.toJson(Map.of("channel", channel, "previous", previous.get())));
                return 0;
            }
        }
    }

    @Command(name = "strikes", description = "Print a member's strike summary")
    static final class StrikesCommand implements Callable<Integer> {
        @ParentCommand
        GuildFlowCommand parent;

        @Option(names = {"--user"}, required = true, description = "User id")
        long user;

        @Override
        public Integer call() {
            try (GuildFlowEngine engine = parent.offlineEngine()) {
                System.out.println(Jsons.toJson(engine.strikes().summarize(user)));
            }
            return 0;
        }
    }

    @Command(name = "strike-remove", description = "Remove a member's most recent strike")
    static final class StrikeRemoveCommand implements Callable<Integer> {
        @ParentCommand
        GuildFlowCommand parent;

        @Option(names = {"--user"}, required = true, description = "User id")
        long user;

        @Override
        public Integer call() {
            try (GuildFlowEngine engine = parent.offlineEngine()) {
                StrikeLedger.RemoveOutcome outcome = engine.strikes().removeLastStrike(user);
                System.out.println(Jsons.toJson(outcome));
                return outcome.kind().ok() ? 0 : 1;
            }
        }
    }

    @Command(name = "suggestions", description = "List suggestion records")
    static final class SuggestionsCommand implements Callable<Integer> {
        @ParentCommand
        GuildFlowCommand parent;

        @Option(names = {"--status"}, description = "Filter by status: pending|accepted|denied")
        String status;

        @Override
        public Integer call() {
            SuggestionStatus filter = status == null ? null : SuggestionStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
            try (GuildFlowEngine engine = parent.offlineEngine()) {
                List<SuggestionRecord> rows = new ArrayList<>();
                for (SuggestionRecord record : engine.suggestions().all().values()) {
                    if (filter == null || record.status() == filter) {
                        rows.add(record);
                    }
                }
                System.out.println(Jsons.toJson(rows));
            }
            return 0;
        }
    }

    @Command(name = "tickets", description = "List ticket records")
    static final class TicketsCommand implements Callable<Integer> {
        @ParentCommand
        GuildFlowCommand parent;

        @Option(names = {"--status"}, description = "Filter by status: open|closed")
        String status;

        @Override
        public Integer call() {
            TicketStatus filter = status == null ? null : TicketStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
            try (GuildFlowEngine engine = parent.offlineEngine()) {
                List<TicketRecord> rows = new ArrayList<>();
                for (TicketRecord record : engine.tickets().all().values()) {
                    if (filter == null || record.status() == filter) {
                        rows.add(record);
                    }
                }
                rows.sort((a, b) -> Long.compare(a.number(), b.number()));
                System.out.println(Jsons.toJson(rows));
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        GuildFlowCommand parent;

        @Override
        public Integer call() {
            int broken = new AuditLogger(parent.config().auditFile(), Clock.systemUTC()).verify();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("valid", broken == 0);
            out.put("first_broken_line", broken);
            System.out.println(Jsons.toJson(out));
            return broken == 0 ? 0 : 1;
        }
    }

    @Command(name = "replay", description = "Feed recorded platform events through the engine against a console platform")
    static final class ReplayCommand implements Callable<Integer> {
        @ParentCommand
        GuildFlowCommand parent;

        @Option(names = {"--file"}, required = true, description = "JSON-lines event file")
        String file;

        @Option(names = {"--guild"}, defaultValue = "1", description = "Guild id for channels known from settings")
        long guild;

        @Override
        public Integer call() throws IOException {
            Path input = Paths.get(file);
            Clock clock = Clock.systemDefaultZone();
            List<PlatformEvent> events = new EventLineParser(clock)
                    .parseAll(Files.readAllLines(input, StandardCharsets.UTF_8));
            BotSettings settings = parent.settings();
            ConsolePlatform platform = new ConsolePlatform(guild, clock);
            platform.registerChannel(settings.suggestionChannelId(), "suggestions");
            platform.registerChannel(settings.welcomeChannelId(), "welcome");
            platform.registerChannel(settings.resultsChannelId(), "results");
            platform.registerChannel(settings.transcriptChannelName());
            try (GuildFlowEngine engine = new GuildFlowEngine(parent.config(), settings, platform, clock)) {
                for (PlatformEvent event : events) {
                    platform.observe(event);
                    engine.dispatch(event);
                }
            }
            System.out.println(Jsons.toJson(Map.of("replayed", events.size(), "file", input.toAbsolutePath().toString())));
            return 0;
        }
    }
}
