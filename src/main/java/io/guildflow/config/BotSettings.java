package io.guildflow.config;

import io.guildflow.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public record BotSettings(
        long suggestionChannelId,
        List<Long> monitoredChannelIds,
        int messageThreshold,
        String reminderMessage,
        int helpThreshold,
        String helpMessage,
        int suggestionReminderThreshold,
        long welcomeChannelId,
        long resultsChannelId,
        String transcriptChannelName,
        Set<String> privilegedRoles,
        String commandPrefix,
        String ticketChannelPrefix,
        String upvoteEmoji,
        String downvoteEmoji,
        long warningTtlMs,
        long ticketDeleteDelayMs,
        int workerThreads
) {
    public static final int DEFAULT_MESSAGE_THRESHOLD = 5;
    public static final int DEFAULT_HELP_THRESHOLD = 10;
    public static final int DEFAULT_SUGGESTION_REMINDER_THRESHOLD = 5;
    public static final long DEFAULT_WARNING_TTL_MS = 10_000L;
    public static final long DEFAULT_TICKET_DELETE_DELAY_MS = 3_000L;
    public static final int DEFAULT_WORKER_THREADS = 4;
    public static final String DEFAULT_REMINDER_MESSAGE = """
            💬 __***Got a suggestion?***__
            Ideas about 🧠 **OOC**, 🎭 **IC** or the 🌐 **community** are all welcome.
            Use 👉 `/suggest create` to send yours.""";
    public static final String DEFAULT_HELP_MESSAGE = """
            🆘 __***Need a hand right now?***__
            Ask here and we will all help you out. 👇""";
    public static final List<String> DEFAULT_PRIVILEGED_ROLES = List.of(
            "Manager", "Deputy Manager", "👑 Manager", "👑 Deputy Manager"
    );

    public BotSettings {
        monitoredChannelIds = monitoredChannelIds == null ? List.of() : List.copyOf(monitoredChannelIds);
        privilegedRoles = privilegedRoles == null ? Set.of() : Set.copyOf(privilegedRoles);
    }

    public static BotSettings defaults(long suggestionChannelId) {
        return fromFile(new SettingsFile(
                suggestionChannelId, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, null, null
        ));
    }

    public static BotSettings load(Path settingsFile) {
        if (!Files.exists(settingsFile)) {
            throw new IllegalArgumentException("Settings file not found: " + settingsFile);
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            return fromFile(file);
        } catch (IOException e) {
            throw new IllegalArgumentException("Unreadable settings file: " + settingsFile + ": " + e.getMessage(), e);
        }
    }

    public static BotSettings fromFile(SettingsFile file) {
        if (file == null || file.suggestionChannelId() == null || file.suggestionChannelId() <= 0L) {
            throw new IllegalArgumentException("suggestionChannelId is required");
        }
        long suggestionChannel = file.suggestionChannelId();
        List<Long> monitored = new ArrayList<>();
        if (file.monitoredChannelIds() != null) {
            for (Long id : file.monitoredChannelIds()) {
                if (id != null && id > 0L && !monitored.contains(id)) {
                    monitored.add(id);
                }
            }
        }
        if (monitored.isEmpty()) {
            monitored.add(suggestionChannel);
        }
        Set<String> roles = new LinkedHashSet<>();
        List<String> rawRoles = file.privilegedRoles() == null ? DEFAULT_PRIVILEGED_ROLES : file.privilegedRoles();
        for (String role : rawRoles) {
            if (role != null && !role.isBlank()) {
                roles.add(role);
            }
        }
        if (roles.isEmpty()) {
            throw new IllegalArgumentException("privilegedRoles must name at least one role");
        }
        return new BotSettings(
                suggestionChannel,
                monitored,
                requirePositive("messageThreshold", file.messageThreshold(), DEFAULT_MESSAGE_THRESHOLD),
                textOrDefault(file.reminderMessage(), DEFAULT_REMINDER_MESSAGE),
                requirePositive("helpThreshold", file.helpThreshold(), DEFAULT_HELP_THRESHOLD),
                textOrDefault(file.helpMessage(), DEFAULT_HELP_MESSAGE),
                requirePositive(
                        "suggestionReminderThreshold",
                        file.suggestionReminderThreshold(),
                        DEFAULT_SUGGESTION_REMINDER_THRESHOLD
                ),
                file.welcomeChannelId() == null ? 0L : file.welcomeChannelId(),
                file.resultsChannelId() == null ? 0L : file.resultsChannelId(),
                textOrDefault(file.transcriptChannelName(), "transcript"),
                roles,
                textOrDefault(file.commandPrefix(), "/"),
                textOrDefault(file.ticketChannelPrefix(), "🎟️-ticket-"),
                textOrDefault(file.upvoteEmoji(), "👍"),
                textOrDefault(file.downvoteEmoji(), "👎"),
                sanitizeLong(file.warningTtlMs(), DEFAULT_WARNING_TTL_MS, 0L),
                sanitizeLong(file.ticketDeleteDelayMs(), DEFAULT_TICKET_DELETE_DELAY_MS, 0L),
                requirePositive("workerThreads", file.workerThreads(), DEFAULT_WORKER_THREADS)
        );
    }

    public boolean isMonitored(long channelId) {
        return monitoredChannelIds.contains(channelId);
    }

    public Duration warningTtl() {
        return Duration.ofMillis(warningTtlMs);
    }

    public Duration ticketDeleteDelay() {
        return Duration.ofMillis(ticketDeleteDelayMs);
    }

    private static int requirePositive(String field, Integer raw, int fallback) {
        if (raw == null) {
            return fallback;
        }
        if (raw <= 0) {
            throw new IllegalArgumentException(field + " must be greater than 0, got " + raw);
        }
        return raw;
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static String textOrDefault(String raw, String fallback) {
        return raw == null || raw.isBlank() ? fallback : raw;
    }

    public record SettingsFile(
            Long suggestionChannelId,
            List<Long> monitoredChannelIds,
            Integer messageThreshold,
            String reminderMessage,
            Integer helpThreshold,
            String helpMessage,
            Integer suggestionReminderThreshold,
            Long welcomeChannelId,
            Long resultsChannelId,
            String transcriptChannelName,
            List<String> privilegedRoles,
            String commandPrefix,
            String ticketChannelPrefix,
            String upvoteEmoji,
            String downvoteEmoji,
            Long warningTtlMs,
            Long ticketDeleteDelayMs,
            Integer workerThreads
    ) {
    }
}
