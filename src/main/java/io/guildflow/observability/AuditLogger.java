package io.guildflow.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.guildflow.util.Hashing;
import io.guildflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines trail of moderation decisions. Each row carries the hash of the previous
 * row, so an edited or deleted line breaks the chain from that point on.
 */
public final class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);

    private final Path auditFile;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile, Clock clock) {
        this.auditFile = auditFile;
        this.clock = clock;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Created concurrently between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    // A failed write is logged; auditing never aborts the decision it describes.
    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now(clock).toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            log.error("Audit row for {} on {} not written: {}", event.action(), event.resource(), e.getMessage(), e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public synchronized int verify() {
        List<String> lines = readLines();
        String expectedPrev = "";
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                JsonNode node = Jsons.mapper().readTree(line);
                String hash = node.path("hash").asText("");
                if (!expectedPrev.equals(node.path("prev_hash").asText(""))) {
                    return lineNumber;
                }
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("timestamp", node.path("timestamp").asText());
                row.put("action", textOrNull(node, "action"));
                row.put("actor", textOrNull(node, "actor"));
                row.put("resource", textOrNull(node, "resource"));
                row.put("result", textOrNull(node, "result"));
                row.put("details", Jsons.mapper().convertValue(node.path("details"), Map.class));
                row.put("prev_hash", expectedPrev);
                if (!Hashing.sha256Hex(Jsons.toCompactJson(row)).equals(hash)) {
                    return lineNumber;
                }
                expectedPrev = hash;
            } catch (IOException e) {
                return lineNumber;
            }
        }
        return 0;
    }

    private List<String> readLines() {
        try {
            return Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Audit log {} unreadable: {}", auditFile, e.getMessage(), e);
            return new ArrayList<>();
        }
    }

    private String loadLastHash() {
        String last = "";
        for (String line : readLines()) {
            if (line != null && !line.isBlank()) {
                last = line;
            }
        }
        if (last.isBlank()) {
            return "";
        }
        try {
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            log.warn("Last audit row unparsable, starting a new chain: {}", e.getMessage());
            return "";
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public AuditEvent {
            details = details == null ? Map.of() : details;
        }

        public static AuditEvent of(String action, String actor, String resource, String result) {
            return new AuditEvent(action, actor, resource, result, Map.of());
        }
    }
}
