package io.guildflow.storage;

import com.fasterxml.jackson.databind.JavaType;
import io.guildflow.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.function.Supplier;

public final class RecordStore {
    private static final String SUFFIX = ".json";

    private final Path dir;

    public RecordStore(Path dir) {
        this.dir = dir;
    }

    public Path dir() {
        return dir;
    }

    public Path pathOf(String name) {
        return dir.resolve(name + SUFFIX);
    }

    public <T> T load(String name, JavaType type, Supplier<T> fallback) {
        Path file = pathOf(name);
        if (!Files.exists(file)) {
            return fallback.get();
        }
        try {
            T value = Jsons.mapper().readValue(file.toFile(), type);
            return value == null ? fallback.get() : value;
        } catch (IOException e) {
            throw new StoreException("Failed to load record set: " + file, e);
        }
    }

    public void save(String name, Object document) {
        Path file = pathOf(name);
        Path tmp = dir.resolve(name + SUFFIX + ".tmp");
        try {
            Files.createDirectories(dir);
            byte[] bytes = Jsons.mapper().writeValueAsBytes(document);
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException ignored) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StoreException("Failed to save record set: " + file, e);
        }
    }

    public String readRaw(String name) {
        Path file = pathOf(name);
        try {
            return Files.exists(file) ? Files.readString(file, StandardCharsets.UTF_8) : "";
        } catch (IOException e) {
            throw new StoreException("Failed to read record set: " + file, e);
        }
    }

    private static void deleteQuietly(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException ignored) {
            // The next save overwrites the stale temp file.
        }
    }
}
