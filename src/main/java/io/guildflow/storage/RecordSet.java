package io.guildflow.storage;

import com.fasterxml.jackson.databind.JavaType;
import io.guildflow.util.Jsons;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * In-memory view of one named record set, loaded once and written back on every mutation.
 *
 * <p>{@link #update} runs the read-modify-write of a single key under that key's lock, so two
 * updates of the same record never interleave. Writes are serialized and always write the whole
 * set: the committed records plus the one pending change. Memory is updated only after the write
 * succeeds, so a failed write leaves both memory and disk as they were and the
 * {@link StoreException} propagates.
 *
 * <p>The set also carries a persisted monotonic sequence, used where records need numbers that
 * are never reissued across restarts.
 */
public final class RecordSet<V> {
    private final RecordStore store;
    private final String name;
    private final ConcurrentMap<String, V> records;
    private final KeyedLocks locks;
    private final Object flushLock;
    private long sequence;

    private RecordSet(RecordStore store, String name, Document<V> loaded) {
        this.store = store;
        this.name = name;
        this.records = new ConcurrentHashMap<>();
        if (loaded.records() != null) {
            loaded.records().forEach((key, value) -> {
                if (key != null && value != null) {
                    records.put(key, value);
                }
            });
        }
        this.locks = new KeyedLocks();
        this.flushLock = new Object();
        this.sequence = Math.max(0L, loaded.sequence());
    }

    public static <V> RecordSet<V> open(RecordStore store, String name, Class<V> valueType) {
        JavaType type = Jsons.mapper().getTypeFactory().constructParametricType(Document.class, valueType);
        Document<V> loaded = store.load(name, type, () -> new Document<>(0L, Map.of()));
        return new RecordSet<>(store, name, loaded);
    }

    public String name() {
        return name;
    }

    public Optional<V> get(String key) {
        return Optional.ofNullable(records.get(key));
    }

    public Map<String, V> snapshot() {
        return new TreeMap<>(records);
    }

    public int size() {
        return records.size();
    }

    public <R> R update(String key, Function<V, Change<V, R>> mutation) {
        return locks.withLock(key, () -> {
            Change<V, R> change = mutation.apply(records.get(key));
            if (!change.writes()) {
                return change.result();
            }
            synchronized (flushLock) {
                Map<String, V> next = new TreeMap<>(records);
                if (change.value() == null) {
                    next.remove(key);
                } else {
                    next.put(key, change.value());
                }
                write(sequence, next);
                if (change.value() == null) {
                    records.remove(key);
                } else {
                    records.put(key, change.value());
                }
            }
            return change.result();
        });
    }

    public long nextSequence() {
        synchronized (flushLock) {
            write(sequence + 1, new TreeMap<>(records));
            sequence++;
            return sequence;
        }
    }

    public long currentSequence() {
        synchronized (flushLock) {
            return sequence;
        }
    }

    // Callers hold flushLock; memory is only touched after this returns.
    private void write(long nextSequence, Map<String, V> nextRecords) {
        store.save(name, new Document<>(nextSequence, new LinkedHashMap<>(nextRecords)));
    }

    public record Document<V>(long sequence, Map<String, V> records) {
    }

    public record Change<V, R>(boolean writes, V value, R result) {
        public static <V, R> Change<V, R> put(V value, R result) {
            if (value == null) {
                throw new IllegalArgumentException("put requires a value");
            }
            return new Change<>(true, value, result);
        }

        public static <V, R> Change<V, R> remove(R result) {
            return new Change<>(true, null, result);
        }

        public static <V, R> Change<V, R> none(R result) {
            return new Change<>(false, null, result);
        }
    }
}
