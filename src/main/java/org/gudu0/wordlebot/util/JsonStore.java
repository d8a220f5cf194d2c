package org.gudu0.wordlebot.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.*;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * A small JSON-backed value with dirty tracking.
 * Writes go to a sibling .tmp file and are moved into place atomically; a failed write leaves the value
 * dirty so the next flush retries it.
 */
public class JsonStore<T> {
    public final Object lock = new Object();

    private final Path path;
    private final ObjectMapper om;
    private final Class<T> type;
    private final Supplier<T> defaultSupplier;
    private final String nameForLogs;

    private volatile boolean dirty = false;
    private final T value;

    public JsonStore(Path path, Class<T> type, Supplier<T> defaultSupplier, String nameForLogs) {
        this.path = path;
        this.type = type;
        this.defaultSupplier = defaultSupplier;
        this.nameForLogs = nameForLogs;

        this.om = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        this.value = loadOrNew();
        ConsoleLog.debug("JsonStore", "Loaded " + nameForLogs + " from " + path);
    }

    public T get() {
        return value;
    }

    /** Mutates the value under the store lock and marks it dirty. */
    public void update(Consumer<T> mutation) {
        synchronized (lock) {
            mutation.accept(value);
            dirty = true;
        }
    }

    public void tryFlush() {
        if (!dirty) return;
        try {
            flushNow();
        } catch (Exception e) {
            ConsoleLog.error("JsonStore", nameForLogs + " flush failed: " + e.getMessage(), e);
        }
    }

    public void flushNow() throws IOException {
        synchronized (lock) {
            if (!dirty) return;

            ConsoleLog.debug("JsonStore", "Flushing " + nameForLogs + " -> " + path);

            Files.createDirectories(path.getParent());
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");

            om.writeValue(tmp.toFile(), value);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

            dirty = false;
        }
    }

    private T loadOrNew() {
        try {
            if (Files.exists(path)) {
                return om.readValue(path.toFile(), type);
            }
            ConsoleLog.debug("JsonStore", nameForLogs + " missing, starting from defaults at " + path);
        } catch (Exception e) {
            ConsoleLog.error("JsonStore", "Failed to load " + nameForLogs + ", starting fresh: " + e.getMessage(), e);
        }
        return defaultSupplier.get();
    }
}
