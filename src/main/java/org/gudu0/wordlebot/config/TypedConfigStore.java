package org.gudu0.wordlebot.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.gudu0.wordlebot.util.ConsoleLog;

import java.io.IOException;
import java.nio.file.*;
import java.util.function.Supplier;

/**
 * Loads a config POJO from JSON, falling back to defaults when the file is missing or broken.
 * Nothing is written until {@link #save()} is called.
 */
public class TypedConfigStore<T> {
    private final Path path;
    private final ObjectMapper om;
    private final Class<T> type;

    private final T cfg;
    private final boolean loadedFromDisk;

    public TypedConfigStore(Path path, Class<T> type, Supplier<T> defaults) {
        this.path = path;
        this.type = type;
        // Unknown keys are ignored; removed fields must not break old config files.
        this.om = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        T loaded = load();
        this.loadedFromDisk = loaded != null;
        this.cfg = loaded != null ? loaded : defaults.get();
    }

    public T cfg() { return cfg; }

    public boolean loadedFromDisk() { return loadedFromDisk; }

    public synchronized void save() throws IOException {
        Files.createDirectories(path.getParent());
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        om.writeValue(tmp.toFile(), cfg);
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        ConsoleLog.debug("TypedConfigStore", "Saved config to " + path);
    }

    private T load() {
        try {
            if (Files.exists(path)) {
                T value = om.readValue(path.toFile(), type);
                ConsoleLog.info("TypedConfigStore", "Loaded config from " + path);
                return value;
            }
        } catch (Exception e) {
            ConsoleLog.error("TypedConfigStore", "Failed to load " + path + ", using defaults: " + e.getMessage(), e);
            return null;
        }
        ConsoleLog.warn("TypedConfigStore", "Config missing: " + path + " (using defaults until saved)");
        return null;
    }
}
