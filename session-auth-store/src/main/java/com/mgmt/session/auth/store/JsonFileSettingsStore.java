package com.mgmt.session.auth.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mgmt.session.auth.server.store.Settings;
import com.mgmt.session.auth.server.store.SettingsStore;
import com.mgmt.session.auth.server.store.StoreException;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link SettingsStore} persisted as a single JSON document.
 *
 * <p>A missing file reads as default settings. Writes go to a sibling temp file that
 * then replaces the document, so readers never see a half-written file. Reads and writes
 * on one instance are serialized; separate processes sharing a file are not coordinated.
 */
@Slf4j
public class JsonFileSettingsStore implements SettingsStore {

    private final Path file;
    private final ObjectMapper mapper;

    public JsonFileSettingsStore(Path file) {
        this(file, new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .enable(SerializationFeature.INDENT_OUTPUT));
    }

    public JsonFileSettingsStore(Path file, ObjectMapper mapper) {
        this.file = Objects.requireNonNull(file, "file");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public synchronized Settings read() {
        if (!Files.exists(file)) {
            log.debug("No settings file at {}, using defaults", file);
            return new Settings();
        }
        try {
            return mapper.readValue(file.toFile(), Settings.class);
        } catch (IOException e) {
            throw new StoreException("Failed to read settings from " + file, e);
        }
    }

    @Override
    public synchronized void write(Settings settings) {
        Objects.requireNonNull(settings, "settings");
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(tmp.toFile(), settings);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StoreException("Failed to write settings to " + file, e);
        }
    }
}
