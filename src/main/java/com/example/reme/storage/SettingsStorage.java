package com.example.reme.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.file.*;

/** Reads and writes {@code settings.json} in the user's Rem-E home directory. */
public class SettingsStorage {
    private static final Logger log = LoggerFactory.getLogger(SettingsStorage.class);

    private final ObjectMapper mapper = JsonStorage.mapper();
    private final Path dir;
    private final Path file;

    public SettingsStorage() { this(Path.of(System.getProperty("user.home"), ".reme")); }

    public SettingsStorage(Path dir) {
        this.dir = dir;
        this.file = dir.resolve("settings.json");
    }

    /** Never fails: a missing or unreadable file yields defaults. */
    public Settings load() {
        if (!Files.exists(file)) return withDefaults(new Settings());
        try (InputStream in = Files.newInputStream(file)) {
            return withDefaults(mapper.readValue(in, Settings.class));
        } catch (IOException ex) {
            log.warn("Ignoring unreadable settings file {}: {}", file, ex.getMessage());
            return withDefaults(new Settings());
        }
    }

    public void save(Settings s) throws IOException {
        if (!Files.exists(dir)) Files.createDirectories(dir);
        try (OutputStream out = Files.newOutputStream(file)) {
            mapper.writeValue(out, s);
        }
    }

    private Settings withDefaults(Settings s) {
        if (s.dataDirectory == null || s.dataDirectory.isBlank()) s.dataDirectory = dir.resolve("data").toString();
        return s;
    }
}
