package com.davisodom.settlementsim.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Versioned JSON files under a data folder.
 *
 * Writes go to a temp file and are moved into place atomically, after copying the previous
 * version to a timestamped backup. Only the newest backups are kept.
 */
public class JsonStore {

    public static final int SCHEMA_VERSION = 1;

    private final Path dataFolder;
    private final Logger logger;
    private final int backupsToKeep;
    private final ObjectMapper jsonMapper;

    public JsonStore(Path dataFolder, Logger logger) {
        this(dataFolder, logger, 5);
    }

    /**
     * @param backupsToKeep backups retained per file; 0 disables backups
     */
    public JsonStore(Path dataFolder, Logger logger, int backupsToKeep) {
        this.dataFolder = dataFolder;
        this.logger = logger;
        this.backupsToKeep = backupsToKeep;
        this.jsonMapper = new ObjectMapper();
        this.jsonMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.jsonMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public ObjectMapper getMapper() {
        return jsonMapper;
    }

    /**
     * Save data wrapped with its schema version.
     *
     * @param filename path relative to the data folder; parent folders are created
     */
    public <T> void saveJson(String filename, T data) throws IOException {
        Path file = dataFolder.resolve(filename);
        Files.createDirectories(file.getParent());

        if (Files.exists(file) && backupsToKeep > 0) {
            backupFile(file);
        }

        Path tempFile = file.resolveSibling(file.getFileName() + ".tmp");
        jsonMapper.writeValue(tempFile.toFile(), new VersionedData<>(SCHEMA_VERSION, data));
        Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

        logger.fine(String.format("Saved %s (schema v%d)", filename, SCHEMA_VERSION));
    }

    /**
     * Load a versioned file.
     *
     * @return the data, or {@code null} if the file doesn't exist
     * @throws IOException on unreadable files or a schema newer than this build understands
     */
    public <T> T loadJson(String filename, Class<T> dataClass) throws IOException {
        return loadJson(filename, jsonMapper.getTypeFactory().constructType(dataClass));
    }

    public <T> List<T> loadJsonList(String filename, Class<T> elementClass) throws IOException {
        List<T> list = loadJson(filename, jsonMapper.getTypeFactory().constructCollectionType(List.class, elementClass));
        return list != null ? list : new ArrayList<>();
    }

    private <T> T loadJson(String filename, JavaType dataType) throws IOException {
        Path file = dataFolder.resolve(filename);
        if (!Files.exists(file)) {
            logger.fine(String.format("%s not found", filename));
            return null;
        }

        VersionedData<T> versioned = jsonMapper.readValue(file.toFile(),
                jsonMapper.getTypeFactory().constructParametricType(VersionedData.class, dataType));

        if (versioned.schemaVersion > SCHEMA_VERSION) {
            throw new IOException(String.format("%s has schema v%d; this build reads up to v%d",
                    filename, versioned.schemaVersion, SCHEMA_VERSION));
        }
        if (versioned.schemaVersion < SCHEMA_VERSION) {
            logger.warning(String.format("Schema upgrade needed for %s: v%d -> v%d",
                    filename, versioned.schemaVersion, SCHEMA_VERSION));
        }
        return versioned.data;
    }

    /**
     * Files directly under a subfolder whose names end with the suffix.
     */
    public List<String> list(String folder, String suffix) throws IOException {
        Path dir = dataFolder.resolve(folder);
        if (!Files.isDirectory(dir)) {
            return new ArrayList<>();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(suffix))
                    .sorted()
                    .map(name -> folder + "/" + name)
                    .collect(Collectors.toList());
        }
    }

    private void backupFile(Path file) throws IOException {
        String backupName = file.getFileName() + ".backup." + System.currentTimeMillis();
        Files.copy(file, file.resolveSibling(backupName), StandardCopyOption.REPLACE_EXISTING);
        cleanOldBackups(file);
    }

    private void cleanOldBackups(Path file) throws IOException {
        String prefix = file.getFileName() + ".backup.";
        List<Path> backups;
        try (Stream<Path> files = Files.list(file.getParent())) {
            backups = files.filter(p -> p.getFileName().toString().startsWith(prefix))
                    .sorted(Comparator.comparingLong(p -> backupStamp(p, prefix)))
                    .collect(Collectors.toList());
        }
        for (int i = 0; i < backups.size() - backupsToKeep; i++) {
            Files.deleteIfExists(backups.get(i));
            logger.fine("Deleted old backup: " + backups.get(i).getFileName());
        }
    }

    private static long backupStamp(Path backup, String prefix) {
        try {
            return Long.parseLong(backup.getFileName().toString().substring(prefix.length()));
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    /**
     * Versioned wrapper written around every file.
     */
    public static class VersionedData<T> {
        public int schemaVersion;
        public T data;

        public VersionedData() {} // For Jackson

        public VersionedData(int schemaVersion, T data) {
            this.schemaVersion = schemaVersion;
            this.data = data;
        }
    }
}
