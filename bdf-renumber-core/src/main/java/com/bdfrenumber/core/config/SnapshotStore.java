package com.bdfrenumber.core.config;

import com.bdfrenumber.core.RenumberException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads and saves {@link RangeSnapshot}s as JSON.
 */
public class SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Reads a snapshot.
     *
     * @param path snapshot file
     * @return snapshot
     * @throws RenumberException if the file cannot be read or parsed
     */
    public RangeSnapshot load(Path path) {
        try {
            RangeSnapshot snapshot = JSON_MAPPER.readValue(path.toFile(), RangeSnapshot.class);
            log.info("Loaded range snapshot from {} ({} file range(s), {} advanced file(s))",
                path, snapshot.fileRanges().size(), snapshot.ranges().size());
            return snapshot;
        } catch (IOException e) {
            throw new RenumberException("Failed to read range snapshot: " + e.getMessage(), path, e);
        }
    }

    /**
     * Writes a snapshot, creating parent directories.
     *
     * @param snapshot snapshot to save
     * @param path target file
     * @throws RenumberException if the file cannot be written
     */
    public void save(RangeSnapshot snapshot, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            JSON_MAPPER.writeValue(path.toFile(), snapshot);
            log.info("Saved range snapshot to {}", path);
        } catch (IOException e) {
            throw new RenumberException("Failed to write range snapshot: " + e.getMessage(), path, e);
        }
    }
}
