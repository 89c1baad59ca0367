package com.snuffles.pricewatch.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Stores the snapshot as pretty-printed JSON. Writes go to a sibling temp file which is then
 * moved over the data file, so a crash mid-write leaves the previous file intact.
 */
@Repository
@Slf4j
public class JsonFileSnapshotRepository implements SnapshotRepository {

    private final ObjectMapper objectMapper;
    private final Path dataFile;
    private final Path legacyFile;
    private final ReentrantLock fileLock = new ReentrantLock();

    public JsonFileSnapshotRepository(
        ObjectMapper objectMapper,
        @Value("${pricewatch.storage.data-file:data/data.json}") String dataFile,
        @Value("${pricewatch.storage.legacy-file:data.json}") String legacyFile
    ) {
        this.objectMapper = objectMapper;
        this.dataFile = Path.of(dataFile);
        this.legacyFile = legacyFile == null || legacyFile.isBlank() ? null : Path.of(legacyFile);
    }

    public Path getDataFile() {
        return dataFile;
    }

    @Override
    public void save(StateSnapshot snapshot) throws IOException {
        fileLock.lock();
        try {
            ensureParentDirectory();
            Path tmp = dataFile.resolveSibling(dataFile.getFileName() + ".tmp");
            try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(writer, snapshot);
            }
            try {
                Files.move(tmp, dataFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                log.debug("Atomic move unsupported for {}; replacing non-atomically", dataFile);
                Files.move(tmp, dataFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            fileLock.unlock();
        }
    }

    @Override
    public Optional<StateSnapshot> load() throws IOException {
        fileLock.lock();
        try {
            migrateLegacyFile();
            if (!Files.exists(dataFile)) {
                log.info("No data file at {}; starting with empty state", dataFile.toAbsolutePath());
                return Optional.empty();
            }
            try (Reader reader = Files.newBufferedReader(dataFile, StandardCharsets.UTF_8)) {
                return Optional.of(objectMapper.readValue(reader, StateSnapshot.class));
            }
        } finally {
            fileLock.unlock();
        }
    }

    private void migrateLegacyFile() throws IOException {
        if (legacyFile == null || Files.exists(dataFile) || !Files.exists(legacyFile)
            || legacyFile.toAbsolutePath().equals(dataFile.toAbsolutePath())) {
            return;
        }
        ensureParentDirectory();
        Files.move(legacyFile, dataFile);
        log.info("Moved data file from {} to {}", legacyFile, dataFile);
    }

    private void ensureParentDirectory() throws IOException {
        Path parent = dataFile.getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
    }
}
