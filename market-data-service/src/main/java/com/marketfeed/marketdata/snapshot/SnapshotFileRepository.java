package com.marketfeed.marketdata.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Single JSON document on local disk holding every asset's snapshot history.
 *
 * <p>Writes go to a temp file in the same directory which is then atomically renamed over
 * the target, so a crash mid-write leaves the previous document intact.
 */
public class SnapshotFileRepository {

    private static final Logger log = LoggerFactory.getLogger(SnapshotFileRepository.class);

    private final Path path;
    private final ObjectMapper objectMapper;

    public SnapshotFileRepository(Path path, ObjectMapper objectMapper) {
        this.path         = path.toAbsolutePath();
        this.objectMapper = objectMapper;
    }

    public Path path() {
        return path;
    }

    /**
     * @return the stored document, empty when the file does not exist
     * @throws SnapshotPersistenceException when the file exists but cannot be read or parsed
     */
    public Optional<SnapshotDocument> read() {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(path.toFile(), SnapshotDocument.class));
        } catch (IOException e) {
            throw new SnapshotPersistenceException("Failed to read snapshot file " + path, e);
        }
    }

    /**
     * @throws SnapshotPersistenceException when the document could not be written; the
     *         previous file is left untouched
     */
    public void write(SnapshotDocument document) {
        Path temp = null;
        try {
            Path directory = path.getParent();
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, path.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), document);
            moveIntoPlace(temp);
            log.debug("Snapshot file written. path={}", path);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new SnapshotPersistenceException("Failed to write snapshot file " + path, e);
        }
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported, falling back to replace. path={}", path);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temp snapshot file. path={} reason={}", temp, e.getMessage());
        }
    }
}
