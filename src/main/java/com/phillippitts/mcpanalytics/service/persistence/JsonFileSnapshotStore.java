package com.phillippitts.mcpanalytics.service.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.phillippitts.mcpanalytics.domain.AnalyticsSnapshot;
import com.phillippitts.mcpanalytics.exception.SnapshotLoadException;
import com.phillippitts.mcpanalytics.exception.SnapshotSaveException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Stores the snapshot as a pretty-printed JSON file.
 *
 * <p>Writes go to a temporary file in the target directory which is then moved over the
 * snapshot, so a crash mid-write leaves the previous snapshot intact.
 */
public class JsonFileSnapshotStore implements SnapshotStore {

    private static final Logger LOG = LogManager.getLogger(JsonFileSnapshotStore.class);

    private final Path file;
    private final ObjectMapper mapper;
    private final ObjectWriter writer;
    private final SnapshotJsonCodec codec;

    /**
     * @param file                snapshot file; its directory is created on first write
     * @param mapper              Jackson mapper used for reading and writing the tree
     * @param recentCallsCapacity recovered recent feeds are cut to this size
     */
    public JsonFileSnapshotStore(Path file, ObjectMapper mapper, int recentCallsCapacity) {
        this.file = Objects.requireNonNull(file, "file").toAbsolutePath().normalize();
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.writer = mapper.writerWithDefaultPrettyPrinter();
        this.codec = new SnapshotJsonCodec(recentCallsCapacity);
    }

    @Override
    public Optional<AnalyticsSnapshot> read(Instant fallbackStartTime) {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = mapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new SnapshotLoadException(file, "unreadable or malformed JSON", e);
        }
        if (root == null || root.isMissingNode()) {
            throw new SnapshotLoadException(file, "file is empty");
        }
        if (!root.isObject()) {
            throw new SnapshotLoadException(file, "top-level value is " + root.getNodeType() + ", expected OBJECT");
        }
        try {
            return Optional.of(codec.decode(root, fallbackStartTime));
        } catch (RuntimeException e) {
            throw new SnapshotLoadException(file, "snapshot could not be decoded", e);
        }
    }

    @Override
    public void write(AnalyticsSnapshot snapshot) {
        Path dir = file.getParent();
        Path temp = null;
        try {
            if (!Files.isDirectory(dir)) {
                Files.createDirectories(dir);
                LOG.info("Created analytics data directory: {}", dir);
            }
            temp = dir.resolve(file.getFileName() + "." + UUID.randomUUID() + ".tmp");
            // Default permissions from the process umask; createTempFile would make it owner-only
            try (OutputStream out = Files.newOutputStream(temp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                writer.writeValue(out, codec.encode(snapshot));
            }
            moveIntoPlace(temp);
        } catch (IOException | RuntimeException e) {
            SnapshotSaveException failure = new SnapshotSaveException(file, e);
            deleteQuietly(temp, failure);
            throw failure;
        }
    }

    @Override
    public String location() {
        return file.toString();
    }

    Path file() {
        return file;
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move not supported for {}; falling back to replace", file);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp, SnapshotSaveException failure) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }
}
