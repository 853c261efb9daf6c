package com.stitchwork.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stitchwork.core.workspace.WorkspaceSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Stores each checkpoint as two JSON files in one directory:
 * {@code <id>.json} for the checkpoint and {@code <id>.workspace.json} for its workspace snapshot.
 * Files are written to a temporary name and moved into place, so readers never see a partial file.
 */
public class FileCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(FileCheckpointStore.class);

    private static final String CHECKPOINT_SUFFIX = ".json";
    private static final String SNAPSHOT_SUFFIX = ".workspace.json";

    private final Path directory;
    private final ObjectMapper mapper;

    public FileCheckpointStore(Path directory) {
        this(directory, CheckpointJson.mapper());
    }

    public FileCheckpointStore(Path directory, ObjectMapper mapper) {
        this.directory = directory;
        this.mapper = mapper;
    }

    public Path directory() {
        return directory;
    }

    @Override
    public void save(Checkpoint checkpoint, WorkspaceSnapshot snapshot) {
        String id = checkpoint.checkpointId();
        try {
            Files.createDirectories(directory);
            // snapshot first: a checkpoint file never points at a missing snapshot
            writeAtomically(directory.resolve(id + SNAPSHOT_SUFFIX), mapper.writeValueAsBytes(snapshot));
            writeAtomically(directory.resolve(id + CHECKPOINT_SUFFIX), mapper.writeValueAsBytes(checkpoint));
            log.debug("Wrote checkpoint {} to {}", id, directory);
        } catch (IOException e) {
            throw new CheckpointStoreException("Failed to write checkpoint " + id, e);
        }
    }

    @Override
    public Optional<Checkpoint> load(String checkpointId) {
        return read(directory.resolve(checkpointId + CHECKPOINT_SUFFIX), Checkpoint.class);
    }

    @Override
    public Optional<WorkspaceSnapshot> loadSnapshot(String checkpointId) {
        return read(directory.resolve(checkpointId + SNAPSHOT_SUFFIX), WorkspaceSnapshot.class);
    }

    @Override
    public List<Checkpoint> list() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        var all = new ArrayList<Checkpoint>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : files.toList()) {
                String name = file.getFileName().toString();
                if (name.endsWith(CHECKPOINT_SUFFIX) && !name.endsWith(SNAPSHOT_SUFFIX)) {
                    read(file, Checkpoint.class).ifPresent(all::add);
                }
            }
        } catch (IOException e) {
            throw new CheckpointStoreException("Failed to list checkpoints in " + directory, e);
        }
        all.sort(Comparator.comparing(Checkpoint::createdAt).thenComparing(Checkpoint::checkpointId));
        return all;
    }

    @Override
    public boolean delete(String checkpointId) {
        try {
            boolean removed = Files.deleteIfExists(directory.resolve(checkpointId + CHECKPOINT_SUFFIX));
            Files.deleteIfExists(directory.resolve(checkpointId + SNAPSHOT_SUFFIX));
            return removed;
        } catch (IOException e) {
            throw new CheckpointStoreException("Failed to delete checkpoint " + checkpointId, e);
        }
    }

    private <T> Optional<T> read(Path file, Class<T> type) {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(file.toFile(), type));
        } catch (IOException e) {
            throw new CheckpointStoreException("Failed to read " + file, e);
        }
    }

    private static void writeAtomically(Path target, byte[] content) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.write(tmp, content);
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
