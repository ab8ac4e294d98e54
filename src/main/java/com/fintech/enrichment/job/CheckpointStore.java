package com.fintech.enrichment.job;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fintech.enrichment.exception.CheckpointException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Stores checkpoints as JSON next to the input file ({@code <input>.checkpoint.json}).
 * <p>
 * Each save rewrites the whole file through a temporary file and a move, so a crash
 * mid-write leaves the previous checkpoint intact.
 */
@Slf4j
public class CheckpointStore {

    public static final String SUFFIX = ".checkpoint.json";

    private final ObjectMapper objectMapper;

    public CheckpointStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path pathFor(String inputPath) {
        return Paths.get(inputPath + SUFFIX);
    }

    /**
     * Loads the checkpoint for an input file.
     * <p>
     * Returns empty when there is none, when it belongs to a different input file, or when
     * it cannot be parsed. An unparseable checkpoint is deleted.
     */
    public Optional<Checkpoint> load(String inputPath) {
        Path path = pathFor(inputPath);
        if (!Files.exists(path)) {
            return Optional.empty();
        }

        Checkpoint checkpoint;
        try {
            checkpoint = objectMapper.readValue(path.toFile(), Checkpoint.class);
        } catch (IOException e) {
            log.warn("Could not load checkpoint {}, starting from scratch: {}", path, e.getMessage());
            delete(inputPath);
            return Optional.empty();
        }

        if (checkpoint.getJobSettings() == null || !sameFile(checkpoint.getJobSettings().getInputPath(), inputPath)) {
            log.warn("Ignoring checkpoint {} written for a different input file", path);
            return Optional.empty();
        }
        log.info("Loaded checkpoint {} at row {} with {} records",
                path, checkpoint.getLastProcessedRow(), checkpoint.getProcessedRecords().size());
        return Optional.of(checkpoint);
    }

    public void save(Checkpoint checkpoint) {
        Path target = pathFor(checkpoint.getJobSettings().getInputPath());
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), checkpoint);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new CheckpointException("Failed to write checkpoint " + target + ": " + e.getMessage(), e);
        }
        log.info("Checkpoint saved at row {} ({} records)",
                checkpoint.getLastProcessedRow(), checkpoint.getProcessedRecords().size());
    }

    public void delete(String inputPath) {
        Path path = pathFor(inputPath);
        try {
            if (Files.deleteIfExists(path)) {
                log.info("Checkpoint {} removed", path);
            }
        } catch (IOException e) {
            throw new CheckpointException("Failed to delete checkpoint " + path + ": " + e.getMessage(), e);
        }
    }

    public boolean exists(String inputPath) {
        return Files.exists(pathFor(inputPath));
    }

    private static boolean sameFile(String saved, String current) {
        if (saved == null || current == null) {
            return false;
        }
        return Paths.get(saved).toAbsolutePath().normalize()
                .equals(Paths.get(current).toAbsolutePath().normalize());
    }
}
