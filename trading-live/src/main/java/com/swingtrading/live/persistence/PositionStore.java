package com.swingtrading.live.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.swingtrading.error.ExternalServiceException;
import com.swingtrading.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Open positions as a JSON file, so a restarted live session resumes them.
 * Writes go to a temporary file that replaces the old one.
 */
public final class PositionStore {
    private static final Logger logger = LoggerFactory.getLogger(PositionStore.class);
    private static final String SERVICE = "position-store";

    private final Path file;
    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(SerializationFeature.INDENT_OUTPUT);

    public PositionStore(Path file) {
        this.file = file;
    }

    public void save(List<Position> positions) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(temp.toFile(), positions);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            logger.debug("Saved {} positions to {}", positions.size(), file);
        } catch (IOException e) {
            throw new ExternalServiceException(SERVICE, "failed to save positions to " + file, e);
        }
    }

    /**
     * @return saved positions, or an empty list when nothing was saved yet
     */
    public List<Position> load() {
        if (!Files.exists(file)) {
            logger.info("No saved positions at {}", file);
            return List.of();
        }
        try {
            List<Position> positions = objectMapper.readValue(file.toFile(), new TypeReference<List<Position>>() {});
            logger.info("Loaded {} saved positions from {}", positions.size(), file);
            return positions;
        } catch (IOException e) {
            throw new ExternalServiceException(SERVICE, "failed to read positions from " + file, e);
        }
    }

    public Path getFile() {
        return file;
    }
}
