package io.github.jakubt4.doppler.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.jakubt4.doppler.exception.ResourceException;
import io.github.jakubt4.doppler.exception.ValidationException;
import io.github.jakubt4.doppler.model.AnalysisSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Stores each snapshot as {@code <id>.json} in one directory.
 */
@Slf4j
public class JsonResultStore implements ResultStore {

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final ObjectMapper objectMapper;
    private final Path directory;

    public JsonResultStore(final ObjectMapper objectMapper, final Path directory) {
        this.objectMapper = objectMapper;
        this.directory = directory;
    }

    @Override
    public void save(final AnalysisSnapshot snapshot) {
        final var file = fileFor(snapshot.id());
        try {
            Files.createDirectories(directory);
            objectMapper.writeValue(file.toFile(), snapshot);
            log.info("Snapshot [{}] saved to {}", snapshot.id(), file);
        } catch (final IOException e) {
            throw new ResourceException("Failed to save snapshot [" + snapshot.id() + "]: " + e.getMessage(), e);
        }
    }

    @Override
    public AnalysisSnapshot load(final String id) {
        final var file = fileFor(id);
        if (!Files.isRegularFile(file)) {
            throw new ResourceException("Snapshot [" + id + "] not found in " + directory);
        }
        try {
            return objectMapper.readValue(file.toFile(), AnalysisSnapshot.class);
        } catch (final IOException e) {
            throw new ResourceException("Failed to load snapshot [" + id + "]: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean delete(final String id) {
        try {
            final var deleted = Files.deleteIfExists(fileFor(id));
            if (deleted) {
                log.info("Snapshot [{}] deleted", id);
            }
            return deleted;
        } catch (final IOException e) {
            throw new ResourceException("Failed to delete snapshot [" + id + "]: " + e.getMessage(), e);
        }
    }

    private Path fileFor(final String id) {
        if (id == null || !SAFE_ID.matcher(id).matches()) {
            throw new ValidationException("Snapshot id [" + id + "] must match " + SAFE_ID.pattern());
        }
        return directory.resolve(id + ".json");
    }
}
