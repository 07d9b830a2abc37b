package io.github.jakubt4.doppler.service.mask;

import io.github.jakubt4.doppler.exception.ResourceException;
import io.github.jakubt4.doppler.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;

/**
 * Masks stored as {@code <spectral type>_<anything>.csv} files in one directory.
 */
@Slf4j
public class DirectoryMaskRepository implements MaskRepository {

    private final Path directory;

    public DirectoryMaskRepository(final Path directory) {
        this.directory = directory;
    }

    @Override
    public List<MaskEntry> list() {
        if (!Files.isDirectory(directory)) {
            throw new ResourceException("Mask directory [" + directory + "] does not exist");
        }
        try (var files = Files.list(directory)) {
            final var entries = files
                    .filter(p -> p.getFileName().toString().endsWith(".csv"))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .map(DirectoryMaskRepository::toEntry)
                    .toList();
            log.debug("Mask directory [{}] — {} masks", directory, entries.size());
            return entries;
        } catch (final IOException e) {
            throw new ResourceException("Failed to list mask directory [" + directory + "]: " + e.getMessage(), e);
        }
    }

    @Override
    public Path resolve(final Path maskPath) {
        final var root = directory.toAbsolutePath().normalize();
        final var resolved = root.resolve(maskPath).normalize();
        if (!resolved.startsWith(root)) {
            throw new ValidationException("Mask path [" + maskPath + "] lies outside the mask directory");
        }
        return resolved;
    }

    private static MaskEntry toEntry(final Path path) {
        final var name = path.getFileName().toString();
        final var cut = name.indexOf('_');
        final var spectralType = cut > 0 ? name.substring(0, cut) : name.substring(0, name.length() - ".csv".length());
        return new MaskEntry(name, spectralType, path);
    }
}
