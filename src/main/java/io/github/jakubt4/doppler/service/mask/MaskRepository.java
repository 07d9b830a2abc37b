package io.github.jakubt4.doppler.service.mask;

import java.nio.file.Path;
import java.util.List;

/**
 * Source of line masks keyed by spectral type.
 */
public interface MaskRepository {

    /**
     * @throws io.github.jakubt4.doppler.exception.ResourceException if the repository cannot be listed
     */
    List<MaskEntry> list();

    /**
     * Locates a mask file named by a client, relative to the repository.
     *
     * @throws io.github.jakubt4.doppler.exception.ValidationException if the path leaves the repository
     */
    Path resolve(Path maskPath);
}
