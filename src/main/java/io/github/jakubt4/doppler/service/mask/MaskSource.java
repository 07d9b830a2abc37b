package io.github.jakubt4.doppler.service.mask;

import java.nio.file.Path;
import java.util.List;

/**
 * Where the line mask of a run comes from.
 *
 * @param path         mask file relative to the repository, {@code null} to select by {@code spectralType}
 * @param spectralType target spectral type for repository selection
 * @param weightColumn weight column, {@code null} for equal weights
 * @param criteria     inclusion criteria, AND-combined
 */
public record MaskSource(Path path, String spectralType, String weightColumn, List<String> criteria) {

    public MaskSource {
        criteria = criteria == null ? List.of() : List.copyOf(criteria);
    }
}
