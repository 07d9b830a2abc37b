package io.github.jakubt4.doppler.service.mask;

import java.nio.file.Path;

/**
 * A mask available in a {@link MaskRepository}.
 *
 * @param id           mask identifier (file name)
 * @param spectralType spectral type the mask was built for
 * @param path         location of the mask file
 */
public record MaskEntry(String id, String spectralType, Path path) {
}
