package io.github.jakubt4.doppler.service.mask;

import io.github.jakubt4.doppler.exception.DopplerException;
import io.github.jakubt4.doppler.exception.ResourceException;
import io.github.jakubt4.doppler.model.LineMask;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Resolves the line mask of a run: a named file inside the repository when given, otherwise the repository
 * mask whose spectral type is numerically closest to the target's.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MaskSelector {

    private final MaskRepository maskRepository;
    private final SpectralTypeScale spectralTypeScale;
    private final LineMaskReader lineMaskReader;

    /**
     * @param maskPath     mask file inside the repository, {@code null} to select by spectral type
     * @param spectralType target spectral type, used only when {@code maskPath} is {@code null}
     * @param weightColumn weight column, {@code null} for equal weights
     * @param criteria     inclusion criteria
     * @throws ResourceException   if no mask can be found
     * @throws io.github.jakubt4.doppler.exception.ValidationException if {@code maskPath} leaves the repository
     */
    public LineMask load(final Path maskPath, final String spectralType, final String weightColumn,
                         final List<String> criteria) {
        final var path = maskPath != null ? maskRepository.resolve(maskPath) : select(spectralType).path();
        return lineMaskReader.read(path, weightColumn, criteria);
    }

    /**
     * Picks the closest mask; ties go to the first mask in repository order.
     *
     * @throws ResourceException if the repository is empty or no mask type can be compared
     */
    public MaskEntry select(final String spectralType) {
        final var target = spectralTypeScale.toNumber(spectralType);
        final var entries = maskRepository.list();

        MaskEntry best = null;
        var bestDistance = Double.POSITIVE_INFINITY;
        for (final var entry : entries) {
            final double number;
            try {
                number = spectralTypeScale.toNumber(entry.spectralType());
            } catch (final DopplerException e) {
                log.warn("Mask [{}] skipped: {}", entry.id(), e.getMessage());
                continue;
            }
            final var distance = Math.abs(number - target);
            if (distance < bestDistance) {
                best = entry;
                bestDistance = distance;
            }
        }
        if (best == null) {
            throw new ResourceException("No mask available for spectral type [" + spectralType + "] among "
                    + entries.size() + " repository entries");
        }
        log.info("Mask [{}] selected for spectral type [{}]", best.id(), spectralType);
        return best;
    }
}
