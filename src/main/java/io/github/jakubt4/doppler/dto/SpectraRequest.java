package io.github.jakubt4.doppler.dto;

import io.github.jakubt4.doppler.exception.ValidationException;
import io.github.jakubt4.doppler.model.FailurePolicy;
import io.github.jakubt4.doppler.model.SpectralTimeSeries;
import io.github.jakubt4.doppler.model.VelocityGrid;
import io.github.jakubt4.doppler.service.mask.MaskSource;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;

/**
 * Inbound request for RV extraction from spectra.
 *
 * @param time          observation times, one per epoch
 * @param wave          wavelength grid shared by all epochs (exclusive with {@code waves})
 * @param waves         wavelength grid per epoch (exclusive with {@code wave})
 * @param fluxVal       flux values per epoch
 * @param fluxErr       flux errors per epoch
 * @param timeUnit      unit of {@code time}
 * @param waveUnit      unit of the wavelengths
 * @param fluxUnit      unit of the fluxes
 * @param maskPath      mask file relative to the mask directory; when absent the mask is selected by {@code spectralType}
 * @param spectralType  target spectral type
 * @param weightColumn  mask weight column
 * @param criteria      mask inclusion criteria
 * @param velocityGrid  {@code [start, stop, step]} in km/s, configured default when absent
 * @param failurePolicy {@code ABORT} or {@code SKIP_EPOCH}, required
 * @param parallelism   worker threads, configured default when absent
 */
public record SpectraRequest(double[] time,
                             double[] wave,
                             double[][] waves,
                             double[][] fluxVal,
                             double[][] fluxErr,
                             String timeUnit,
                             String waveUnit,
                             String fluxUnit,
                             String maskPath,
                             String spectralType,
                             String weightColumn,
                             List<String> criteria,
                             double[] velocityGrid,
                             FailurePolicy failurePolicy,
                             Integer parallelism) {

    public SpectralTimeSeries toSpectra() {
        if (wave != null) {
            return SpectralTimeSeries.sharedGrid(time, wave, fluxVal, fluxErr, timeUnit, waveUnit, fluxUnit);
        }
        return new SpectralTimeSeries(time, waves, fluxVal, fluxErr, timeUnit, waveUnit, fluxUnit);
    }

    public MaskSource toMaskSource() {
        return new MaskSource(maskPath == null ? null : toPath(maskPath), spectralType, weightColumn, criteria);
    }

    private static Path toPath(final String raw) {
        try {
            return Path.of(raw);
        } catch (final InvalidPathException e) {
            throw new ValidationException("Mask path [" + raw + "] is not a valid path", e);
        }
    }

    public VelocityGrid toVelocityGrid() {
        return velocityGrid == null ? null : VelocityGrid.of(velocityGrid);
    }
}
