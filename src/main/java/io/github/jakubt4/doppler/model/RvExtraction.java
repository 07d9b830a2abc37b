package io.github.jakubt4.doppler.model;

import java.util.List;

/**
 * Outcome of running the CCF and profile fit over a spectral time series.
 *
 * <p>Only successfully measured epochs enter {@code rv} and {@code fwhm};
 * {@code epochs[i]} is the source epoch index of their i-th element.
 *
 * @param rv           measured radial velocities
 * @param fwhm         measured CCF widths
 * @param epochs       source epoch index per series element
 * @param measurements per-epoch fit details, in epoch order
 * @param failures     epochs skipped under {@link FailurePolicy#SKIP_EPOCH}
 * @param cancelled    {@code true} when the run stopped before visiting every epoch
 */
public record RvExtraction(RvSeries rv,
                           FwhmSeries fwhm,
                           int[] epochs,
                           List<EpochMeasurement> measurements,
                           List<EpochFailure> failures,
                           boolean cancelled) {
}
