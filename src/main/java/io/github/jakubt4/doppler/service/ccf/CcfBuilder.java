package io.github.jakubt4.doppler.service.ccf;

import io.github.jakubt4.doppler.exception.DomainException;
import io.github.jakubt4.doppler.model.CcfRecord;
import io.github.jakubt4.doppler.model.LineMask;
import io.github.jakubt4.doppler.model.SpectralTimeSeries;
import io.github.jakubt4.doppler.model.VelocityGrid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds the cross-correlation function of a spectrum with a weighted line mask.
 *
 * <p>For every trial velocity the mask centers are Doppler-shifted and the spectrum is
 * linearly interpolated at each shifted center. Flux errors are propagated assuming
 * independent pixels.
 */
@Slf4j
@Component
public class CcfBuilder {

    /**
     * Drops mask lines that leave the spectral overlap at either end of the velocity grid
     * and renormalizes the remaining weights to sum to one.
     *
     * <p>The overlap is the wavelength range covered by every epoch, so the filtered mask
     * is valid for the whole time series and is computed once per run.
     *
     * @throws DomainException if no line survives, or the surviving weights do not sum to a positive value
     */
    public LineMask prefilter(final LineMask mask, final SpectralTimeSeries spectra, final VelocityGrid grid) {
        var lower = Double.NEGATIVE_INFINITY;
        var upper = Double.POSITIVE_INFINITY;
        for (var e = 0; e < spectra.epochCount(); e++) {
            final var wave = spectra.wave()[e];
            if (wave.length == 0) {
                throw new DomainException("Epoch " + e + ": empty wavelength array");
            }
            lower = Math.max(lower, min(wave));
            upper = Math.min(upper, max(wave));
        }
        return prefilter(mask, lower, upper, grid);
    }

    LineMask prefilter(final LineMask mask, final double lower, final double upper, final VelocityGrid grid) {
        if (mask.size() == 0) {
            throw new DomainException("Line mask [" + mask.id() + "] is empty");
        }
        final var blue = DopplerShift.shift(mask.centers(), grid.min());
        final var red = DopplerShift.shift(mask.centers(), grid.max());

        var kept = 0;
        final var keep = new boolean[mask.size()];
        for (var k = 0; k < mask.size(); k++) {
            keep[k] = blue[k] > lower && red[k] < upper;
            if (keep[k]) {
                kept++;
            }
        }
        if (kept == 0) {
            throw new DomainException("Line mask [" + mask.id() + "] lies entirely outside the spectral overlap ["
                    + lower + ", " + upper + "] for velocities [" + grid.min() + ", " + grid.max() + "] km/s");
        }

        final var centers = new double[kept];
        final var weights = new double[kept];
        var sum = 0.0;
        var j = 0;
        for (var k = 0; k < mask.size(); k++) {
            if (keep[k]) {
                centers[j] = mask.centers()[k];
                weights[j] = mask.weights()[k];
                sum += weights[j];
                j++;
            }
        }
        if (!(sum > 0.0)) {
            throw new DomainException("Line mask [" + mask.id() + "] weights of the " + kept
                    + " lines inside the overlap sum to " + sum);
        }
        for (var k = 0; k < kept; k++) {
            weights[k] /= sum;
        }

        log.info("Mask [{}] — kept {} of {} lines inside [{}, {}]",
                mask.id(), kept, mask.size(), lower, upper);
        return new LineMask(mask.id(), centers, weights);
    }

    /**
     * Computes the CCF of one epoch.
     *
     * @param wave    ascending wavelength grid of the epoch
     * @param flux    flux values on {@code wave}
     * @param fluxErr flux errors on {@code wave}
     * @param mask    pre-filtered mask, weights summing to one
     * @param grid    trial velocities
     * @throws DomainException if a shifted line falls outside {@code wave}
     */
    public CcfRecord compute(final double[] wave, final double[] flux, final double[] fluxErr,
                             final LineMask mask, final VelocityGrid grid) {
        final var velocities = grid.velocities();
        final var values = new double[velocities.length];
        final var errors = new double[velocities.length];
        final var weights = mask.weights();

        for (var j = 0; j < velocities.length; j++) {
            final var shifted = DopplerShift.shift(mask.centers(), velocities[j]);

            var value = 0.0;
            var variance = 0.0;
            for (var k = 0; k < shifted.length; k++) {
                final var right = upperBound(wave, shifted[k]);
                final var left = right - 1;
                if (left < 0 || right >= wave.length) {
                    throw new DomainException("Mask line " + mask.centers()[k] + " shifted to " + shifted[k]
                            + " at " + velocities[j] + " km/s lies outside the wavelength grid [" + wave.length + "]");
                }

                final var fRight = (shifted[k] - wave[left]) / (wave[right] - wave[left]);
                final var fLeft = 1.0 - fRight;
                final var w = weights[k];

                value += (flux[left] * fLeft + flux[right] * fRight) * w;
                variance += (fluxErr[left] * fluxErr[left] * fLeft + fluxErr[right] * fluxErr[right] * fRight) * w * w;
            }
            values[j] = value;
            errors[j] = Math.sqrt(variance);
        }
        return new CcfRecord(velocities, values, errors);
    }

    /**
     * Index of the first element strictly greater than {@code key} in ascending {@code a}.
     */
    static int upperBound(final double[] a, final double key) {
        var lo = 0;
        var hi = a.length;
        while (lo < hi) {
            final var mid = (lo + hi) >>> 1;
            if (a[mid] <= key) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    private static double min(final double[] a) {
        var m = Double.POSITIVE_INFINITY;
        for (final var x : a) {
            m = Math.min(m, x);
        }
        return m;
    }

    private static double max(final double[] a) {
        var m = Double.NEGATIVE_INFINITY;
        for (final var x : a) {
            m = Math.max(m, x);
        }
        return m;
    }
}
