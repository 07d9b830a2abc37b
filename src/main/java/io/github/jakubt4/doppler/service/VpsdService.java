package io.github.jakubt4.doppler.service;

import io.github.jakubt4.doppler.client.PeriodogramEngine;
import io.github.jakubt4.doppler.exception.DomainException;
import io.github.jakubt4.doppler.exception.ValidationException;
import io.github.jakubt4.doppler.model.PeriodogramResult;
import io.github.jakubt4.doppler.model.RvSeries;
import io.github.jakubt4.doppler.model.Vpsd;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;

/**
 * Builds the velocity power spectral density of an RV series.
 *
 * <p>The unnormalized periodogram is averaged in {@value #BINS} logarithmically spaced
 * frequency bins; empty bins are dropped. Both the full-resolution and the binned power
 * are divided by the spectral window area to give a density.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VpsdService {

    public static final int BINS = 50;

    private final PeriodogramEngine periodogramEngine;

    /**
     * Computes the VPSD of {@code rv}.
     *
     * @throws ValidationException if the series carries no errors
     * @throws DomainException     if the periodogram cannot be log-binned or has no usable window
     */
    public Vpsd compute(final RvSeries rv) {
        if (rv.error() == null) {
            throw new ValidationException("RV series [" + rv.maskId() + "] has no errors, required for the periodogram");
        }
        final var periodogram = periodogramEngine.periodogram(rv.time(), rv.value(), rv.error(), false, true);
        return build(periodogram);
    }

    /**
     * Derives the VPSD from a periodogram. Pure function of its input.
     */
    public Vpsd build(final PeriodogramResult periodogram) {
        final var freq = periodogram.frequency();
        final var power = periodogram.power();
        if (freq.length < 2) {
            throw new DomainException("Periodogram has " + freq.length + " frequencies, at least 2 required");
        }
        if (!(freq[0] > 0.0)) {
            throw new DomainException("Periodogram starts at frequency " + freq[0] + ", log binning needs > 0");
        }
        final var area = periodogram.windowArea();
        if (!(area > 0.0) || !Double.isFinite(area)) {
            throw new DomainException("Spectral window area is " + area + ", cannot normalize power");
        }

        final var edges = logEdges(freq[0], freq[freq.length - 1], BINS + 1);
        final var freqAvg = new double[BINS];
        final var powerAvg = new double[BINS];
        var kept = 0;
        for (var b = 0; b < BINS; b++) {
            var sum = 0.0;
            var count = 0;
            for (var i = 0; i < freq.length; i++) {
                if (freq[i] > edges[b] && freq[i] < edges[b + 1]) {
                    sum += power[i];
                    count++;
                }
            }
            if (count > 0) {
                freqAvg[kept] = (edges[b] + edges[b + 1]) / 2.0;
                powerAvg[kept] = sum / count;
                kept++;
            }
        }

        final var density = divide(power, area);
        final var binnedFreq = Arrays.copyOf(freqAvg, kept);
        final var binnedPower = Arrays.copyOf(powerAvg, kept);

        log.info("VPSD — {} frequencies, {} of {} log bins populated, window area={}",
                freq.length, kept, BINS, area);
        return new Vpsd(freq.clone(), power.clone(), density, periodogram.phase().clone(),
                binnedFreq, binnedPower, divide(binnedPower, area));
    }

    /**
     * {@code count} edges evenly spaced in log10 between {@code lo} and {@code hi}, both included.
     */
    static double[] logEdges(final double lo, final double hi, final int count) {
        final var logLo = Math.log10(lo);
        final var logHi = Math.log10(hi);
        final var edges = new double[count];
        for (var i = 0; i < count; i++) {
            edges[i] = Math.pow(10.0, logLo + (logHi - logLo) * i / (count - 1));
        }
        return edges;
    }

    private static double[] divide(final double[] values, final double divisor) {
        final var out = new double[values.length];
        for (var i = 0; i < values.length; i++) {
            out[i] = values[i] / divisor;
        }
        return out;
    }
}
