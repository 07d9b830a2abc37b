package io.github.jakubt4.doppler.service;

import io.github.jakubt4.doppler.exception.DopplerException;
import io.github.jakubt4.doppler.exception.EpochProcessingException;
import io.github.jakubt4.doppler.model.EpochFailure;
import io.github.jakubt4.doppler.model.EpochMeasurement;
import io.github.jakubt4.doppler.model.FailurePolicy;
import io.github.jakubt4.doppler.model.FwhmSeries;
import io.github.jakubt4.doppler.model.LineMask;
import io.github.jakubt4.doppler.model.RvExtraction;
import io.github.jakubt4.doppler.model.RvSeries;
import io.github.jakubt4.doppler.model.SpectralTimeSeries;
import io.github.jakubt4.doppler.model.VelocityGrid;
import io.github.jakubt4.doppler.service.ccf.CcfBuilder;
import io.github.jakubt4.doppler.service.ccf.ProfileExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns a spectral time series into RV and FWHM series.
 *
 * <p>The mask is pre-filtered once against the wavelength overlap of all epochs; every
 * epoch is then cross-correlated and fitted independently. Epochs share no mutable
 * state, so the loop can run on a thread pool; results are always assembled in epoch
 * order, whatever order the workers finish in.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RadialVelocityService {

    private final CcfBuilder ccfBuilder;
    private final ProfileExtractor profileExtractor;

    /**
     * Measures every epoch of {@code spectra}.
     *
     * @param spectra reduced spectra
     * @param mask    line mask, not yet filtered
     * @param grid    trial velocities
     * @param options parallelism, failure policy, progress and cancellation
     * @return the assembled series; partial when cancelled
     * @throws io.github.jakubt4.doppler.exception.DomainException if the mask has no line inside the spectral overlap
     * @throws EpochProcessingException                             under {@link FailurePolicy#ABORT} when an epoch fails
     */
    public RvExtraction measure(final SpectralTimeSeries spectra, final LineMask mask,
                                final VelocityGrid grid, final EpochRunOptions options) {
        final var filtered = ccfBuilder.prefilter(mask, spectra, grid);
        final var total = spectra.epochCount();
        final var outcomes = new EpochOutcome[total];
        final var completed = new AtomicInteger();

        log.info("[{}] Measuring {} epochs on {} velocities, parallelism={}, policy={}",
                mask.id(), total, grid.size(), options.parallelism(), options.failurePolicy());

        if (options.parallelism() == 1 || total == 1) {
            for (var e = 0; e < total; e++) {
                if (options.cancellation().getAsBoolean()) {
                    break;
                }
                outcomes[e] = measureEpoch(e, spectra, filtered, grid, options, completed);
            }
        } else {
            runParallel(spectra, filtered, grid, options, outcomes, completed);
        }

        return assemble(spectra, filtered, outcomes);
    }

    private void runParallel(final SpectralTimeSeries spectra, final LineMask filtered, final VelocityGrid grid,
                             final EpochRunOptions options, final EpochOutcome[] outcomes,
                             final AtomicInteger completed) {
        final var total = outcomes.length;
        final var executor = Executors.newFixedThreadPool(Math.min(options.parallelism(), total));
        try {
            final var futures = new ArrayList<Future<EpochOutcome>>(total);
            for (var e = 0; e < total; e++) {
                final var epoch = e;
                futures.add(executor.submit(() -> options.cancellation().getAsBoolean()
                        ? null
                        : measureEpoch(epoch, spectra, filtered, grid, options, completed)));
            }
            for (var e = 0; e < total; e++) {
                try {
                    outcomes[e] = futures.get(e).get();
                } catch (final ExecutionException ex) {
                    futures.forEach(f -> f.cancel(true));
                    if (ex.getCause() instanceof RuntimeException cause) {
                        throw cause;
                    }
                    throw new IllegalStateException("Epoch " + e + " failed", ex.getCause());
                } catch (final InterruptedException ex) {
                    futures.forEach(f -> f.cancel(true));
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while measuring epoch " + e, ex);
                }
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private EpochOutcome measureEpoch(final int epoch, final SpectralTimeSeries spectra, final LineMask mask,
                                      final VelocityGrid grid, final EpochRunOptions options,
                                      final AtomicInteger completed) {
        try {
            final var ccf = ccfBuilder.compute(
                    spectra.wave()[epoch], spectra.fluxVal()[epoch], spectra.fluxErr()[epoch], mask, grid);
            final var measurement = profileExtractor.extract(epoch, ccf);
            log.debug("[{}] Epoch {} — rv={} ± {} km/s, fwhm={} km/s",
                    mask.id(), epoch, measurement.rv(), measurement.rvError(), measurement.fwhm());
            return new EpochOutcome(measurement, null);
        } catch (final DopplerException e) {
            if (options.failurePolicy() == FailurePolicy.ABORT) {
                throw new EpochProcessingException(epoch, e);
            }
            log.warn("[{}] Epoch {} skipped: {}", mask.id(), epoch, e.getMessage());
            return new EpochOutcome(null, new EpochFailure(epoch, e.getMessage()));
        } finally {
            options.progress().onEpochCompleted(epoch, completed.incrementAndGet(), spectra.epochCount());
        }
    }

    private RvExtraction assemble(final SpectralTimeSeries spectra, final LineMask mask,
                                  final EpochOutcome[] outcomes) {
        final var measurements = new ArrayList<EpochMeasurement>();
        final var failures = new ArrayList<EpochFailure>();
        var cancelled = false;
        for (final var outcome : outcomes) {
            if (outcome == null) {
                cancelled = true;
            } else if (outcome.measurement() != null) {
                measurements.add(outcome.measurement());
            } else {
                failures.add(outcome.failure());
            }
        }

        final var n = measurements.size();
        final var epochs = new int[n];
        final var time = new double[n];
        final var rv = new double[n];
        final var rvErr = new double[n];
        final var fwhm = new double[n];
        for (var i = 0; i < n; i++) {
            final var m = measurements.get(i);
            epochs[i] = m.epoch();
            time[i] = spectra.time()[m.epoch()];
            rv[i] = m.rv();
            rvErr[i] = m.rvError();
            fwhm[i] = m.fwhm();
        }

        if (cancelled) {
            log.warn("[{}] Run cancelled after {} of {} epochs", mask.id(), n + failures.size(), outcomes.length);
        }
        log.info("[{}] Measured {} epochs, {} skipped", mask.id(), n, failures.size());

        return new RvExtraction(
                new RvSeries(time, rv, rvErr, spectra.timeUnit(), RvSeries.UNIT_KM_S, RvSeries.METHOD_CCF, mask.id()),
                new FwhmSeries(time, fwhm),
                epochs,
                List.copyOf(measurements),
                List.copyOf(failures),
                cancelled);
    }

    private record EpochOutcome(EpochMeasurement measurement, EpochFailure failure) {
    }
}
