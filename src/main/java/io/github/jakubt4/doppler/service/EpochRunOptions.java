package io.github.jakubt4.doppler.service;

import io.github.jakubt4.doppler.exception.ValidationException;
import io.github.jakubt4.doppler.model.FailurePolicy;

import java.util.function.BooleanSupplier;

/**
 * How the per-epoch CCF and profile fit loop is run.
 *
 * @param parallelism     worker threads; {@code 1} runs on the calling thread
 * @param failurePolicy   what to do when an epoch fails, required
 * @param progress        progress observer
 * @param cancellation    polled before each epoch; {@code true} stops the run
 */
public record EpochRunOptions(int parallelism,
                              FailurePolicy failurePolicy,
                              ProgressListener progress,
                              BooleanSupplier cancellation) {

    public EpochRunOptions {
        if (failurePolicy == null) {
            throw new ValidationException("An epoch failure policy must be chosen explicitly");
        }
        if (parallelism < 1) {
            throw new ValidationException("Parallelism must be at least 1, got " + parallelism);
        }
        progress = progress == null ? ProgressListener.NONE : progress;
        cancellation = cancellation == null ? () -> false : cancellation;
    }

    public static EpochRunOptions sequential(final FailurePolicy failurePolicy) {
        return new EpochRunOptions(1, failurePolicy, ProgressListener.NONE, null);
    }

    public EpochRunOptions withParallelism(final int threads) {
        return new EpochRunOptions(threads, failurePolicy, progress, cancellation);
    }

    public EpochRunOptions withProgress(final ProgressListener listener) {
        return new EpochRunOptions(parallelism, failurePolicy, listener, cancellation);
    }

    public EpochRunOptions withCancellation(final BooleanSupplier cancelled) {
        return new EpochRunOptions(parallelism, failurePolicy, progress, cancelled);
    }
}
