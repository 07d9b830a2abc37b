package io.github.jakubt4.doppler.service;

/**
 * Observer of the per-epoch loop. Advisory only; implementations must be thread-safe
 * when the loop runs in parallel.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (epoch, completed, total) -> { };

    /**
     * Called once per visited epoch, successful or not.
     *
     * @param epoch     index of the epoch that just finished
     * @param completed epochs finished so far, including this one
     * @param total     epochs in the run
     */
    void onEpochCompleted(int epoch, int completed, int total);
}
