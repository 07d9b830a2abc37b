package io.github.jakubt4.doppler.model;

/**
 * What the epoch loop does when a single epoch cannot be measured.
 */
public enum FailurePolicy {
    /** Stop the run and raise the failure with its epoch index. */
    ABORT,
    /** Record the failure, leave the epoch out of the series and continue. */
    SKIP_EPOCH
}
