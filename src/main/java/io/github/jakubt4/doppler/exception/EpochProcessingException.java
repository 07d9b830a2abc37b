package io.github.jakubt4.doppler.exception;

import lombok.Getter;

/**
 * Failure of the CCF or RV extraction for a single epoch. The original typed
 * failure is kept as the cause.
 */
@Getter
public class EpochProcessingException extends DopplerException {

    private final int epoch;

    public EpochProcessingException(final int epoch, final DopplerException cause) {
        super("Epoch " + epoch + ": " + cause.getMessage(), cause);
        this.epoch = epoch;
    }
}
