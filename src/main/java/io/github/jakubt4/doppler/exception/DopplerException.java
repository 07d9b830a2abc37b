package io.github.jakubt4.doppler.exception;

/**
 * Root of the analysis error taxonomy. All failures raised by the numeric core
 * are unchecked and carry enough context (epoch index, array shape or component
 * name) to diagnose the offending input.
 */
public abstract class DopplerException extends RuntimeException {

    protected DopplerException(final String message) {
        super(message);
    }

    protected DopplerException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
