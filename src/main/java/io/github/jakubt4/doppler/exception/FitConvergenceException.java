package io.github.jakubt4.doppler.exception;

/**
 * Nonlinear least-squares fit did not converge, or no usable starting point exists.
 */
public class FitConvergenceException extends DopplerException {

    public FitConvergenceException(final String message) {
        super(message);
    }

    public FitConvergenceException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
