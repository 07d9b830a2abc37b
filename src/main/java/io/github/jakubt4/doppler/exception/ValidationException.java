package io.github.jakubt4.doppler.exception;

/**
 * Missing or malformed input: absent spectral arrays, mismatched shapes,
 * empty component lists, wrong coefficient-vector lengths.
 */
public class ValidationException extends DopplerException {

    public ValidationException(final String message) {
        super(message);
    }

    public ValidationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
