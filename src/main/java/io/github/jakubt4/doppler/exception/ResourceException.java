package io.github.jakubt4.doppler.exception;

public class ResourceException extends DopplerException {

    public ResourceException(final String message) {
        super(message);
    }

    public ResourceException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
