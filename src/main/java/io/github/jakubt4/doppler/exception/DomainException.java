package io.github.jakubt4.doppler.exception;

/**
 * Input that is well-formed but outside the domain the algorithms are defined on:
 * empty wavelength arrays, masks outside the spectral overlap, degenerate grids.
 */
public class DomainException extends DopplerException {

    public DomainException(final String message) {
        super(message);
    }
}
