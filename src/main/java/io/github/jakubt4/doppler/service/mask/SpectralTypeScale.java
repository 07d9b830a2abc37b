package io.github.jakubt4.doppler.service.mask;

/**
 * Maps spectral types to numbers so that closeness between types can be measured.
 */
@FunctionalInterface
public interface SpectralTypeScale {

    /**
     * @throws io.github.jakubt4.doppler.exception.ValidationException if the type is not understood
     */
    double toNumber(String spectralType);
}
