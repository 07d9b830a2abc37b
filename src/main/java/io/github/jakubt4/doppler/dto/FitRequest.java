package io.github.jakubt4.doppler.dto;

import io.github.jakubt4.doppler.model.ComponentSpec;
import io.github.jakubt4.doppler.model.Vpsd;

import java.util.List;

/**
 * Inbound request to decompose a VPSD.
 *
 * @param frequency  full-resolution VPSD frequencies
 * @param density    full-resolution VPSD density
 * @param components components with initial guesses, in reporting order
 */
public record FitRequest(double[] frequency, double[] density, List<ComponentSpec> components) {

    public Vpsd toVpsd() {
        return new Vpsd(frequency, null, density, null, null, null, null);
    }
}
