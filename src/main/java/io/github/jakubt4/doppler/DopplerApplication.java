package io.github.jakubt4.doppler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Doppler: radial velocities and velocity power spectra of stars.
 *
 * <p>Measures radial velocities from time series of reduced spectra by cross-correlating
 * them with a weighted line mask, builds the velocity power spectral density of the
 * resulting RV series, and decomposes it into noise and signal components.
 *
 * @see io.github.jakubt4.doppler.service.RadialVelocityService
 * @see io.github.jakubt4.doppler.service.VpsdService
 * @see io.github.jakubt4.doppler.service.ComponentFitService
 */
@SpringBootApplication
public class DopplerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DopplerApplication.class, args);
    }
}
