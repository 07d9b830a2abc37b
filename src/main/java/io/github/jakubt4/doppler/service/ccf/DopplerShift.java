package io.github.jakubt4.doppler.service.ccf;

import io.github.jakubt4.doppler.exception.DomainException;
import org.orekit.utils.Constants;

/**
 * Non-relativistic Doppler shift of wavelengths by a radial velocity in km/s.
 */
public final class DopplerShift {

    public static final double SPEED_OF_LIGHT_KM_S = Constants.SPEED_OF_LIGHT / 1000.0;

    private DopplerShift() {
    }

    /**
     * Shifts every wavelength by {@code v}: {@code wave * (1 + v / c)}.
     *
     * @param wave wavelengths, any unit
     * @param v    velocity in km/s, positive for redshift
     * @return a new array of shifted wavelengths
     * @throws DomainException if {@code wave} is empty
     */
    public static double[] shift(final double[] wave, final double v) {
        if (wave == null || wave.length == 0) {
            throw new DomainException("Cannot Doppler-shift an empty wavelength array");
        }
        final var factor = factor(v);
        final var shifted = new double[wave.length];
        for (var i = 0; i < wave.length; i++) {
            shifted[i] = wave[i] * factor;
        }
        return shifted;
    }

    public static double shift(final double wave, final double v) {
        return wave * factor(v);
    }

    private static double factor(final double v) {
        return 1.0 + v / SPEED_OF_LIGHT_KM_S;
    }
}
