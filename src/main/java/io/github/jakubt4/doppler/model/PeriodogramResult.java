package io.github.jakubt4.doppler.model;

import io.github.jakubt4.doppler.exception.ValidationException;

/**
 * Output of a {@link io.github.jakubt4.doppler.client.PeriodogramEngine}.
 *
 * <p>Frequencies are strictly increasing and power is non-negative. The window arrays
 * are empty and {@code windowArea} is {@code NaN} when no window was requested.
 */
public record PeriodogramResult(double[] frequency,
                                double[] power,
                                double[] phase,
                                double[] windowFrequency,
                                double[] windowPower,
                                double windowArea) {

    public PeriodogramResult {
        if (frequency == null || power == null || phase == null) {
            throw new ValidationException("Periodogram requires frequency, power and phase arrays");
        }
        if (power.length != frequency.length || phase.length != frequency.length) {
            throw new ValidationException("Periodogram shape mismatch: frequency=[" + frequency.length
                    + "], power=[" + power.length + "], phase=[" + phase.length + "]");
        }
        for (var i = 1; i < frequency.length; i++) {
            if (!(frequency[i] > frequency[i - 1])) {
                throw new ValidationException("Periodogram frequencies must be strictly increasing (index " + i + ")");
            }
        }
        for (var i = 0; i < power.length; i++) {
            if (!(power[i] >= 0.0)) {
                throw new ValidationException("Periodogram power must be non-negative (index " + i + ")");
            }
        }
        windowFrequency = windowFrequency == null ? new double[0] : windowFrequency;
        windowPower = windowPower == null ? new double[0] : windowPower;
        if (windowFrequency.length != windowPower.length) {
            throw new ValidationException("Window shape mismatch: frequency=[" + windowFrequency.length
                    + "], power=[" + windowPower.length + "]");
        }
    }
}
