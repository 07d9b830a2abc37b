package io.github.jakubt4.doppler.model;

/**
 * Velocity power spectral density of an RV series.
 *
 * <p>The {@code *Avg} arrays hold the log-binned averages with empty bins removed;
 * they are index-aligned with each other but not with the full-resolution arrays.
 *
 * @param frequency    periodogram frequencies
 * @param power        periodogram power
 * @param density      power divided by the spectral window area
 * @param phase        periodogram phase
 * @param frequencyAvg bin centers of the non-empty log bins
 * @param powerAvg     mean power per non-empty bin
 * @param densityAvg   {@code powerAvg} divided by the spectral window area
 */
public record Vpsd(double[] frequency,
                   double[] power,
                   double[] density,
                   double[] phase,
                   double[] frequencyAvg,
                   double[] powerAvg,
                   double[] densityAvg) {
}
