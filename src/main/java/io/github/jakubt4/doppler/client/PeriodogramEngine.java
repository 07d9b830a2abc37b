package io.github.jakubt4.doppler.client;

import io.github.jakubt4.doppler.model.PeriodogramResult;

/**
 * Frequency-domain power estimator for unevenly sampled time series.
 */
public interface PeriodogramEngine {

    /**
     * @param time      sample times
     * @param value     sample values
     * @param error     sample errors
     * @param normalize {@code true} for power normalized to [0, 1], {@code false} for power in value units squared
     * @param window    {@code true} to also compute the spectral window of the sampling
     */
    PeriodogramResult periodogram(double[] time, double[] value, double[] error, boolean normalize, boolean window);
}
