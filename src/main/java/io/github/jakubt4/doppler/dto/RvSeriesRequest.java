package io.github.jakubt4.doppler.dto;

import io.github.jakubt4.doppler.model.RvSeries;

/**
 * Inbound RV series for VPSD computation.
 */
public record RvSeriesRequest(double[] time, double[] value, double[] error, String timeUnit, String rvUnit) {

    public RvSeries toSeries() {
        return RvSeries.of(time, value, error, timeUnit, rvUnit);
    }
}
