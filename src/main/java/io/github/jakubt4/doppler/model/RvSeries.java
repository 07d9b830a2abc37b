package io.github.jakubt4.doppler.model;

import io.github.jakubt4.doppler.exception.ValidationException;

/**
 * Radial velocity time series.
 *
 * @param time     observation times
 * @param value    radial velocities
 * @param error    radial velocity errors, {@code null} when not known
 * @param timeUnit unit of {@code time}
 * @param rvUnit   unit of {@code value} and {@code error}
 * @param method   extraction method ({@code "CCF"}), {@code null} for supplied series
 * @param maskId   mask the velocities were measured with, {@code null} for supplied series
 */
public record RvSeries(double[] time,
                       double[] value,
                       double[] error,
                       String timeUnit,
                       String rvUnit,
                       String method,
                       String maskId) {

    public static final String METHOD_CCF = "CCF";
    public static final String UNIT_KM_S = "km/s";

    public RvSeries {
        if (time == null || value == null) {
            throw new ValidationException("RV series requires time and value arrays");
        }
        if (time.length != value.length || (error != null && error.length != time.length)) {
            throw new ValidationException("RV series shape mismatch: time=[" + time.length + "], value=["
                    + value.length + "], error=[" + (error == null ? "none" : error.length) + "]");
        }
    }

    /**
     * A series supplied directly, not measured from spectra.
     */
    public static RvSeries of(final double[] time, final double[] value, final double[] error,
                              final String timeUnit, final String rvUnit) {
        return new RvSeries(time, value, error, timeUnit, rvUnit, null, null);
    }

    public int size() {
        return time.length;
    }
}
