package io.github.jakubt4.doppler.model;

/**
 * CCF widths, index-aligned with the {@link RvSeries} they were measured with.
 */
public record FwhmSeries(double[] time, double[] value) {
}
