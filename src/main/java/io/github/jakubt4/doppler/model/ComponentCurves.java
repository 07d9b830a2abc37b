package io.github.jakubt4.doppler.model;

import java.util.Map;

/**
 * Density of each component and of their sum on a frequency axis.
 *
 * @param frequency  evaluation frequencies
 * @param components density per component name, in component order
 * @param total      sum over all components
 */
public record ComponentCurves(double[] frequency, Map<String, double[]> components, double[] total) {
}
