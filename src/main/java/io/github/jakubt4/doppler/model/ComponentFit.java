package io.github.jakubt4.doppler.model;

/**
 * Fitted coefficients of one VPSD component with their standard errors.
 */
public record ComponentFit(String name, String type, double[] coefficients, double[] errors) {
}
