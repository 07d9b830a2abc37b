package io.github.jakubt4.doppler.model;

/**
 * A VPSD component as requested by a caller, before it is checked against the
 * registered component types.
 *
 * @param name         unique label of the component
 * @param type         registered type name ({@code Constant}, {@code Lorentz}, {@code Harvey}, ...)
 * @param initialGuess starting coefficients for the fit
 */
public record ComponentSpec(String name, String type, double[] initialGuess) {
}
