package io.github.jakubt4.doppler.service.component;

import io.github.jakubt4.doppler.exception.ValidationException;

/**
 * A named, typed VPSD component with its coefficients.
 *
 * @param name         unique label
 * @param type         shape
 * @param coefficients coefficients, {@code type.arity()} of them
 * @param errors       standard errors of the coefficients, {@code null} before fitting
 */
public record VpsdComponent(String name, ComponentType type, double[] coefficients, double[] errors) {

    public VpsdComponent {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Component name is required");
        }
        if (type == null) {
            throw new ValidationException("Component [" + name + "] has no type");
        }
        if (coefficients == null || coefficients.length != type.arity()) {
            throw new ValidationException("Component [" + name + "] of type " + type.typeName() + " needs "
                    + type.arity() + " coefficients, got " + (coefficients == null ? 0 : coefficients.length));
        }
        if (errors != null && errors.length != coefficients.length) {
            throw new ValidationException("Component [" + name + "] has " + coefficients.length
                    + " coefficients but " + errors.length + " errors");
        }
    }

    public VpsdComponent(final String name, final ComponentType type, final double... coefficients) {
        this(name, type, coefficients, null);
    }

    public double density(final double f) {
        return type.density(f, coefficients);
    }
}
