package io.github.jakubt4.doppler.service.component;

/**
 * Closed-form shape of a VPSD component. Implementations are stateless and are
 * looked up by {@link #typeName()} in a {@link ComponentTypeRegistry}.
 */
public interface ComponentType {

    String typeName();

    /** Number of coefficients the shape takes. */
    int arity();

    /** Density at frequency {@code f}. */
    double density(double f, double[] c);

    /** Partial derivatives of {@link #density} with respect to each coefficient. */
    double[] gradient(double f, double[] c);
}
