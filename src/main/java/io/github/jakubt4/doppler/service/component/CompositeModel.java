package io.github.jakubt4.doppler.service.component;

import io.github.jakubt4.doppler.exception.ValidationException;
import io.github.jakubt4.doppler.model.ComponentCurves;
import org.hipparchus.analysis.ParametricUnivariateFunction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Sum of VPSD components.
 *
 * <p>As a {@link ParametricUnivariateFunction} the parameters are the coefficients of all
 * components concatenated in component order. Component order only affects that packing
 * and reporting; the sum itself does not depend on it.
 */
public class CompositeModel implements ParametricUnivariateFunction {

    private final List<VpsdComponent> components;
    private final int[] offsets;
    private final int parameterCount;

    /**
     * @throws ValidationException if {@code components} is empty or names repeat
     */
    public CompositeModel(final List<VpsdComponent> components) {
        if (components == null || components.isEmpty()) {
            throw new ValidationException("Composite model needs at least one component");
        }
        final var names = new HashSet<String>();
        for (final var component : components) {
            if (!names.add(component.name())) {
                throw new ValidationException("Duplicate component name [" + component.name() + "]");
            }
        }
        this.components = List.copyOf(components);
        this.offsets = new int[components.size()];
        var offset = 0;
        for (var i = 0; i < components.size(); i++) {
            offsets[i] = offset;
            offset += components.get(i).type().arity();
        }
        this.parameterCount = offset;
    }

    public List<VpsdComponent> components() {
        return components;
    }

    public int parameterCount() {
        return parameterCount;
    }

    /** Current coefficients of all components, concatenated. */
    public double[] parameters() {
        final var p = new double[parameterCount];
        for (var i = 0; i < components.size(); i++) {
            final var c = components.get(i).coefficients();
            System.arraycopy(c, 0, p, offsets[i], c.length);
        }
        return p;
    }

    /**
     * Copies this model with new coefficients and errors, both in packed order.
     */
    public CompositeModel withParameters(final double[] parameters, final double[] errors) {
        final var updated = new ArrayList<VpsdComponent>(components.size());
        for (var i = 0; i < components.size(); i++) {
            final var c = components.get(i);
            final var from = offsets[i];
            final var to = from + c.type().arity();
            updated.add(new VpsdComponent(c.name(), c.type(),
                    Arrays.copyOfRange(parameters, from, to),
                    errors == null ? null : Arrays.copyOfRange(errors, from, to)));
        }
        return new CompositeModel(updated);
    }

    public double density(final double f) {
        var sum = 0.0;
        for (final var component : components) {
            sum += component.density(f);
        }
        return sum;
    }

    @Override
    public double value(final double f, final double... parameters) {
        var sum = 0.0;
        for (var i = 0; i < components.size(); i++) {
            final var type = components.get(i).type();
            sum += type.density(f, Arrays.copyOfRange(parameters, offsets[i], offsets[i] + type.arity()));
        }
        return sum;
    }

    @Override
    public double[] gradient(final double f, final double... parameters) {
        final var gradient = new double[parameterCount];
        for (var i = 0; i < components.size(); i++) {
            final var type = components.get(i).type();
            final var g = type.gradient(f, Arrays.copyOfRange(parameters, offsets[i], offsets[i] + type.arity()));
            System.arraycopy(g, 0, gradient, offsets[i], g.length);
        }
        return gradient;
    }

    /**
     * Evaluates every component and the total on {@code frequency}.
     */
    public ComponentCurves curves(final double[] frequency) {
        final var curves = new LinkedHashMap<String, double[]>();
        final var total = new double[frequency.length];
        for (final var component : components) {
            final var curve = new double[frequency.length];
            for (var k = 0; k < frequency.length; k++) {
                curve[k] = component.density(frequency[k]);
                total[k] += curve[k];
            }
            curves.put(component.name(), curve);
        }
        return new ComponentCurves(frequency.clone(), curves, total);
    }
}
