package io.github.jakubt4.doppler.service;

import io.github.jakubt4.doppler.exception.ValidationException;
import io.github.jakubt4.doppler.model.ComponentCurves;
import io.github.jakubt4.doppler.model.ComponentFit;
import io.github.jakubt4.doppler.model.ComponentSpec;
import io.github.jakubt4.doppler.model.FitResult;
import io.github.jakubt4.doppler.model.Vpsd;
import io.github.jakubt4.doppler.service.component.ComponentTypeRegistry;
import io.github.jakubt4.doppler.service.component.CompositeModel;
import io.github.jakubt4.doppler.service.component.VpsdComponent;
import io.github.jakubt4.doppler.service.fit.ParametricCurveFitter;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.exception.MathRuntimeException;
import org.hipparchus.fitting.WeightedObservedPoints;
import org.hipparchus.optim.nonlinear.vector.leastsquares.LeastSquaresOptimizer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Decomposes a VPSD into named components with a joint Levenberg–Marquardt fit.
 *
 * <p>The fit is unweighted, on the full-resolution density. Standard errors come from the
 * fit covariance scaled by the reduced chi-square.
 */
@Slf4j
@Service
public class ComponentFitService {

    private static final double SINGULARITY_THRESHOLD = 1.0e-14;

    private final ComponentTypeRegistry registry;
    private final int maxIterations;

    public ComponentFitService(final ComponentTypeRegistry registry,
                               @Value("${doppler.fit.max-iterations:1000}") final int maxIterations) {
        this.registry = registry;
        this.maxIterations = maxIterations;
    }

    /**
     * Fits {@code specs} jointly to {@code vpsd}.
     *
     * @throws ValidationException if the list is empty, a type is unknown, a guess has the wrong length
     *                             or names repeat
     * @throws io.github.jakubt4.doppler.exception.FitConvergenceException if the optimizer does not converge
     */
    public FitResult fit(final Vpsd vpsd, final List<ComponentSpec> specs) {
        final var model = toModel(specs);
        if (vpsd == null || vpsd.frequency() == null || vpsd.density() == null
                || vpsd.frequency().length != vpsd.density().length) {
            throw new ValidationException("VPSD with aligned frequency and density arrays is required");
        }

        final var frequency = vpsd.frequency();
        final var density = vpsd.density();
        if (frequency.length == 0) {
            throw new ValidationException("VPSD has no frequencies to fit");
        }
        final var points = new WeightedObservedPoints();
        for (var i = 0; i < frequency.length; i++) {
            points.add(1.0, frequency[i], density[i]);
        }

        final var names = model.components().stream().map(VpsdComponent::name).toList();
        final var optimum = new ParametricCurveFitter(model, model.parameters(), maxIterations)
                .optimize(points.toList(), "VPSD component fit " + names);

        final var parameters = optimum.getPoint().toArray();
        final var chiSquare = optimum.getCost() * optimum.getCost();
        final var dof = frequency.length - model.parameterCount();
        final var errors = standardErrors(optimum, model.parameterCount(), chiSquare, dof, names);

        final var fitted = model.withParameters(parameters, errors);
        final var components = new ArrayList<ComponentFit>();
        for (final var c : fitted.components()) {
            components.add(new ComponentFit(c.name(), c.type().typeName(), c.coefficients(), c.errors()));
        }

        log.info("VPSD fit {} — chi2={}, iterations={}, evaluations={}",
                names, chiSquare, optimum.getIterations(), optimum.getEvaluations());
        return new FitResult(List.copyOf(components),
                chiSquare,
                dof > 0 ? chiSquare / dof : Double.NaN,
                optimum.getRMS(),
                optimum.getIterations(),
                optimum.getEvaluations());
    }

    /**
     * Density of every fitted component, and their sum, on {@code frequency}.
     */
    public ComponentCurves curves(final double[] frequency, final FitResult fit) {
        final var components = new ArrayList<VpsdComponent>();
        for (final var c : fit.components()) {
            components.add(new VpsdComponent(c.name(), registry.resolve(c.type()), c.coefficients(), c.errors()));
        }
        return new CompositeModel(components).curves(frequency);
    }

    CompositeModel toModel(final List<ComponentSpec> specs) {
        if (specs == null || specs.isEmpty()) {
            throw new ValidationException("At least one VPSD component is required for the fit");
        }
        final var components = new ArrayList<VpsdComponent>(specs.size());
        for (final var spec : specs) {
            if (spec.type() == null) {
                throw new ValidationException("Component [" + spec.name() + "] has no type");
            }
            final var type = registry.find(spec.type()).orElseThrow(() -> new ValidationException(
                    "Component [" + spec.name() + "] has unknown type [" + spec.type() + "]"));
            components.add(new VpsdComponent(spec.name(), type, spec.initialGuess(), null));
        }
        return new CompositeModel(components);
    }

    private static double[] standardErrors(final LeastSquaresOptimizer.Optimum optimum, final int parameterCount,
                                           final double chiSquare, final int dof, final List<String> names) {
        final var errors = new double[parameterCount];
        if (dof <= 0) {
            log.warn("VPSD fit {} has {} degrees of freedom, coefficient errors are unbounded", names, dof);
            Arrays.fill(errors, Double.POSITIVE_INFINITY);
            return errors;
        }
        try {
            final var covariance = optimum.getCovariances(SINGULARITY_THRESHOLD);
            final var scale = chiSquare / dof;
            for (var i = 0; i < parameterCount; i++) {
                errors[i] = Math.sqrt(covariance.getEntry(i, i) * scale);
            }
        } catch (final MathRuntimeException e) {
            log.warn("VPSD fit {} covariance is singular, coefficient errors are unbounded: {}", names, e.getMessage());
            Arrays.fill(errors, Double.POSITIVE_INFINITY);
        }
        return errors;
    }
}
