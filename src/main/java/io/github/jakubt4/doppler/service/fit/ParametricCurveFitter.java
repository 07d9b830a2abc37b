package io.github.jakubt4.doppler.service.fit;

import io.github.jakubt4.doppler.exception.FitConvergenceException;
import org.hipparchus.analysis.ParametricUnivariateFunction;
import org.hipparchus.exception.MathRuntimeException;
import org.hipparchus.fitting.AbstractCurveFitter;
import org.hipparchus.fitting.WeightedObservedPoint;
import org.hipparchus.linear.DiagonalMatrix;
import org.hipparchus.optim.nonlinear.vector.leastsquares.LeastSquaresBuilder;
import org.hipparchus.optim.nonlinear.vector.leastsquares.LeastSquaresOptimizer;
import org.hipparchus.optim.nonlinear.vector.leastsquares.LeastSquaresProblem;
import org.hipparchus.optim.nonlinear.vector.leastsquares.LevenbergMarquardtOptimizer;

import java.util.Collection;

/**
 * Levenberg–Marquardt fit of any {@link ParametricUnivariateFunction} to weighted points.
 *
 * <p>Unlike {@link AbstractCurveFitter#fit} this exposes the full
 * {@link LeastSquaresOptimizer.Optimum}, so callers can read the covariance and
 * residual statistics. Optimizer failures surface as {@link FitConvergenceException}.
 */
public class ParametricCurveFitter extends AbstractCurveFitter {

    public static final int DEFAULT_MAX_ITERATIONS = 1000;

    private final ParametricUnivariateFunction function;
    private final double[] start;
    private final int maxIterations;

    public ParametricCurveFitter(final ParametricUnivariateFunction function, final double[] start,
                                 final int maxIterations) {
        this.function = function;
        this.start = start.clone();
        this.maxIterations = maxIterations;
    }

    public ParametricCurveFitter(final ParametricUnivariateFunction function, final double[] start) {
        this(function, start, DEFAULT_MAX_ITERATIONS);
    }

    /**
     * Runs the optimizer and returns the optimum.
     *
     * @param what label used in the failure message
     * @throws FitConvergenceException if the optimizer fails or ends on non-finite parameters
     */
    public LeastSquaresOptimizer.Optimum optimize(final Collection<WeightedObservedPoint> points, final String what) {
        final LeastSquaresOptimizer.Optimum optimum;
        try {
            optimum = getOptimizer().optimize(getProblem(points));
        } catch (final MathRuntimeException e) {
            throw new FitConvergenceException(what + ": optimizer did not converge: " + e.getMessage(), e);
        }
        for (final var p : optimum.getPoint().toArray()) {
            if (!Double.isFinite(p)) {
                throw new FitConvergenceException(what + ": optimizer ended on non-finite parameters");
            }
        }
        return optimum;
    }

    @Override
    protected LeastSquaresProblem getProblem(final Collection<WeightedObservedPoint> observations) {
        final var len = observations.size();
        final var target = new double[len];
        final var weights = new double[len];

        var i = 0;
        for (final var obs : observations) {
            target[i] = obs.getY();
            weights[i] = obs.getWeight();
            ++i;
        }

        final var model = new AbstractCurveFitter.TheoreticalValuesFunction(function, observations);

        return new LeastSquaresBuilder()
                .maxEvaluations(Integer.MAX_VALUE)
                .maxIterations(maxIterations)
                .lazyEvaluation(false)
                .start(start)
                .target(target)
                .weight(new DiagonalMatrix(weights))
                .model(model.getModelFunction(), model.getModelFunctionJacobian())
                .build();
    }

    @Override
    protected LeastSquaresOptimizer getOptimizer() {
        return new LevenbergMarquardtOptimizer();
    }
}
