package io.github.jakubt4.doppler.service.ccf;

import io.github.jakubt4.doppler.exception.FitConvergenceException;
import io.github.jakubt4.doppler.exception.ValidationException;
import io.github.jakubt4.doppler.model.CcfRecord;
import io.github.jakubt4.doppler.model.EpochMeasurement;
import io.github.jakubt4.doppler.service.fit.ParametricCurveFitter;
import org.hipparchus.fitting.WeightedObservedPoints;
import org.springframework.stereotype.Component;

/**
 * Fits an {@link InvertedGaussian} to a CCF and derives RV, RV error and FWHM.
 *
 * <p>The RV error is not taken from the fit covariance. It is propagated from the CCF
 * errors through the numerical slope of the CCF:
 * {@code 1 / sqrt(sum_j (dccf_j / (err_j * dv_j))^2)}.
 */
@Component
public class ProfileExtractor {

    /**
     * Starting point of the profile fit, {@code (C0, a0, b0, c0)}.
     *
     * @throws FitConvergenceException if the CCF never drops below half depth before its minimum
     */
    public static double[] initialGuess(final CcfRecord ccf) {
        final var v = ccf.velocities();
        final var y = ccf.values();

        var iMin = 0;
        var iMax = 0;
        for (var j = 1; j < y.length; j++) {
            if (y[j] < y[iMin]) {
                iMin = j;
            }
            if (y[j] > y[iMax]) {
                iMax = j;
            }
        }

        final var continuum = y[iMax];
        final var depth = continuum - y[iMin];
        final var center = v[iMin];

        final var halfDepth = continuum - depth / 2.0;
        var crossing = -1;
        for (var j = 0; j < y.length; j++) {
            if (y[j] < halfDepth) {
                crossing = j;
                break;
            }
        }
        if (crossing < 0 || crossing == iMin) {
            throw new FitConvergenceException("CCF has no half-depth crossing left of its minimum at "
                    + center + " km/s");
        }
        final var fwhm = (center - v[crossing]) * 2.0;
        return new double[]{continuum, depth, center, fwhm};
    }

    /**
     * Fits one epoch's CCF.
     *
     * @throws ValidationException     if a CCF error is not strictly positive
     * @throws FitConvergenceException if no starting point exists or the fit does not converge
     */
    public EpochMeasurement extract(final int epoch, final CcfRecord ccf) {
        final var errors = ccf.errors();
        final var points = new WeightedObservedPoints();
        for (var j = 0; j < ccf.size(); j++) {
            if (!(errors[j] > 0.0) || !Double.isFinite(errors[j])) {
                throw new ValidationException("CCF error at " + ccf.velocities()[j] + " km/s is " + errors[j]
                        + ", flux errors must be positive");
            }
            points.add(1.0 / (errors[j] * errors[j]), ccf.velocities()[j], ccf.values()[j]);
        }

        final var start = initialGuess(ccf);
        final var fitter = new ParametricCurveFitter(InvertedGaussian.INSTANCE, start);
        final var p = fitter.optimize(points.toList(), "CCF profile fit").getPoint().toArray();

        return new EpochMeasurement(epoch,
                p[InvertedGaussian.CENTER],
                rvError(ccf),
                p[InvertedGaussian.FWHM],
                ccf);
    }

    static double rvError(final CcfRecord ccf) {
        final var dv = gradient(ccf.velocities());
        final var dccf = gradient(ccf.values());
        final var err = ccf.errors();

        var sum = 0.0;
        for (var j = 0; j < dv.length; j++) {
            final var slope = dccf[j] / (err[j] * dv[j]);
            sum += slope * slope;
        }
        return 1.0 / Math.sqrt(sum);
    }

    /**
     * Second-order central differences inside, first-order differences at the ends.
     */
    static double[] gradient(final double[] y) {
        final var n = y.length;
        final var g = new double[n];
        g[0] = y[1] - y[0];
        g[n - 1] = y[n - 1] - y[n - 2];
        for (var i = 1; i < n - 1; i++) {
            g[i] = (y[i + 1] - y[i - 1]) / 2.0;
        }
        return g;
    }
}
