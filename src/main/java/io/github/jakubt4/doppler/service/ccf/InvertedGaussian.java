package io.github.jakubt4.doppler.service.ccf;

import org.hipparchus.analysis.ParametricUnivariateFunction;

/**
 * Absorption-line profile {@code C - a * exp(-(v - b)^2 / (2 sigma^2))} with the width
 * given as FWHM, {@code sigma = c / 2.3548}.
 *
 * <p>Parameter order is {@code (C, a, b, c)}: continuum, depth, center, FWHM.
 */
public final class InvertedGaussian implements ParametricUnivariateFunction {

    public static final InvertedGaussian INSTANCE = new InvertedGaussian();

    public static final double FWHM_PER_SIGMA = 2.3548;

    public static final int CONTINUUM = 0;
    public static final int DEPTH = 1;
    public static final int CENTER = 2;
    public static final int FWHM = 3;

    private InvertedGaussian() {
    }

    public static double value(final double v, final double continuum, final double depth,
                               final double center, final double fwhm) {
        final var sigma = fwhm / FWHM_PER_SIGMA;
        final var d = v - center;
        return continuum - depth * Math.exp(-d * d / (2.0 * sigma * sigma));
    }

    @Override
    public double value(final double v, final double... p) {
        return value(v, p[CONTINUUM], p[DEPTH], p[CENTER], p[FWHM]);
    }

    @Override
    public double[] gradient(final double v, final double... p) {
        final var depth = p[DEPTH];
        final var fwhm = p[FWHM];
        final var sigma = fwhm / FWHM_PER_SIGMA;
        final var d = v - p[CENTER];
        final var g = Math.exp(-d * d / (2.0 * sigma * sigma));

        final var gradient = new double[4];
        gradient[CONTINUUM] = 1.0;
        gradient[DEPTH] = -g;
        gradient[CENTER] = -depth * g * d / (sigma * sigma);
        // d(sigma)/d(fwhm) = 1 / 2.3548
        gradient[FWHM] = -depth * g * d * d / (sigma * sigma * sigma) / FWHM_PER_SIGMA;
        return gradient;
    }

    /**
     * Samples the profile on a velocity grid.
     */
    public static double[] sample(final double[] velocities, final double continuum, final double depth,
                                  final double center, final double fwhm) {
        final var values = new double[velocities.length];
        for (var i = 0; i < velocities.length; i++) {
            values[i] = value(velocities[i], continuum, depth, center, fwhm);
        }
        return values;
    }
}
