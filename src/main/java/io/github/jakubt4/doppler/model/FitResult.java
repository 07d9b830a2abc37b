package io.github.jakubt4.doppler.model;

import java.util.List;

/**
 * Joint fit of a composite VPSD model.
 *
 * @param components       fitted components, in the order they were requested
 * @param chiSquare        sum of squared residuals at the optimum
 * @param reducedChiSquare {@code chiSquare} per degree of freedom, {@code NaN} without free degrees
 * @param rms              root mean square of the residuals
 * @param iterations       optimizer iterations
 * @param evaluations      model evaluations
 */
public record FitResult(List<ComponentFit> components,
                        double chiSquare,
                        double reducedChiSquare,
                        double rms,
                        int iterations,
                        int evaluations) {
}
