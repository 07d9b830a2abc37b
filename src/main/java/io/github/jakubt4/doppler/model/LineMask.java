package io.github.jakubt4.doppler.model;

import io.github.jakubt4.doppler.exception.ValidationException;

/**
 * Weighted line list used as the cross-correlation template.
 *
 * @param id      identifier of the mask source (usually the file name)
 * @param centers line center wavelengths, in mask order
 * @param weights line weights, index-aligned with {@code centers}
 */
public record LineMask(String id, double[] centers, double[] weights) {

    public LineMask {
        if (centers == null || weights == null) {
            throw new ValidationException("Line mask [" + id + "] requires centers and weights");
        }
        if (centers.length != weights.length) {
            throw new ValidationException("Line mask [" + id + "] shape mismatch: centers=["
                    + centers.length + "], weights=[" + weights.length + "]");
        }
    }

    public int size() {
        return centers.length;
    }

    public double weightSum() {
        var sum = 0.0;
        for (final var w : weights) {
            sum += w;
        }
        return sum;
    }
}
