package io.github.jakubt4.doppler.model;

/**
 * Cross-correlation function of one epoch, indexed by trial velocity.
 */
public record CcfRecord(double[] velocities, double[] values, double[] errors) {

    public int size() {
        return velocities.length;
    }
}
