package io.github.jakubt4.doppler.model;

import io.github.jakubt4.doppler.exception.DomainException;

/**
 * Evenly spaced trial velocities in km/s. The stop value is included when it lies
 * on the grid.
 *
 * @param start first velocity
 * @param stop  last velocity
 * @param step  spacing, strictly positive
 */
public record VelocityGrid(double start, double stop, double step) {

    /** The initial-guess heuristic of the profile fit needs at least this many points. */
    public static final int MIN_POINTS = 5;

    public static final int MAX_POINTS = 1_000_000;

    public static final VelocityGrid DEFAULT = new VelocityGrid(-20.0, 20.0, 0.25);

    public VelocityGrid {
        if (!Double.isFinite(start) || !Double.isFinite(stop) || !Double.isFinite(step) || step <= 0.0) {
            throw new DomainException("Degenerate velocity grid [" + start + ", " + stop + ", " + step + "]");
        }
        final var exact = Math.ceil((stop + step / 2.0 - start) / step);
        if (exact > MAX_POINTS) {
            throw new DomainException("Velocity grid [" + start + ", " + stop + ", " + step
                    + "] would hold more than " + MAX_POINTS + " points");
        }
        final var points = count(start, stop, step);
        if (points < MIN_POINTS) {
            throw new DomainException("Degenerate velocity grid [" + start + ", " + stop + ", " + step
                    + "]: " + points + " points, at least " + MIN_POINTS + " required");
        }
    }

    public static VelocityGrid of(final double[] bounds) {
        if (bounds == null || bounds.length != 3) {
            throw new DomainException("Velocity grid must be given as [start, stop, step]");
        }
        return new VelocityGrid(bounds[0], bounds[1], bounds[2]);
    }

    public int size() {
        return count(start, stop, step);
    }

    public double[] velocities() {
        final var velocities = new double[size()];
        for (var k = 0; k < velocities.length; k++) {
            velocities[k] = start + k * step;
        }
        return velocities;
    }

    public double min() {
        return start;
    }

    public double max() {
        return start + (size() - 1) * step;
    }

    private static int count(final double start, final double stop, final double step) {
        final var n = (int) Math.ceil((stop + step / 2.0 - start) / step);
        return Math.max(n, 0);
    }
}
