package io.github.jakubt4.doppler.model;

import io.github.jakubt4.doppler.exception.ValidationException;

import java.util.Arrays;

/**
 * Reduced spectra of one target, one row per epoch.
 *
 * <p>Each epoch carries its own wavelength grid; {@link #sharedGrid} builds the common
 * case of all epochs sampled on the same grid. All value arrays are mandatory and
 * must agree in shape epoch by epoch.
 *
 * @param time      observation times, one per epoch
 * @param wave      wavelength grid per epoch, ascending
 * @param fluxVal   flux values per epoch
 * @param fluxErr   flux errors per epoch
 * @param timeUnit  unit of {@code time} (may be {@code null})
 * @param waveUnit  unit of {@code wave} (may be {@code null})
 * @param fluxUnit  unit of the flux arrays (may be {@code null})
 */
public record SpectralTimeSeries(double[] time,
                                 double[][] wave,
                                 double[][] fluxVal,
                                 double[][] fluxErr,
                                 String timeUnit,
                                 String waveUnit,
                                 String fluxUnit) {

    public SpectralTimeSeries {
        require(time, "time");
        require(wave, "wave");
        require(fluxVal, "flux values");
        require(fluxErr, "flux errors");

        final var epochs = time.length;
        if (epochs == 0) {
            throw new ValidationException("Spectral time series holds no epochs");
        }
        checkRows(wave, epochs, "wave");
        checkRows(fluxVal, epochs, "flux values");
        checkRows(fluxErr, epochs, "flux errors");

        for (var i = 0; i < epochs; i++) {
            if (wave[i] == null || fluxVal[i] == null || fluxErr[i] == null) {
                throw new ValidationException("Epoch " + i + ": spectral arrays must all be provided");
            }
            if (fluxVal[i].length != wave[i].length || fluxErr[i].length != wave[i].length) {
                throw new ValidationException("Epoch " + i + ": shape mismatch, wave=[" + wave[i].length
                        + "], flux values=[" + fluxVal[i].length + "], flux errors=[" + fluxErr[i].length + "]");
            }
        }
    }

    /**
     * Builds a series in which every epoch is sampled on the same wavelength grid.
     */
    public static SpectralTimeSeries sharedGrid(final double[] time,
                                                final double[] wave,
                                                final double[][] fluxVal,
                                                final double[][] fluxErr,
                                                final String timeUnit,
                                                final String waveUnit,
                                                final String fluxUnit) {
        require(time, "time");
        require(wave, "wave");
        final var grids = new double[time.length][];
        Arrays.fill(grids, wave);
        return new SpectralTimeSeries(time, grids, fluxVal, fluxErr, timeUnit, waveUnit, fluxUnit);
    }

    public int epochCount() {
        return time.length;
    }

    private static void require(final Object array, final String name) {
        if (array == null) {
            throw new ValidationException("Spectral data incomplete: " + name + " must be provided");
        }
    }

    private static void checkRows(final double[][] rows, final int epochs, final String name) {
        if (rows.length != epochs) {
            throw new ValidationException("Shape mismatch: " + name + " has " + rows.length
                    + " epochs, time has " + epochs);
        }
    }
}
