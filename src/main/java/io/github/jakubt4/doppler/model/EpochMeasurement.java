package io.github.jakubt4.doppler.model;

/**
 * Profile fit of a single epoch's CCF.
 *
 * @param epoch   source epoch index
 * @param rv      fitted line center, km/s
 * @param rvError propagated RV uncertainty, km/s
 * @param fwhm    fitted full width at half maximum, km/s
 * @param ccf     the CCF the fit was made on
 */
public record EpochMeasurement(int epoch, double rv, double rvError, double fwhm, CcfRecord ccf) {
}
