package io.github.jakubt4.doppler.model;

/**
 * Result of the full chain spectra → RV → VPSD → component fit.
 *
 * <p>{@code vpsd} is {@code null} when the epoch loop was cancelled; {@code fit} and
 * {@code curves} are {@code null} when no components were requested.
 */
public record PipelineResult(RvExtraction extraction, Vpsd vpsd, FitResult fit, ComponentCurves curves) {
}
