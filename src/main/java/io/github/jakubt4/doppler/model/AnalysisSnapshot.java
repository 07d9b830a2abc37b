package io.github.jakubt4.doppler.model;

/**
 * Everything one analysis produced, as stored by a
 * {@link io.github.jakubt4.doppler.service.store.ResultStore}. Stages that were not
 * run are {@code null}.
 */
public record AnalysisSnapshot(String id, RvSeries rv, FwhmSeries fwhm, Vpsd vpsd, FitResult fit) {
}
