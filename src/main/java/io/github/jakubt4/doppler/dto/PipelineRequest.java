package io.github.jakubt4.doppler.dto;

import io.github.jakubt4.doppler.model.ComponentSpec;

import java.util.List;

/**
 * Inbound request for the full analysis chain.
 *
 * @param spectra    spectra and RV extraction settings
 * @param components components to fit to the VPSD, {@code null} to stop after the VPSD
 * @param snapshotId when given, results are stored under this id
 */
public record PipelineRequest(SpectraRequest spectra, List<ComponentSpec> components, String snapshotId) {
}
