package io.github.jakubt4.doppler.dto;

import io.github.jakubt4.doppler.model.ComponentCurves;
import io.github.jakubt4.doppler.model.EpochFailure;
import io.github.jakubt4.doppler.model.FitResult;
import io.github.jakubt4.doppler.model.FwhmSeries;
import io.github.jakubt4.doppler.model.RvSeries;
import io.github.jakubt4.doppler.model.Vpsd;

import java.util.List;

public record PipelineResponse(String status,
                               String message,
                               RvSeries rv,
                               FwhmSeries fwhm,
                               List<EpochFailure> failures,
                               Vpsd vpsd,
                               FitResult fit,
                               ComponentCurves curves) {

    public static PipelineResponse rejected(final String status, final String message) {
        return new PipelineResponse(status, message, null, null, List.of(), null, null, null);
    }
}
