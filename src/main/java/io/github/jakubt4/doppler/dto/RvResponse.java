package io.github.jakubt4.doppler.dto;

import io.github.jakubt4.doppler.model.EpochFailure;
import io.github.jakubt4.doppler.model.FwhmSeries;
import io.github.jakubt4.doppler.model.RvSeries;

import java.util.List;

/**
 * Response to an RV extraction.
 *
 * @param status   {@code "MEASURED"}, {@code "CANCELLED"}, {@code "NOT_CONVERGED"} or {@code "REJECTED"}
 * @param message  human-readable detail
 * @param rv       measured velocities, {@code null} on rejection
 * @param fwhm     measured widths, {@code null} on rejection
 * @param epochs   source epoch of each series element
 * @param failures skipped epochs
 */
public record RvResponse(String status,
                         String message,
                         RvSeries rv,
                         FwhmSeries fwhm,
                         int[] epochs,
                         List<EpochFailure> failures) {

    public static RvResponse rejected(final String status, final String message) {
        return new RvResponse(status, message, null, null, null, List.of());
    }
}
