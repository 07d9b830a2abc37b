package io.github.jakubt4.doppler.controller;

import io.github.jakubt4.doppler.dto.AnalysisStatus;
import io.github.jakubt4.doppler.dto.FitRequest;
import io.github.jakubt4.doppler.dto.FitResponse;
import io.github.jakubt4.doppler.dto.PipelineRequest;
import io.github.jakubt4.doppler.dto.PipelineResponse;
import io.github.jakubt4.doppler.dto.RvResponse;
import io.github.jakubt4.doppler.dto.RvSeriesRequest;
import io.github.jakubt4.doppler.dto.SpectraRequest;
import io.github.jakubt4.doppler.dto.VpsdResponse;
import io.github.jakubt4.doppler.exception.DopplerException;
import io.github.jakubt4.doppler.exception.FitConvergenceException;
import io.github.jakubt4.doppler.service.AnalysisPipelineService;
import io.github.jakubt4.doppler.service.ComponentFitService;
import io.github.jakubt4.doppler.service.ProgressListener;
import io.github.jakubt4.doppler.service.VpsdService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the analysis stages.
 *
 * <p>{@code POST /api/analysis/rv} measures RVs from spectra, {@code /vpsd} builds the VPSD
 * of an RV series, {@code /fit} decomposes a VPSD into components and {@code /pipeline}
 * chains all three. Invalid input is answered with {@code 400}, a fit that does not
 * converge with {@code 422}.
 */
@Slf4j
@RestController
@RequestMapping("/api/analysis")
@RequiredArgsConstructor
public class AnalysisController {

    private static final ProgressListener LOG_PROGRESS =
            (epoch, completed, total) -> log.debug("Epoch {} done ({}/{})", epoch, completed, total);

    private final AnalysisPipelineService analysisPipelineService;
    private final VpsdService vpsdService;
    private final ComponentFitService componentFitService;

    @PostMapping("/rv")
    public ResponseEntity<RvResponse> measureRv(@RequestBody final SpectraRequest request) {
        try {
            final var options = analysisPipelineService.options(
                    request.failurePolicy(), request.parallelism(), LOG_PROGRESS);
            final var extraction = analysisPipelineService.measure(
                    request.toSpectra(), request.toMaskSource(), request.toVelocityGrid(), options);
            final var status = extraction.cancelled() ? AnalysisStatus.CANCELLED : AnalysisStatus.MEASURED;
            return ResponseEntity.ok(new RvResponse(status,
                    extraction.rv().size() + " epochs measured, " + extraction.failures().size() + " skipped",
                    extraction.rv(), extraction.fwhm(), extraction.epochs(), extraction.failures()));
        } catch (final DopplerException e) {
            log.error("RV extraction rejected: {}", e.getMessage());
            return ResponseEntity.status(statusOf(e)).body(RvResponse.rejected(rejectionOf(e), e.getMessage()));
        }
    }

    @PostMapping("/vpsd")
    public ResponseEntity<VpsdResponse> computeVpsd(@RequestBody final RvSeriesRequest request) {
        try {
            final var vpsd = vpsdService.compute(request.toSeries());
            return ResponseEntity.ok(new VpsdResponse(AnalysisStatus.COMPUTED,
                    vpsd.frequencyAvg().length + " populated log bins", vpsd));
        } catch (final DopplerException e) {
            log.error("VPSD computation rejected: {}", e.getMessage());
            return ResponseEntity.status(statusOf(e))
                    .body(new VpsdResponse(AnalysisStatus.REJECTED, e.getMessage(), null));
        }
    }

    @PostMapping("/fit")
    public ResponseEntity<FitResponse> fitComponents(@RequestBody final FitRequest request) {
        try {
            final var vpsd = request.toVpsd();
            final var fit = componentFitService.fit(vpsd, request.components());
            final var curves = componentFitService.curves(vpsd.frequency(), fit);
            return ResponseEntity.ok(new FitResponse(AnalysisStatus.FITTED,
                    fit.components().size() + " components fitted", fit, curves));
        } catch (final DopplerException e) {
            log.error("VPSD fit rejected: {}", e.getMessage());
            return ResponseEntity.status(statusOf(e))
                    .body(new FitResponse(rejectionOf(e), e.getMessage(), null, null));
        }
    }

    @PostMapping("/pipeline")
    public ResponseEntity<PipelineResponse> runPipeline(@RequestBody final PipelineRequest request) {
        if (request.spectra() == null) {
            return ResponseEntity.badRequest()
                    .body(PipelineResponse.rejected(AnalysisStatus.REJECTED, "Spectra are required"));
        }
        try {
            final var spectra = request.spectra();
            final var options = analysisPipelineService.options(
                    spectra.failurePolicy(), spectra.parallelism(), LOG_PROGRESS);
            final var result = analysisPipelineService.run(spectra.toSpectra(), spectra.toMaskSource(),
                    spectra.toVelocityGrid(), options, request.components());
            if (request.snapshotId() != null) {
                analysisPipelineService.save(request.snapshotId(), result);
            }
            final var extraction = result.extraction();
            final var status = extraction.cancelled() ? AnalysisStatus.CANCELLED
                    : result.fit() != null ? AnalysisStatus.FITTED : AnalysisStatus.COMPUTED;
            return ResponseEntity.ok(new PipelineResponse(status,
                    extraction.rv().size() + " epochs measured, " + extraction.failures().size() + " skipped",
                    extraction.rv(), extraction.fwhm(), extraction.failures(),
                    result.vpsd(), result.fit(), result.curves()));
        } catch (final DopplerException e) {
            log.error("Pipeline rejected: {}", e.getMessage());
            return ResponseEntity.status(statusOf(e))
                    .body(PipelineResponse.rejected(rejectionOf(e), e.getMessage()));
        }
    }

    private static HttpStatus statusOf(final DopplerException e) {
        return notConverged(e) ? HttpStatus.UNPROCESSABLE_ENTITY : HttpStatus.BAD_REQUEST;
    }

    private static String rejectionOf(final DopplerException e) {
        return notConverged(e) ? AnalysisStatus.NOT_CONVERGED : AnalysisStatus.REJECTED;
    }

    // Epoch failures wrap the typed failure of that epoch.
    private static boolean notConverged(final DopplerException e) {
        return e instanceof FitConvergenceException || e.getCause() instanceof FitConvergenceException;
    }
}
