package io.github.jakubt4.doppler.service;

import io.github.jakubt4.doppler.model.AnalysisSnapshot;
import io.github.jakubt4.doppler.model.ComponentSpec;
import io.github.jakubt4.doppler.model.FailurePolicy;
import io.github.jakubt4.doppler.model.PipelineResult;
import io.github.jakubt4.doppler.model.RvExtraction;
import io.github.jakubt4.doppler.model.SpectralTimeSeries;
import io.github.jakubt4.doppler.model.VelocityGrid;
import io.github.jakubt4.doppler.service.mask.MaskSelector;
import io.github.jakubt4.doppler.service.mask.MaskSource;
import io.github.jakubt4.doppler.service.store.ResultStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs the analysis stages in order: mask resolution, per-epoch RV extraction, VPSD,
 * component fit. Each stage starts only once the previous one has produced its
 * complete result.
 */
@Slf4j
@Service
public class AnalysisPipelineService {

    private final MaskSelector maskSelector;
    private final RadialVelocityService radialVelocityService;
    private final VpsdService vpsdService;
    private final ComponentFitService componentFitService;
    private final ResultStore resultStore;
    private final VelocityGrid defaultVelocityGrid;
    private final int defaultParallelism;

    public AnalysisPipelineService(final MaskSelector maskSelector,
                                   final RadialVelocityService radialVelocityService,
                                   final VpsdService vpsdService,
                                   final ComponentFitService componentFitService,
                                   final ResultStore resultStore,
                                   final VelocityGrid defaultVelocityGrid,
                                   @Value("${doppler.ccf.parallelism:1}") final int defaultParallelism) {
        this.maskSelector = maskSelector;
        this.radialVelocityService = radialVelocityService;
        this.vpsdService = vpsdService;
        this.componentFitService = componentFitService;
        this.resultStore = resultStore;
        this.defaultVelocityGrid = defaultVelocityGrid;
        this.defaultParallelism = defaultParallelism;
    }

    /**
     * Run options with the configured parallelism unless {@code parallelism} is given.
     */
    public EpochRunOptions options(final FailurePolicy failurePolicy, final Integer parallelism,
                                   final ProgressListener progress) {
        return new EpochRunOptions(parallelism == null ? defaultParallelism : parallelism,
                failurePolicy, progress, null);
    }

    /**
     * Resolves the mask and measures every epoch.
     *
     * @param grid velocity grid, {@code null} for the configured default
     */
    public RvExtraction measure(final SpectralTimeSeries spectra, final MaskSource maskSource,
                                final VelocityGrid grid, final EpochRunOptions options) {
        final var mask = maskSelector.load(maskSource.path(), maskSource.spectralType(),
                maskSource.weightColumn(), maskSource.criteria());
        return radialVelocityService.measure(spectra, mask, grid == null ? defaultVelocityGrid : grid, options);
    }

    /**
     * Full chain. Stops after the RV stage if the epoch loop was cancelled.
     *
     * @param components components to fit, {@code null} to stop after the VPSD
     */
    public PipelineResult run(final SpectralTimeSeries spectra, final MaskSource maskSource, final VelocityGrid grid,
                              final EpochRunOptions options, final List<ComponentSpec> components) {
        final var extraction = measure(spectra, maskSource, grid, options);
        if (extraction.cancelled()) {
            log.warn("Pipeline stopped — epoch loop cancelled, no VPSD computed");
            return new PipelineResult(extraction, null, null, null);
        }

        final var vpsd = vpsdService.compute(extraction.rv());
        if (components == null) {
            return new PipelineResult(extraction, vpsd, null, null);
        }

        final var fit = componentFitService.fit(vpsd, components);
        final var curves = componentFitService.curves(vpsd.frequency(), fit);
        return new PipelineResult(extraction, vpsd, fit, curves);
    }

    /**
     * Stores what {@code result} holds under {@code id}.
     */
    public AnalysisSnapshot save(final String id, final PipelineResult result) {
        final var snapshot = new AnalysisSnapshot(id,
                result.extraction().rv(),
                result.extraction().fwhm(),
                result.vpsd(),
                result.fit());
        resultStore.save(snapshot);
        return snapshot;
    }
}
