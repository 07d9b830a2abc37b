package io.github.jakubt4.doppler.service;

import io.github.jakubt4.doppler.SyntheticSpectra;
import io.github.jakubt4.doppler.model.AnalysisSnapshot;
import io.github.jakubt4.doppler.model.ComponentCurves;
import io.github.jakubt4.doppler.model.ComponentSpec;
import io.github.jakubt4.doppler.model.FailurePolicy;
import io.github.jakubt4.doppler.model.FitResult;
import io.github.jakubt4.doppler.model.FwhmSeries;
import io.github.jakubt4.doppler.model.LineMask;
import io.github.jakubt4.doppler.model.PipelineResult;
import io.github.jakubt4.doppler.model.RvExtraction;
import io.github.jakubt4.doppler.model.RvSeries;
import io.github.jakubt4.doppler.model.SpectralTimeSeries;
import io.github.jakubt4.doppler.model.VelocityGrid;
import io.github.jakubt4.doppler.model.Vpsd;
import io.github.jakubt4.doppler.service.mask.MaskSelector;
import io.github.jakubt4.doppler.service.mask.MaskSource;
import io.github.jakubt4.doppler.service.store.ResultStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnalysisPipelineServiceTest {

    private static final MaskSource MASK_SOURCE = new MaskSource(Path.of("masks/G2_test.csv"), null, null, null);
    private static final LineMask MASK = SyntheticSpectra.threeLineMask();
    private static final List<ComponentSpec> COMPONENTS =
            List.of(new ComponentSpec("noise", "Constant", new double[]{1.0}));

    @Mock
    private MaskSelector maskSelector;
    @Mock
    private RadialVelocityService radialVelocityService;
    @Mock
    private VpsdService vpsdService;
    @Mock
    private ComponentFitService componentFitService;
    @Mock
    private ResultStore resultStore;

    private AnalysisPipelineService service;
    private SpectralTimeSeries spectra;

    @BeforeEach
    void setUp() {
        service = new AnalysisPipelineService(maskSelector, radialVelocityService, vpsdService,
                componentFitService, resultStore, VelocityGrid.DEFAULT, 2);
        spectra = SyntheticSpectra.shiftedLine(new double[]{0.0, 1.0, 2.0}, new double[]{0.0, 0.0, 0.0});
    }

    @Test
    void optionsFallBackToConfiguredParallelism() {
        assertThat(service.options(FailurePolicy.ABORT, null, null).parallelism()).isEqualTo(2);
        assertThat(service.options(FailurePolicy.ABORT, 6, null).parallelism()).isEqualTo(6);
    }

    @Test
    void measureUsesDefaultGridWhenNoneGiven() {
        final var options = service.options(FailurePolicy.ABORT, null, null);
        when(maskSelector.load(MASK_SOURCE.path(), null, null, List.of())).thenReturn(MASK);
        when(radialVelocityService.measure(spectra, MASK, VelocityGrid.DEFAULT, options)).thenReturn(extraction(false));

        service.measure(spectra, MASK_SOURCE, null, options);

        verify(radialVelocityService).measure(spectra, MASK, VelocityGrid.DEFAULT, options);
    }

    @Test
    void runChainsStagesInOrder() {
        final var options = service.options(FailurePolicy.SKIP_EPOCH, 1, null);
        final var extraction = extraction(false);
        final var vpsd = vpsd();
        final var fit = new FitResult(List.of(), 0.0, 0.0, 0.0, 1, 1);
        final var curves = new ComponentCurves(vpsd.frequency(), Map.of(), new double[2]);
        when(maskSelector.load(any(), any(), any(), any())).thenReturn(MASK);
        when(radialVelocityService.measure(any(), any(), any(), any())).thenReturn(extraction);
        when(vpsdService.compute(extraction.rv())).thenReturn(vpsd);
        when(componentFitService.fit(vpsd, COMPONENTS)).thenReturn(fit);
        when(componentFitService.curves(vpsd.frequency(), fit)).thenReturn(curves);

        final var result = service.run(spectra, MASK_SOURCE, null, options, COMPONENTS);

        assertThat(result.extraction()).isSameAs(extraction);
        assertThat(result.vpsd()).isSameAs(vpsd);
        assertThat(result.fit()).isSameAs(fit);
        assertThat(result.curves()).isSameAs(curves);
        final var order = inOrder(maskSelector, radialVelocityService, vpsdService, componentFitService);
        order.verify(maskSelector).load(any(), any(), any(), any());
        order.verify(radialVelocityService).measure(any(), any(), any(), any());
        order.verify(vpsdService).compute(extraction.rv());
        order.verify(componentFitService).fit(vpsd, COMPONENTS);
    }

    @Test
    void runStopsAfterVpsdWithoutComponents() {
        final var extraction = extraction(false);
        when(maskSelector.load(any(), any(), any(), any())).thenReturn(MASK);
        when(radialVelocityService.measure(any(), any(), any(), any())).thenReturn(extraction);
        when(vpsdService.compute(extraction.rv())).thenReturn(vpsd());

        final var result = service.run(spectra, MASK_SOURCE, null,
                service.options(FailurePolicy.ABORT, null, null), null);

        assertThat(result.vpsd()).isNotNull();
        assertThat(result.fit()).isNull();
        verifyNoInteractions(componentFitService);
    }

    @Test
    void cancelledRunSkipsLaterStages() {
        when(maskSelector.load(any(), any(), any(), any())).thenReturn(MASK);
        when(radialVelocityService.measure(any(), any(), any(), any())).thenReturn(extraction(true));

        final var result = service.run(spectra, MASK_SOURCE, null,
                service.options(FailurePolicy.ABORT, null, null), COMPONENTS);

        assertThat(result.extraction().cancelled()).isTrue();
        assertThat(result.vpsd()).isNull();
        verifyNoInteractions(vpsdService, componentFitService);
    }

    @Test
    void saveStoresSnapshotOfResult() {
        final var extraction = extraction(false);
        final var vpsd = vpsd();
        final var captor = ArgumentCaptor.forClass(AnalysisSnapshot.class);

        final var snapshot = service.save("run-7",
                new PipelineResult(extraction, vpsd, null, null));

        verify(resultStore).save(captor.capture());
        assertThat(captor.getValue()).isSameAs(snapshot);
        assertThat(snapshot.id()).isEqualTo("run-7");
        assertThat(snapshot.rv()).isSameAs(extraction.rv());
        assertThat(snapshot.vpsd()).isSameAs(vpsd);
        assertThat(snapshot.fit()).isNull();
    }

    private static RvExtraction extraction(final boolean cancelled) {
        final var time = new double[]{0.0, 1.0, 2.0};
        final var rv = new RvSeries(time, new double[]{0.1, 0.0, -0.1}, new double[]{0.01, 0.01, 0.01},
                "d", RvSeries.UNIT_KM_S, RvSeries.METHOD_CCF, MASK.id());
        return new RvExtraction(rv, new FwhmSeries(time, new double[]{14.0, 14.0, 14.0}),
                new int[]{0, 1, 2}, List.of(), List.of(), cancelled);
    }

    private static Vpsd vpsd() {
        final var f = new double[]{0.1, 0.2};
        return new Vpsd(f, new double[]{1.0, 0.5}, new double[]{0.5, 0.25}, new double[2], f,
                new double[]{1.0, 0.5}, new double[]{0.5, 0.25});
    }
}
