package io.github.jakubt4.doppler.service.ccf;

import io.github.jakubt4.doppler.SyntheticSpectra;
import io.github.jakubt4.doppler.exception.FitConvergenceException;
import io.github.jakubt4.doppler.exception.ValidationException;
import io.github.jakubt4.doppler.model.CcfRecord;
import io.github.jakubt4.doppler.model.VelocityGrid;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ProfileExtractorTest {

    private static final double[] STEP_VELOCITIES = {-2.0, -1.0, 0.0, 1.0, 2.0};

    private final ProfileExtractor profileExtractor = new ProfileExtractor();

    @Test
    void initialGuessReadsContinuumDepthCenterAndWidth() {
        final var ccf = new CcfRecord(STEP_VELOCITIES,
                new double[]{1.0, 0.7, 0.5, 0.8, 1.0},
                SyntheticSpectra.filled(5, 0.1));

        // half depth is 0.75, first crossed at v = -1
        assertThat(ProfileExtractor.initialGuess(ccf)).containsExactly(1.0, 0.5, 0.0, 2.0);
    }

    @Test
    void initialGuessFailsWhenOnlyTheMinimumIsBelowHalfDepth() {
        final var ccf = new CcfRecord(STEP_VELOCITIES,
                new double[]{1.0, 0.9, 0.5, 0.8, 1.0},
                SyntheticSpectra.filled(5, 0.1));

        assertThatThrownBy(() -> ProfileExtractor.initialGuess(ccf))
                .isInstanceOf(FitConvergenceException.class);
    }

    @Test
    void flatCcfHasNoStartingPoint() {
        final var ccf = new CcfRecord(STEP_VELOCITIES,
                SyntheticSpectra.filled(5, 1.0),
                SyntheticSpectra.filled(5, 0.1));

        assertThatThrownBy(() -> profileExtractor.extract(0, ccf))
                .isInstanceOf(FitConvergenceException.class)
                .hasMessageContaining("half-depth");
    }

    @Test
    void extractRecoversProfileParameters() {
        final var velocities = VelocityGrid.DEFAULT.velocities();
        final var values = InvertedGaussian.sample(velocities, 1.0, 0.3, 1.5, 6.0);
        final var ccf = new CcfRecord(velocities, values, SyntheticSpectra.filled(velocities.length, 0.001));

        final var measurement = profileExtractor.extract(7, ccf);

        assertThat(measurement.epoch()).isEqualTo(7);
        assertThat(measurement.rv()).isCloseTo(1.5, within(1e-6));
        assertThat(measurement.fwhm()).isCloseTo(6.0, within(1e-6));
        assertThat(measurement.rvError()).isPositive().isFinite();
        assertThat(measurement.ccf()).isSameAs(ccf);
    }

    @Test
    void nonPositiveCcfErrorIsRejected() {
        final var ccf = new CcfRecord(STEP_VELOCITIES,
                new double[]{1.0, 0.7, 0.5, 0.8, 1.0},
                new double[]{0.1, 0.1, 0.0, 0.1, 0.1});

        assertThatThrownBy(() -> profileExtractor.extract(0, ccf))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void rvErrorFollowsCcfSlope() {
        final var ccf = new CcfRecord(STEP_VELOCITIES,
                new double[]{1.0, 0.7, 0.5, 0.8, 1.0},
                SyntheticSpectra.filled(5, 0.1));

        // slopes / err: -3, -2.5, 0.5, 2.5, 2
        assertThat(ProfileExtractor.rvError(ccf)).isCloseTo(1.0 / Math.sqrt(25.75), within(1e-12));
    }

    @Test
    void gradientUsesCentralDifferencesInside() {
        assertThat(ProfileExtractor.gradient(new double[]{0.0, 1.0, 4.0, 9.0}))
                .containsExactly(1.0, 2.0, 4.0, 5.0);
    }
}
