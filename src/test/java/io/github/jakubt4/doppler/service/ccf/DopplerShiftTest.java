package io.github.jakubt4.doppler.service.ccf;

import io.github.jakubt4.doppler.exception.DomainException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DopplerShiftTest {

    @Test
    void speedOfLightIsInKilometresPerSecond() {
        assertThat(DopplerShift.SPEED_OF_LIGHT_KM_S).isCloseTo(299792.458, within(1e-9));
    }

    @Test
    void zeroVelocityLeavesWavelengthUnchanged() {
        assertThat(DopplerShift.shift(new double[]{5000.0, 6000.0}, 0.0)).containsExactly(5000.0, 6000.0);
    }

    @Test
    void positiveVelocityRedshifts() {
        final var shifted = DopplerShift.shift(5000.0, 10.0);

        assertThat(shifted).isGreaterThan(5000.0);
        assertThat(shifted).isCloseTo(5000.0 * (1.0 + 10.0 / DopplerShift.SPEED_OF_LIGHT_KM_S), within(1e-9));
    }

    @Test
    void shiftingBackRecoversOriginalWavelength() {
        final var v = 37.5;
        final var there = DopplerShift.shift(5000.0, v);
        final var back = there / (1.0 + v / DopplerShift.SPEED_OF_LIGHT_KM_S);

        assertThat(back).isCloseTo(5000.0, within(1e-9));
    }

    @Test
    void shiftingByOppositeVelocityReturnsToOriginalWavelength() {
        final var wave = new double[]{4500.0, 5000.0, 6562.8};
        for (final var v : new double[]{1.0, -20.0, 37.5, 1000.0}) {
            // the first-order shift loses (v/c)^2 on a round trip
            final var beta = v / DopplerShift.SPEED_OF_LIGHT_KM_S;
            final var roundTrip = DopplerShift.shift(DopplerShift.shift(wave, v), -v);
            for (var i = 0; i < wave.length; i++) {
                final var tolerance = wave[i] * (1.01 * beta * beta + 1e-15);
                assertThat(roundTrip[i]).as("array, v=%s", v).isCloseTo(wave[i], within(tolerance));
                assertThat(DopplerShift.shift(DopplerShift.shift(wave[i], v), -v))
                        .as("scalar, v=%s", v).isCloseTo(wave[i], within(tolerance));
            }
        }
    }

    @Test
    void emptyWavelengthArrayIsRejected() {
        assertThatThrownBy(() -> DopplerShift.shift(new double[0], 1.0))
                .isInstanceOf(DomainException.class);
    }
}
