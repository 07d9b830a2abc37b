package io.github.jakubt4.doppler.model;

import io.github.jakubt4.doppler.exception.DomainException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VelocityGridTest {

    @Test
    void defaultGridIncludesBothEnds() {
        final var velocities = VelocityGrid.DEFAULT.velocities();

        assertThat(velocities).hasSize(161);
        assertThat(velocities[0]).isEqualTo(-20.0);
        assertThat(velocities[80]).isEqualTo(0.0);
        assertThat(velocities[160]).isEqualTo(20.0);
        assertThat(VelocityGrid.DEFAULT.max()).isEqualTo(20.0);
    }

    @Test
    void stopOffTheGridIsExcluded() {
        final var grid = new VelocityGrid(0.0, 2.1, 0.5);

        assertThat(grid.velocities()).containsExactly(0.0, 0.5, 1.0, 1.5, 2.0);
        assertThat(grid.max()).isEqualTo(2.0);
    }

    @Test
    void nonPositiveStepIsDegenerate() {
        assertThatThrownBy(() -> new VelocityGrid(-20.0, 20.0, 0.0)).isInstanceOf(DomainException.class);
        assertThatThrownBy(() -> new VelocityGrid(-20.0, 20.0, -0.25)).isInstanceOf(DomainException.class);
    }

    @Test
    void tooFewPointsAreDegenerate() {
        assertThatThrownBy(() -> new VelocityGrid(0.0, 1.0, 0.5))
                .isInstanceOf(DomainException.class)
                .hasMessageContaining("at least " + VelocityGrid.MIN_POINTS);
    }

    @Test
    void reversedBoundsAreDegenerate() {
        assertThatThrownBy(() -> new VelocityGrid(20.0, -20.0, 0.25)).isInstanceOf(DomainException.class);
    }

    @Test
    void tinyStepIsRejectedBeforeAllocation() {
        assertThatThrownBy(() -> new VelocityGrid(-20.0, 20.0, 1e-12))
                .isInstanceOf(DomainException.class)
                .hasMessageContaining("more than " + VelocityGrid.MAX_POINTS);
        assertThatThrownBy(() -> new VelocityGrid(-20.0, 20.0, Double.MIN_VALUE))
                .isInstanceOf(DomainException.class);
    }

    @Test
    void gridAtThePointLimitIsAccepted() {
        final var grid = new VelocityGrid(0.0, VelocityGrid.MAX_POINTS - 1.0, 1.0);

        assertThat(grid.size()).isEqualTo(VelocityGrid.MAX_POINTS);
    }
}
