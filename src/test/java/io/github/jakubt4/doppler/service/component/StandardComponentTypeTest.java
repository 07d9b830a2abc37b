package io.github.jakubt4.doppler.service.component;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class StandardComponentTypeTest {

    @Test
    void constantIsFlat() {
        assertThat(StandardComponentType.CONSTANT.density(0.3, new double[]{2.0})).isEqualTo(2.0);
        assertThat(StandardComponentType.CONSTANT.density(30.0, new double[]{2.0})).isEqualTo(2.0);
    }

    @Test
    void lorentzPeaksAtItsCenter() {
        final var c = new double[]{1.0, 0.01, 0.2};

        assertThat(StandardComponentType.LORENTZ.density(0.2, c)).isCloseTo(1.0, within(1e-15));
        assertThat(StandardComponentType.LORENTZ.density(0.21, c)).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void harveyHalvesAtInverseTimescale() {
        final var c = new double[]{4.0, 20.0, 2.0};

        assertThat(StandardComponentType.HARVEY.density(1.0 / 20.0, c)).isCloseTo(2.0, within(1e-12));
        assertThat(StandardComponentType.HARVEY.density(0.0, c)).isEqualTo(4.0);
    }

    @ParameterizedTest
    @EnumSource(StandardComponentType.class)
    void gradientMatchesFiniteDifferences(final StandardComponentType type) {
        final var c = switch (type) {
            case CONSTANT -> new double[]{0.7};
            case LORENTZ -> new double[]{1.5, 0.02, 0.15};
            case HARVEY -> new double[]{3.0, 12.0, 2.5};
        };
        final var h = 1e-7;
        for (final var f : new double[]{0.01, 0.1, 0.14, 0.4}) {
            final var gradient = type.gradient(f, c);
            assertThat(gradient).hasSize(type.arity());
            for (var p = 0; p < c.length; p++) {
                final var up = c.clone();
                final var down = c.clone();
                up[p] += h;
                down[p] -= h;
                final var numeric = (type.density(f, up) - type.density(f, down)) / (2.0 * h);
                assertThat(gradient[p]).as("%s d/dc%d at f=%s", type, p, f)
                        .isCloseTo(numeric, within(1e-5 * Math.max(1.0, Math.abs(numeric))));
            }
        }
    }
}
