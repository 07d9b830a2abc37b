package io.github.jakubt4.doppler.service.component;

import io.github.jakubt4.doppler.exception.ValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComponentTypeRegistryTest {

    private static final ComponentType POWER_LAW = new ComponentType() {
        @Override
        public String typeName() {
            return "PowerLaw";
        }

        @Override
        public int arity() {
            return 2;
        }

        @Override
        public double density(final double f, final double[] c) {
            return c[0] * Math.pow(f, -c[1]);
        }

        @Override
        public double[] gradient(final double f, final double[] c) {
            final var p = Math.pow(f, -c[1]);
            return new double[]{p, -c[0] * p * Math.log(f)};
        }
    };

    @Test
    void standardRegistryKnowsBuiltInShapes() {
        final var registry = ComponentTypeRegistry.standard();

        assertThat(registry.resolve("Constant")).isSameAs(StandardComponentType.CONSTANT);
        assertThat(registry.resolve("Lorentz")).isSameAs(StandardComponentType.LORENTZ);
        assertThat(registry.resolve("Harvey")).isSameAs(StandardComponentType.HARVEY);
        assertThat(registry.types()).hasSize(3);
    }

    @Test
    void unknownTypeIsRejected() {
        assertThatThrownBy(() -> ComponentTypeRegistry.standard().resolve("Gaussian"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Gaussian");
        assertThat(ComponentTypeRegistry.standard().find("Gaussian")).isEmpty();
    }

    @Test
    void customTypesCanBeRegistered() {
        final var registry = ComponentTypeRegistry.standard().register(POWER_LAW);

        assertThat(registry.resolve("PowerLaw")).isSameAs(POWER_LAW);
    }

    @Test
    void duplicateRegistrationIsRejected() {
        final var registry = ComponentTypeRegistry.standard();

        assertThatThrownBy(() -> registry.register(StandardComponentType.HARVEY))
                .isInstanceOf(ValidationException.class);
    }
}
