package io.github.jakubt4.doppler.service.component;

/**
 * Built-in VPSD shapes.
 */
public enum StandardComponentType implements ComponentType {

    /** White noise floor: {@code c0}. */
    CONSTANT("Constant", 1) {
        @Override
        public double density(final double f, final double[] c) {
            return c[0];
        }

        @Override
        public double[] gradient(final double f, final double[] c) {
            return new double[]{1.0};
        }
    },

    /** Resonance: {@code c0 c1^2 / (c1^2 + (f - c2)^2)}. */
    LORENTZ("Lorentz", 3) {
        @Override
        public double density(final double f, final double[] c) {
            final var w2 = c[1] * c[1];
            final var d = f - c[2];
            return c[0] * w2 / (w2 + d * d);
        }

        @Override
        public double[] gradient(final double f, final double[] c) {
            final var w2 = c[1] * c[1];
            final var d = f - c[2];
            final var q = w2 + d * d;
            final var q2 = q * q;
            return new double[]{
                    w2 / q,
                    c[0] * 2.0 * c[1] * d * d / q2,
                    c[0] * w2 * 2.0 * d / q2
            };
        }
    },

    /** Power-law roll-off: {@code c0 / (1 + (c1 f)^c2)}. */
    HARVEY("Harvey", 3) {
        @Override
        public double density(final double f, final double[] c) {
            return c[0] / (1.0 + Math.pow(c[1] * f, c[2]));
        }

        @Override
        public double[] gradient(final double f, final double[] c) {
            final var x = c[1] * f;
            final var u = Math.pow(x, c[2]);
            final var denom = 1.0 + u;
            final var denom2 = denom * denom;
            return new double[]{
                    1.0 / denom,
                    -c[0] * c[2] * Math.pow(x, c[2] - 1.0) * f / denom2,
                    x > 0.0 ? -c[0] * u * Math.log(x) / denom2 : 0.0
            };
        }
    };

    private final String typeName;
    private final int arity;

    StandardComponentType(final String typeName, final int arity) {
        this.typeName = typeName;
        this.arity = arity;
    }

    @Override
    public String typeName() {
        return typeName;
    }

    @Override
    public int arity() {
        return arity;
    }
}
