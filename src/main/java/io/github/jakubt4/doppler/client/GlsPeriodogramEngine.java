package io.github.jakubt4.doppler.client;

import io.github.jakubt4.doppler.exception.DomainException;
import io.github.jakubt4.doppler.exception.ValidationException;
import io.github.jakubt4.doppler.model.PeriodogramResult;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.util.FastMath;
import org.hipparchus.util.MathArrays;

import java.util.Arrays;

/**
 * Generalised Lomb–Scargle periodogram (Zechmeister &amp; Kürster 2009): error-weighted,
 * with a floating mean.
 *
 * <p>Frequencies run from {@code 1/T} to {@code 1/(2 median dt)} in steps of
 * {@code 1/(oversampling T)}, where {@code T} is the time span. The spectral window is
 * {@code |sum_i w_i exp(-2 pi i f t_i)|^2} with weights normalized to one, evaluated on a
 * symmetric grid {@code [-f_max, f_max]} with the same step; its area is the trapezoid
 * integral over that grid.
 */
@Slf4j
public class GlsPeriodogramEngine implements PeriodogramEngine {

    public static final int DEFAULT_OVERSAMPLING = 10;

    private final int oversampling;

    public GlsPeriodogramEngine(final int oversampling) {
        if (oversampling < 1) {
            throw new ValidationException("Oversampling must be at least 1, got " + oversampling);
        }
        this.oversampling = oversampling;
    }

    public GlsPeriodogramEngine() {
        this(DEFAULT_OVERSAMPLING);
    }

    @Override
    public PeriodogramResult periodogram(final double[] time, final double[] value, final double[] error,
                                         final boolean normalize, final boolean window) {
        final var n = checkInput(time, value, error);
        final var weights = weights(error);

        final var sorted = time.clone();
        Arrays.sort(sorted);
        final var span = sorted[n - 1] - sorted[0];
        if (!(span > 0.0)) {
            throw new DomainException("Time series spans no time (" + n + " samples)");
        }
        final var spacings = new double[n - 1];
        for (var i = 1; i < n; i++) {
            spacings[i - 1] = sorted[i] - sorted[i - 1];
        }
        Arrays.sort(spacings);
        final var medianSpacing = median(spacings);

        final var fMin = 1.0 / span;
        final var fMax = medianSpacing > 0.0 ? 0.5 / medianSpacing : 0.5 * n / span;
        final var df = 1.0 / (oversampling * span);
        final var count = Math.max(2, (int) Math.floor((fMax - fMin) / df) + 1);

        var yMean = 0.0;
        for (var i = 0; i < n; i++) {
            yMean += weights[i] * value[i];
        }
        var yy = 0.0;
        for (var i = 0; i < n; i++) {
            final var d = value[i] - yMean;
            yy += weights[i] * d * d;
        }

        final var frequency = new double[count];
        final var power = new double[count];
        final var phase = new double[count];
        for (var k = 0; k < count; k++) {
            final var f = fMin + k * df;
            frequency[k] = f;
            final var omega = 2.0 * FastMath.PI * f;

            var c = 0.0;
            var s = 0.0;
            var yc = 0.0;
            var ys = 0.0;
            var cc = 0.0;
            var cs = 0.0;
            for (var i = 0; i < n; i++) {
                final var sc = FastMath.sinCos(omega * time[i]);
                final var cos = sc.cos();
                final var sin = sc.sin();
                final var w = weights[i];
                final var y = value[i] - yMean;
                c += w * cos;
                s += w * sin;
                yc += w * y * cos;
                ys += w * y * sin;
                cc += w * cos * cos;
                cs += w * cos * sin;
            }
            final var ss = 1.0 - cc - s * s;
            cc -= c * c;
            cs -= c * s;
            // y is already centered, so YC and YS need no mean correction
            final var d = cc * ss - cs * cs;

            if (d > 0.0 && yy > 0.0) {
                final var reduction = (ss * yc * yc + cc * ys * ys - 2.0 * cs * yc * ys) / d;
                final var p = Math.max(0.0, reduction / yy);
                power[k] = normalize ? p : p * yy;
                final var a = (yc * ss - ys * cs) / d;
                final var b = (ys * cc - yc * cs) / d;
                phase[k] = FastMath.atan2(b, a);
            }
        }

        if (!window) {
            return new PeriodogramResult(frequency, power, phase, null, null, Double.NaN);
        }

        final var half = count + (int) Math.floor(fMin / df);
        final var windowFrequency = new double[2 * half + 1];
        final var windowPower = new double[2 * half + 1];
        for (var k = -half; k <= half; k++) {
            final var f = k * df;
            final var omega = 2.0 * FastMath.PI * f;
            var re = 0.0;
            var im = 0.0;
            for (var i = 0; i < n; i++) {
                final var sc = FastMath.sinCos(omega * time[i]);
                re += weights[i] * sc.cos();
                im -= weights[i] * sc.sin();
            }
            windowFrequency[k + half] = f;
            windowPower[k + half] = re * re + im * im;
        }
        var area = 0.0;
        for (var k = 1; k < windowFrequency.length; k++) {
            area += 0.5 * (windowPower[k] + windowPower[k - 1]) * (windowFrequency[k] - windowFrequency[k - 1]);
        }

        log.debug("GLS periodogram — {} samples, {} frequencies in [{}, {}], window area={}",
                n, count, frequency[0], frequency[count - 1], area);
        return new PeriodogramResult(frequency, power, phase, windowFrequency, windowPower, area);
    }

    private static int checkInput(final double[] time, final double[] value, final double[] error) {
        if (time == null || value == null || error == null) {
            throw new ValidationException("Periodogram requires time, value and error arrays");
        }
        if (time.length != value.length || error.length != time.length) {
            throw new ValidationException("Periodogram input shape mismatch: time=[" + time.length
                    + "], value=[" + value.length + "], error=[" + error.length + "]");
        }
        if (time.length < 3) {
            throw new DomainException("Periodogram needs at least 3 samples, got " + time.length);
        }
        return time.length;
    }

    private static double[] weights(final double[] error) {
        final var weights = new double[error.length];
        for (var i = 0; i < error.length; i++) {
            if (!(error[i] > 0.0) || !Double.isFinite(error[i])) {
                throw new ValidationException("Periodogram error at index " + i + " is " + error[i]
                        + ", errors must be positive");
            }
            weights[i] = 1.0 / (error[i] * error[i]);
        }
        return MathArrays.normalizeArray(weights, 1.0);
    }

    private static double median(final double[] sorted) {
        final var m = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[m] : 0.5 * (sorted[m - 1] + sorted[m]);
    }
}
