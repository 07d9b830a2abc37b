package io.github.jakubt4.doppler.service.mask;

import io.github.jakubt4.doppler.exception.ValidationException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Morgan–Keenan sequence: {@code O0 = 0}, {@code B0 = 10}, ... {@code M0 = 60}, with the
 * subclass added ({@code G2V = 42}, {@code K1.5 = 51.5}). Luminosity class is ignored.
 */
public class MkSpectralTypeScale implements SpectralTypeScale {

    private static final String CLASSES = "OBAFGKM";
    private static final Pattern TYPE = Pattern.compile("^([OBAFGKM])(\\d+(?:\\.\\d+)?)?.*$");

    @Override
    public double toNumber(final String spectralType) {
        if (spectralType == null) {
            throw new ValidationException("Spectral type is required");
        }
        final var matcher = TYPE.matcher(spectralType.trim().toUpperCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new ValidationException("Unrecognized spectral type [" + spectralType + "]");
        }
        final var base = CLASSES.indexOf(matcher.group(1).charAt(0)) * 10.0;
        final var subclass = matcher.group(2) == null ? 0.0 : Double.parseDouble(matcher.group(2));
        return base + subclass;
    }
}
