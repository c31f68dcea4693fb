package nl.nfi.djzxcvbn.common;

import java.time.Duration;
import java.util.Locale;

import static java.lang.Math.abs;

public final class Formatting {

    // below this, guess counts are printed as plain integers
    private static final double SCIENTIFIC_THRESHOLD = 1e6;

    public static String toHumanReadableGuesses(final double guesses) {
        if (Double.isInfinite(guesses) || Double.isNaN(guesses)) {
            return Double.toString(guesses);
        }
        if (abs(guesses) < SCIENTIFIC_THRESHOLD) {
            return String.format(Locale.ROOT, "%.0f", guesses);
        }
        return String.format(Locale.ROOT, "%.2e", guesses);
    }

    public static String toHumanReadableDuration(final Duration duration) {
        final long micros = duration.toNanos() / 1000;
        if (micros < 1000) {
            return micros + " us";
        }
        if (micros < 1_000_000) {
            return String.format(Locale.ROOT, "%.1f ms", micros / 1000.0);
        }
        return String.format(Locale.ROOT, "%.2f s", micros / 1_000_000.0);
    }
}
