package nl.nfi.djzxcvbn.estimate.time;

import java.util.OptionalDouble;

public enum TimeBucket {

    INSTANT("instant", 0, 1),
    SECONDS("second", 1, 60),
    MINUTES("minute", 60, 60 * 60),
    HOURS("hour", 60 * 60, 60 * 60 * 24),
    DAYS("day", 60 * 60 * 24, 60 * 60 * 24 * 31),
    // a month is counted as 31 days, a year as 12 such months
    MONTHS("month", 60 * 60 * 24 * 31, 60.0 * 60 * 24 * 31 * 12),
    YEARS("year", 60.0 * 60 * 24 * 31 * 12, 60.0 * 60 * 24 * 31 * 12 * 100),
    CENTURIES("centuries", 60.0 * 60 * 24 * 31 * 12 * 100, Double.POSITIVE_INFINITY);

    private final String unit;
    private final double unitSeconds;
    private final double upperBound;

    TimeBucket(final String unit, final double unitSeconds, final double upperBound) {
        this.unit = unit;
        this.unitSeconds = unitSeconds;
        this.upperBound = upperBound;
    }

    public static TimeBucket of(final double seconds) {
        for (final TimeBucket bucket : values()) {
            if (seconds < bucket.upperBound) {
                return bucket;
            }
        }
        return CENTURIES;
    }

    public String unit() {
        return unit;
    }

    // buckets without a count render as a fixed phrase
    public boolean counted() {
        return this != INSTANT && this != CENTURIES;
    }

    // number of whole units, rounded half up, empty for buckets without a count
    public OptionalDouble count(final double seconds) {
        if (!counted()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Math.round(seconds / unitSeconds));
    }
}
