package nl.nfi.djzxcvbn.estimate.time;

import nl.nfi.djzxcvbn.estimate.feedback.Translator;

// a crack time reduced to its bucket and whole unit count, e.g. (HOURS, 3)
public record CrackTimeDisplay(TimeBucket bucket, long count) {

    public static CrackTimeDisplay of(final double seconds) {
        final TimeBucket bucket = TimeBucket.of(seconds);
        return new CrackTimeDisplay(bucket, (long) bucket.count(seconds).orElse(0));
    }

    // translation key, e.g. time.hours, or time.hour for a count of one
    public String key() {
        if (!bucket.counted()) {
            return "time." + bucket.unit();
        }
        return count == 1 ? "time." + bucket.unit() : "time." + bucket.unit() + "s";
    }

    public String render(final Translator translator) {
        final String text = translator.translate(key());
        return bucket.counted() ? text.replace("{count}", Long.toString(count)) : text;
    }
}
