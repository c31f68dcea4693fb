package nl.nfi.djzxcvbn.estimate.feedback;

// resolves a message key to display text, the estimator itself only ever selects keys
@FunctionalInterface
public interface Translator {

    String translate(final String key);

    // renders the keys themselves, for callers that translate on their own
    static Translator keys() {
        return key -> key;
    }
}
