package nl.nfi.djzxcvbn.estimate.match;

public enum PatternType {
    DICTIONARY("dictionary"),
    REVERSE_DICTIONARY("reverse_dictionary"),
    LEET("leet"),
    SPATIAL("spatial"),
    REPEAT("repeat"),
    SEQUENCE("sequence"),
    REGEX("regex"),
    DATE("date"),
    BRUTEFORCE("bruteforce");

    private final String tag;

    PatternType(final String tag) {
        this.tag = tag;
    }

    // stable external name, also the last tie breaker when reconstructing the optimal sequence
    public String tag() {
        return tag;
    }
}
