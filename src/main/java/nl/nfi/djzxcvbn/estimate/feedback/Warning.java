package nl.nfi.djzxcvbn.estimate.feedback;

public enum Warning {

    STRAIGHT_ROW("straight_row"),
    KEY_PATTERN("key_pattern"),
    SIMPLE_REPEAT("simple_repeat"),
    EXTENDED_REPEAT("extended_repeat"),
    SEQUENCES("sequences"),
    RECENT_YEARS("recent_years"),
    DATES("dates"),
    TOP10_PASSWORD("top10_password"),
    TOP100_PASSWORD("top100_password"),
    COMMON_PASSWORD("common_password"),
    SIMILAR_TO_COMMON("similar_to_common"),
    WORD_BY_ITSELF("word_by_itself"),
    NAMES_BY_THEMSELVES("names_by_themselves"),
    COMMON_NAMES("common_names");

    private final String key;

    Warning(final String key) {
        this.key = key;
    }

    public String key() {
        return "warning." + key;
    }
}
