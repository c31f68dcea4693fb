package nl.nfi.djzxcvbn.estimate.feedback;

public enum Suggestion {

    USE_FEW_WORDS("use_few_words"),
    NO_NEED_FOR_MIXED_CHARS("no_need_for_mixed_chars"),
    ADD_ANOTHER_WORD("add_another_word"),
    LONGER_KEYBOARD_PATTERN("longer_keyboard_pattern"),
    AVOID_REPEATS("avoid_repeats"),
    AVOID_SEQUENCES("avoid_sequences"),
    AVOID_RECENT_YEARS("avoid_recent_years"),
    AVOID_ASSOCIATED_YEARS("avoid_associated_years"),
    AVOID_ASSOCIATED_DATES_AND_YEARS("avoid_associated_dates_and_years"),
    CAPITALIZATION("capitalization"),
    ALL_UPPERCASE("all_uppercase"),
    REVERSED_WORDS("reversed_words"),
    PREDICTABLE_SUBSTITUTIONS("predictable_substitutions");

    private final String key;

    Suggestion(final String key) {
        this.key = key;
    }

    public String key() {
        return "suggestion." + key;
    }
}
