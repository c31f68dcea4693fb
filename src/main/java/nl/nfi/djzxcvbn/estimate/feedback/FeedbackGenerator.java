package nl.nfi.djzxcvbn.estimate.feedback;

import nl.nfi.djzxcvbn.estimate.match.DictionaryMatch;
import nl.nfi.djzxcvbn.estimate.match.Match;
import nl.nfi.djzxcvbn.estimate.match.RegexMatcher;
import nl.nfi.djzxcvbn.estimate.match.RegexMatch;
import nl.nfi.djzxcvbn.estimate.match.RepeatMatch;
import nl.nfi.djzxcvbn.estimate.match.SpatialMatch;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

// picks warning and suggestion keys for weak passwords, text is left to a Translator
public final class FeedbackGenerator {

    private static final int MAX_SCORE_WITH_FEEDBACK = 2;

    private static final Set<String> NAME_DICTIONARIES = Set.of("surnames", "male_names", "female_names");
    private static final Pattern START_UPPER = Pattern.compile("^[A-Z][^A-Z]+$");
    private static final Pattern ALL_UPPER = Pattern.compile("^[^a-z]+$");

    private FeedbackGenerator() {
    }

    public static Feedback generate(final int score, final List<? extends Match> sequence) {
        if (sequence.isEmpty()) {
            return Feedback.of(null, Suggestion.USE_FEW_WORDS, Suggestion.NO_NEED_FOR_MIXED_CHARS);
        }
        if (score > MAX_SCORE_WITH_FEEDBACK) {
            return Feedback.NONE;
        }

        final Match dominant = dominantMatch(sequence);
        return matchFeedback(dominant, sequence.size() == 1)
                .map(feedback -> feedback.withLeadingSuggestion(Suggestion.ADD_ANOTHER_WORD))
                .orElseGet(() -> Feedback.of(null, Suggestion.ADD_ANOTHER_WORD));
    }

    // longest span, the more expensive one when two are equally long
    static Match dominantMatch(final List<? extends Match> sequence) {
        Match dominant = sequence.get(0);
        for (final Match match : sequence.subList(1, sequence.size())) {
            if (match.length() > dominant.length()
                    || (match.length() == dominant.length() && match.guesses() > dominant.guesses())) {
                dominant = match;
            }
        }
        return dominant;
    }

    private static Optional<Feedback> matchFeedback(final Match match, final boolean soleMatch) {
        return switch (match.pattern()) {
            case DICTIONARY, REVERSE_DICTIONARY, LEET -> Optional.of(dictionaryFeedback((DictionaryMatch) match, soleMatch));
            case SPATIAL -> Optional.of(Feedback.of(
                    ((SpatialMatch) match).turns() == 1 ? Warning.STRAIGHT_ROW : Warning.KEY_PATTERN,
                    Suggestion.LONGER_KEYBOARD_PATTERN
            ));
            case REPEAT -> Optional.of(Feedback.of(
                    ((RepeatMatch) match).baseToken().length() == 1 ? Warning.SIMPLE_REPEAT : Warning.EXTENDED_REPEAT,
                    Suggestion.AVOID_REPEATS
            ));
            case SEQUENCE -> Optional.of(Feedback.of(Warning.SEQUENCES, Suggestion.AVOID_SEQUENCES));
            case REGEX -> RegexMatcher.RECENT_YEAR.equals(((RegexMatch) match).regexName())
                    ? Optional.of(Feedback.of(Warning.RECENT_YEARS, Suggestion.AVOID_RECENT_YEARS, Suggestion.AVOID_ASSOCIATED_YEARS))
                    : Optional.empty();
            case DATE -> Optional.of(Feedback.of(Warning.DATES, Suggestion.AVOID_ASSOCIATED_DATES_AND_YEARS));
            case BRUTEFORCE -> Optional.empty();
        };
    }

    private static Feedback dictionaryFeedback(final DictionaryMatch match, final boolean soleMatch) {
        final Warning warning = dictionaryWarning(match, soleMatch);

        final List<Suggestion> suggestions = new ArrayList<>();
        final String token = match.token();
        if (START_UPPER.matcher(token).find()) {
            suggestions.add(Suggestion.CAPITALIZATION);
        } else if (ALL_UPPER.matcher(token).find() && !token.toLowerCase(Locale.ROOT).equals(token)) {
            suggestions.add(Suggestion.ALL_UPPERCASE);
        }
        if (match.reversed() && token.length() >= 4) {
            suggestions.add(Suggestion.REVERSED_WORDS);
        }
        if (match.leet()) {
            suggestions.add(Suggestion.PREDICTABLE_SUBSTITUTIONS);
        }
        return new Feedback(Optional.ofNullable(warning), suggestions);
    }

    private static Warning dictionaryWarning(final DictionaryMatch match, final boolean soleMatch) {
        final String dictionaryName = match.dictionaryName();
        if ("passwords".equals(dictionaryName)) {
            if (soleMatch && !match.leet() && !match.reversed()) {
                if (match.rank() <= 10) {
                    return Warning.TOP10_PASSWORD;
                }
                return match.rank() <= 100 ? Warning.TOP100_PASSWORD : Warning.COMMON_PASSWORD;
            }
            return match.guessesLog10() <= 4 ? Warning.SIMILAR_TO_COMMON : null;
        }
        if ("english_wikipedia".equals(dictionaryName)) {
            return soleMatch ? Warning.WORD_BY_ITSELF : null;
        }
        if (NAME_DICTIONARIES.contains(dictionaryName)) {
            return soleMatch ? Warning.NAMES_BY_THEMSELVES : Warning.COMMON_NAMES;
        }
        return null;
    }
}
