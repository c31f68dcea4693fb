package nl.nfi.djzxcvbn.estimate.feedback;

import nl.nfi.djzxcvbn.estimate.match.BruteforceMatch;
import nl.nfi.djzxcvbn.estimate.match.DateMatch;
import nl.nfi.djzxcvbn.estimate.match.DictionaryMatch;
import nl.nfi.djzxcvbn.estimate.match.Match;
import nl.nfi.djzxcvbn.estimate.match.RegexMatch;
import nl.nfi.djzxcvbn.estimate.match.RegexMatcher;
import nl.nfi.djzxcvbn.estimate.match.RepeatMatch;
import nl.nfi.djzxcvbn.estimate.match.SequenceMatch;
import nl.nfi.djzxcvbn.estimate.match.SpatialMatch;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FeedbackGeneratorTest {

    private static DictionaryMatch word(final String token, final int rank, final String dictionaryName, final int passwordLength) {
        return DictionaryMatch.of(0, token.length() - 1, token, token.toLowerCase(Locale.ROOT), rank, dictionaryName, false, Map.of(), passwordLength);
    }

    @Test
    void emptyPassword() {
        final Feedback feedback = FeedbackGenerator.generate(0, List.of());

        assertThat(feedback.warning()).isEmpty();
        assertThat(feedback.suggestions()).containsExactly(Suggestion.USE_FEW_WORDS, Suggestion.NO_NEED_FOR_MIXED_CHARS);
    }

    @Test
    void strongPasswordsGetNoFeedback() {
        final List<Match> sequence = List.of(BruteforceMatch.of(0, 11, "kjhsdf8723hd"));

        assertThat(FeedbackGenerator.generate(3, sequence)).isEqualTo(Feedback.NONE);
        assertThat(FeedbackGenerator.generate(4, sequence)).isEqualTo(Feedback.NONE);
    }

    @Test
    void bruteforceOnlyGetsAGenericSuggestion() {
        final Feedback feedback = FeedbackGenerator.generate(1, List.of(BruteforceMatch.of(0, 3, "kjhs")));

        assertThat(feedback.warning()).isEmpty();
        assertThat(feedback.suggestions()).containsExactly(Suggestion.ADD_ANOTHER_WORD);
    }

    @Test
    void dominantMatchIsTheLongest() {
        final Match shortExpensive = new RegexMatch(0, 3, "1987", RegexMatcher.RECENT_YEAR, 1000);
        final Match longCheap = SequenceMatch.of(4, 9, "abcdef", "lower", 26, 1, 10);
        final Match longExpensive = BruteforceMatch.of(4, 9, "kjhsdf");

        assertThat(FeedbackGenerator.dominantMatch(List.of(shortExpensive, longCheap))).isEqualTo(longCheap);
        assertThat(FeedbackGenerator.dominantMatch(List.of(longCheap, longExpensive))).isEqualTo(longExpensive);
    }

    @Nested
    class DictionaryWords {

        @Test
        void topPasswords() {
            assertThat(FeedbackGenerator.generate(0, List.of(word("password", 2, "passwords", 8))).warning())
                    .hasValue(Warning.TOP10_PASSWORD);
            assertThat(FeedbackGenerator.generate(0, List.of(word("sunshine", 50, "passwords", 8))).warning())
                    .hasValue(Warning.TOP100_PASSWORD);
            assertThat(FeedbackGenerator.generate(1, List.of(word("sunshine", 500, "passwords", 8))).warning())
                    .hasValue(Warning.COMMON_PASSWORD);
        }

        @Test
        void commonPasswordInsideLongerPassword() {
            final List<Match> sequence = List.of(word("password", 2, "passwords", 10), BruteforceMatch.of(8, 9, "x!"));

            final Feedback feedback = FeedbackGenerator.generate(1, sequence);

            assertThat(feedback.warning()).hasValue(Warning.SIMILAR_TO_COMMON);
            assertThat(feedback.suggestions()).containsExactly(Suggestion.ADD_ANOTHER_WORD);
        }

        @Test
        void words() {
            assertThat(FeedbackGenerator.generate(1, List.of(word("musculature", 300, "english_wikipedia", 11))).warning())
                    .hasValue(Warning.WORD_BY_ITSELF);
            assertThat(FeedbackGenerator.generate(1, List.of(word("musculature", 300, "english_wikipedia", 13), BruteforceMatch.of(11, 12, "x!")))
                    .warning())
                    .isEmpty();
        }

        @Test
        void names() {
            assertThat(FeedbackGenerator.generate(1, List.of(word("smith", 1, "surnames", 5))).warning())
                    .hasValue(Warning.NAMES_BY_THEMSELVES);
            assertThat(FeedbackGenerator.generate(1, List.of(word("smith", 1, "surnames", 7), BruteforceMatch.of(5, 6, "x!"))).warning())
                    .hasValue(Warning.COMMON_NAMES);
        }

        @Test
        void userInputsHaveNoWarning() {
            assertThat(FeedbackGenerator.generate(0, List.of(word("xenomorphic", 1, "user_inputs", 11))).warning()).isEmpty();
        }

        @Test
        void capitalization() {
            assertThat(FeedbackGenerator.generate(1, List.of(word("Musculature", 300, "english_wikipedia", 11))).suggestions())
                    .containsExactly(Suggestion.ADD_ANOTHER_WORD, Suggestion.CAPITALIZATION);
            assertThat(FeedbackGenerator.generate(1, List.of(word("MUSCULATURE", 300, "english_wikipedia", 11))).suggestions())
                    .containsExactly(Suggestion.ADD_ANOTHER_WORD, Suggestion.ALL_UPPERCASE);
        }

        @Test
        void reversedAndSubstitutedWords() {
            final DictionaryMatch reversed = DictionaryMatch.of(0, 7, "drowssap", "password", 2, "passwords", true, Map.of(), 8);
            final DictionaryMatch leet = DictionaryMatch.of(0, 7, "p4ssword", "password", 2, "passwords", false, Map.of('4', 'a'), 8);

            final Feedback reversedFeedback = FeedbackGenerator.generate(0, List.of(reversed));
            assertThat(reversedFeedback.warning()).hasValue(Warning.SIMILAR_TO_COMMON);
            assertThat(reversedFeedback.suggestions()).containsExactly(Suggestion.ADD_ANOTHER_WORD, Suggestion.REVERSED_WORDS);

            final Feedback leetFeedback = FeedbackGenerator.generate(0, List.of(leet));
            assertThat(leetFeedback.warning()).hasValue(Warning.SIMILAR_TO_COMMON);
            assertThat(leetFeedback.suggestions()).containsExactly(Suggestion.ADD_ANOTHER_WORD, Suggestion.PREDICTABLE_SUBSTITUTIONS);
        }
    }

    @Nested
    class Patterns {

        @Test
        void keyboard() {
            final Feedback straight = FeedbackGenerator.generate(0, List.of(new SpatialMatch(0, 5, "qwerty", "qwerty", 1, 0, 2160)));
            final Feedback turning = FeedbackGenerator.generate(0, List.of(new SpatialMatch(0, 5, "zxcvfr", "qwerty", 2, 0, 900)));

            assertThat(straight.warning()).hasValue(Warning.STRAIGHT_ROW);
            assertThat(straight.suggestions()).containsExactly(Suggestion.ADD_ANOTHER_WORD, Suggestion.LONGER_KEYBOARD_PATTERN);
            assertThat(turning.warning()).hasValue(Warning.KEY_PATTERN);
        }

        @Test
        void repeats() {
            final Feedback simple = FeedbackGenerator.generate(0, List.of(RepeatMatch.of(0, 3, "aaaa", "a", 26, List.of(), 4)));
            final Feedback extended = FeedbackGenerator.generate(0, List.of(RepeatMatch.of(0, 5, "abcabc", "abc", 12, List.of(), 6)));

            assertThat(simple.warning()).hasValue(Warning.SIMPLE_REPEAT);
            assertThat(extended.warning()).hasValue(Warning.EXTENDED_REPEAT);
            assertThat(extended.suggestions()).containsExactly(Suggestion.ADD_ANOTHER_WORD, Suggestion.AVOID_REPEATS);
        }

        @Test
        void sequences() {
            final Feedback feedback = FeedbackGenerator.generate(0, List.of(SequenceMatch.of(0, 3, "abcd", "lower", 26, 1, 4)));

            assertThat(feedback.warning()).hasValue(Warning.SEQUENCES);
            assertThat(feedback.suggestions()).containsExactly(Suggestion.ADD_ANOTHER_WORD, Suggestion.AVOID_SEQUENCES);
        }

        @Test
        void years() {
            final Feedback feedback = FeedbackGenerator.generate(0, List.of(new RegexMatch(0, 3, "1987", RegexMatcher.RECENT_YEAR, 39)));

            assertThat(feedback.warning()).hasValue(Warning.RECENT_YEARS);
            assertThat(feedback.suggestions())
                    .containsExactly(Suggestion.ADD_ANOTHER_WORD, Suggestion.AVOID_RECENT_YEARS, Suggestion.AVOID_ASSOCIATED_YEARS);
        }

        @Test
        void dates() {
            final Feedback feedback = FeedbackGenerator.generate(1, List.of(DateMatch.of(0, 7, "13071987", "", 1987, 7, 13, 8)));

            assertThat(feedback.warning()).hasValue(Warning.DATES);
            assertThat(feedback.suggestions()).containsExactly(Suggestion.ADD_ANOTHER_WORD, Suggestion.AVOID_ASSOCIATED_DATES_AND_YEARS);
        }
    }

    @Test
    void renderedThroughTranslator() {
        final FeedbackText text = Feedback.of(Warning.DATES, Suggestion.AVOID_ASSOCIATED_DATES_AND_YEARS).render(Translator.keys());

        assertThat(text.warning()).isEqualTo("warning.dates");
        assertThat(text.suggestions()).containsExactly("suggestion.avoid_associated_dates_and_years");
        assertThat(Feedback.NONE.render(Translator.keys()).warning()).isEmpty();
    }
}
