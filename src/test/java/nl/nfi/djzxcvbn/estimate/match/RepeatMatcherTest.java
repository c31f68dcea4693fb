package nl.nfi.djzxcvbn.estimate.match;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class RepeatMatcherTest {

    private final RepeatMatcher withoutBasePatterns = new RepeatMatcher(password -> List.of());
    private final RepeatMatcher withSequences = new RepeatMatcher(new SequenceMatcher());

    @Test
    void singleCharacterRepeat() {
        final List<RepeatMatch> matches = withoutBasePatterns.match("aaaaaaaa");

        assertThat(matches).hasSize(1);
        final RepeatMatch match = matches.get(0);
        assertThat(match.baseToken()).isEqualTo("a");
        assertThat(match.repeatCount()).isEqualTo(8);
        // bruteforce of one lower case letter
        assertThat(match.baseGuesses()).isEqualTo(26);
        assertThat(match.guesses()).isEqualTo(26 * 8);
    }

    @Test
    void baseTokenIsAnalysedByTheBaseMatcher() {
        final RepeatMatch match = withSequences.match("abcabcabc").get(0);

        assertThat(match.baseToken()).isEqualTo("abc");
        assertThat(match.repeatCount()).isEqualTo(3);
        assertThat(match.baseMatches())
                .extracting(Match::pattern)
                .containsExactly(PatternType.SEQUENCE);
        assertThat(match.baseGuesses()).isEqualTo(12);
        assertThat(match.guesses()).isEqualTo(36);
    }

    @Test
    void greedyRepeatGetsItsShortestBase() {
        assertThat(withoutBasePatterns.match("aabaab"))
                .extracting(RepeatMatch::i, RepeatMatch::j, RepeatMatch::baseToken, RepeatMatch::repeatCount)
                .containsExactly(tuple(0, 5, "aab", 2));
    }

    @Test
    void severalRepeats() {
        assertThat(withoutBasePatterns.match("abab12xxxx"))
                .extracting(RepeatMatch::i, RepeatMatch::j, RepeatMatch::baseToken)
                .containsExactly(tuple(0, 3, "ab"), tuple(6, 9, "x"));
    }

    @Test
    void noRepeat() {
        assertThat(withoutBasePatterns.match("")).isEmpty();
        assertThat(withoutBasePatterns.match("abcdef")).isEmpty();
    }
}
