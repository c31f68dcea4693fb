package nl.nfi.djzxcvbn.estimate.match;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class SequenceMatcherTest {

    private final SequenceMatcher matcher = new SequenceMatcher();

    @ParameterizedTest
    @CsvSource({
            "a,b,1",
            "b,a,-1",
            "z,a,1",
            "a,z,-1",
            "9,0,1",
            "0,9,-1",
            "Z,A,1",
            "a,c,2",
            "c,X,-11",
    })
    void delta(final char previous, final char current, final int expected) {
        assertThat(SequenceMatcher.delta(previous, current)).isEqualTo(expected);
    }

    @Test
    void runsOfDifferentClasses() {
        assertThat(matcher.match("abcXYZ"))
                .extracting(SequenceMatch::i, SequenceMatch::j, SequenceMatch::sequenceName, SequenceMatch::sequenceSpace)
                .containsExactly(tuple(0, 2, "lower", 26), tuple(3, 5, "upper", 26));
    }

    @Test
    void wrapsAround() {
        final List<SequenceMatch> matches = matcher.match("xyzab");

        assertThat(matches).hasSize(1);
        assertThat(matches.get(0).delta()).isEqualTo(1);
        assertThat(matches.get(0).token()).isEqualTo("xyzab");
        assertThat(matches.get(0).guesses()).isEqualTo(26 * 5);
    }

    @Test
    void descendingDigits() {
        final SequenceMatch match = matcher.match("97531").get(0);

        assertThat(match.sequenceName()).isEqualTo("digits");
        assertThat(match.ascending()).isFalse();
        assertThat(match.delta()).isEqualTo(-2);
        // obvious start, doubled for descending
        assertThat(match.guesses()).isEqualTo(4 * 2 * 5);
    }

    @Test
    void neighbouringRunsShareTheirBoundary() {
        assertThat(matcher.match("abcba"))
                .extracting(SequenceMatch::i, SequenceMatch::j, SequenceMatch::delta)
                .containsExactly(tuple(0, 2, 1), tuple(2, 4, -1));
    }

    @Test
    void unicodeRun() {
        assertThat(matcher.match("αβγ"))
                .extracting(SequenceMatch::sequenceName, SequenceMatch::sequenceSpace)
                .containsExactly(tuple("unicode", 26));
    }

    @Test
    void noSequence() {
        assertThat(matcher.match("")).isEmpty();
        assertThat(matcher.match("ab")).isEmpty();
        assertThat(matcher.match("aaa")).isEmpty();
        // steps above the maximum delta are not a sequence
        assertThat(matcher.match("agm")).isEmpty();
        assertThat(matcher.match("afk")).hasSize(1);
    }
}
