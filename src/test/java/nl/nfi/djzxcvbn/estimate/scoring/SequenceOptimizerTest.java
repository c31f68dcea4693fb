package nl.nfi.djzxcvbn.estimate.scoring;

import nl.nfi.djzxcvbn.estimate.match.BruteforceMatch;
import nl.nfi.djzxcvbn.estimate.match.DateMatch;
import nl.nfi.djzxcvbn.estimate.match.Match;
import nl.nfi.djzxcvbn.estimate.match.PatternType;
import nl.nfi.djzxcvbn.estimate.match.RegexMatch;
import org.junit.jupiter.api.Test;

import java.util.List;

import static java.lang.Math.pow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SequenceOptimizerTest {

    private static final String PASSWORD = "0123456789";

    private static Match match(final int i, final int j, final double guesses) {
        return new RegexMatch(i, j, PASSWORD.substring(i, j + 1), "test", guesses);
    }

    @Test
    void emptyPassword() {
        final OptimalSequence optimal = SequenceOptimizer.optimize("", List.of());
        assertThat(optimal.guesses()).isEqualTo(1);
        assertThat(optimal.score()).isZero();
        assertThat(optimal.sequence()).isEmpty();
    }

    @Test
    void withoutCandidatesTheWholePasswordIsOneBruteforceMatch() {
        final OptimalSequence optimal = SequenceOptimizer.optimize(PASSWORD, List.of());
        assertThat(optimal.guesses()).isEqualTo(pow(10, 10));
        assertThat(optimal.sequence()).containsExactly(BruteforceMatch.of(0, 9, PASSWORD));
    }

    @Test
    void gapAfterMatchIsFilledWithBruteforce() {
        final Match m0 = match(0, 5, 1);
        final OptimalSequence optimal = SequenceOptimizer.optimize(PASSWORD, List.of(m0));
        assertThat(optimal.guesses()).isEqualTo(pow(10, 4));
        assertThat(optimal.sequence()).containsExactly(m0, BruteforceMatch.of(6, 9, "6789"));
    }

    @Test
    void gapsOnBothSidesAreFilledWithBruteforce() {
        final Match m0 = match(1, 8, 1);
        final OptimalSequence optimal = SequenceOptimizer.optimize(PASSWORD, List.of(m0));
        // single characters cost at least one more than the single character submatch minimum
        assertThat(optimal.guesses()).isEqualTo(11 * 11);
        assertThat(optimal.sequence()).containsExactly(BruteforceMatch.of(0, 0, "0"), m0, BruteforceMatch.of(9, 9, "9"));
    }

    @Test
    void cheaperMatchOnSameSpanWins() {
        final Match m0 = match(0, 9, 1);
        final Match m1 = match(0, 9, 2);
        assertThat(SequenceOptimizer.optimize(PASSWORD, List.of(m1, m0)).sequence()).containsExactly(m0);
        assertThat(SequenceOptimizer.optimize(PASSWORD, List.of(m0, m1)).sequence()).containsExactly(m0);
    }

    @Test
    void productOfShorterMatchesCanBeatOneLongMatch() {
        final Match whole = match(0, 9, 3);
        final Match left = match(0, 3, 1);
        final Match right = match(4, 9, 1);
        final OptimalSequence optimal = SequenceOptimizer.optimize(PASSWORD, List.of(whole, left, right));
        assertThat(optimal.guesses()).isEqualTo(1);
        assertThat(optimal.sequence()).containsExactly(left, right);
    }

    @Test
    void equallyCheapSequencesPreferTheEarlierStart() {
        final Match whole = match(0, 9, 4);
        final Match left = match(0, 4, 2);
        final Match right = match(5, 9, 2);
        final OptimalSequence optimal = SequenceOptimizer.optimize(PASSWORD, List.of(left, right, whole));
        assertThat(optimal.guesses()).isEqualTo(4);
        assertThat(optimal.sequence()).containsExactly(whole);
    }

    @Test
    void tiedExplanationsOfOneSpanMultiplyTheGuesses() {
        final Match regex = match(0, 9, 5);
        final Match date = new DateMatch(0, 9, PASSWORD, "", 2000, 1, 1, 5);
        final OptimalSequence optimal = SequenceOptimizer.optimize(PASSWORD, List.of(regex, date));
        assertThat(optimal.guesses()).isEqualTo(10);
        // lowest pattern tag represents the span
        assertThat(optimal.sequence()).containsExactly(date);
    }

    @Test
    void identicalCandidatesAreOneExplanation() {
        final Match m0 = match(0, 9, 5);
        final Match duplicate = match(0, 9, 5);
        final OptimalSequence optimal = SequenceOptimizer.optimize(PASSWORD, List.of(m0, duplicate));
        assertThat(optimal.guesses()).isEqualTo(5);
    }

    @Test
    void fewerTiedExplanationsBeatAnEarlierStartAtEqualCost() {
        // two tied explanations of 3 guesses on the whole password cost as much as 6 * 1 on two halves
        final Match tiedRegex = match(0, 9, 3);
        final Match tiedDate = new DateMatch(0, 9, PASSWORD, "", 2000, 1, 1, 3);
        final Match left = match(0, 4, 6);
        final Match right = match(5, 9, 1);
        final OptimalSequence optimal = SequenceOptimizer.optimize(PASSWORD, List.of(tiedRegex, tiedDate, left, right));
        assertThat(optimal.guesses()).isEqualTo(6);
        assertThat(optimal.sequence()).containsExactly(left, right);
    }

    @Test
    void bruteforceSegmentsAreNeverAdjacent() {
        final Match m0 = match(2, 3, 100);
        final Match m1 = match(6, 7, 1e9);
        final OptimalSequence optimal = SequenceOptimizer.optimize(PASSWORD, List.of(m0, m1));
        final List<Match> sequence = optimal.sequence();
        for (int k = 1; k < sequence.size(); k++) {
            assertThat(sequence.get(k - 1).pattern() == PatternType.BRUTEFORCE && sequence.get(k).pattern() == PatternType.BRUTEFORCE)
                    .isFalse();
        }
        assertCoversPassword(sequence, PASSWORD.length());
    }

    @Test
    void deterministic() {
        final List<Match> candidates = List.of(match(0, 4, 2), match(5, 9, 2), match(0, 9, 4), match(3, 6, 1));
        final OptimalSequence first = SequenceOptimizer.optimize(PASSWORD, candidates);
        for (int i = 0; i < 16; i++) {
            assertThat(SequenceOptimizer.optimize(PASSWORD, candidates)).isEqualTo(first);
        }
    }

    @Test
    void matchOutsidePasswordIsAProgrammingError() {
        assertThatThrownBy(() -> SequenceOptimizer.optimize("abc", List.of(new RegexMatch(1, 3, "bcd", "test", 1))))
                .isInstanceOf(IllegalStateException.class);
    }

    static void assertCoversPassword(final List<Match> sequence, final int length) {
        int next = 0;
        for (final Match match : sequence) {
            assertThat(match.i()).isEqualTo(next);
            assertThat(match.j()).isGreaterThanOrEqualTo(match.i());
            next = match.j() + 1;
        }
        assertThat(next).isEqualTo(length);
    }
}
