package nl.nfi.djzxcvbn.estimate.match;

import java.util.Comparator;

import static java.util.Comparator.comparingInt;

// a recognized pattern on the inclusive span [i, j] of a password, equal matches explain the span the same way
public interface Match {

    Comparator<Match> BY_SPAN = comparingInt(Match::i).thenComparingInt(Match::j);

    PatternType pattern();

    int i();

    int j();

    String token();

    // for this span alone, at least 1
    double guesses();

    default int length() {
        return j() - i() + 1;
    }

    default double guessesLog10() {
        return Math.log10(guesses());
    }
}
