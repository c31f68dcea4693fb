package nl.nfi.djzxcvbn.estimate.scoring;

import nl.nfi.djzxcvbn.estimate.match.Match;

import java.util.List;

// the cheapest way to explain a whole password, matches ordered by position and covering it without gaps
public record OptimalSequence(String password, double guesses, List<Match> sequence) {

    public OptimalSequence {
        sequence = List.copyOf(sequence);
    }

    public static OptimalSequence empty() {
        return new OptimalSequence("", 1, List.of());
    }

    public double guessesLog10() {
        return Math.log10(guesses);
    }

    public int score() {
        return ScoreClassifier.score(guesses);
    }
}
