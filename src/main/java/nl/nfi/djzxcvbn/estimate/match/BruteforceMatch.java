package nl.nfi.djzxcvbn.estimate.match;

import nl.nfi.djzxcvbn.estimate.scoring.GuessEstimators;

// filler for spans no matcher recognized, only ever created by the sequence optimizer
public record BruteforceMatch(int i, int j, String token, double guesses) implements Match {

    public static BruteforceMatch of(final int i, final int j, final String token) {
        return new BruteforceMatch(i, j, token, GuessEstimators.bruteforce(token));
    }

    @Override
    public PatternType pattern() {
        return PatternType.BRUTEFORCE;
    }
}
