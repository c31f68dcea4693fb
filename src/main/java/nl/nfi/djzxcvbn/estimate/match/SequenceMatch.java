package nl.nfi.djzxcvbn.estimate.match;

import nl.nfi.djzxcvbn.estimate.scoring.GuessEstimators;

public record SequenceMatch(
        int i,
        int j,
        String token,
        String sequenceName,
        int sequenceSpace,
        int delta,
        double guesses
) implements Match {

    public static SequenceMatch of(final int i, final int j, final String token, final String sequenceName, final int sequenceSpace,
                                   final int delta, final int passwordLength) {
        final double guesses = GuessEstimators.withSubmatchMinimum(
                GuessEstimators.sequence(token, delta > 0),
                token.length(),
                passwordLength
        );
        return new SequenceMatch(i, j, token, sequenceName, sequenceSpace, delta, guesses);
    }

    public boolean ascending() {
        return delta > 0;
    }

    @Override
    public PatternType pattern() {
        return PatternType.SEQUENCE;
    }
}
