package nl.nfi.djzxcvbn.estimate.match;

import nl.nfi.djzxcvbn.estimate.scoring.GuessEstimators;

import java.util.List;

// baseMatches is the optimal sequence explaining one occurrence of the base token
public record RepeatMatch(
        int i,
        int j,
        String token,
        String baseToken,
        double baseGuesses,
        List<Match> baseMatches,
        int repeatCount,
        double guesses
) implements Match {

    public static RepeatMatch of(final int i, final int j, final String token, final String baseToken, final double baseGuesses,
                                 final List<Match> baseMatches, final int passwordLength) {
        final int repeatCount = token.length() / baseToken.length();
        final double guesses = GuessEstimators.withSubmatchMinimum(
                GuessEstimators.repeat(baseGuesses, repeatCount),
                token.length(),
                passwordLength
        );
        return new RepeatMatch(i, j, token, baseToken, baseGuesses, List.copyOf(baseMatches), repeatCount, guesses);
    }

    @Override
    public PatternType pattern() {
        return PatternType.REPEAT;
    }
}
