package nl.nfi.djzxcvbn.estimate.match;

import nl.nfi.djzxcvbn.estimate.scoring.GuessEstimators;

// separator is empty for dates written without one, e.g. 13071987
public record DateMatch(int i, int j, String token, String separator, int year, int month, int day, double guesses) implements Match {

    public static DateMatch of(final int i, final int j, final String token, final String separator, final int year, final int month,
                               final int day, final int passwordLength) {
        final double guesses = GuessEstimators.withSubmatchMinimum(
                GuessEstimators.date(year, !separator.isEmpty()),
                token.length(),
                passwordLength
        );
        return new DateMatch(i, j, token, separator, year, month, day, guesses);
    }

    public boolean hasSeparator() {
        return !separator.isEmpty();
    }

    @Override
    public PatternType pattern() {
        return PatternType.DATE;
    }
}
