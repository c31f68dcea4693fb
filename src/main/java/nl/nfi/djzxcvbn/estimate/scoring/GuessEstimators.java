package nl.nfi.djzxcvbn.estimate.scoring;

import java.time.Year;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import static java.lang.Math.abs;
import static java.lang.Math.max;
import static java.lang.Math.min;
import static java.lang.Math.pow;

// stateless guess formulas, each consuming only the fields of one match
public final class GuessEstimators {

    public static final int REFERENCE_YEAR = Year.now().getValue();
    public static final int MIN_YEAR_SPACE = 20;

    // a pattern inside a longer password is never cheaper than this
    public static final double MIN_SUBMATCH_GUESSES_SINGLE_CHAR = 10;
    public static final double MIN_SUBMATCH_GUESSES_MULTI_CHAR = 50;

    static final int LOWERCASE_CARDINALITY = 26;
    static final int UPPERCASE_CARDINALITY = 26;
    static final int DIGIT_CARDINALITY = 10;
    static final int SYMBOL_CARDINALITY = 33;
    static final int UNICODE_CARDINALITY = 100;

    private static final Pattern START_UPPER = Pattern.compile("^[A-Z][^A-Z]+$");
    private static final Pattern END_UPPER = Pattern.compile("^[^A-Z]+[A-Z]$");
    private static final Pattern ALL_UPPER = Pattern.compile("^[^a-z]+$");
    private static final Pattern ALL_LOWER = Pattern.compile("^[^A-Z]+$");
    private static final Pattern DIGIT = Pattern.compile("\\d");

    private static final double ALL_UPPER_VARIATIONS = 2;
    private static final int DATE_DAYS_PER_YEAR = 365;
    private static final int DATE_SEPARATOR_VARIATIONS = 4;

    private GuessEstimators() {
    }

    public static double withSubmatchMinimum(final double guesses, final int tokenLength, final int passwordLength) {
        if (tokenLength >= passwordLength) {
            return max(guesses, 1);
        }
        final double minimum = tokenLength == 1 ? MIN_SUBMATCH_GUESSES_SINGLE_CHAR : MIN_SUBMATCH_GUESSES_MULTI_CHAR;
        return max(guesses, minimum);
    }

    // one more than the submatch minimum, so a recognized pattern wins over bruteforce on the same span
    public static double bruteforce(final CharSequence token) {
        return bruteforce(characterClasses(token), token.length());
    }

    static double bruteforce(final int characterClasses, final int length) {
        final double guesses = pow(cardinality(characterClasses), length);
        final double minimum = length == 1
                ? MIN_SUBMATCH_GUESSES_SINGLE_CHAR + 1
                : MIN_SUBMATCH_GUESSES_MULTI_CHAR + 1;
        return max(guesses, minimum);
    }

    public static int cardinality(final CharSequence token) {
        return cardinality(characterClasses(token));
    }

    static int characterClasses(final CharSequence token) {
        int classes = 0;
        for (int i = 0; i < token.length(); i++) {
            classes |= characterClass(token.charAt(i));
        }
        return classes;
    }

    static int characterClass(final char c) {
        if (c >= 'a' && c <= 'z') {
            return 1;
        }
        if (c >= 'A' && c <= 'Z') {
            return 1 << 1;
        }
        if (c >= '0' && c <= '9') {
            return 1 << 2;
        }
        if (c < 0x80) {
            return 1 << 3;
        }
        return 1 << 4;
    }

    static int cardinality(final int classes) {
        int cardinality = 0;
        if ((classes & 1) != 0) {
            cardinality += LOWERCASE_CARDINALITY;
        }
        if ((classes & (1 << 1)) != 0) {
            cardinality += UPPERCASE_CARDINALITY;
        }
        if ((classes & (1 << 2)) != 0) {
            cardinality += DIGIT_CARDINALITY;
        }
        if ((classes & (1 << 3)) != 0) {
            cardinality += SYMBOL_CARDINALITY;
        }
        if ((classes & (1 << 4)) != 0) {
            cardinality += UNICODE_CARDINALITY;
        }
        return cardinality;
    }

    public static double dictionary(final int rank, final double uppercaseVariations, final double leetVariations, final boolean reversed) {
        return rank * uppercaseVariations * leetVariations * (reversed ? 2 : 1);
    }

    public static double uppercaseVariations(final String word) {
        if (ALL_LOWER.matcher(word).matches() || word.toLowerCase(Locale.ROOT).equals(word)) {
            return 1;
        }
        // first or last letter capitalized
        if (START_UPPER.matcher(word).matches() || END_UPPER.matcher(word).matches()) {
            return 2;
        }
        if (ALL_UPPER.matcher(word).matches()) {
            return ALL_UPPER_VARIATIONS;
        }

        int upper = 0;
        int lower = 0;
        for (int i = 0; i < word.length(); i++) {
            final char c = word.charAt(i);
            if (Character.isUpperCase(c)) {
                upper++;
            } else if (Character.isLowerCase(c)) {
                lower++;
            }
        }
        // every way of putting at most min(U, L) capitals in the word
        double variations = 0;
        for (int i = 1; i <= min(upper, lower); i++) {
            variations += nCk(upper + lower, i);
        }
        return max(variations, 1);
    }

    public static double leetVariations(final String token, final Map<Character, Character> substitutions) {
        if (substitutions.isEmpty()) {
            return 1;
        }
        final String lowered = token.toLowerCase(Locale.ROOT);
        double variations = 1;
        for (final Map.Entry<Character, Character> substitution : substitutions.entrySet()) {
            int subbed = 0;
            int unsubbed = 0;
            for (int i = 0; i < lowered.length(); i++) {
                final char c = lowered.charAt(i);
                if (c == substitution.getKey()) {
                    subbed++;
                } else if (c == substitution.getValue()) {
                    unsubbed++;
                }
            }
            if (subbed == 0 || unsubbed == 0) {
                // fully subbed or fully unsubbed, the attacker tries both
                variations *= 2;
            } else {
                double possibilities = 0;
                for (int i = 1; i <= min(subbed, unsubbed); i++) {
                    possibilities += nCk(subbed + unsubbed, i);
                }
                variations *= possibilities;
            }
        }
        return variations;
    }

    // patterns of length L or less with at most t turns, times the shifted key variations
    public static double spatial(final int startingPositions, final double averageDegree, final int length, final int turns, final int shiftedCount) {
        double guesses = 0;
        for (int i = 2; i <= length; i++) {
            final int possibleTurns = min(turns, i - 1);
            for (int j = 1; j <= possibleTurns; j++) {
                guesses += nCk(i - 1, j - 1) * startingPositions * pow(averageDegree, j);
            }
        }

        if (shiftedCount > 0) {
            final int unshiftedCount = length - shiftedCount;
            if (unshiftedCount == 0) {
                guesses *= 2;
            } else {
                double shiftedVariations = 0;
                for (int i = 1; i <= min(shiftedCount, unshiftedCount); i++) {
                    shiftedVariations += nCk(shiftedCount + unshiftedCount, i);
                }
                guesses *= shiftedVariations;
            }
        }
        return max(guesses, 1);
    }

    public static double repeat(final double baseGuesses, final int repeatCount) {
        return baseGuesses * repeatCount;
    }

    public static double sequence(final String token, final boolean ascending) {
        final char first = token.charAt(0);
        double baseGuesses;
        if (first == 'a' || first == 'A' || first == 'z' || first == 'Z' || first == '0' || first == '1' || first == '9') {
            // obvious starting points
            baseGuesses = 4;
        } else if (DIGIT.matcher(String.valueOf(first)).matches()) {
            baseGuesses = 10;
        } else {
            baseGuesses = 26;
        }
        if (!ascending) {
            baseGuesses *= 2;
        }
        return baseGuesses * token.length();
    }

    public static double recentYear(final int year) {
        return max(abs(year - REFERENCE_YEAR), MIN_YEAR_SPACE);
    }

    public static double date(final int year, final boolean hasSeparator) {
        final double yearSpace = max(abs(year - REFERENCE_YEAR), MIN_YEAR_SPACE);
        final double guesses = yearSpace * DATE_DAYS_PER_YEAR;
        return hasSeparator ? guesses * DATE_SEPARATOR_VARIATIONS : guesses;
    }

    static double nCk(final int n, final int k) {
        if (k > n || k < 0) {
            return 0;
        }
        if (k == 0) {
            return 1;
        }
        double result = 1;
        int remaining = n;
        for (int denominator = 1; denominator <= k; denominator++) {
            result *= remaining;
            result /= denominator;
            remaining--;
        }
        return result;
    }
}
