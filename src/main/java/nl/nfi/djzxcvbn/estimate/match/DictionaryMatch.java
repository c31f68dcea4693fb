package nl.nfi.djzxcvbn.estimate.match;

import nl.nfi.djzxcvbn.estimate.scoring.GuessEstimators;

import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static java.util.Collections.unmodifiableMap;

// covers plain, reversed and leet dictionary words
public record DictionaryMatch(
        int i,
        int j,
        String token,
        String matchedWord,
        int rank,
        String dictionaryName,
        boolean reversed,
        Map<Character, Character> leetSubstitutions,
        double uppercaseVariations,
        double leetVariations,
        double guesses
) implements Match {

    public static DictionaryMatch of(final int i, final int j, final String token, final String matchedWord, final int rank,
                                     final String dictionaryName, final boolean reversed, final Map<Character, Character> leetSubstitutions,
                                     final int passwordLength) {
        final double uppercaseVariations = GuessEstimators.uppercaseVariations(token);
        final double leetVariations = GuessEstimators.leetVariations(token, leetSubstitutions);
        final double guesses = GuessEstimators.withSubmatchMinimum(
                GuessEstimators.dictionary(rank, uppercaseVariations, leetVariations, reversed),
                token.length(),
                passwordLength
        );
        return new DictionaryMatch(i, j, token, matchedWord, rank, dictionaryName, reversed,
                unmodifiableMap(new TreeMap<>(leetSubstitutions)), uppercaseVariations, leetVariations, guesses);
    }

    @Override
    public PatternType pattern() {
        if (leet()) {
            return PatternType.LEET;
        }
        return reversed ? PatternType.REVERSE_DICTIONARY : PatternType.DICTIONARY;
    }

    public boolean leet() {
        return !leetSubstitutions.isEmpty();
    }

    public double baseGuesses() {
        return rank;
    }

    // ordered by leet character, e.g. "3 -> e, 4 -> a"
    public String substitutionDisplay() {
        return leetSubstitutions.entrySet().stream()
                .map(entry -> "%s -> %s".formatted(entry.getKey(), entry.getValue()))
                .collect(Collectors.joining(", "));
    }
}
