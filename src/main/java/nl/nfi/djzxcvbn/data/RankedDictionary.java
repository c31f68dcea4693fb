package nl.nfi.djzxcvbn.data;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;

import static java.util.Collections.unmodifiableMap;

// frequency ordered word list: rank 1 is the most common word
public final class RankedDictionary {

    private final String name;
    private final Map<String, Integer> ranks;
    private final int maxWordLength;

    private RankedDictionary(final String name, final Map<String, Integer> ranks, final int maxWordLength) {
        this.name = name;
        this.ranks = ranks;
        this.maxWordLength = maxWordLength;
    }

    // words are expected in frequency order, duplicates keep their first (lowest) rank
    public static RankedDictionary fromWords(final String name, final Collection<String> words) {
        final Map<String, Integer> ranks = new HashMap<>();
        int maxWordLength = 0;
        int rank = 1;
        for (final String word : words) {
            final String lowered = lowerCase(word.strip());
            if (lowered.isEmpty() || ranks.containsKey(lowered)) {
                continue;
            }
            ranks.put(lowered, rank++);
            maxWordLength = Math.max(maxWordLength, lowered.length());
        }
        return new RankedDictionary(name, unmodifiableMap(ranks), maxWordLength);
    }

    // char by char, so a lowered password keeps the positions of the original and matches the stored words
    public static String lowerCase(final String value) {
        final char[] characters = value.toCharArray();
        for (int i = 0; i < characters.length; i++) {
            characters[i] = Character.toLowerCase(characters[i]);
        }
        return new String(characters);
    }

    public String name() {
        return name;
    }

    public OptionalInt rank(final String word) {
        final Integer rank = ranks.get(word);
        return rank == null ? OptionalInt.empty() : OptionalInt.of(rank);
    }

    public boolean contains(final String word) {
        return ranks.containsKey(word);
    }

    public int size() {
        return ranks.size();
    }

    public int maxWordLength() {
        return maxWordLength;
    }

    @Override
    public String toString() {
        return "RankedDictionary[%s, %d words]".formatted(name, ranks.size());
    }
}
