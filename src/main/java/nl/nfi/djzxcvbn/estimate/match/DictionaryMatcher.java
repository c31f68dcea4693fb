package nl.nfi.djzxcvbn.estimate.match;

import nl.nfi.djzxcvbn.data.Dictionaries;
import nl.nfi.djzxcvbn.data.RankedDictionary;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import static java.lang.Math.min;

public final class DictionaryMatcher implements PasswordMatcher {

    private final Dictionaries dictionaries;

    public DictionaryMatcher(final Dictionaries dictionaries) {
        this.dictionaries = dictionaries;
    }

    @Override
    public List<DictionaryMatch> match(final String password) {
        final List<DictionaryMatch> matches = new ArrayList<>();
        final String lowered = RankedDictionary.lowerCase(password);
        final int length = password.length();

        for (final RankedDictionary dictionary : dictionaries.all()) {
            for (int i = 0; i < length; i++) {
                // no word in this dictionary is longer, so no need to look further
                final int end = min(length, i + dictionary.maxWordLength());
                for (int j = i; j < end; j++) {
                    final String word = lowered.substring(i, j + 1);
                    final OptionalInt rank = dictionary.rank(word);
                    if (rank.isPresent()) {
                        matches.add(DictionaryMatch.of(
                                i, j, password.substring(i, j + 1), word, rank.getAsInt(), dictionary.name(), false, Map.of(), length
                        ));
                    }
                }
            }
        }

        matches.sort(Match.BY_SPAN);
        return matches;
    }
}
