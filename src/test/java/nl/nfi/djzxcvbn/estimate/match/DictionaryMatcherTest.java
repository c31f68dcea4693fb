package nl.nfi.djzxcvbn.estimate.match;

import nl.nfi.djzxcvbn.data.Dictionaries;
import nl.nfi.djzxcvbn.data.RankedDictionary;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class DictionaryMatcherTest {

    private static final Dictionaries DICTIONARIES = Dictionaries.of(
            RankedDictionary.fromWords("d1", List.of("motherboard", "mother", "board", "abcd", "cdef")),
            RankedDictionary.fromWords("d2", List.of("z", "8", "99", "$", "asdf1234&*"))
    );

    private final DictionaryMatcher matcher = new DictionaryMatcher(DICTIONARIES);

    @Test
    void wordsInsideWords() {
        final List<DictionaryMatch> matches = matcher.match("motherboard");

        assertThat(matches)
                .extracting(DictionaryMatch::i, DictionaryMatch::j, DictionaryMatch::matchedWord, DictionaryMatch::rank)
                .containsExactly(
                        tuple(0, 5, "mother", 2),
                        tuple(0, 10, "motherboard", 1),
                        tuple(6, 10, "board", 3)
                );
        assertThat(matches).allSatisfy(match -> {
            assertThat(match.pattern()).isEqualTo(PatternType.DICTIONARY);
            assertThat(match.reversed()).isFalse();
            assertThat(match.leet()).isFalse();
        });
    }

    @Test
    void overlappingWords() {
        assertThat(matcher.match("abcdef"))
                .extracting(DictionaryMatch::i, DictionaryMatch::j, DictionaryMatch::token)
                .containsExactly(tuple(0, 3, "abcd"), tuple(2, 5, "cdef"));
    }

    @Test
    void caseInsensitiveButTokenAsWritten() {
        final List<DictionaryMatch> matches = matcher.match("BoaRdZ");

        assertThat(matches)
                .extracting(DictionaryMatch::token, DictionaryMatch::matchedWord, DictionaryMatch::dictionaryName)
                .containsExactly(tuple("BoaRd", "board", "d1"), tuple("Z", "z", "d2"));
        // at most two capitals placed anywhere in five letters: 5C1 + 5C2
        assertThat(matches.get(0).uppercaseVariations()).isEqualTo(15);
    }

    @Test
    void symbolsAndDigits() {
        assertThat(matcher.match("asdf1234&*"))
                .extracting(DictionaryMatch::matchedWord)
                .containsExactly("asdf1234&*");
        assertThat(matcher.match("899"))
                .extracting(DictionaryMatch::i, DictionaryMatch::j)
                .containsExactly(tuple(0, 0), tuple(1, 2));
    }

    @Test
    void nothingToFind() {
        assertThat(matcher.match("")).isEmpty();
        assertThat(matcher.match("xyx")).isEmpty();
        assertThat(new DictionaryMatcher(Dictionaries.empty()).match("motherboard")).isEmpty();
    }
}
