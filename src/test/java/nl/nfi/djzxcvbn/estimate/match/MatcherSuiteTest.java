package nl.nfi.djzxcvbn.estimate.match;

import nl.nfi.djzxcvbn.data.AdjacencyGraphs;
import nl.nfi.djzxcvbn.data.Dictionaries;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class MatcherSuiteTest {

    private static MatcherSuite suite;

    @BeforeAll
    static void loadDictionaries() throws IOException {
        suite = MatcherSuite.forSnapshot(Dictionaries.loadDefault(), AdjacencyGraphs.standard());
    }

    @Test
    void candidatesOfAllMatchersOrderedBySpan() {
        final List<Match> matches = suite.match("password1987qwerty");

        assertThat(matches).isSortedAccordingTo(Match.BY_SPAN);
        assertThat(matches)
                .extracting(Match::pattern)
                .contains(PatternType.DICTIONARY, PatternType.REGEX, PatternType.DATE, PatternType.SPATIAL);
        assertThat(matches)
                .filteredOn(match -> match instanceof DictionaryMatch dictionary && dictionary.matchedWord().equals("password"))
                .extracting(Match::i, Match::j)
                .contains(tuple(0, 7));
    }

    @Test
    void repeatBaseIsAnalysedWithTheWholeSuite() {
        final RepeatMatch repeat = suite.match("aaaaaaaa").stream()
                .filter(RepeatMatch.class::isInstance)
                .map(RepeatMatch.class::cast)
                .findFirst()
                .orElseThrow();

        assertThat(repeat.baseToken()).isEqualTo("a");
        // no list holds single letters, so "a" is bruteforced
        assertThat(repeat.baseGuesses()).isEqualTo(26);
        assertThat(repeat.guesses()).isEqualTo(208);
    }

    @Test
    void deterministic() {
        assertThat(suite.match("Tr0ub4dour&3")).isEqualTo(suite.match("Tr0ub4dour&3"));
        assertThat(suite.match("")).isEmpty();
    }
}
