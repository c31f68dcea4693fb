package nl.nfi.djzxcvbn.estimate.match;

import nl.nfi.djzxcvbn.data.AdjacencyGraphs;
import nl.nfi.djzxcvbn.data.Dictionaries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

// all matchers over one frozen dictionary and graph snapshot, safe to share between threads
public final class MatcherSuite implements PasswordMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(MatcherSuite.class);

    private final List<PasswordMatcher> matchers;

    private MatcherSuite(final Dictionaries dictionaries, final AdjacencyGraphs graphs) {
        final DictionaryMatcher dictionaryMatcher = new DictionaryMatcher(dictionaries);
        this.matchers = List.of(
                dictionaryMatcher,
                new ReverseDictionaryMatcher(dictionaryMatcher),
                new LeetMatcher(dictionaryMatcher),
                new SpatialMatcher(graphs),
                new RepeatMatcher(this),
                new SequenceMatcher(),
                new RegexMatcher(),
                new DateMatcher()
        );
    }

    public static MatcherSuite forSnapshot(final Dictionaries dictionaries, final AdjacencyGraphs graphs) {
        return new MatcherSuite(dictionaries, graphs);
    }

    // candidates of every matcher, ordered by span, overlapping and duplicate candidates included
    @Override
    public List<Match> match(final String password) {
        final List<Match> matches = new ArrayList<>();
        for (final PasswordMatcher matcher : matchers) {
            final List<? extends Match> found = matcher.match(password);
            LOG.trace("{} found {} candidates", matcher.getClass().getSimpleName(), found.size());
            matches.addAll(found);
        }
        matches.sort(Match.BY_SPAN);
        return matches;
    }
}
