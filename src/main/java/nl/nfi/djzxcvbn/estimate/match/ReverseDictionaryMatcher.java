package nl.nfi.djzxcvbn.estimate.match;

import java.util.ArrayList;
import java.util.List;

// dictionary words written backwards, e.g. drowssap
public final class ReverseDictionaryMatcher implements PasswordMatcher {

    private final DictionaryMatcher dictionaryMatcher;

    public ReverseDictionaryMatcher(final DictionaryMatcher dictionaryMatcher) {
        this.dictionaryMatcher = dictionaryMatcher;
    }

    @Override
    public List<DictionaryMatch> match(final String password) {
        final String reversed = new StringBuilder(password).reverse().toString();
        final int last = password.length() - 1;

        final List<DictionaryMatch> matches = new ArrayList<>();
        for (final DictionaryMatch match : dictionaryMatcher.match(reversed)) {
            // map the span back onto the password as written
            final int i = last - match.j();
            final int j = last - match.i();
            matches.add(DictionaryMatch.of(
                    i, j, password.substring(i, j + 1), match.matchedWord(), match.rank(), match.dictionaryName(),
                    true, match.leetSubstitutions(), password.length()
            ));
        }

        matches.sort(Match.BY_SPAN);
        return matches;
    }
}
