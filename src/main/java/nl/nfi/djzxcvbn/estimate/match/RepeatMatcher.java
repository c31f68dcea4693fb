package nl.nfi.djzxcvbn.estimate.match;

import nl.nfi.djzxcvbn.estimate.scoring.OptimalSequence;
import nl.nfi.djzxcvbn.estimate.scoring.SequenceOptimizer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.regex.Pattern.DOTALL;

// a base token written two or more times in a row, e.g. aaaa or abcabcabc
public final class RepeatMatcher implements PasswordMatcher {

    private static final Pattern GREEDY = Pattern.compile("(.+)\\1+", DOTALL);
    private static final Pattern LAZY = Pattern.compile("(.+?)\\1+", DOTALL);
    private static final Pattern LAZY_ANCHORED = Pattern.compile("^(.+?)\\1+$", DOTALL);

    // analyses the base token, the base is always shorter than the password so the recursion ends
    private final PasswordMatcher baseMatcher;

    public RepeatMatcher(final PasswordMatcher baseMatcher) {
        this.baseMatcher = baseMatcher;
    }

    @Override
    public List<RepeatMatch> match(final String password) {
        final List<RepeatMatch> matches = new ArrayList<>();
        final Matcher greedy = GREEDY.matcher(password);
        final Matcher lazy = LAZY.matcher(password);

        int lastIndex = 0;
        while (lastIndex < password.length()) {
            if (!greedy.find(lastIndex) || !lazy.find(lastIndex)) {
                break;
            }

            final int start;
            final int end;
            final String baseToken;
            if (greedy.group().length() > lazy.group().length()) {
                // greedy found the longer repeat, e.g. aabaab instead of aa, its base is the shortest unit repeating it
                start = greedy.start();
                end = greedy.end();
                final Matcher anchored = LAZY_ANCHORED.matcher(greedy.group());
                if (!anchored.matches()) {
                    throw new IllegalStateException("Greedy repeat is not a repeat of its shortest base");
                }
                baseToken = anchored.group(1);
            } else {
                start = lazy.start();
                end = lazy.end();
                baseToken = lazy.group(1);
            }

            final OptimalSequence baseAnalysis = SequenceOptimizer.optimize(baseToken, baseMatcher.match(baseToken));
            matches.add(RepeatMatch.of(
                    start, end - 1, password.substring(start, end), baseToken, baseAnalysis.guesses(), baseAnalysis.sequence(), password.length()
            ));
            lastIndex = end;
        }
        return matches;
    }
}
