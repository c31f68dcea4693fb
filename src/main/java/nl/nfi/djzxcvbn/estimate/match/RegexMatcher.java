package nl.nfi.djzxcvbn.estimate.match;

import nl.nfi.djzxcvbn.estimate.scoring.GuessEstimators;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.Collections.unmodifiableMap;

public final class RegexMatcher implements PasswordMatcher {

    public static final String RECENT_YEAR = "recent_year";

    static final Map<String, Pattern> REGEXES = buildRegexes();

    @Override
    public List<RegexMatch> match(final String password) {
        final List<RegexMatch> matches = new ArrayList<>();
        for (final Map.Entry<String, Pattern> regex : REGEXES.entrySet()) {
            final Matcher matcher = regex.getValue().matcher(password);
            while (matcher.find()) {
                final String token = matcher.group();
                final double guesses = GuessEstimators.withSubmatchMinimum(
                        guesses(regex.getKey(), token),
                        token.length(),
                        password.length()
                );
                matches.add(new RegexMatch(matcher.start(), matcher.end() - 1, token, regex.getKey(), guesses));
            }
        }
        matches.sort(Match.BY_SPAN);
        return matches;
    }

    private static double guesses(final String regexName, final String token) {
        if (RECENT_YEAR.equals(regexName)) {
            return GuessEstimators.recentYear(Integer.parseInt(token));
        }
        throw new IllegalStateException("No guess estimate for regex: %s".formatted(regexName));
    }

    private static Map<String, Pattern> buildRegexes() {
        final Map<String, Pattern> regexes = new LinkedHashMap<>();
        regexes.put(RECENT_YEAR, Pattern.compile("19\\d\\d|20\\d\\d"));
        return unmodifiableMap(regexes);
    }
}
