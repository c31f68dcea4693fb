package nl.nfi.djzxcvbn.debug;

import static nl.nfi.djzxcvbn.common.Formatting.toHumanReadableGuesses;
import static nl.nfi.djzxcvbn.common.Timers.time;

import java.io.IOException;
import java.util.List;

import nl.nfi.djzxcvbn.common.Timers.TimedResult;
import nl.nfi.djzxcvbn.data.AdjacencyGraphs;
import nl.nfi.djzxcvbn.data.Dictionaries;
import nl.nfi.djzxcvbn.estimate.match.Match;
import nl.nfi.djzxcvbn.estimate.match.MatcherSuite;
import nl.nfi.djzxcvbn.estimate.scoring.OptimalSequence;
import nl.nfi.djzxcvbn.estimate.scoring.SequenceOptimizer;

public final class PrintMatches {

    static {
        System.setProperty("LOG_DIRECTORY_PATH", "debug_log");
    }

    public static void main(final String... args) throws IOException {
        // insert the password to inspect, or pass it as the first argument
        final String password = args.length > 0 ? args[0] : "Tr0ub4dour&3";

        final TimedResult<Dictionaries> loaded = time(Dictionaries::loadDefault);
        System.out.println("Time taken to load dictionaries: " + loaded.duration());

        final MatcherSuite matchers = MatcherSuite.forSnapshot(loaded.value(), AdjacencyGraphs.standard());
        final List<Match> candidates = matchers.match(password);

        System.out.println("Candidates (" + candidates.size() + "):");
        for (final Match match : candidates) {
            System.out.println(describe(match));
        }

        final OptimalSequence optimal = SequenceOptimizer.optimize(password, candidates);
        System.out.println("Optimal sequence, " + toHumanReadableGuesses(optimal.guesses()) + " guesses, score " + optimal.score() + ":");
        for (final Match match : optimal.sequence()) {
            System.out.println(describe(match));
        }
    }

    private static String describe(final Match match) {
        return "  [%d, %d] %-18s %-20s %s".formatted(match.i(), match.j(), match.pattern().tag(), match.token(), toHumanReadableGuesses(match.guesses()));
    }
}
