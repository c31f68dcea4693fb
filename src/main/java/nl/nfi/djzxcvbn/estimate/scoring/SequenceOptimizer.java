package nl.nfi.djzxcvbn.estimate.scoring;

import nl.nfi.djzxcvbn.estimate.match.BruteforceMatch;
import nl.nfi.djzxcvbn.estimate.match.Match;
import nl.nfi.djzxcvbn.estimate.match.PatternType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

// cheapest non-overlapping sequence of matches covering a whole password, guesses multiply along the sequence
//
// per prefix length k two optima are kept: the cheapest explanation of password[0, k) and the cheapest one not ending
// in bruteforce. a recognized match on [i, k) extends the first at i, a bruteforce segment only extends the second,
// so two bruteforce segments are never adjacent.
//
// distinct matches on one span with the same minimal guesses are a tie, the span then costs the minimum times the
// number of tied matches. equally cheap steps are ordered by tied matches, start, pattern tag and candidate order.
//
// O(n^2 + m) for a password of length n and m candidates
public final class SequenceOptimizer {

    private SequenceOptimizer() {
    }

    public static OptimalSequence optimize(final String password, final Collection<? extends Match> candidates) {
        final int length = password.length();
        if (length == 0) {
            return OptimalSequence.empty();
        }

        final List<List<SpanOption>> optionsByEnd = groupBySpan(length, candidates);

        final Step[] best = new Step[length + 1];
        final Step[] bestNonBruteforce = new Step[length + 1];
        best[0] = Step.START;
        bestNonBruteforce[0] = Step.START;

        for (int k = 1; k <= length; k++) {
            Step overall = null;
            Step nonBruteforce = null;

            for (final SpanOption option : optionsByEnd.get(k)) {
                final Step previous = best[option.start()];
                final Step step = new Step(previous.guesses() * option.adjustedGuesses(), option.start(), option.representative(),
                        option.alternatives(), option.order());
                overall = cheaper(overall, step);
                nonBruteforce = cheaper(nonBruteforce, step);
            }

            // widen the bruteforce segment leftwards, tracking its character classes as it grows
            int characterClasses = 0;
            for (int i = k - 1; i >= 0; i--) {
                characterClasses |= GuessEstimators.characterClass(password.charAt(i));
                final Step previous = bestNonBruteforce[i];
                if (previous == null) {
                    continue;
                }
                final double guesses = GuessEstimators.bruteforce(characterClasses, k - i);
                overall = cheaper(overall, Step.bruteforce(previous.guesses() * guesses, i));
            }

            best[k] = overall;
            bestNonBruteforce[k] = nonBruteforce;
        }

        return new OptimalSequence(password, best[length].guesses(), reconstruct(password, best, bestNonBruteforce));
    }

    // distinct candidates per span, each span reduced to its tie-adjusted cost
    private static List<List<SpanOption>> groupBySpan(final int length, final Collection<? extends Match> candidates) {
        final Map<Long, List<Match>> bySpan = new LinkedHashMap<>();
        final Set<Match> distinct = new LinkedHashSet<>(candidates);
        for (final Match match : distinct) {
            if (match.i() < 0 || match.j() >= length || match.i() > match.j()) {
                throw new IllegalStateException("Match [%d, %d] outside password of length %d".formatted(match.i(), match.j(), length));
            }
            bySpan.computeIfAbsent(((long) match.i() << 32) | match.j(), span -> new ArrayList<>()).add(match);
        }

        final List<List<SpanOption>> optionsByEnd = new ArrayList<>(length + 1);
        for (int k = 0; k <= length; k++) {
            optionsByEnd.add(new ArrayList<>());
        }
        int order = 0;
        for (final List<Match> span : bySpan.values()) {
            double minimum = Double.POSITIVE_INFINITY;
            for (final Match match : span) {
                minimum = Math.min(minimum, match.guesses());
            }
            int alternatives = 0;
            Match representative = null;
            for (final Match match : span) {
                if (match.guesses() != minimum) {
                    continue;
                }
                alternatives++;
                if (representative == null || match.pattern().tag().compareTo(representative.pattern().tag()) < 0) {
                    representative = match;
                }
            }
            optionsByEnd.get(representative.j() + 1).add(new SpanOption(representative, minimum * alternatives, alternatives, order++));
        }
        return optionsByEnd;
    }

    private static Step cheaper(final Step current, final Step candidate) {
        if (current == null || candidate.guesses() < current.guesses()) {
            return candidate;
        }
        if (candidate.guesses() > current.guesses()) {
            return current;
        }
        if (candidate.alternatives() != current.alternatives()) {
            return candidate.alternatives() < current.alternatives() ? candidate : current;
        }
        if (candidate.start() != current.start()) {
            return candidate.start() < current.start() ? candidate : current;
        }
        final int byTag = candidate.tag().compareTo(current.tag());
        if (byTag != 0) {
            return byTag < 0 ? candidate : current;
        }
        return candidate.order() < current.order() ? candidate : current;
    }

    private static List<Match> reconstruct(final String password, final Step[] best, final Step[] bestNonBruteforce) {
        final List<Match> sequence = new ArrayList<>();
        int k = password.length();
        boolean afterBruteforce = false;
        while (k > 0) {
            final Step step = afterBruteforce ? bestNonBruteforce[k] : best[k];
            final int start = step.start();
            if (step.bruteforce()) {
                sequence.add(BruteforceMatch.of(start, k - 1, password.substring(start, k)));
            } else {
                sequence.add(step.match());
            }
            afterBruteforce = step.bruteforce();
            k = start;
        }
        Collections.reverse(sequence);
        return sequence;
    }

    private record SpanOption(Match representative, double adjustedGuesses, int alternatives, int order) {

        int start() {
            return representative.i();
        }
    }

    // one way to end a prefix, bruteforce steps carry no match until reconstruction
    private record Step(double guesses, int start, Match match, int alternatives, int order) {

        static final Step START = new Step(1, 0, null, 0, -1);

        static Step bruteforce(final double guesses, final int start) {
            return new Step(guesses, start, null, 1, Integer.MAX_VALUE);
        }

        boolean bruteforce() {
            return match == null;
        }

        String tag() {
            return bruteforce() ? PatternType.BRUTEFORCE.tag() : match.pattern().tag();
        }
    }
}
