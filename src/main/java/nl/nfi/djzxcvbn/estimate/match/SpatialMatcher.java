package nl.nfi.djzxcvbn.estimate.match;

import nl.nfi.djzxcvbn.data.AdjacencyGraph;
import nl.nfi.djzxcvbn.data.AdjacencyGraphs;

import java.util.ArrayList;
import java.util.List;

// runs of at least three keys where every key touches the previous one, e.g. qwerty or 7896
public final class SpatialMatcher implements PasswordMatcher {

    static final int MIN_LENGTH = 3;

    private static final String SHIFTED_CHARACTERS = "~!@#$%^&*()_+QWERTYUIOP{}|ASDFGHJKL:\"ZXCVBNM<>?";

    private final AdjacencyGraphs graphs;

    public SpatialMatcher(final AdjacencyGraphs graphs) {
        this.graphs = graphs;
    }

    @Override
    public List<SpatialMatch> match(final String password) {
        final List<SpatialMatch> matches = new ArrayList<>();
        for (final AdjacencyGraph graph : graphs.all()) {
            matchGraph(password, graph, matches);
        }
        matches.sort(Match.BY_SPAN);
        return matches;
    }

    private static void matchGraph(final String password, final AdjacencyGraph graph, final List<SpatialMatch> matches) {
        final int length = password.length();
        int i = 0;
        while (i < length - 1) {
            int j = i + 1;
            int lastDirection = -1;
            int turns = 0;
            // only keyboards have a shift layer
            int shiftedCount = graph.slanted() && isShifted(password.charAt(i)) ? 1 : 0;

            while (true) {
                boolean found = false;
                if (j < length) {
                    final char current = password.charAt(j);
                    final List<String> adjacent = graph.neighbours(password.charAt(j - 1));
                    for (int direction = 0; direction < adjacent.size(); direction++) {
                        final int index = adjacent.get(direction).indexOf(current);
                        if (index < 0) {
                            continue;
                        }
                        found = true;
                        // second character of a key is its shifted variant
                        if (index == 1) {
                            shiftedCount++;
                        }
                        if (lastDirection != direction) {
                            turns++;
                            lastDirection = direction;
                        }
                        break;
                    }
                }

                if (found) {
                    j++;
                    continue;
                }
                if (j - i >= MIN_LENGTH) {
                    matches.add(SpatialMatch.of(i, j - 1, password.substring(i, j), graph, turns, shiftedCount, length));
                }
                i = j;
                break;
            }
        }
    }

    private static boolean isShifted(final char c) {
        return SHIFTED_CHARACTERS.indexOf(c) >= 0;
    }
}
