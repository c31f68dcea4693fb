package nl.nfi.djzxcvbn.estimate.match;

import nl.nfi.djzxcvbn.data.AdjacencyGraph;
import nl.nfi.djzxcvbn.estimate.scoring.GuessEstimators;

public record SpatialMatch(int i, int j, String token, String graph, int turns, int shiftedCount, double guesses) implements Match {

    public static SpatialMatch of(final int i, final int j, final String token, final AdjacencyGraph graph, final int turns,
                                  final int shiftedCount, final int passwordLength) {
        final double guesses = GuessEstimators.withSubmatchMinimum(
                GuessEstimators.spatial(graph.startingPositions(), graph.averageDegree(), token.length(), turns, shiftedCount),
                token.length(),
                passwordLength
        );
        return new SpatialMatch(i, j, token, graph.name(), turns, shiftedCount, guesses);
    }

    @Override
    public PatternType pattern() {
        return PatternType.SPATIAL;
    }
}
