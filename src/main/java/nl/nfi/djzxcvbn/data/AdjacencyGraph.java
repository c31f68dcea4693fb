package nl.nfi.djzxcvbn.data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;

// physical key adjacency of one input device
//  a key is a token of one or more characters, e.g. "qQ" on a keyboard (unshifted, shifted) or "7" on a keypad
//  every character maps to the keys around its own key, the list index being the direction
//  (for slanted keyboards: left, top left, top right, right, bottom right, bottom left)
//  missing neighbours are empty strings, so each list has the same length
public final class AdjacencyGraph {

    private final String name;
    private final boolean slanted;
    private final Map<Character, List<String>> neighbours;
    private final double averageDegree;

    private AdjacencyGraph(final String name, final boolean slanted, final Map<Character, List<String>> neighbours) {
        this.name = name;
        this.slanted = slanted;
        this.neighbours = neighbours;
        this.averageDegree = calculateAverageDegree(neighbours);
    }

    // layout as drawn on the device: one row per line, keys separated by whitespace,
    // on slanted keyboards each row is shifted one extra character to the right
    public static AdjacencyGraph fromLayout(final String name, final String layout, final boolean slanted) {
        final String[] tokens = layout.strip().split("\\s+");
        final int tokenSize = tokens[0].length();
        for (final String token : tokens) {
            if (token.length() != tokenSize) {
                throw new IllegalArgumentException("Key size mismatch in layout %s: %s".formatted(name, token));
            }
        }
        // a key plus its trailing separator
        final int xUnit = tokenSize + 1;

        final Map<Position, String> positions = new LinkedHashMap<>();
        final String[] lines = layout.split("\n", -1);
        for (int y = 0; y < lines.length; y++) {
            final String line = lines[y];
            final int slant = slanted ? y - 1 : 0;
            for (final String token : line.strip().split("\\s+")) {
                if (token.isEmpty()) {
                    continue;
                }
                final int offset = line.indexOf(token) - slant;
                if (offset % xUnit != 0) {
                    throw new IllegalArgumentException("Unexpected x offset for %s in layout %s".formatted(token, name));
                }
                positions.put(new Position(offset / xUnit, y), token);
            }
        }

        final Map<Character, List<String>> neighbours = new HashMap<>();
        for (final Map.Entry<Position, String> entry : positions.entrySet()) {
            final List<String> adjacent = new ArrayList<>();
            for (final Position position : entry.getKey().adjacent(slanted)) {
                adjacent.add(positions.getOrDefault(position, ""));
            }
            for (final char character : entry.getValue().toCharArray()) {
                neighbours.put(character, unmodifiableList(adjacent));
            }
        }
        return new AdjacencyGraph(name, slanted, unmodifiableMap(neighbours));
    }

    public String name() {
        return name;
    }

    // keyboards with a shift layer, as opposed to keypads
    public boolean slanted() {
        return slanted;
    }

    public List<String> neighbours(final char character) {
        return neighbours.getOrDefault(character, List.of());
    }

    public int startingPositions() {
        return neighbours.size();
    }

    public double averageDegree() {
        return averageDegree;
    }

    private static double calculateAverageDegree(final Map<Character, List<String>> neighbours) {
        if (neighbours.isEmpty()) {
            return 0.0;
        }
        long degreeSum = 0;
        for (final List<String> adjacent : neighbours.values()) {
            degreeSum += adjacent.stream().filter(key -> !key.isEmpty()).count();
        }
        return (double) degreeSum / neighbours.size();
    }

    private record Position(int x, int y) {

        List<Position> adjacent(final boolean slanted) {
            if (slanted) {
                return List.of(
                        new Position(x - 1, y),
                        new Position(x, y - 1),
                        new Position(x + 1, y - 1),
                        new Position(x + 1, y),
                        new Position(x, y + 1),
                        new Position(x - 1, y + 1)
                );
            }
            return List.of(
                    new Position(x - 1, y),
                    new Position(x - 1, y - 1),
                    new Position(x, y - 1),
                    new Position(x + 1, y - 1),
                    new Position(x + 1, y),
                    new Position(x + 1, y + 1),
                    new Position(x, y + 1),
                    new Position(x - 1, y + 1)
            );
        }
    }
}
