package nl.nfi.djzxcvbn.data;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Collections.unmodifiableMap;

public final class AdjacencyGraphs {

    public static final String QWERTY = "qwerty";
    public static final String DVORAK = "dvorak";
    public static final String KEYPAD = "keypad";
    public static final String MAC_KEYPAD = "mac_keypad";

    private static final String QWERTY_LAYOUT = String.join("\n",
            "",
            "`~ 1! 2@ 3# 4$ 5% 6^ 7& 8* 9( 0) -_ =+",
            "    qQ wW eE rR tT yY uU iI oO pP [{ ]} \\|",
            "     aA sS dD fF gG hH jJ kK lL ;: '\"",
            "      zZ xX cC vV bB nN mM ,< .> /?",
            "");

    private static final String DVORAK_LAYOUT = String.join("\n",
            "",
            "`~ 1! 2@ 3# 4$ 5% 6^ 7& 8* 9( 0) [{ ]}",
            "    '\" ,< .> pP yY fF gG cC rR lL /? =+ \\|",
            "     aA oO eE uU iI dD hH tT nN sS -_",
            "      ;: qQ jJ kK xX bB mM wW vV zZ",
            "");

    private static final String KEYPAD_LAYOUT = String.join("\n",
            "",
            "  / * -",
            "7 8 9 +",
            "4 5 6",
            "1 2 3",
            "  0 .",
            "");

    private static final String MAC_KEYPAD_LAYOUT = String.join("\n",
            "",
            "  = / *",
            "7 8 9 -",
            "4 5 6 +",
            "1 2 3",
            "  0 .",
            "");

    // built once, the graphs are immutable
    private static final AdjacencyGraphs DEFAULT = of(List.of(
            AdjacencyGraph.fromLayout(QWERTY, QWERTY_LAYOUT, true),
            AdjacencyGraph.fromLayout(DVORAK, DVORAK_LAYOUT, true),
            AdjacencyGraph.fromLayout(KEYPAD, KEYPAD_LAYOUT, false),
            AdjacencyGraph.fromLayout(MAC_KEYPAD, MAC_KEYPAD_LAYOUT, false)
    ));

    private final Map<String, AdjacencyGraph> graphs;

    private AdjacencyGraphs(final Map<String, AdjacencyGraph> graphs) {
        this.graphs = graphs;
    }

    public static AdjacencyGraphs standard() {
        return DEFAULT;
    }

    public static AdjacencyGraphs of(final Collection<AdjacencyGraph> graphs) {
        final Map<String, AdjacencyGraph> byName = new LinkedHashMap<>();
        for (final AdjacencyGraph graph : graphs) {
            if (byName.put(graph.name(), graph) != null) {
                throw new IllegalArgumentException("Duplicate graph name: %s".formatted(graph.name()));
            }
        }
        return new AdjacencyGraphs(unmodifiableMap(byName));
    }

    public Collection<AdjacencyGraph> all() {
        return graphs.values();
    }

    public Optional<AdjacencyGraph> get(final String name) {
        return Optional.ofNullable(graphs.get(name));
    }
}
