package nl.nfi.djzxcvbn.data;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AdjacencyGraphsTest {

    private static AdjacencyGraph graph(final String name) {
        return AdjacencyGraphs.standard().get(name).orElseThrow();
    }

    @Test
    void standardGraphs() {
        assertThat(AdjacencyGraphs.standard().all())
                .extracting(AdjacencyGraph::name)
                .containsExactly(AdjacencyGraphs.QWERTY, AdjacencyGraphs.DVORAK, AdjacencyGraphs.KEYPAD, AdjacencyGraphs.MAC_KEYPAD);
    }

    @Test
    void qwerty() {
        final AdjacencyGraph qwerty = graph(AdjacencyGraphs.QWERTY);

        assertThat(qwerty.slanted()).isTrue();
        assertThat(qwerty.startingPositions()).isEqualTo(94);
        assertThat(qwerty.averageDegree()).isCloseTo(4.595744680851064, within(1e-12));
        assertThat(qwerty.neighbours('g')).containsExactly("fF", "tT", "yY", "hH", "bB", "vV");
        assertThat(qwerty.neighbours('G')).isEqualTo(qwerty.neighbours('g'));
        assertThat(qwerty.neighbours('q')).containsExactly("", "1!", "2@", "wW", "aA", "");
        assertThat(qwerty.neighbours('~')).containsExactly("", "", "", "1!", "", "");
        assertThat(qwerty.neighbours('é')).isEmpty();
    }

    @Test
    void keypads() {
        final AdjacencyGraph keypad = graph(AdjacencyGraphs.KEYPAD);
        final AdjacencyGraph macKeypad = graph(AdjacencyGraphs.MAC_KEYPAD);

        assertThat(keypad.slanted()).isFalse();
        assertThat(keypad.startingPositions()).isEqualTo(15);
        assertThat(keypad.averageDegree()).isCloseTo(76.0 / 15, within(1e-12));
        assertThat(macKeypad.startingPositions()).isEqualTo(16);
        assertThat(macKeypad.averageDegree()).isCloseTo(5.25, within(1e-12));
        assertThat(keypad.neighbours('5')).containsExactly("4", "7", "8", "9", "6", "3", "2", "1");
    }

    @Test
    void invalidLayouts() {
        assertThatThrownBy(() -> AdjacencyGraph.fromLayout("bad", "ab c", false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AdjacencyGraphs.of(java.util.List.of(graph(AdjacencyGraphs.QWERTY), graph(AdjacencyGraphs.QWERTY))))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
