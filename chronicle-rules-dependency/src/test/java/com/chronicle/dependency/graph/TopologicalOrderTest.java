package com.chronicle.dependency.graph;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TopologicalOrderTest {

    @Test
    void dependenciesComeFirst() {
        TopologicalOrder order = TopologicalOrder.of(GraphFixtures.graph("effect>cond", "cond>var"));
        assertEquals(List.of("var", "cond", "effect"), order.order());
        assertTrue(order.isComplete());
    }

    @Test
    void everyEdgeTargetPrecedesItsSource() {
        DependencyGraph g = GraphFixtures.graph("a>b", "a>c", "b>d", "c>d", "e>c");
        List<String> order = TopologicalOrder.of(g).order();
        assertEquals(5, order.size());
        for (DependencyEdge edge : g.edges()) {
            assertTrue(order.indexOf(edge.toId()) < order.indexOf(edge.fromId()), edge.toString());
        }
    }

    @Test
    void cycleMembersAreLeftUnordered() {
        TopologicalOrder order = TopologicalOrder.of(GraphFixtures.graph("x>a", "a>b", "b>a", "z"));
        assertFalse(order.isComplete());
        assertEquals(List.of("a", "b"), order.unordered());
        assertEquals(List.of("z", "x"), order.order());
    }
}
