package com.chronicle.dependency.graph;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GraphTraversalTest {

    private final DependencyGraph chain = GraphFixtures.graph("a>b", "b>c", "c>d");

    @Test
    void downstreamFollowsDependencies() {
        assertEquals(Set.of("b", "c", "d"), GraphTraversal.downstream(chain, "a", null));
        assertEquals(Set.of("b", "c"), GraphTraversal.downstream(chain, "a", 2));
        assertEquals(Set.of("b", "c", "d"), GraphTraversal.downstream(chain, "a", -1));
    }

    @Test
    void upstreamFollowsDependents() {
        assertEquals(Set.of("c", "b", "a"), GraphTraversal.upstream(chain, "d", null));
        assertEquals(Set.of("c"), GraphTraversal.upstream(chain, "d", 1));
    }

    @Test
    void zeroDepthAndUnknownNodeYieldNothing() {
        assertTrue(GraphTraversal.downstream(chain, "a", 0).isEmpty());
        assertTrue(GraphTraversal.upstream(chain, "missing", null).isEmpty());
    }

    @Test
    void traversalTerminatesOnCycles() {
        DependencyGraph ring = GraphFixtures.ring(4);
        assertEquals(Set.of("n1", "n2", "n3"), GraphTraversal.downstream(ring, "n0", null));
        assertEquals(Set.of("n3", "n2", "n1"), GraphTraversal.upstream(ring, "n0", null));
    }

    @Test
    void pathAndCycleQueries() {
        assertTrue(GraphTraversal.hasPath(chain, "a", "d"));
        assertFalse(GraphTraversal.hasPath(chain, "d", "a"));
        assertTrue(GraphTraversal.wouldCreateCycle(chain, "d", "a"));
        assertTrue(GraphTraversal.wouldCreateCycle(chain, "b", "b"));
        assertFalse(GraphTraversal.wouldCreateCycle(chain, "a", "d"));
    }

    @Test
    void selectionImpactUnionsEverySelectedNode() {
        DependencyGraph g = GraphFixtures.graph("a>b", "x>y");
        SelectionImpact impact = SelectionImpact.of(g, List.of("a", "y", "ghost"), null);
        assertEquals(Set.of("a", "y"), impact.selected());
        assertEquals(Set.of("b"), impact.downstream());
        assertEquals(Set.of("x"), impact.upstream());
        assertEquals(Set.of("a", "y", "b", "x"), impact.highlighted());
    }
}
