package unionfind.algorithm;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class KruskalMstTest {

    @Test
    public void connectedGraph() {
        List<WeightedEdge> edges = Arrays.asList(
                new WeightedEdge(1, 3, 5),
                new WeightedEdge(0, 1, 1),
                new WeightedEdge(0, 2, 3),
                new WeightedEdge(2, 3, 4),
                new WeightedEdge(1, 2, 2));

        SpanningForest forest = KruskalMst.compute(4, edges);

        assertEquals(Arrays.asList(
                new WeightedEdge(0, 1, 1),
                new WeightedEdge(1, 2, 2),
                new WeightedEdge(2, 3, 4)), forest.edges());
        assertEquals(7.0, forest.totalWeight(), 0.0);
        assertEquals(1, forest.componentCount());
        assertTrue(forest.isSpanningTree());
    }

    @Test
    public void disconnectedGraphYieldsForest() {
        List<WeightedEdge> edges = Arrays.asList(
                new WeightedEdge(0, 1, 2.5),
                new WeightedEdge(3, 2, 1.5),
                new WeightedEdge(1, 0, 0.5));

        SpanningForest forest = KruskalMst.compute(5, edges);

        assertEquals(2, forest.edges().size());
        assertEquals(2.0, forest.totalWeight(), 1e-9);
        assertEquals(3, forest.componentCount());
        assertFalse(forest.isSpanningTree());
    }

    @Test
    public void equalWeightsKeepInputOrder() {
        List<WeightedEdge> edges = Arrays.asList(
                new WeightedEdge(0, 1, 1),
                new WeightedEdge(1, 2, 1),
                new WeightedEdge(0, 2, 1));

        SpanningForest forest = KruskalMst.compute(3, edges);

        assertEquals(edges.subList(0, 2), forest.edges());
    }

    @Test
    public void negativeWeightsAreAllowed() {
        List<WeightedEdge> edges = Arrays.asList(
                new WeightedEdge(0, 1, -2),
                new WeightedEdge(1, 2, 3),
                new WeightedEdge(0, 2, -1));

        SpanningForest forest = KruskalMst.compute(3, edges);

        assertEquals(-3.0, forest.totalWeight(), 0.0);
    }

    @Test
    public void noVertices() {
        SpanningForest forest = KruskalMst.compute(0, Collections.emptyList());
        assertTrue(forest.edges().isEmpty());
        assertEquals(0, forest.componentCount());
        assertFalse(forest.isSpanningTree());
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void rejectsEdgeToUnknownVertex() {
        KruskalMst.compute(2, Collections.singletonList(new WeightedEdge(0, 2, 1)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNaNWeight() {
        new WeightedEdge(0, 1, Double.NaN);
    }
}
