package unionfind.algorithm;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import unionfind.DisjointSetUnion;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

import static com.google.common.base.Preconditions.checkElementIndex;

public class KruskalMst {
    private static final Logger LOG = LogManager.getLogger(KruskalMst.class);

    /**
     * Computes a minimum spanning forest with Kruskal's algorithm.
     * Edges are considered in ascending weight order; edges of equal weight keep their input order.
     * @param elementCount Number of vertices, which are identified by {@code 0..elementCount-1}.
     * @param edges Undirected weighted edges.
     * @return The chosen edges, total weight and number of trees in the forest.
     * @throws IndexOutOfBoundsException if an edge refers to a vertex outside of {@code [0, elementCount)}.
     */
    public static SpanningForest compute(int elementCount, Collection<WeightedEdge> edges) {
        for (WeightedEdge edge : edges) {
            checkElementIndex(edge.from(), elementCount, "edge source");
            checkElementIndex(edge.to(), elementCount, "edge target");
        }

        List<WeightedEdge> sorted = new ArrayList<>(edges);
        sorted.sort(Comparator.comparingDouble(WeightedEdge::weight));

        DisjointSetUnion components = new DisjointSetUnion(elementCount);
        List<WeightedEdge> chosen = new ArrayList<>(Math.max(elementCount - 1, 0));
        double totalWeight = 0;
        int remaining = elementCount;
        for (WeightedEdge edge : sorted) {
            if (remaining <= 1) {
                break;
            }
            if (components.union(edge.from(), edge.to())) {
                chosen.add(edge);
                totalWeight += edge.weight();
                remaining--;
            }
        }

        SpanningForest forest = new SpanningForest(chosen, totalWeight, components.countComponents());
        LOG.debug("computed minimum spanning forest over {} vertices and {} edges: {}", elementCount, edges.size(), forest);
        return forest;
    }
}
