package unionfind.algorithm;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Result of {@link KruskalMst#compute}: one minimum spanning tree per connected component.
 */
public final class SpanningForest {
    private final ImmutableList<WeightedEdge> edges;
    private final double totalWeight;
    private final int componentCount;

    SpanningForest(List<WeightedEdge> edges, double totalWeight, int componentCount) {
        this.edges = ImmutableList.copyOf(edges);
        this.totalWeight = totalWeight;
        this.componentCount = componentCount;
    }

    /** chosen edges, in ascending weight order */
    public List<WeightedEdge> edges() {
        return edges;
    }

    public double totalWeight() {
        return totalWeight;
    }

    public int componentCount() {
        return componentCount;
    }

    /** true if the forest is a single tree, i.e. the input graph was connected */
    public boolean isSpanningTree() {
        return componentCount == 1;
    }

    @Override
    public String toString() {
        return String.format("SpanningForest{edges=%d, totalWeight=%s, components=%d}", edges.size(), totalWeight, componentCount);
    }
}
