package unionfind.algorithm;

import unionfind.DisjointSetUnion;

import java.util.OptionalInt;

public class CycleDetector {

    /**
     * Adds the undirected edges one by one and reports the first edge whose endpoints are already connected.
     * A self-loop closes a cycle on its own.
     * @param elementCount Number of vertices, which are identified by {@code 0..elementCount-1}.
     * @param edges Pairs of vertex ids.
     * @return The index into `edges` of the first edge closing a cycle, or empty if the graph is a forest.
     * @throws IndexOutOfBoundsException if an edge refers to a vertex outside of {@code [0, elementCount)}.
     */
    public static OptionalInt findCycleClosingEdge(int elementCount, int[][] edges) {
        DisjointSetUnion components = new DisjointSetUnion(elementCount);
        for (int i = 0; i < edges.length; i++) {
            int[] edge = Edges.checkPair(edges[i], i);
            if (!components.union(edge[0], edge[1])) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    public static boolean hasCycle(int elementCount, int[][] edges) {
        return findCycleClosingEdge(elementCount, edges).isPresent();
    }

    /**
     * @throws CycleDetectedException if the edges contain a cycle.
     */
    public static void requireAcyclic(int elementCount, int[][] edges) {
        OptionalInt closing = findCycleClosingEdge(elementCount, edges);
        if (closing.isPresent()) {
            int index = closing.getAsInt();
            throw new CycleDetectedException(index, String.format(
                    "Graph contains a cycle, closed by edge #%d (%d-%d).", index, edges[index][0], edges[index][1]));
        }
    }

    public static class CycleDetectedException extends RuntimeException {
        private final int edgeIndex;

        public CycleDetectedException(int edgeIndex, String message) {
            super(message);
            this.edgeIndex = edgeIndex;
        }

        public int getEdgeIndex() {
            return edgeIndex;
        }
    }
}
