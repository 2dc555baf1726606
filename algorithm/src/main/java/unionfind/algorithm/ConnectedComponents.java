package unionfind.algorithm;

import com.google.common.collect.ImmutableList;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TIntObjectHashMap;
import unionfind.DisjointSetUnion;
import unionfind.util.ElementIndex;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public class ConnectedComponents {

    /**
     * Lists the members of every component of the given structure.
     * @return One ascending array of element ids per component, ordered by the component's smallest element.
     */
    public static List<int[]> group(DisjointSetUnion components) {
        int elementCount = components.elementCount();
        TIntObjectHashMap<TIntArrayList> membersByRepresentative = new TIntObjectHashMap<>(components.countComponents());
        for (int element = 0; element < elementCount; element++) {
            int representative = components.find(element);
            TIntArrayList members = membersByRepresentative.get(representative);
            if (members == null) {
                members = new TIntArrayList(components.size(element));
                membersByRepresentative.put(representative, members);
            }
            members.add(element);
        }

        int[] representatives = membersByRepresentative.keys();
        List<Integer> ordered = new ArrayList<>(representatives.length);
        for (int representative : representatives) {
            ordered.add(representative);
        }
        ordered.sort(Comparator.comparingInt(components::minLabel));

        ImmutableList.Builder<int[]> result = ImmutableList.builderWithExpectedSize(ordered.size());
        for (int representative : ordered) {
            result.add(membersByRepresentative.get(representative).toArray());
        }
        return result.build();
    }

    /**
     * @param elementCount Number of vertices, which are identified by {@code 0..elementCount-1}.
     * @param edges Undirected edges as pairs of vertex ids.
     */
    public static List<int[]> ofEdges(int elementCount, int[][] edges) {
        DisjointSetUnion components = new DisjointSetUnion(elementCount);
        for (int i = 0; i < edges.length; i++) {
            int[] edge = Edges.checkPair(edges[i], i);
            components.union(edge[0], edge[1]);
        }
        return group(components);
    }

    /**
     * Same as {@link #ofEdges(int, int[][])}, for graphs whose nodes carry arbitrary long ids.
     * Ids that only occur in `edges` are treated as additional nodes.
     * @return One array of node ids per component; components and their members are in first-seen order.
     */
    public static List<long[]> ofNodeIds(long[] nodeIds, long[][] edges) {
        ElementIndex index = ElementIndex.of(nodeIds);
        for (int i = 0; i < edges.length; i++) {
            long[] edge = Edges.checkPair(edges[i], i);
            index.add(edge[0]);
            index.add(edge[1]);
        }

        DisjointSetUnion components = index.newDisjointSetUnion();
        for (long[] edge : edges) {
            components.union(index.indexOf(edge[0]), index.indexOf(edge[1]));
        }

        ImmutableList.Builder<long[]> result = ImmutableList.builder();
        for (int[] members : group(components)) {
            long[] ids = new long[members.length];
            for (int i = 0; i < members.length; i++) {
                ids[i] = index.idAt(members[i]);
            }
            result.add(ids);
        }
        return result.build();
    }
}
