package unionfind.algorithm;

final class Edges {

    private Edges() {
    }

    static int[] checkPair(int[] edge, int position) {
        if (edge == null || edge.length != 2) {
            throw new IllegalArgumentException(String.format("edge #%d must consist of exactly two endpoints", position));
        }
        return edge;
    }

    static long[] checkPair(long[] edge, int position) {
        if (edge == null || edge.length != 2) {
            throw new IllegalArgumentException(String.format("edge #%d must consist of exactly two endpoints", position));
        }
        return edge;
    }
}
