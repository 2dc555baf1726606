package unionfind.algorithm;

import java.util.Objects;

/**
 * An undirected edge between two element ids, carrying a weight.
 */
public final class WeightedEdge {
    private final int from;
    private final int to;
    private final double weight;

    public WeightedEdge(int from, int to, double weight) {
        if (Double.isNaN(weight)) {
            throw new IllegalArgumentException(String.format("edge %d-%d has a NaN weight", from, to));
        }
        this.from = from;
        this.to = to;
        this.weight = weight;
    }

    public int from() {
        return from;
    }

    public int to() {
        return to;
    }

    public double weight() {
        return weight;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WeightedEdge)) return false;
        WeightedEdge that = (WeightedEdge) o;
        return from == that.from && to == that.to && Double.compare(weight, that.weight) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, weight);
    }

    @Override
    public String toString() {
        return String.format("%d-%d (%s)", from, to, weight);
    }
}
