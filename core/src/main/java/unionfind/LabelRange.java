package unionfind;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The smallest and largest element label of a component.
 * Immutable; combining two ranges with {@link #span(LabelRange)} is associative and commutative,
 * so components may be merged in any order.
 */
public final class LabelRange {
  private final int min;
  private final int max;

  private LabelRange(int min, int max) {
    this.min = min;
    this.max = max;
  }

  public static LabelRange of(int min, int max) {
    checkArgument(min <= max, "min label %s is greater than max label %s", min, max);
    return new LabelRange(min, max);
  }

  public static LabelRange singleton(int label) {
    return new LabelRange(label, label);
  }

  public int min() {
    return min;
  }

  public int max() {
    return max;
  }

  /** number of labels between min and max, both inclusive */
  public long width() {
    return (long) max - min + 1;
  }

  public boolean contains(int label) {
    return min <= label && label <= max;
  }

  /**
   * @return the smallest range covering both this and the given range
   */
  public LabelRange span(LabelRange other) {
    int newMin = Math.min(min, other.min);
    int newMax = Math.max(max, other.max);
    if (newMin == min && newMax == max) return this;
    if (newMin == other.min && newMax == other.max) return other;
    return new LabelRange(newMin, newMax);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof LabelRange)) return false;
    LabelRange that = (LabelRange) o;
    return min == that.min && max == that.max;
  }

  @Override
  public int hashCode() {
    return 31 * min + max;
  }

  @Override
  public String toString() {
    return String.format("[%d..%d]", min, max);
  }
}
