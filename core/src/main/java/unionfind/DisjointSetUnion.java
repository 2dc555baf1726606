package unionfind;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import unionfind.util.OperationStats;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

/**
 * Disjoint-set union (union-find) over the elements {@code 0..n-1}, with path compression and union by size.
 * Each component also tracks the smallest and largest element label it contains, see {@link LabelRange}.
 *
 * The number of elements is fixed at construction and components can only ever be merged, never split.
 *
 * Not thread-safe: {@link #find(int)} compresses paths and therefore mutates internal state even for the
 * query methods {@link #size(int)} and {@link #same(int, int)}. Callers sharing an instance between threads
 * must guard every method with the same lock.
 */
public class DisjointSetUnion {
  private static final Logger LOG = LogManager.getLogger(DisjointSetUnion.class);

  private final int elementCount;
  // parent[i] is the next element on the path from i to its representative; parent[r] == r for representatives
  private final int[] parent;
  // element count for representatives, 0 for absorbed representatives, 1 for untouched singletons
  private final int[] componentSize;
  // label range per component, only meaningful at representatives
  private final int[] minLabel;
  private final int[] maxLabel;

  private final Config.FindStrategy findStrategy;
  private final OperationStats stats;
  private int pendingRelinks;

  public DisjointSetUnion(int elementCount) {
    this(elementCount, Config.withDefaults());
  }

  public DisjointSetUnion(int elementCount, Config config) {
    checkArgument(elementCount >= 0, "element count must not be negative, but was %s", elementCount);
    this.elementCount = elementCount;
    this.parent = new int[elementCount];
    this.componentSize = new int[elementCount];
    this.minLabel = new int[elementCount];
    this.maxLabel = new int[elementCount];
    for (int i = 0; i < elementCount; i++) {
      parent[i] = i;
      componentSize[i] = 1;
      minLabel[i] = i;
      maxLabel[i] = i;
    }
    this.findStrategy = config.getFindStrategy();
    this.stats = new OperationStats(config.isStatsEnabled());
    LOG.debug("created disjoint set union with {} elements, findStrategy={}", elementCount, findStrategy);
  }

  /**
   * Finds the representative of the component containing element `a`.
   * Every element visited on the way is re-linked directly to the representative.
   *
   * @throws IndexOutOfBoundsException if `a` is not in {@code [0, elementCount)}
   */
  public int find(int a) {
    checkElement(a);
    return root(a);
  }

  /**
   * Merges the components containing `x` and `y`. The smaller component is attached below the representative
   * of the larger one; on equal sizes the representative of `x` survives.
   *
   * @return true if the components were different and are now merged, false if they were already the same.
   * @throws IndexOutOfBoundsException if either element is not in {@code [0, elementCount)}
   */
  public boolean union(int x, int y) {
    checkElement(x);
    checkElement(y);
    int gravity = root(x);
    int pebble = root(y);
    if (gravity == pebble) {
      return false;
    }

    if (componentSize[pebble] > componentSize[gravity]) {
      int tmp = gravity;
      gravity = pebble;
      pebble = tmp;
    }

    parent[pebble] = gravity;
    componentSize[gravity] += componentSize[pebble];
    componentSize[pebble] = 0;
    minLabel[gravity] = Math.min(minLabel[gravity], minLabel[pebble]);
    maxLabel[gravity] = Math.max(maxLabel[gravity], maxLabel[pebble]);

    stats.recordMerge();
    if (LOG.isTraceEnabled()) {
      LOG.trace("merged component of {} into {}, new size {}", pebble, gravity, componentSize[gravity]);
    }
    return true;
  }

  /**
   * @return the number of elements in the component containing `a`
   */
  public int size(int a) {
    return componentSize[find(a)];
  }

  /**
   * @return true if `u` and `v` belong to the same component
   */
  public boolean same(int u, int v) {
    checkElement(u);
    checkElement(v);
    return root(u) == root(v);
  }

  /**
   * Counts the current components by scanning for representatives, i.e. O(n).
   */
  public int countComponents() {
    int count = 0;
    for (int size : componentSize) {
      if (size > 0) count++;
    }
    return count;
  }

  /**
   * @return smallest and largest element label in the component containing `a`
   */
  public LabelRange labelRange(int a) {
    int r = find(a);
    return minLabel[r] == maxLabel[r]
        ? LabelRange.singleton(minLabel[r])
        : LabelRange.of(minLabel[r], maxLabel[r]);
  }

  public int minLabel(int a) {
    return minLabel[find(a)];
  }

  public int maxLabel(int a) {
    return maxLabel[find(a)];
  }

  public int elementCount() {
    return elementCount;
  }

  public OperationStats stats() {
    return stats;
  }

  private void checkElement(int a) {
    checkElementIndex(a, elementCount, "element");
  }

  private int root(int a) {
    int root;
    if (findStrategy.isRecursive()) {
      pendingRelinks = 0;
      root = compressRecursively(a);
      stats.recordFind(pendingRelinks);
    } else {
      root = compressTwoPass(a);
    }
    return root;
  }

  private int compressTwoPass(int a) {
    int root = a;
    while (parent[root] != root) {
      root = parent[root];
    }

    int relinked = 0;
    int current = a;
    while (parent[current] != root) {
      int next = parent[current];
      parent[current] = root;
      current = next;
      relinked++;
    }
    stats.recordFind(relinked);
    return root;
  }

  private int compressRecursively(int a) {
    int p = parent[a];
    if (p == a) {
      return a;
    }
    int root = compressRecursively(p);
    if (p != root) {
      parent[a] = root;
      pendingRelinks++;
    }
    return root;
  }
}
