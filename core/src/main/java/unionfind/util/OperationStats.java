package unionfind.util;

import static com.google.common.base.Preconditions.checkState;

/**
 * Counters for the work a DisjointSetUnion performs.
 * Not thread-safe, just like the structure it is attached to.
 */
public class OperationStats {
  public final boolean statsEnabled;
  private long findCount;
  private long relinkedCount;
  private long mergeCount;

  public OperationStats(boolean statsEnabled) {
    this.statsEnabled = statsEnabled;
  }

  public void recordFind(int relinked) {
    if (!statsEnabled) return;
    findCount++;
    relinkedCount += relinked;
  }

  public void recordMerge() {
    if (statsEnabled) mergeCount++;
  }

  public long getFindCount() {
    checkEnabled();
    return findCount;
  }

  /** number of nodes whose parent link was rewritten by path compression */
  public long getRelinkedCount() {
    checkEnabled();
    return relinkedCount;
  }

  /** number of union calls that actually joined two components */
  public long getMergeCount() {
    checkEnabled();
    return mergeCount;
  }

  private void checkEnabled() {
    checkState(statsEnabled, "operation statistics not enabled");
  }

  @Override
  public String toString() {
    if (!statsEnabled) return "OperationStats{disabled}";
    return String.format("OperationStats{finds=%d, relinked=%d, merges=%d}", findCount, relinkedCount, mergeCount);
  }
}
