package unionfind.stats;

/**
 * Counters for the operations of a {@link unionfind.DisjointSet}.
 * Only updated when stats are enabled in the {@link unionfind.Config}; reading them otherwise is an error.
 */
public class OperationStats {
  public final boolean statsEnabled;
  private long findCount;
  private long unionCount;
  private long mergeCount;
  private long compressedPointerCount;
  private long findTimeSpentNanos;

  public OperationStats(boolean statsEnabled) {
    this.statsEnabled = statsEnabled;
  }

  public final long getStartTimeNanos() {
    // System.nanoTime is relatively expensive - only go there if we're actually recording stats
    return statsEnabled ? System.nanoTime() : 0;
  }

  public void recordFind(long startTimeNanos, int pointersRewritten) {
    if (!statsEnabled) return;
    findCount++;
    compressedPointerCount += pointersRewritten;
    findTimeSpentNanos += System.nanoTime() - startTimeNanos;
  }

  /** @param merged whether the union joined two distinct sets */
  public void recordUnion(boolean merged) {
    if (!statsEnabled) return;
    unionCount++;
    if (merged) mergeCount++;
  }

  public void reset() {
    findCount = 0;
    unionCount = 0;
    mergeCount = 0;
    compressedPointerCount = 0;
    findTimeSpentNanos = 0;
  }

  public final long getFindCount() {
    ensureEnabled();
    return findCount;
  }

  public final long getUnionCount() {
    ensureEnabled();
    return unionCount;
  }

  public final long getMergeCount() {
    ensureEnabled();
    return mergeCount;
  }

  /** number of parent pointers redirected to a root by path compression */
  public final long getCompressedPointerCount() {
    ensureEnabled();
    return compressedPointerCount;
  }

  public final double getAverageFindTimeNanos() {
    ensureEnabled();
    return findCount == 0 ? 0d : (double) findTimeSpentNanos / findCount;
  }

  private void ensureEnabled() {
    if (!statsEnabled) throw new IllegalStateException("operation statistics not enabled");
  }

  @Override
  public String toString() {
    if (!statsEnabled) return "OperationStats{disabled}";
    return String.format("OperationStats{finds=%d, unions=%d, merges=%d, compressedPointers=%d}",
        findCount, unionCount, mergeCount, compressedPointerCount);
  }
}
