package unionfind.stats;

import org.junit.Test;
import unionfind.Config;
import unionfind.DisjointSet;

import static org.junit.Assert.*;

public class OperationStatsTest {

  @Test
  public void countsOperations() {
    DisjointSet disjointSet = new DisjointSet(Config.withDefaults().withStatsEnabled());
    for (int i = 1; i <= 10; i++) {
      disjointSet.add(i);
    }
    disjointSet.union(1, 2);
    disjointSet.union(3, 5);
    disjointSet.union(3, 6);
    disjointSet.union(2, 1);
    disjointSet.find(5);

    OperationStats stats = disjointSet.getStats();
    assertEquals(4, stats.getUnionCount());
    assertEquals(3, stats.getMergeCount());
    // every union looks up both of its elements
    assertEquals(9, stats.getFindCount());
    assertEquals(0, stats.getCompressedPointerCount());
    assertTrue(stats.getAverageFindTimeNanos() >= 0);
  }

  @Test
  public void clearResetsCounters() {
    DisjointSet disjointSet = new DisjointSet(Config.withDefaults().withStatsEnabled());
    disjointSet.add(1);
    disjointSet.find(1);
    disjointSet.clear();

    assertEquals(0, disjointSet.getStats().getFindCount());
    assertEquals(0d, disjointSet.getStats().getAverageFindTimeNanos(), 0d);
  }

  @Test
  public void disabledStatsCannotBeRead() {
    DisjointSet disjointSet = new DisjointSet();
    disjointSet.add(1);
    disjointSet.find(1);

    assertFalse(disjointSet.getStats().statsEnabled);
    assertEquals("OperationStats{disabled}", disjointSet.getStats().toString());
    try {
      disjointSet.getStats().getFindCount();
      fail("reading disabled statistics did not fail");
    } catch (IllegalStateException e) {
      assertEquals("operation statistics not enabled", e.getMessage());
    }
  }
}
