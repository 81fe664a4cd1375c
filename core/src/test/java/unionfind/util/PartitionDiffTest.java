package unionfind.util;

import org.junit.Test;
import unionfind.DisjointSet;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.junit.Assert.*;

public class PartitionDiffTest {

  @Test
  public void unionIsCommutativeInEffect() {
    Random random = new Random(2024);
    DisjointSet forward = withElements(50);
    DisjointSet backward = withElements(50);
    for (int i = 0; i < 40; i++) {
      int x = random.nextInt(50);
      int y = random.nextInt(50);
      forward.union(x, y);
      backward.union(y, x);
    }

    assertEquals(Arrays.asList(), PartitionDiff.compare(forward, backward));
    assertEquals(Partitions.classes(forward), Partitions.classes(backward));
  }

  @Test
  public void differentRepresentativesAreNotADifference() {
    DisjointSet set1 = withElements(3);
    DisjointSet set2 = withElements(3);
    set1.union(0, 1);
    set2.union(1, 0);

    assertNotEquals(set1.find(0), set2.find(0));
    assertTrue(PartitionDiff.compare(set1, set2).isEmpty());
  }

  @Test
  public void reportsMembershipAndElementDifferences() {
    DisjointSet set1 = withElements(4);
    DisjointSet set2 = withElements(3);
    set1.union(0, 1);
    set2.union(0, 2);

    List<String> diff = PartitionDiff.compare(set1, set2);
    assertEquals(Arrays.asList(
        "element count differs: set1=4, set2=3",
        "set count differs: set1=3, set2=2",
        "different set for element=0; set1=[0, 1], set2=[0, 2]",
        "different set for element=1; set1=[0, 1], set2=[1]",
        "different set for element=2; set1=[2], set2=[0, 2]",
        "element 3 only exists in set1"
    ), diff);
  }

  private static DisjointSet withElements(int count) {
    DisjointSet disjointSet = new DisjointSet();
    for (int i = 0; i < count; i++) {
      disjointSet.add(i);
    }
    return disjointSet;
  }
}
