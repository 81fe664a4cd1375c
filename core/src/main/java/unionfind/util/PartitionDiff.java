package unionfind.util;

import unionfind.DisjointSet;

import java.util.*;

public class PartitionDiff {

  /** compare the partitions held by two disjoint sets
   * only membership matters: if both group the same elements together, no differences are reported,
   * even if they picked different representatives
   */
  public static List<String> compare(DisjointSet set1, DisjointSet set2) {
    final List<String> diff = new ArrayList<>();
    if (set1.size() != set2.size()) {
      diff.add(String.format("element count differs: set1=%d, set2=%d", set1.size(), set2.size()));
    }
    if (set1.setCount() != set2.setCount()) {
      diff.add(String.format("set count differs: set1=%d, set2=%d", set1.setCount(), set2.setCount()));
    }

    final SortedMap<Integer, SortedSet<Integer>> partition1 = Partitions.of(set1);
    final SortedMap<Integer, SortedSet<Integer>> partition2 = Partitions.of(set2);

    SortedSet<Integer> elements = new TreeSet<>();
    Arrays.stream(set1.elements()).forEach(elements::add);
    Arrays.stream(set2.elements()).forEach(elements::add);

    elements.forEach(element -> {
      if (!set1.contains(element)) diff.add(String.format("element %d only exists in set2", element));
      else if (!set2.contains(element)) diff.add(String.format("element %d only exists in set1", element));
      else {
        SortedSet<Integer> members1 = partition1.get(set1.find(element));
        SortedSet<Integer> members2 = partition2.get(set2.find(element));
        if (!members1.equals(members2)) {
          diff.add(String.format("different set for element=%d; set1=%s, set2=%s", element, members1, members2));
        }
      }
    });

    return diff;
  }
}
