package unionfind.util;

import com.google.common.collect.ImmutableSet;
import unionfind.DisjointSet;

import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

public class Partitions {

  /**
   * Groups all elements by their representative.
   * Calls `find` for every element, so all paths end up compressed.
   */
  public static SortedMap<Integer, SortedSet<Integer>> of(DisjointSet disjointSet) {
    final SortedMap<Integer, SortedSet<Integer>> byRoot = new TreeMap<>();
    for (int element : disjointSet.elements()) {
      byRoot.computeIfAbsent(disjointSet.find(element), root -> new TreeSet<>()).add(element);
    }
    return byRoot;
  }

  /** the sets themselves, without their representatives - two structures holding the same partition yield equal results */
  public static Set<Set<Integer>> classes(DisjointSet disjointSet) {
    ImmutableSet.Builder<Set<Integer>> classes = ImmutableSet.builder();
    of(disjointSet).values().forEach(members -> classes.add(ImmutableSet.copyOf(members)));
    return classes.build();
  }
}
