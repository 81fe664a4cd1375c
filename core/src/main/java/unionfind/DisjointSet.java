package unionfind;

import com.google.common.collect.ImmutableSortedMap;
import gnu.trove.map.hash.TIntIntHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import unionfind.stats.OperationStats;

import java.util.Arrays;
import java.util.SortedMap;

/**
 * A memory-efficient Disjoint Set (Union-Find) forest over int elements, backed by Trove primitive maps.
 * Uses Union by Rank and Path Compression.
 *
 * Elements must be {@link #add added} before they can be passed to {@link #find} or {@link #union}.
 * Not thread-safe: callers that share an instance across threads must serialize access themselves.
 */
public class DisjointSet {
    private static final Logger logger = LoggerFactory.getLogger(DisjointSet.class);

    // Maps Element -> ParentElement; roots point to themselves
    private final TIntIntHashMap parent;
    // Maps Element -> Rank; only meaningful for roots, frozen once an element is attached
    private final TIntIntHashMap rank;
    private final Config.DuplicatePolicy duplicatePolicy;
    private final OperationStats stats;
    private int setCount;

    public DisjointSet() {
        this(Config.withDefaults());
    }

    public DisjointSet(Config config) {
        this.parent = new TIntIntHashMap(config.getInitialCapacity());
        this.rank = new TIntIntHashMap(config.getInitialCapacity());
        this.duplicatePolicy = config.getDuplicatePolicy();
        this.stats = new OperationStats(config.isStatsEnabled());
    }

    /**
     * Establishes a new singleton set for the given element, with rank 0 and itself as parent.
     * If the element is already present, the configured {@link Config.DuplicatePolicy} applies.
     */
    public void add(int element) {
        if (parent.containsKey(element)) {
            switch (duplicatePolicy) {
                case IGNORE -> {
                    logger.debug("element {} already present, ignoring add", element);
                    return;
                }
                case REJECT -> throw new DuplicateElementException(element);
                case OVERWRITE -> {
                    boolean wasRoot = parent.get(element) == element;
                    if (!wasRoot || rank.get(element) > 0) {
                        logger.warn("element {} was linked to other elements, overwriting detaches it from its set", element);
                    } else {
                        logger.debug("element {} already present, resetting it", element);
                    }
                    if (!wasRoot) setCount++;
                    parent.put(element, element);
                    rank.put(element, 0);
                    return;
                }
            }
        }
        parent.put(element, element);
        rank.put(element, 0);
        setCount++;
    }

    /**
     * Finds the representative (root) of the set containing element.
     * Performs path compression: every element on the way is re-parented directly to the root.
     * Iterative, so long chains don't blow the stack.
     */
    public int find(int element) {
        ensurePresent(element);
        long start = stats.getStartTimeNanos();

        int root = element;
        int p;
        while ((p = parent.get(root)) != root) {
            root = p;
        }

        int rewritten = 0;
        int current = element;
        while (current != root) {
            int next = parent.get(current);
            if (next != root) {
                parent.put(current, root);
                rewritten++;
            }
            current = next;
        }

        stats.recordFind(start, rewritten);
        return root;
    }

    /**
     * Unifies the sets containing x and y. The root of lower rank is attached below the root of higher rank;
     * on equal ranks y's root goes below x's root, whose rank grows by one.
     * @return true if the sets were different and are now merged, false if they were already the same.
     */
    public boolean union(int x, int y) {
        ensurePresent(x);
        ensurePresent(y);
        int rootX = find(x);
        int rootY = find(y);

        if (rootX == rootY) {
            stats.recordUnion(false);
            return false;
        }

        int rankX = rank.get(rootX);
        int rankY = rank.get(rootY);
        if (rankX > rankY) {
            parent.put(rootY, rootX);
        } else if (rankX < rankY) {
            parent.put(rootX, rootY);
        } else {
            parent.put(rootY, rootX);
            rank.put(rootX, rankX + 1);
        }
        setCount--;
        if (logger.isTraceEnabled()) {
            logger.trace("merged sets of {} (root {}, rank {}) and {} (root {}, rank {})", x, rootX, rankX, y, rootY, rankY);
        }
        stats.recordUnion(true);
        return true;
    }

    public boolean connected(int x, int y) {
        return find(x) == find(y);
    }

    public boolean contains(int element) {
        return parent.containsKey(element);
    }

    /** number of elements */
    public int size() {
        return parent.size();
    }

    /** number of disjoint sets */
    public int setCount() {
        return setCount;
    }

    /** rank of the element as stored, without touching any parent pointers */
    public int rank(int element) {
        ensurePresent(element);
        return rank.get(element);
    }

    /** parent of the element as stored, without path compression */
    public int parent(int element) {
        ensurePresent(element);
        return parent.get(element);
    }

    public Record record(int element) {
        ensurePresent(element);
        return new Record(rank.get(element), parent.get(element));
    }

    /** Diagnostic view of all elements and their (rank, parent), ordered by element. */
    public SortedMap<Integer, Record> records() {
        ImmutableSortedMap.Builder<Integer, Record> builder = ImmutableSortedMap.naturalOrder();
        parent.forEachEntry((element, parentElement) -> {
            builder.put(element, new Record(rank.get(element), parentElement));
            return true;
        });
        return builder.build();
    }

    /** elements in ascending order */
    public int[] elements() {
        int[] elements = parent.keys();
        Arrays.sort(elements);
        return elements;
    }

    public OperationStats getStats() {
        return stats;
    }

    public void clear() {
        parent.clear();
        rank.clear();
        setCount = 0;
        stats.reset();
    }

    /**
     * Verifies the forest invariants: every parent is a known element, following parents always ends in a root,
     * ranks are non-negative and strictly increase towards the root, and the number of roots matches setCount.
     * @throws IllegalStateException describing the first violation found
     */
    public void checkConsistency() {
        int roots = 0;
        for (int element : parent.keys()) {
            int rankOfElement = rank.get(element);
            if (rankOfElement < 0) {
                throw new IllegalStateException(String.format("element %d has negative rank %d", element, rankOfElement));
            }
            int p = parent.get(element);
            if (p == element) {
                roots++;
                continue;
            }
            if (!parent.containsKey(p)) {
                throw new IllegalStateException(String.format("parent %d of element %d is not part of this set", p, element));
            }
            if (rank.get(p) <= rankOfElement) {
                throw new IllegalStateException(String.format(
                    "rank of element %d (%d) is not below the rank of its parent %d (%d)", element, rankOfElement, p, rank.get(p)));
            }
            // a chain longer than the number of elements must contain a cycle
            int hops = 0;
            int current = element;
            while (parent.get(current) != current) {
                current = parent.get(current);
                if (++hops > parent.size()) {
                    throw new IllegalStateException("cycle in parent pointers starting at element " + element);
                }
            }
        }
        if (roots != setCount) {
            throw new IllegalStateException(String.format("found %d roots, but setCount is %d", roots, setCount));
        }
    }

    private void ensurePresent(int element) {
        if (!parent.containsKey(element)) {
            throw new ElementNotFoundException(element);
        }
    }

    @Override
    public String toString() {
        return "DisjointSet" + records();
    }

    public static class ElementNotFoundException extends RuntimeException {
        private final int element;

        public ElementNotFoundException(int element) {
            super(String.format("element %d was never added to this disjoint set", element));
            this.element = element;
        }

        public int getElement() {
            return element;
        }
    }

    public static class DuplicateElementException extends RuntimeException {
        private final int element;

        public DuplicateElementException(int element) {
            super(String.format("element %d is already present in this disjoint set", element));
            this.element = element;
        }

        public int getElement() {
            return element;
        }
    }
}
