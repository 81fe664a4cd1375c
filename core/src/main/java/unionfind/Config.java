package unionfind;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

public class Config {
    private static final int defaultInitialCapacity = 100;
    private int initialCapacity = defaultInitialCapacity;
    private DuplicatePolicy duplicatePolicy = DuplicatePolicy.OVERWRITE;
    private boolean statsEnabled = false;

    public static Config withDefaults() {
        return new Config();
    }

    /**
     * Expected number of elements, used to size the backing maps up front.
     * defaults to 100
     */
    public Config withInitialCapacity(int initialCapacity) {
        checkArgument(initialCapacity >= 0, "initialCapacity must not be negative, but was %s", initialCapacity);
        this.initialCapacity = initialCapacity;
        return this;
    }

    /* What `add` does for an element that is already present. Defaults to OVERWRITE. */
    public Config withDuplicatePolicy(DuplicatePolicy duplicatePolicy) {
        this.duplicatePolicy = checkNotNull(duplicatePolicy, "duplicatePolicy");
        return this;
    }

    /* If specified, DisjointSet counts finds, unions and path compression rewrites. */
    public Config withStatsEnabled() {
        this.statsEnabled = true;
        return this;
    }

    public int getInitialCapacity() {
        return initialCapacity;
    }

    public DuplicatePolicy getDuplicatePolicy() {
        return duplicatePolicy;
    }

    public boolean isStatsEnabled() {
        return statsEnabled;
    }

    public enum DuplicatePolicy {
        /** reset the element to a fresh singleton root: rank 0, parent self */
        OVERWRITE,
        /** keep the existing record untouched */
        IGNORE,
        /** throw {@link DisjointSet.DuplicateElementException} */
        REJECT
    }
}
