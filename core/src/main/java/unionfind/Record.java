package unionfind;

import java.util.Objects;

/**
 * Snapshot of one element's entry in a {@link DisjointSet}: its rank and its parent pointer.
 * Detached from the structure, i.e. later unions or finds do not change it.
 */
public final class Record {
  private final int rank;
  private final int parent;

  public Record(int rank, int parent) {
    this.rank = rank;
    this.parent = parent;
  }

  public int rank() {
    return rank;
  }

  public int parent() {
    return parent;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Record)) return false;
    Record other = (Record) o;
    return rank == other.rank && parent == other.parent;
  }

  @Override
  public int hashCode() {
    return Objects.hash(rank, parent);
  }

  @Override
  public String toString() {
    return "Record{rank=" + rank + ", parent=" + parent + "}";
  }
}
