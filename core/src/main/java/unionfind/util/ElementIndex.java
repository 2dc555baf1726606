package unionfind.util;

import gnu.trove.list.array.TLongArrayList;
import gnu.trove.map.hash.TLongIntHashMap;
import unionfind.Config;
import unionfind.DisjointSetUnion;

import java.util.NoSuchElementException;

import static com.google.common.base.Preconditions.checkElementIndex;

/**
 * Maps arbitrary (sparse) long ids, e.g. graph node ids, to the dense element ids {@code 0..n-1}
 * a {@link DisjointSetUnion} works with. Dense ids are handed out in first-seen order.
 */
public class ElementIndex {
  private static final int NO_ENTRY = -1;

  // Maps id -> dense index
  private final TLongIntHashMap indexById;
  // Maps dense index -> id
  private final TLongArrayList idByIndex;

  public ElementIndex() {
    this(100);
  }

  public ElementIndex(int initialCapacity) {
    this.indexById = new TLongIntHashMap(initialCapacity, 0.5f, 0L, NO_ENTRY);
    this.idByIndex = new TLongArrayList(initialCapacity);
  }

  public static ElementIndex of(long... ids) {
    ElementIndex index = new ElementIndex(Math.max(ids.length, 10));
    for (long id : ids) {
      index.add(id);
    }
    return index;
  }

  /**
   * Registers the id if it is not known yet.
   * @return the dense index of the id
   */
  public int add(long id) {
    int existing = indexById.get(id);
    if (existing != NO_ENTRY) {
      return existing;
    }
    int index = idByIndex.size();
    indexById.put(id, index);
    idByIndex.add(id);
    return index;
  }

  public boolean contains(long id) {
    return indexById.containsKey(id);
  }

  /**
   * @throws NoSuchElementException if the id was never added
   */
  public int indexOf(long id) {
    int index = indexById.get(id);
    if (index == NO_ENTRY) {
      throw new NoSuchElementException("unknown id: " + id);
    }
    return index;
  }

  public long idAt(int index) {
    checkElementIndex(index, idByIndex.size(), "index");
    return idByIndex.get(index);
  }

  public int size() {
    return idByIndex.size();
  }

  /**
   * Creates a DisjointSetUnion with one element per id known right now.
   * Ids added afterwards have no element in the returned structure.
   */
  public DisjointSetUnion newDisjointSetUnion() {
    return new DisjointSetUnion(size());
  }

  public DisjointSetUnion newDisjointSetUnion(Config config) {
    return new DisjointSetUnion(size(), config);
  }
}
