package org.waabox.protocache.store;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.waabox.protocache.model.Prototype;

/**
 * An immutable set of records with its id index, as swapped atomically by
 * the {@link PrototypeStore}.
 *
 * <p>The record list is rebuilt from the index, so it never holds two
 * records with the same id and {@code records.size() == index.size()}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class PrototypeSnapshot {

  /** The single empty snapshot. */
  private static final PrototypeSnapshot EMPTY = new PrototypeSnapshot(
      Collections.emptyList(), Collections.emptyMap(), null, 0, 0, 0);

  /** The records, unmodifiable, in first-seen id order. */
  private final List<Prototype> records;

  /** The id index, unmodifiable. */
  private final Map<Integer, Prototype> index;

  /** When the snapshot was stored, null for the empty snapshot. */
  private final Instant cachedAt;

  /** The estimated data size in bytes. */
  private final long sizeBytes;

  /** The smallest id, 0 when empty. */
  private final int minId;

  /** The largest id, 0 when empty. */
  private final int maxId;

  /** The number of input records that were dropped as duplicates. */
  private final int duplicates;

  private PrototypeSnapshot(final List<Prototype> theRecords,
      final Map<Integer, Prototype> theIndex, final Instant theCachedAt,
      final long theSizeBytes, final int theMinId, final int theMaxId) {
    this(theRecords, theIndex, theCachedAt, theSizeBytes, theMinId, theMaxId,
        0);
  }

  private PrototypeSnapshot(final List<Prototype> theRecords,
      final Map<Integer, Prototype> theIndex, final Instant theCachedAt,
      final long theSizeBytes, final int theMinId, final int theMaxId,
      final int theDuplicates) {
    records = theRecords;
    index = theIndex;
    cachedAt = theCachedAt;
    sizeBytes = theSizeBytes;
    minId = theMinId;
    maxId = theMaxId;
    duplicates = theDuplicates;
  }

  /**
   * Returns the empty snapshot.
   *
   * @return the empty snapshot, never null
   */
  static PrototypeSnapshot empty() {
    return EMPTY;
  }

  /**
   * Builds a snapshot from the given records in a single pass.
   *
   * <p>When the same id appears more than once the last record wins, and it
   * keeps the position of the first occurrence.
   *
   * @param input     the records, never null
   * @param cachedAt  the store timestamp, never null
   * @param sizeBytes the estimated data size
   *
   * @return the new snapshot, never null
   */
  static PrototypeSnapshot of(final List<Prototype> input,
      final Instant cachedAt, final long sizeBytes) {
    final Map<Integer, Prototype> index = new LinkedHashMap<>(
        Math.max(16, (int) (input.size() / 0.75f) + 1));
    int min = Integer.MAX_VALUE;
    int max = Integer.MIN_VALUE;
    for (Prototype record : input) {
      final int id = record.getId();
      index.put(id, record);
      min = Math.min(min, id);
      max = Math.max(max, id);
    }
    if (index.isEmpty()) {
      min = 0;
      max = 0;
    }
    final List<Prototype> records = Collections.unmodifiableList(
        new ArrayList<>(index.values()));
    return new PrototypeSnapshot(records, Collections.unmodifiableMap(index),
        cachedAt, sizeBytes, min, max, input.size() - index.size());
  }

  List<Prototype> records() {
    return records;
  }

  Map<Integer, Prototype> index() {
    return index;
  }

  Instant cachedAt() {
    return cachedAt;
  }

  long sizeBytes() {
    return sizeBytes;
  }

  int minId() {
    return minId;
  }

  int maxId() {
    return maxId;
  }

  int duplicates() {
    return duplicates;
  }

  boolean isEmpty() {
    return records.isEmpty();
  }
}
