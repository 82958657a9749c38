package org.waabox.protocache.store;

import java.util.List;

import org.waabox.protocache.model.Prototype;

/**
 * Estimates the serialized size of a list of records.
 *
 * <p>Implementations may throw any runtime exception when a record cannot
 * be serialized; the store applies its {@link SizeEstimationFailurePolicy}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface SnapshotSizeEstimator {

  /**
   * Estimates the size of the given records in bytes.
   *
   * @param records the records to measure, never null
   *
   * @return the estimated size in bytes, never negative
   */
  long estimate(List<Prototype> records);
}
