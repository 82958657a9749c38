package org.waabox.protocache;

import org.waabox.protocache.store.StoreStats;

/**
 * Receives the lifecycle events of snapshot write operations.
 *
 * <p>Every method has an empty default, so implementations override only
 * what they need. A listener that throws is logged and ignored; it never
 * changes the outcome of the operation.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface RepositoryListener {

  /**
   * Called when a write operation starts running.
   *
   * @param operation the operation, never null
   */
  default void snapshotStarted(final SnapshotOperation operation) {
  }

  /**
   * Called when a write operation stored a new snapshot.
   *
   * @param operation the operation, never null
   * @param stats     the store statistics after the write, never null
   */
  default void snapshotCompleted(final SnapshotOperation operation,
      final StoreStats stats) {
  }

  /**
   * Called when a write operation failed.
   *
   * @param operation the operation, never null
   * @param failure   the failure, never null
   */
  default void snapshotFailed(final SnapshotOperation operation,
      final SnapshotFailure failure) {
  }
}
