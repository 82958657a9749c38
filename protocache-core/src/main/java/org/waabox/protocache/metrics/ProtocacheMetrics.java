package org.waabox.protocache.metrics;

import org.waabox.protocache.FailureKind;
import org.waabox.protocache.SnapshotOperation;

/**
 * An abstraction for recording operational metrics of the snapshot cache.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer or Prometheus. Use {@link NoopProtocacheMetrics} when metrics
 * collection is not required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ProtocacheMetrics {

  /**
   * Records a successful snapshot write.
   *
   * @param operation  the operation that wrote the snapshot, never null
   * @param durationMs the time spent fetching and storing, in milliseconds
   * @param itemCount  the number of records stored
   */
  void snapshotRefreshed(SnapshotOperation operation, long durationMs,
      int itemCount);

  /**
   * Records a failed snapshot write.
   *
   * @param operation the operation that failed, never null
   * @param kind      the failure category, never null
   */
  void snapshotFailed(SnapshotOperation operation, FailureKind kind);

  /**
   * Records the estimated size of the stored snapshot.
   *
   * @param dataSizeBytes the estimated size in bytes
   */
  void snapshotSizeReported(long dataSizeBytes);
}
