package org.waabox.protocache.metrics;

import org.waabox.protocache.FailureKind;
import org.waabox.protocache.SnapshotOperation;

/**
 * A no-operation implementation of {@link ProtocacheMetrics}.
 *
 * <p>All methods in this class are intentionally empty.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopProtocacheMetrics implements ProtocacheMetrics {

  /** {@inheritDoc} */
  @Override
  public void snapshotRefreshed(final SnapshotOperation operation,
      final long durationMs, final int itemCount) {
  }

  /** {@inheritDoc} */
  @Override
  public void snapshotFailed(final SnapshotOperation operation,
      final FailureKind kind) {
  }

  /** {@inheritDoc} */
  @Override
  public void snapshotSizeReported(final long dataSizeBytes) {
  }
}
