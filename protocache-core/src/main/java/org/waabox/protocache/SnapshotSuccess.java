package org.waabox.protocache;

import java.util.Objects;

import org.waabox.protocache.store.StoreStats;

/**
 * A successful snapshot write.
 *
 * @param stats the store statistics right after the write, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record SnapshotSuccess(StoreStats stats) implements SnapshotResult {

  /**
   * Creates a new success.
   *
   * @throws NullPointerException if stats is null
   */
  public SnapshotSuccess {
    Objects.requireNonNull(stats, "stats must not be null");
  }
}
