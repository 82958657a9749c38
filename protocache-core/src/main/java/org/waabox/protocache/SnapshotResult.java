package org.waabox.protocache;

/**
 * The outcome of a {@link PrototypeRepository} write operation.
 *
 * <p>Write operations never throw for fetch or store problems; they always
 * complete with one of the two implementations of this interface.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public sealed interface SnapshotResult
    permits SnapshotSuccess, SnapshotFailure {

  /**
   * Tells whether the operation succeeded.
   *
   * @return true for a {@link SnapshotSuccess}
   */
  default boolean isOk() {
    return this instanceof SnapshotSuccess;
  }
}
