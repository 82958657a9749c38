package org.waabox.protocache.store;

/**
 * Describes what is known about the stored snapshot after a failed write.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum DataState {

  /** The previous snapshot is intact and still served. */
  UNCHANGED,

  /** The store could not tell whether the snapshot was modified. */
  UNKNOWN
}
