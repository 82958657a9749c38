package org.waabox.protocache;

/**
 * The write operations of the {@link PrototypeRepository}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum SnapshotOperation {

  /** An explicit fetch with caller provided parameters. */
  SETUP,

  /** A fetch that reuses the last successful parameters. */
  REFRESH
}
