package org.waabox.protocache;

/**
 * The component a snapshot failure originated in.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum FailureOrigin {
  FETCHER,
  STORE,
  UNKNOWN
}
