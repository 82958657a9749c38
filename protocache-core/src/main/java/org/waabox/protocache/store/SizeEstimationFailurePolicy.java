package org.waabox.protocache.store;

/**
 * What the store does when the size of a candidate snapshot cannot be
 * estimated.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum SizeEstimationFailurePolicy {

  /** Log a warning, count the data as zero bytes and accept it. */
  FAIL_OPEN,

  /** Reject the data with a {@link SizeEstimationException}. */
  FAIL_CLOSED
}
