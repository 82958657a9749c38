package org.waabox.protocache.store;

/**
 * Thrown when the size of a candidate snapshot cannot be estimated and the
 * store is configured with {@link SizeEstimationFailurePolicy#FAIL_CLOSED}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SizeEstimationException extends StoreException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception.
   *
   * @param cause the serialization failure, cannot be null.
   */
  public SizeEstimationException(final Throwable cause) {
    super("Failed to estimate snapshot data size: " + cause.getMessage(),
        DataState.UNCHANGED, cause);
  }
}
