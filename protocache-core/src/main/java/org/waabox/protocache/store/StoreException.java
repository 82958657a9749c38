package org.waabox.protocache.store;

import java.util.Objects;

/**
 * Base exception for failures raised by the {@link PrototypeStore}.
 *
 * <p>Every store exception reports the {@link DataState} of the snapshot
 * after the failure, so callers can tell whether the previously cached data
 * is still valid.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class StoreException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** The state of the stored data after the failure, never null. */
  private final DataState dataState;

  /** Creates a new exception.
   *
   * @param message the detail message, cannot be null.
   * @param theDataState the state of the stored data, cannot be null.
   */
  public StoreException(final String message, final DataState theDataState) {
    this(message, theDataState, null);
  }

  /** Creates a new exception with a cause.
   *
   * @param message the detail message, cannot be null.
   * @param theDataState the state of the stored data, cannot be null.
   * @param cause the underlying cause, may be null.
   */
  public StoreException(final String message, final DataState theDataState,
      final Throwable cause) {
    super(message, cause);
    dataState = Objects.requireNonNull(theDataState,
        "dataState must not be null");
  }

  /**
   * Returns the state of the stored data after this failure.
   *
   * @return the data state, never null
   */
  public DataState getDataState() {
    return dataState;
  }
}
