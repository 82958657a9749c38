package org.waabox.protocache.fetch;

/**
 * Thrown when the caller cancels an in-flight fetch.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FetchAbortedException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception.
   *
   * @param message the detail message, cannot be null.
   */
  public FetchAbortedException(final String message) {
    super(message);
  }
}
