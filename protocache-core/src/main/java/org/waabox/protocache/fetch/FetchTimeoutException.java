package org.waabox.protocache.fetch;

/**
 * Thrown when a fetch exceeds the deadline enforced by the fetcher.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FetchTimeoutException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** The deadline that was exceeded, in milliseconds. */
  private final long timeoutMs;

  /** Creates a new exception.
   *
   * @param theTimeoutMs the exceeded deadline in milliseconds.
   * @param cause the underlying cause, may be null.
   */
  public FetchTimeoutException(final long theTimeoutMs,
      final Throwable cause) {
    super("Request timed out after " + theTimeoutMs + "ms", cause);
    timeoutMs = theTimeoutMs;
  }

  public long getTimeoutMs() {
    return timeoutMs;
  }
}
