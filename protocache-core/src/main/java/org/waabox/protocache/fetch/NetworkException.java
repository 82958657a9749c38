package org.waabox.protocache.fetch;

import java.util.Objects;

/**
 * A transport failure carrying an explicit network code, such as
 * {@code ECONNREFUSED} or {@code ENOTFOUND}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NetworkException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** The raw network code, never null. */
  private final String code;

  /** Creates a new exception.
   *
   * @param theCode the raw network code, cannot be null.
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, may be null.
   */
  public NetworkException(final String theCode, final String message,
      final Throwable cause) {
    super(message, cause);
    code = Objects.requireNonNull(theCode, "code must not be null");
  }

  /** Creates a new exception with no cause.
   *
   * @param theCode the raw network code, cannot be null.
   * @param message the detail message, cannot be null.
   */
  public NetworkException(final String theCode, final String message) {
    this(theCode, message, null);
  }

  public String getCode() {
    return code;
  }
}
