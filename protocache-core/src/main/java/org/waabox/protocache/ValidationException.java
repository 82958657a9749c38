package org.waabox.protocache;

import java.util.Objects;

/**
 * Thrown when a repository operation is called with an invalid argument.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ValidationException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  /** The name of the offending argument, never null. */
  private final String field;

  /** Creates a new exception.
   *
   * @param theField the name of the offending argument, cannot be null.
   * @param message the detail message, cannot be null.
   */
  public ValidationException(final String theField, final String message) {
    super(message);
    field = Objects.requireNonNull(theField, "field must not be null");
  }

  public String getField() {
    return field;
  }
}
