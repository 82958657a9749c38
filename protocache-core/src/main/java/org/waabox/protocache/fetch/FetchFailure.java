package org.waabox.protocache.fetch;

import java.util.Objects;
import java.util.OptionalInt;

import org.waabox.protocache.FailureDetails;
import org.waabox.protocache.FailureKind;

/**
 * A classified fetch failure.
 *
 * @param kind    the failure category, never null
 * @param code    the stable failure code, see {@link FetchErrorCodes},
 *                never null
 * @param message a human readable message, never null
 * @param status  the HTTP status, null unless kind is HTTP
 * @param details the diagnostic details, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record FetchFailure(FailureKind kind, String code, String message,
    Integer status, FailureDetails details) implements FetchResult {

  /**
   * Creates a new failure.
   *
   * @throws NullPointerException if kind, code or message is null
   */
  public FetchFailure {
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(code, "code must not be null");
    Objects.requireNonNull(message, "message must not be null");
    if (details == null) {
      details = FailureDetails.empty();
    }
  }

  /**
   * Returns the HTTP status as an optional.
   *
   * @return the status, or empty when the failure has none
   */
  public OptionalInt statusValue() {
    return status == null ? OptionalInt.empty() : OptionalInt.of(status);
  }
}
