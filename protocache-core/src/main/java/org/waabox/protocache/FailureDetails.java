package org.waabox.protocache;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Diagnostic details attached to a failure.
 *
 * <p>The request side holds the method and url of the upstream call; the
 * response side holds the HTTP status text or a transport level code such
 * as {@code ECONNREFUSED} or {@code TIMEOUT}. Every part is optional.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FailureDetails {

  /** The details with no information. */
  private static final FailureDetails EMPTY = new FailureDetails(null, null,
      null, null);

  /** The request method, may be null. */
  private final String requestMethod;

  /** The request url, may be null. */
  private final String requestUrl;

  /** The response status text, may be null. */
  private final String statusText;

  /** The transport level code, may be null. */
  private final String code;

  private FailureDetails(final String theRequestMethod,
      final String theRequestUrl, final String theStatusText,
      final String theCode) {
    requestMethod = theRequestMethod;
    requestUrl = theRequestUrl;
    statusText = theStatusText;
    code = theCode;
  }

  /**
   * Returns the details with no information.
   *
   * @return the empty details, never null
   */
  public static FailureDetails empty() {
    return EMPTY;
  }

  /**
   * Creates the details of an HTTP failure.
   *
   * @param method     the request method, may be null
   * @param url        the request url, may be null
   * @param statusText the response status text, may be null
   *
   * @return the details, never null
   */
  public static FailureDetails ofHttp(final String method, final String url,
      final String statusText) {
    return new FailureDetails(method, url, statusText, null);
  }

  /**
   * Creates details that only carry a transport level code.
   *
   * @param code the code, never null
   *
   * @return the details, never null
   */
  public static FailureDetails ofCode(final String code) {
    Objects.requireNonNull(code, "code must not be null");
    return new FailureDetails(null, null, null, code);
  }

  public Optional<String> getRequestMethod() {
    return Optional.ofNullable(requestMethod);
  }

  public Optional<String> getRequestUrl() {
    return Optional.ofNullable(requestUrl);
  }

  public Optional<String> getStatusText() {
    return Optional.ofNullable(statusText);
  }

  public Optional<String> getCode() {
    return Optional.ofNullable(code);
  }

  public boolean isEmpty() {
    return requestMethod == null && requestUrl == null && statusText == null
        && code == null;
  }

  /**
   * Renders the details as a nested map with optional {@code req} and
   * {@code res} entries.
   *
   * @return an unmodifiable map, never null
   */
  public Map<String, Map<String, String>> asMap() {
    final Map<String, String> req = new LinkedHashMap<>();
    putIfPresent(req, "url", requestUrl);
    putIfPresent(req, "method", requestMethod);
    final Map<String, String> res = new LinkedHashMap<>();
    putIfPresent(res, "statusText", statusText);
    putIfPresent(res, "code", code);

    final Map<String, Map<String, String>> result = new LinkedHashMap<>();
    if (!req.isEmpty()) {
      result.put("req", Collections.unmodifiableMap(req));
    }
    if (!res.isEmpty()) {
      result.put("res", Collections.unmodifiableMap(res));
    }
    return Collections.unmodifiableMap(result);
  }

  private static void putIfPresent(final Map<String, String> target,
      final String key, final String value) {
    if (value != null) {
      target.put(key, value);
    }
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FailureDetails)) {
      return false;
    }
    final FailureDetails other = (FailureDetails) o;
    return Objects.equals(requestMethod, other.requestMethod)
        && Objects.equals(requestUrl, other.requestUrl)
        && Objects.equals(statusText, other.statusText)
        && Objects.equals(code, other.code);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return Objects.hash(requestMethod, requestUrl, statusText, code);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return asMap().toString();
  }
}
