package org.waabox.protocache.fetch;

/**
 * Thrown when the upstream API answers with a non-success HTTP status.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class UpstreamApiException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** The HTTP status. */
  private final int status;

  /** The HTTP status text, may be null. */
  private final String statusText;

  /** The request method, may be null. */
  private final String method;

  /** The request url, may be null. */
  private final String url;

  /** Creates a new exception.
   *
   * @param theStatus the HTTP status.
   * @param theStatusText the status text, may be null.
   * @param theMethod the request method, may be null.
   * @param theUrl the request url, may be null.
   */
  public UpstreamApiException(final int theStatus, final String theStatusText,
      final String theMethod, final String theUrl) {
    super("Upstream responded with HTTP " + theStatus
        + (theStatusText == null || theStatusText.isEmpty()
            ? "" : " " + theStatusText));
    status = theStatus;
    statusText = theStatusText;
    method = theMethod;
    url = theUrl;
  }

  public int getStatus() {
    return status;
  }

  public String getStatusText() {
    return statusText;
  }

  public String getMethod() {
    return method;
  }

  public String getUrl() {
    return url;
  }
}
