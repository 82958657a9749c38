package org.waabox.protocache.fetch;

/**
 * The stable codes carried by a {@link FetchFailure}.
 *
 * <p>Network failures carry the raw transport code instead, such as
 * {@code ECONNREFUSED}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FetchErrorCodes {

  public static final String CLIENT_BAD_REQUEST = "CLIENT_BAD_REQUEST";
  public static final String CLIENT_UNAUTHORIZED = "CLIENT_UNAUTHORIZED";
  public static final String CLIENT_FORBIDDEN = "CLIENT_FORBIDDEN";
  public static final String CLIENT_NOT_FOUND = "CLIENT_NOT_FOUND";
  public static final String CLIENT_METHOD_NOT_ALLOWED =
      "CLIENT_METHOD_NOT_ALLOWED";
  public static final String CLIENT_TIMEOUT = "CLIENT_TIMEOUT";
  public static final String CLIENT_RATE_LIMITED = "CLIENT_RATE_LIMITED";
  public static final String CLIENT_ERROR = "CLIENT_ERROR";
  public static final String SERVER_INTERNAL_ERROR = "SERVER_INTERNAL_ERROR";
  public static final String SERVER_BAD_GATEWAY = "SERVER_BAD_GATEWAY";
  public static final String SERVER_SERVICE_UNAVAILABLE =
      "SERVER_SERVICE_UNAVAILABLE";
  public static final String SERVER_GATEWAY_TIMEOUT =
      "SERVER_GATEWAY_TIMEOUT";
  public static final String SERVER_ERROR = "SERVER_ERROR";

  public static final String TIMEOUT = "TIMEOUT";
  public static final String ABORTED = "ABORTED";
  public static final String CORS_BLOCKED = "CORS_BLOCKED";
  public static final String NETWORK_ERROR = "NETWORK_ERROR";
  public static final String UNKNOWN = "UNKNOWN";

  private FetchErrorCodes() {
  }
}
