package org.waabox.protocache;

/**
 * The category of a failed snapshot operation.
 *
 * <p>Fetcher failures use {@link #HTTP}, {@link #NETWORK},
 * {@link #TIMEOUT}, {@link #ABORT}, {@link #CORS} and {@link #UNKNOWN};
 * store failures use {@link #STORAGE_LIMIT}, {@link #SERIALIZATION} and
 * {@link #UNKNOWN}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum FailureKind {

  /** The upstream answered with a non-success HTTP status. */
  HTTP("http"),

  /** The connection failed at the transport level. */
  NETWORK("network"),

  /** The request exceeded its deadline. */
  TIMEOUT("timeout"),

  /** The caller cancelled the request. */
  ABORT("abort"),

  /** An opaque transport failure with no usable diagnostics. */
  CORS("cors"),

  /** The snapshot was larger than the store allows. */
  STORAGE_LIMIT("storage_limit"),

  /** The snapshot could not be serialized for size estimation. */
  SERIALIZATION("serialization"),

  /** Anything else. */
  UNKNOWN("unknown");

  /** The stable lowercase identifier. */
  private final String code;

  FailureKind(final String theCode) {
    code = theCode;
  }

  /**
   * Returns the stable lowercase identifier of this kind.
   *
   * @return the identifier, never null
   */
  public String code() {
    return code;
  }
}
