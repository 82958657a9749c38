package org.waabox.protocache.fetch.http;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuration holder for the {@link HttpPrototypeFetcher}.
 *
 * <p>Holds the base url of the upstream API, the optional bearer token,
 * the per-request timeout and the {@code User-Agent} sent on every
 * request.
 *
 * <pre>{@code
 * HttpFetcherConfig config = HttpFetcherConfig.builder()
 *     .baseUrl("https://api.example.com/v2/api")
 *     .token(System.getenv("CATALOG_TOKEN"))
 *     .timeout(Duration.ofSeconds(10))
 *     .build();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class HttpFetcherConfig {

  /** The default per-request timeout. */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  /** The default user agent. */
  public static final String DEFAULT_USER_AGENT = "Protocache/1.0 (java)";

  /** The base url without a trailing slash, never null. */
  private final String baseUrl;

  /** The bearer token, may be null. */
  private final String token;

  /** The per-request timeout, never null. */
  private final Duration timeout;

  /** The user agent, never null. */
  private final String userAgent;

  private HttpFetcherConfig(final Builder builder) {
    baseUrl = builder.baseUrl;
    token = builder.token;
    timeout = builder.timeout;
    userAgent = builder.userAgent;
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the base url of the upstream API, without a trailing slash.
   *
   * @return the base url, never null
   */
  public String baseUrl() {
    return baseUrl;
  }

  /**
   * Returns the bearer token.
   *
   * @return the token, or empty when requests are anonymous
   */
  public Optional<String> token() {
    return Optional.ofNullable(token);
  }

  /**
   * Returns the per-request timeout.
   *
   * @return the timeout, never null
   */
  public Duration timeout() {
    return timeout;
  }

  /**
   * Returns the user agent sent on every request.
   *
   * @return the user agent, never null
   */
  public String userAgent() {
    return userAgent;
  }

  /** Fluent builder for {@link HttpFetcherConfig}. */
  public static final class Builder {

    /** The required base url. */
    private String baseUrl;

    /** The optional bearer token. */
    private String token;

    /** The timeout, defaults to {@link #DEFAULT_TIMEOUT}. */
    private Duration timeout = DEFAULT_TIMEOUT;

    /** The user agent, defaults to {@link #DEFAULT_USER_AGENT}. */
    private String userAgent = DEFAULT_USER_AGENT;

    private Builder() {
    }

    /**
     * Sets the base url of the upstream API.
     *
     * @param theBaseUrl an absolute http or https url, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder baseUrl(final String theBaseUrl) {
      Objects.requireNonNull(theBaseUrl, "baseUrl must not be null");
      String url = theBaseUrl.trim();
      while (url.endsWith("/")) {
        url = url.substring(0, url.length() - 1);
      }
      baseUrl = url;
      return this;
    }

    /**
     * Sets the bearer token. A null or blank token disables the
     * {@code Authorization} header.
     *
     * @param theToken the token, may be null
     *
     * @return this builder for chaining, never null
     */
    public Builder token(final String theToken) {
      token = theToken == null || theToken.isBlank() ? null : theToken;
      return this;
    }

    public Builder timeout(final Duration theTimeout) {
      Objects.requireNonNull(theTimeout, "timeout must not be null");
      timeout = theTimeout;
      return this;
    }

    public Builder userAgent(final String theUserAgent) {
      Objects.requireNonNull(theUserAgent, "userAgent must not be null");
      userAgent = theUserAgent;
      return this;
    }

    /**
     * Validates the values and builds the configuration.
     *
     * @return the configuration, never null
     *
     * @throws IllegalArgumentException if the base url is missing or not an
     *                                  absolute http url, or the timeout is
     *                                  not positive
     */
    public HttpFetcherConfig build() {
      if (baseUrl == null || baseUrl.isEmpty()) {
        throw new IllegalArgumentException("baseUrl must be set");
      }
      final URI uri = URI.create(baseUrl);
      if (!"http".equalsIgnoreCase(uri.getScheme())
          && !"https".equalsIgnoreCase(uri.getScheme())) {
        throw new IllegalArgumentException(
            "baseUrl must be an http or https url, got " + baseUrl);
      }
      if (timeout.isZero() || timeout.isNegative()) {
        throw new IllegalArgumentException("timeout must be positive, got "
            + timeout);
      }
      return new HttpFetcherConfig(this);
    }
  }
}
