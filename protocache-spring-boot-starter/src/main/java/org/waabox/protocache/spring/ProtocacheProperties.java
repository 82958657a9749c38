package org.waabox.protocache.spring;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import org.waabox.protocache.FetchParams;
import org.waabox.protocache.fetch.http.HttpFetcherConfig;
import org.waabox.protocache.store.SizeEstimationFailurePolicy;
import org.waabox.protocache.store.StoreConfig;

/**
 * Configuration properties for Protocache, mapped from the
 * {@code protocache.*} prefix in application.yml or application.properties.
 *
 * <p>Supports:
 * <ul>
 *   <li>{@code protocache.ttl} - how long a snapshot stays fresh.</li>
 *   <li>{@code protocache.max-data-size-bytes} - the snapshot size
 *       limit.</li>
 *   <li>{@code protocache.size-estimation-failure-policy} -
 *       {@code fail-open} or {@code fail-closed}.</li>
 *   <li>{@code protocache.setup-on-start} - whether the first snapshot is
 *       loaded when the application starts.</li>
 *   <li>{@code protocache.initial-offset} and
 *       {@code protocache.initial-limit} - the page loaded on start.</li>
 *   <li>{@code protocache.api.*} - the upstream API, see {@link Api}.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "protocache")
public class ProtocacheProperties {

  /** How long a snapshot stays fresh. */
  private Duration ttl = StoreConfig.DEFAULT_TTL;

  /** The maximum estimated snapshot size, in bytes. */
  private long maxDataSizeBytes = StoreConfig.DEFAULT_MAX_DATA_SIZE_BYTES;

  /** What to do when the snapshot size cannot be estimated. */
  private SizeEstimationFailurePolicy sizeEstimationFailurePolicy =
      SizeEstimationFailurePolicy.FAIL_OPEN;

  /** Whether the first snapshot is loaded on start. */
  private boolean setupOnStart = true;

  /** The offset of the page loaded on start. */
  private int initialOffset = FetchParams.DEFAULT_OFFSET;

  /** The limit of the page loaded on start. */
  private int initialLimit = FetchParams.DEFAULT_LIMIT;

  /** The upstream API settings. */
  private final Api api = new Api();

  public Duration getTtl() {
    return ttl;
  }

  public void setTtl(final Duration ttl) {
    this.ttl = ttl;
  }

  public long getMaxDataSizeBytes() {
    return maxDataSizeBytes;
  }

  public void setMaxDataSizeBytes(final long maxDataSizeBytes) {
    this.maxDataSizeBytes = maxDataSizeBytes;
  }

  public SizeEstimationFailurePolicy getSizeEstimationFailurePolicy() {
    return sizeEstimationFailurePolicy;
  }

  public void setSizeEstimationFailurePolicy(
      final SizeEstimationFailurePolicy sizeEstimationFailurePolicy) {
    this.sizeEstimationFailurePolicy = sizeEstimationFailurePolicy;
  }

  public boolean isSetupOnStart() {
    return setupOnStart;
  }

  public void setSetupOnStart(final boolean setupOnStart) {
    this.setupOnStart = setupOnStart;
  }

  public int getInitialOffset() {
    return initialOffset;
  }

  public void setInitialOffset(final int initialOffset) {
    this.initialOffset = initialOffset;
  }

  public int getInitialLimit() {
    return initialLimit;
  }

  public void setInitialLimit(final int initialLimit) {
    this.initialLimit = initialLimit;
  }

  /**
   * Returns the upstream API settings.
   *
   * @return the settings, never null
   */
  public Api getApi() {
    return api;
  }

  /**
   * Settings of the upstream API, mapped from {@code protocache.api.*}.
   *
   * <p>The HTTP fetcher is only created when {@code base-url} is set.
   */
  public static class Api {

    /** The base url of the upstream API, null disables the HTTP fetcher. */
    private String baseUrl;

    /** The bearer token, null means anonymous requests. */
    private String token;

    /** The per-request timeout. */
    private Duration timeout = HttpFetcherConfig.DEFAULT_TIMEOUT;

    /** The user agent sent on every request. */
    private String userAgent = HttpFetcherConfig.DEFAULT_USER_AGENT;

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(final String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getToken() {
      return token;
    }

    public void setToken(final String token) {
      this.token = token;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(final Duration timeout) {
      this.timeout = timeout;
    }

    public String getUserAgent() {
      return userAgent;
    }

    public void setUserAgent(final String userAgent) {
      this.userAgent = userAgent;
    }
  }
}
