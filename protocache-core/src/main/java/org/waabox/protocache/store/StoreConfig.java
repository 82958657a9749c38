package org.waabox.protocache.store;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable configuration of a {@link PrototypeStore}.
 *
 * <p>Defaults: a 30 minute TTL, a 10 MiB data size limit and
 * {@link SizeEstimationFailurePolicy#FAIL_OPEN}. The data size limit can
 * never be raised above {@link #MAX_DATA_SIZE_CEILING_BYTES}.
 *
 * <pre>{@code
 * StoreConfig config = StoreConfig.builder()
 *     .ttl(Duration.ofMinutes(5))
 *     .maxDataSizeBytes(2 * 1024 * 1024)
 *     .build();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class StoreConfig {

  /** The default snapshot time to live. */
  public static final Duration DEFAULT_TTL = Duration.ofMinutes(30);

  /** The default data size limit, 10 MiB. */
  public static final long DEFAULT_MAX_DATA_SIZE_BYTES = 10L * 1024 * 1024;

  /** The hard ceiling for the data size limit, 30 MiB. */
  public static final long MAX_DATA_SIZE_CEILING_BYTES = 30L * 1024 * 1024;

  /** How long a snapshot is considered fresh, never null. */
  private final Duration ttl;

  /** The maximum estimated size of a snapshot, in bytes. */
  private final long maxDataSizeBytes;

  /** What to do when size estimation fails, never null. */
  private final SizeEstimationFailurePolicy sizeEstimationFailurePolicy;

  private StoreConfig(final Duration theTtl, final long theMaxDataSizeBytes,
      final SizeEstimationFailurePolicy thePolicy) {
    ttl = theTtl;
    maxDataSizeBytes = theMaxDataSizeBytes;
    sizeEstimationFailurePolicy = thePolicy;
  }

  /**
   * Returns a configuration holding every default.
   *
   * @return the default configuration, never null
   */
  public static StoreConfig defaults() {
    return builder().build();
  }

  /**
   * Creates a new builder initialized with the defaults.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  public Duration getTtl() {
    return ttl;
  }

  public long getMaxDataSizeBytes() {
    return maxDataSizeBytes;
  }

  public SizeEstimationFailurePolicy getSizeEstimationFailurePolicy() {
    return sizeEstimationFailurePolicy;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return "StoreConfig{ttl=" + ttl + ", maxDataSizeBytes="
        + maxDataSizeBytes + ", sizeEstimationFailurePolicy="
        + sizeEstimationFailurePolicy + "}";
  }

  /** Fluent builder for {@link StoreConfig}. */
  public static final class Builder {

    /** The time to live, defaults to {@link #DEFAULT_TTL}. */
    private Duration ttl = DEFAULT_TTL;

    /** The data size limit, defaults to 10 MiB. */
    private long maxDataSizeBytes = DEFAULT_MAX_DATA_SIZE_BYTES;

    /** The size estimation failure policy, defaults to fail open. */
    private SizeEstimationFailurePolicy sizeEstimationFailurePolicy =
        SizeEstimationFailurePolicy.FAIL_OPEN;

    private Builder() {
    }

    /**
     * Sets how long a snapshot is considered fresh.
     *
     * @param theTtl the time to live, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder ttl(final Duration theTtl) {
      Objects.requireNonNull(theTtl, "ttl must not be null");
      ttl = theTtl;
      return this;
    }

    /**
     * Sets the maximum estimated size of a snapshot.
     *
     * @param theMaxDataSizeBytes the limit in bytes
     *
     * @return this builder for chaining, never null
     */
    public Builder maxDataSizeBytes(final long theMaxDataSizeBytes) {
      maxDataSizeBytes = theMaxDataSizeBytes;
      return this;
    }

    /**
     * Sets what the store does when a size estimation fails.
     *
     * @param thePolicy the policy, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder sizeEstimationFailurePolicy(
        final SizeEstimationFailurePolicy thePolicy) {
      Objects.requireNonNull(thePolicy,
          "sizeEstimationFailurePolicy must not be null");
      sizeEstimationFailurePolicy = thePolicy;
      return this;
    }

    /**
     * Validates the values and builds the configuration.
     *
     * @return the configuration, never null
     *
     * @throws ConfigurationException if the data size limit is not positive
     *                                or above 30 MiB, or the ttl is negative
     */
    public StoreConfig build() {
      if (maxDataSizeBytes <= 0) {
        throw new ConfigurationException("maxDataSizeBytes must be positive,"
            + " got " + maxDataSizeBytes);
      }
      if (maxDataSizeBytes > MAX_DATA_SIZE_CEILING_BYTES) {
        throw new ConfigurationException("maxDataSizeBytes ("
            + maxDataSizeBytes + ") exceeds the allowed maximum of "
            + MAX_DATA_SIZE_CEILING_BYTES + " bytes (30 MiB)");
      }
      if (ttl.isNegative()) {
        throw new ConfigurationException("ttl must not be negative, got "
            + ttl);
      }
      return new StoreConfig(ttl, maxDataSizeBytes,
          sizeEstimationFailurePolicy);
    }
  }
}
