package org.waabox.protocache;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

import org.waabox.protocache.fetch.FetchFailure;
import org.waabox.protocache.store.DataState;

/**
 * A failed snapshot write.
 *
 * <p>Failures coming from the fetcher carry the classified kind, code and
 * details of the fetch. Failures coming from the store carry one of the
 * {@code STORE_*} codes and the {@link DataState} reported by the store.
 *
 * @param origin    the failing component, never null
 * @param kind      the failure category, never null
 * @param code      the stable failure code, never null
 * @param message   a human readable message, never null
 * @param status    the HTTP status, may be null
 * @param details   the diagnostic details, never null
 * @param dataState the state of the stored data, may be null
 * @param cause     the underlying throwable, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record SnapshotFailure(FailureOrigin origin, FailureKind kind,
    String code, String message, Integer status, FailureDetails details,
    DataState dataState, Throwable cause) implements SnapshotResult {

  /** The snapshot was larger than the store allows. */
  public static final String STORE_CAPACITY_EXCEEDED =
      "STORE_CAPACITY_EXCEEDED";

  /** The snapshot size could not be estimated. */
  public static final String STORE_SERIALIZATION_FAILED =
      "STORE_SERIALIZATION_FAILED";

  /** Any other store failure. */
  public static final String STORE_UNKNOWN = "STORE_UNKNOWN";

  /**
   * Creates a new failure.
   *
   * @throws NullPointerException if origin, kind, code or message is null
   */
  public SnapshotFailure {
    Objects.requireNonNull(origin, "origin must not be null");
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(code, "code must not be null");
    Objects.requireNonNull(message, "message must not be null");
    if (details == null) {
      details = FailureDetails.empty();
    }
  }

  /**
   * Creates a failure from a classified fetch failure.
   *
   * @param failure the fetch failure, never null
   *
   * @return the snapshot failure, never null
   */
  public static SnapshotFailure fromFetch(final FetchFailure failure) {
    Objects.requireNonNull(failure, "failure must not be null");
    return new SnapshotFailure(FailureOrigin.FETCHER, failure.kind(),
        failure.code(), failure.message(), failure.status(),
        failure.details(), null, null);
  }

  public OptionalInt statusValue() {
    return status == null ? OptionalInt.empty() : OptionalInt.of(status);
  }

  public Optional<DataState> dataStateValue() {
    return Optional.ofNullable(dataState);
  }

  public Optional<Throwable> causeValue() {
    return Optional.ofNullable(cause);
  }
}
