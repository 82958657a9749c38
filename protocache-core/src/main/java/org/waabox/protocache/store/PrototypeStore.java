package org.waabox.protocache.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.protocache.model.Prototype;

/**
 * Holds the current snapshot of catalog records in memory.
 *
 * <p>The snapshot is kept behind an {@link AtomicReference} and replaced as
 * a whole by {@link #setAll(List)}; it is never mutated in place. Readers
 * dereference it once per call and never lock, so a reader observes either
 * the previous snapshot or the new one, never a mix.
 *
 * <p>The store bounds memory by rejecting any snapshot whose estimated
 * serialized size exceeds {@link StoreConfig#getMaxDataSizeBytes()}, and
 * bounds staleness by reporting the snapshot as expired once its age is
 * greater than {@link StoreConfig#getTtl()}. Expired data is still served.
 *
 * <p>Writers coordinate through {@link #runExclusive(RefreshTask)}: at most
 * one task runs at a time and callers arriving while it runs share its
 * outcome.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PrototypeStore {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(PrototypeStore.class);

  /** The current snapshot, atomically swapped on every write. */
  private final AtomicReference<PrototypeSnapshot> current;

  /** The future of the exclusive task in flight, null when idle. */
  private final AtomicReference<CompletableFuture<?>> inFlight;

  /** The store configuration, never null. */
  private final StoreConfig config;

  /** The clock used to stamp and age snapshots, never null. */
  private final Clock clock;

  /** The size estimator applied before every write, never null. */
  private final SnapshotSizeEstimator sizeEstimator;

  /** Creates a store with the default configuration. */
  public PrototypeStore() {
    this(StoreConfig.defaults());
  }

  /**
   * Creates a store with the given configuration.
   *
   * @param theConfig the configuration, never null
   */
  public PrototypeStore(final StoreConfig theConfig) {
    this(theConfig, Clock.systemUTC(), new JsonSnapshotSizeEstimator());
  }

  /**
   * Creates a store with the given configuration, clock and estimator.
   *
   * @param theConfig        the configuration, never null
   * @param theClock         the clock, never null
   * @param theSizeEstimator the size estimator, never null
   */
  public PrototypeStore(final StoreConfig theConfig, final Clock theClock,
      final SnapshotSizeEstimator theSizeEstimator) {
    config = Objects.requireNonNull(theConfig, "config must not be null");
    clock = Objects.requireNonNull(theClock, "clock must not be null");
    sizeEstimator = Objects.requireNonNull(theSizeEstimator,
        "sizeEstimator must not be null");
    current = new AtomicReference<>(PrototypeSnapshot.empty());
    inFlight = new AtomicReference<>();
    log.info("Prototype store initialized with ttl {}, max data size {}"
        + " bytes, size estimation failure policy {}", config.getTtl(),
        config.getMaxDataSizeBytes(),
        config.getSizeEstimationFailurePolicy());
  }

  /**
   * Replaces the whole snapshot with the given records.
   *
   * <p>The records are measured first; when the estimate exceeds the
   * configured limit the call fails and the previous snapshot stays in
   * place. Otherwise the id index is rebuilt, where a repeated id keeps the
   * last record, and the new snapshot is swapped in stamped with the
   * current time.
   *
   * @param records the new records, never null
   *
   * @return the size of the stored data, never null
   *
   * @throws DataSizeExceededException if the data is larger than allowed
   * @throws SizeEstimationException   if the size cannot be estimated and
   *                                   the policy is fail closed
   */
  public SetAllResult setAll(final List<Prototype> records) {
    Objects.requireNonNull(records, "records must not be null");

    final long sizeBytes = estimateSize(records);
    if (sizeBytes > config.getMaxDataSizeBytes()) {
      log.warn("Rejected snapshot of {} records: estimated size {} bytes"
          + " exceeds the limit of {} bytes", records.size(), sizeBytes,
          config.getMaxDataSizeBytes());
      throw new DataSizeExceededException(sizeBytes,
          config.getMaxDataSizeBytes());
    }

    final PrototypeSnapshot next = PrototypeSnapshot.of(records,
        clock.instant(), sizeBytes);
    if (next.duplicates() > 0) {
      log.warn("Found {} duplicate prototype ids, the last occurrence of"
          + " each was kept", next.duplicates());
    }
    current.set(next);

    log.info("Snapshot updated with {} prototypes ({} bytes)",
        next.records().size(), sizeBytes);
    return new SetAllResult(sizeBytes);
  }

  /**
   * Looks a record up by its id.
   *
   * @param prototypeId the id to look for
   *
   * @return the record, or empty when the snapshot does not hold it
   */
  public Optional<Prototype> getByPrototypeId(final int prototypeId) {
    return Optional.ofNullable(current.get().index().get(prototypeId));
  }

  /**
   * Returns the records of the current snapshot.
   *
   * <p>The returned list is the snapshot's own unmodifiable list; it is not
   * copied and is not affected by later writes.
   *
   * @return the records, never null
   */
  public List<Prototype> getAll() {
    return current.get().records();
  }

  /**
   * Returns the ids of the current snapshot, in record order.
   *
   * @return a new list of ids, never null
   */
  public List<Integer> getPrototypeIds() {
    final List<Prototype> records = current.get().records();
    final List<Integer> ids = new ArrayList<>(records.size());
    for (Prototype record : records) {
      ids.add(record.getId());
    }
    return Collections.unmodifiableList(ids);
  }

  /**
   * Returns the smallest id in the snapshot.
   *
   * @return the smallest id, or empty when there are no records
   */
  public OptionalInt getMinPrototypeId() {
    final PrototypeSnapshot snapshot = current.get();
    return snapshot.isEmpty() ? OptionalInt.empty()
        : OptionalInt.of(snapshot.minId());
  }

  /**
   * Returns the largest id in the snapshot.
   *
   * @return the largest id, or empty when there are no records
   */
  public OptionalInt getMaxPrototypeId() {
    final PrototypeSnapshot snapshot = current.get();
    return snapshot.isEmpty() ? OptionalInt.empty()
        : OptionalInt.of(snapshot.maxId());
  }

  public int size() {
    return current.get().records().size();
  }

  /**
   * Returns when the current snapshot was stored.
   *
   * @return the timestamp, or null when nothing was stored
   */
  public Instant getCachedAt() {
    return current.get().cachedAt();
  }

  public StoreConfig getConfig() {
    return config;
  }

  /**
   * Tells whether the snapshot is older than the ttl.
   *
   * <p>A snapshot is still fresh at exactly ttl and expired one instant
   * later. A store that never stored anything is expired.
   *
   * @return true if expired
   */
  public boolean isExpired() {
    return isExpired(current.get().cachedAt(), clock.instant());
  }

  public boolean isRefreshInFlight() {
    return inFlight.get() != null;
  }

  /**
   * Computes the store statistics from a single read of the snapshot.
   *
   * @return the statistics, never null
   */
  public StoreStats getStats() {
    final PrototypeSnapshot snapshot = current.get();
    final Instant now = clock.instant();
    final Instant cachedAt = snapshot.cachedAt();
    final boolean expired = isExpired(cachedAt, now);
    long remaining = 0;
    if (!expired) {
      remaining = config.getTtl().minus(elapsed(cachedAt, now)).toMillis();
    }
    return new StoreStats(snapshot.records().size(), cachedAt, expired,
        remaining, snapshot.sizeBytes(), isRefreshInFlight());
  }

  /** Drops every record and the snapshot timestamp. */
  public void clear() {
    final PrototypeSnapshot previous = current.getAndSet(
        PrototypeSnapshot.empty());
    log.info("Snapshot cleared, {} prototypes dropped",
        previous.records().size());
  }

  /**
   * Runs the given task unless another exclusive task is in flight.
   *
   * <p>When no task is running, the given task is executed on the calling
   * thread and the returned future is already complete when this method
   * returns. When a task is running, the given task is never invoked and
   * the future of the running task is returned instead, so every caller
   * observes the same result or the same failure.
   *
   * <p>A task failure is logged and completes the shared future
   * exceptionally. Either way the in-flight marker is cleared before the
   * future completes.
   *
   * @param task the task to run, never null
   * @param <R>  the type of the task result
   *
   * @return the future of the task that ran, never null
   */
  @SuppressWarnings("unchecked")
  public <R> CompletableFuture<R> runExclusive(final RefreshTask<R> task) {
    Objects.requireNonNull(task, "task must not be null");

    final CompletableFuture<R> mine = new CompletableFuture<>();
    while (!inFlight.compareAndSet(null, mine)) {
      final CompletableFuture<?> running = inFlight.get();
      if (running != null) {
        log.debug("Exclusive task already in flight, joining it");
        return (CompletableFuture<R>) running;
      }
    }

    R result = null;
    Throwable failure = null;
    try {
      result = task.run();
    } catch (final Exception e) {
      log.error("Exclusive store task failed", e);
      failure = e;
    } catch (final Error e) {
      inFlight.set(null);
      mine.completeExceptionally(e);
      throw e;
    } finally {
      inFlight.set(null);
    }

    if (failure != null) {
      mine.completeExceptionally(failure);
    } else {
      mine.complete(result);
    }
    return mine;
  }

  /**
   * Estimates the size of the given records, applying the failure policy.
   *
   * @param records the records, never null
   *
   * @return the estimate, 0 when it failed and the policy is fail open
   */
  private long estimateSize(final List<Prototype> records) {
    try {
      return sizeEstimator.estimate(records);
    } catch (final RuntimeException e) {
      if (config.getSizeEstimationFailurePolicy()
          == SizeEstimationFailurePolicy.FAIL_CLOSED) {
        log.warn("Failed to estimate snapshot data size, rejecting data", e);
        throw new SizeEstimationException(e);
      }
      log.warn("Failed to estimate snapshot data size, assuming 0 bytes", e);
      return 0;
    }
  }

  private boolean isExpired(final Instant cachedAt, final Instant now) {
    if (cachedAt == null) {
      return true;
    }
    return elapsed(cachedAt, now).compareTo(config.getTtl()) > 0;
  }

  /** The age of a snapshot, never negative when the clock moves back. */
  private static Duration elapsed(final Instant cachedAt, final Instant now) {
    final Duration elapsed = Duration.between(cachedAt, now);
    return elapsed.isNegative() ? Duration.ZERO : elapsed;
  }
}
