package org.waabox.protocache;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.protocache.fetch.ErrorClassifier;
import org.waabox.protocache.fetch.FetchErrorCodes;
import org.waabox.protocache.fetch.FetchFailure;
import org.waabox.protocache.fetch.FetchResult;
import org.waabox.protocache.fetch.FetchSuccess;
import org.waabox.protocache.fetch.PrototypeFetcher;
import org.waabox.protocache.metrics.NoopProtocacheMetrics;
import org.waabox.protocache.metrics.ProtocacheMetrics;
import org.waabox.protocache.model.Prototype;
import org.waabox.protocache.model.UpstreamPrototype;
import org.waabox.protocache.normalize.DefaultPrototypeNormalizer;
import org.waabox.protocache.normalize.PrototypeNormalizer;
import org.waabox.protocache.store.DataSizeExceededException;
import org.waabox.protocache.store.DataState;
import org.waabox.protocache.store.PrototypeStore;
import org.waabox.protocache.store.SetAllResult;
import org.waabox.protocache.store.SizeEstimationException;
import org.waabox.protocache.store.StoreConfig;
import org.waabox.protocache.store.StoreException;
import org.waabox.protocache.store.StoreStats;

/**
 * The entry point of the snapshot cache.
 *
 * <p>Write operations pull one page from the upstream catalog through the
 * {@link PrototypeFetcher}, normalize every record and replace the
 * snapshot held by the {@link PrototypeStore}. Read operations only look at
 * the current snapshot and never reach the network; once the ttl elapses
 * the snapshot is reported as expired but keeps being served until the
 * next successful write.
 *
 * <p>Write operations never throw for fetch or store problems. They
 * complete with a {@link SnapshotResult}, and any failure leaves the
 * previous snapshot in place. Concurrent writes are de-duplicated through
 * {@link PrototypeStore#runExclusive}: a caller arriving while a write is
 * running receives the future of that write.
 *
 * <pre>{@code
 * PrototypeRepository repository = PrototypeRepository.builder()
 *     .fetcher(new HttpPrototypeFetcher(config))
 *     .storeConfig(StoreConfig.builder().ttl(Duration.ofMinutes(5)).build())
 *     .build();
 *
 * SnapshotResult result = repository
 *     .setupSnapshot(FetchParams.page(0, 100)).join();
 * Optional<Prototype> prototype = repository
 *     .getPrototypeFromSnapshotByPrototypeId(42);
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PrototypeRepository {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(PrototypeRepository.class);

  /** Below this sample to population ratio, indices are drawn into a set
   *  instead of shuffling a copy of the whole population. */
  private static final double SET_SAMPLING_RATIO = 0.5;

  /** The snapshot store, never null. */
  private final PrototypeStore store;

  /** The upstream fetcher, never null. */
  private final PrototypeFetcher fetcher;

  /** The record normalizer, never null. */
  private final PrototypeNormalizer normalizer;

  /** The metrics reporter, never null. */
  private final ProtocacheMetrics metrics;

  /** The lifecycle listeners, never null, unmodifiable. */
  private final List<RepositoryListener> listeners;

  /** The source of randomness for the sampling reads, never null. */
  private final Random random;

  /** The parameters of the last successful setup, null until then. */
  private final AtomicReference<FetchParams> lastFetchParams;

  private PrototypeRepository(final Builder builder) {
    store = builder.store;
    fetcher = builder.fetcher;
    normalizer = builder.normalizer;
    metrics = builder.metrics;
    listeners = Collections.unmodifiableList(
        new ArrayList<>(builder.listeners));
    random = builder.random;
    lastFetchParams = new AtomicReference<>();
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
   * Fetches a page with the default parameters and stores it.
   *
   * @return the future of the operation, never null
   *
   * @see #setupSnapshot(FetchParams)
   */
  public CompletableFuture<SnapshotResult> setupSnapshot() {
    return setupSnapshot(FetchParams.none());
  }

  /**
   * Fetches a page with the given parameters and stores it.
   *
   * <p>Unset parameters are filled from {@link FetchParams#defaults()}.
   * When the operation succeeds the merged parameters are remembered and
   * later reused by {@link #refreshSnapshot()}. When another write is
   * already running, its future is returned and the given parameters are
   * ignored.
   *
   * @param params the fetch parameters, null for the defaults
   *
   * @return the future of the operation, completed with a success or a
   *         failure and never exceptionally, never null
   */
  public CompletableFuture<SnapshotResult> setupSnapshot(
      final FetchParams params) {
    final FetchParams merged = (params == null ? FetchParams.none() : params)
        .mergeOver(FetchParams.defaults());
    return store.runExclusive(() -> {
      final SnapshotResult result = execute(SnapshotOperation.SETUP, merged);
      if (result.isOk()) {
        lastFetchParams.set(merged);
      }
      return result;
    });
  }

  /**
   * Fetches a page with the parameters of the last successful setup, or the
   * defaults if there was none, and stores it.
   *
   * <p>This operation never changes the remembered parameters.
   *
   * @return the future of the operation, completed with a success or a
   *         failure and never exceptionally, never null
   */
  public CompletableFuture<SnapshotResult> refreshSnapshot() {
    return store.runExclusive(() -> {
      final FetchParams params = getLastFetchParams()
          .orElse(FetchParams.defaults());
      return execute(SnapshotOperation.REFRESH, params);
    });
  }

  /**
   * Returns the parameters of the last successful setup.
   *
   * @return the parameters, or empty if no setup succeeded yet
   */
  public Optional<FetchParams> getLastFetchParams() {
    return Optional.ofNullable(lastFetchParams.get());
  }

  /**
   * Returns every record of the current snapshot.
   *
   * @return an unmodifiable list, never null
   */
  public List<Prototype> getAllFromSnapshot() {
    return store.getAll();
  }

  /**
   * Looks a record up in the current snapshot.
   *
   * @param prototypeId the record id, must be positive
   *
   * @return the record, or empty when the snapshot does not hold it
   *
   * @throws ValidationException if prototypeId is not positive
   */
  public Optional<Prototype> getPrototypeFromSnapshotByPrototypeId(
      final int prototypeId) {
    if (prototypeId <= 0) {
      throw new ValidationException("prototypeId",
          "prototypeId must be a positive integer, got " + prototypeId);
    }
    return store.getByPrototypeId(prototypeId);
  }

  public List<Integer> getPrototypeIdsFromSnapshot() {
    return store.getPrototypeIds();
  }

  /**
   * Picks one record of the current snapshot uniformly at random.
   *
   * @return the record, or empty when the snapshot is empty
   */
  public Optional<Prototype> getRandomPrototypeFromSnapshot() {
    final List<Prototype> all = store.getAll();
    if (all.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(all.get(random.nextInt(all.size())));
  }

  /**
   * Picks distinct records of the current snapshot at random.
   *
   * <p>When size is at least the number of records, every record is
   * returned in random order.
   *
   * @param size the number of records to pick, must not be negative
   *
   * @return the picked records in random order, never null
   *
   * @throws ValidationException if size is negative
   */
  public List<Prototype> getRandomSampleFromSnapshot(final int size) {
    if (size < 0) {
      throw new ValidationException("size",
          "size must not be negative, got " + size);
    }
    final List<Prototype> all = store.getAll();
    if (size == 0 || all.isEmpty()) {
      return Collections.emptyList();
    }
    final int population = all.size();
    if (size < population * SET_SAMPLING_RATIO) {
      return sampleByIndexSet(all, size);
    }
    final List<Prototype> copy = new ArrayList<>(all);
    final int picks = Math.min(size, population);
    for (int i = 0; i < picks && i < population - 1; i++) {
      final int j = i + random.nextInt(population - i);
      Collections.swap(copy, i, j);
    }
    return Collections.unmodifiableList(new ArrayList<>(
        copy.subList(0, picks)));
  }

  /**
   * Returns the smallest and largest id of the current snapshot.
   *
   * @return the range, or empty when the snapshot is empty
   */
  public Optional<IdRange> analyzePrototypes() {
    final OptionalInt min = store.getMinPrototypeId();
    final OptionalInt max = store.getMaxPrototypeId();
    if (min.isEmpty() || max.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new IdRange(min.getAsInt(), max.getAsInt()));
  }

  public StoreStats getStats() {
    return store.getStats();
  }

  public StoreConfig getConfig() {
    return store.getConfig();
  }

  /**
   * Runs the fetch, normalize and store pipeline, reporting to listeners
   * and metrics.
   *
   * @param operation the operation being run, never null
   * @param params    the merged parameters, never null
   *
   * @return the result, never null
   */
  private SnapshotResult execute(final SnapshotOperation operation,
      final FetchParams params) {
    notifyListeners(listener -> listener.snapshotStarted(operation));
    log.debug("Snapshot {} started with {}", operation, params);
    final long start = System.nanoTime();

    final SnapshotResult result = fetchAndStore(params);
    final long durationMs = (System.nanoTime() - start) / 1_000_000;

    if (result instanceof SnapshotSuccess success) {
      final StoreStats stats = success.stats();
      log.info("Snapshot {} stored {} prototypes ({} bytes) in {}ms",
          operation, stats.size(), stats.dataSizeBytes(), durationMs);
      report(() -> metrics.snapshotRefreshed(operation, durationMs,
          stats.size()));
      report(() -> metrics.snapshotSizeReported(stats.dataSizeBytes()));
      notifyListeners(listener -> listener.snapshotCompleted(operation,
          stats));
    } else {
      final SnapshotFailure failure = (SnapshotFailure) result;
      log.warn("Snapshot {} failed after {}ms: origin={}, kind={}, code={},"
          + " message={}", operation, durationMs, failure.origin(),
          failure.kind().code(), failure.code(), failure.message());
      report(() -> metrics.snapshotFailed(operation, failure.kind()));
      notifyListeners(listener -> listener.snapshotFailed(operation,
          failure));
    }
    return result;
  }

  private SnapshotResult fetchAndStore(final FetchParams params) {
    FetchResult fetched;
    try {
      fetched = fetcher.fetchPage(params);
    } catch (final RuntimeException e) {
      fetched = ErrorClassifier.classify(e);
    }
    if (fetched == null) {
      fetched = ErrorClassifier.classify(null);
    }
    if (fetched instanceof FetchFailure failure) {
      return SnapshotFailure.fromFetch(failure);
    }

    final List<UpstreamPrototype> upstream =
        ((FetchSuccess) fetched).prototypes();
    final List<Prototype> normalized = new ArrayList<>(upstream.size());
    try {
      for (UpstreamPrototype record : upstream) {
        if (record == null) {
          log.warn("Skipping null prototype in upstream response");
          continue;
        }
        if (record.getId() <= 0) {
          log.warn("Skipping upstream prototype without a valid id: {}",
              record);
          continue;
        }
        normalized.add(normalizer.normalize(record));
      }
    } catch (final RuntimeException e) {
      return new SnapshotFailure(FailureOrigin.UNKNOWN, FailureKind.UNKNOWN,
          FetchErrorCodes.UNKNOWN, "Failed to normalize prototypes: "
          + e.getMessage(), null, FailureDetails.empty(),
          DataState.UNCHANGED, e);
    }

    try {
      final SetAllResult stored = store.setAll(normalized);
      log.debug("Stored {} bytes of prototype data",
          stored.dataSizeBytes());
      return new SnapshotSuccess(store.getStats());
    } catch (final DataSizeExceededException e) {
      return storeFailure(FailureKind.STORAGE_LIMIT,
          SnapshotFailure.STORE_CAPACITY_EXCEEDED, e, e.getDataState());
    } catch (final SizeEstimationException e) {
      return storeFailure(FailureKind.SERIALIZATION,
          SnapshotFailure.STORE_SERIALIZATION_FAILED, e, e.getDataState());
    } catch (final StoreException e) {
      return storeFailure(FailureKind.UNKNOWN,
          SnapshotFailure.STORE_UNKNOWN, e, e.getDataState());
    } catch (final RuntimeException e) {
      return storeFailure(FailureKind.UNKNOWN,
          SnapshotFailure.STORE_UNKNOWN, e, DataState.UNKNOWN);
    }
  }

  private static SnapshotFailure storeFailure(final FailureKind kind,
      final String code, final RuntimeException error,
      final DataState dataState) {
    final String message = error.getMessage() != null
        ? error.getMessage() : error.getClass().getName();
    return new SnapshotFailure(FailureOrigin.STORE, kind, code, message,
        null, FailureDetails.empty(), dataState, error);
  }

  private List<Prototype> sampleByIndexSet(final List<Prototype> all,
      final int size) {
    final Set<Integer> picked = new LinkedHashSet<>();
    while (picked.size() < size) {
      picked.add(random.nextInt(all.size()));
    }
    final List<Prototype> sample = new ArrayList<>(size);
    for (Integer index : picked) {
      sample.add(all.get(index));
    }
    return Collections.unmodifiableList(sample);
  }

  private void notifyListeners(
      final Consumer<RepositoryListener> event) {
    for (RepositoryListener listener : listeners) {
      try {
        event.accept(listener);
      } catch (final RuntimeException e) {
        log.warn("Repository listener {} failed: {}",
            listener.getClass().getName(), e.getMessage(), e);
      }
    }
  }

  private void report(final Runnable metric) {
    try {
      metric.run();
    } catch (final RuntimeException e) {
      log.warn("Metrics reporter failed: {}", e.getMessage(), e);
    }
  }

  /**
   * Fluent builder for {@link PrototypeRepository}.
   *
   * <p>Only the fetcher is required. The store defaults to one built from
   * the store config, which itself defaults to {@link
   * StoreConfig#defaults()}; the normalizer defaults to
   * {@link DefaultPrototypeNormalizer} and the metrics to
   * {@link NoopProtocacheMetrics}.
   */
  public static final class Builder {

    /** The required fetcher. */
    private PrototypeFetcher fetcher;

    /** The optional store. */
    private PrototypeStore store;

    /** The optional store config, used when no store is given. */
    private StoreConfig storeConfig;

    /** The optional normalizer. */
    private PrototypeNormalizer normalizer;

    /** The optional metrics reporter. */
    private ProtocacheMetrics metrics;

    /** The optional source of randomness. */
    private Random random;

    /** The registered listeners. */
    private final List<RepositoryListener> listeners = new ArrayList<>();

    private Builder() {
    }

    /**
     * Sets the upstream fetcher.
     *
     * @param theFetcher the fetcher, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder fetcher(final PrototypeFetcher theFetcher) {
      Objects.requireNonNull(theFetcher, "fetcher must not be null");
      fetcher = theFetcher;
      return this;
    }

    /**
     * Sets the store. Takes precedence over {@link #storeConfig}.
     *
     * @param theStore the store, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder store(final PrototypeStore theStore) {
      Objects.requireNonNull(theStore, "store must not be null");
      store = theStore;
      return this;
    }

    /**
     * Sets the configuration of the store created by this builder.
     *
     * @param theStoreConfig the store config, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder storeConfig(final StoreConfig theStoreConfig) {
      Objects.requireNonNull(theStoreConfig, "storeConfig must not be null");
      storeConfig = theStoreConfig;
      return this;
    }

    public Builder normalizer(final PrototypeNormalizer theNormalizer) {
      Objects.requireNonNull(theNormalizer, "normalizer must not be null");
      normalizer = theNormalizer;
      return this;
    }

    public Builder metrics(final ProtocacheMetrics theMetrics) {
      Objects.requireNonNull(theMetrics, "metrics must not be null");
      metrics = theMetrics;
      return this;
    }

    /**
     * Sets the source of randomness used by the sampling reads.
     *
     * @param theRandom the random, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder random(final Random theRandom) {
      Objects.requireNonNull(theRandom, "random must not be null");
      random = theRandom;
      return this;
    }

    /**
     * Registers a lifecycle listener.
     *
     * @param theListener the listener, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder listener(final RepositoryListener theListener) {
      Objects.requireNonNull(theListener, "listener must not be null");
      listeners.add(theListener);
      return this;
    }

    /**
     * Builds the repository.
     *
     * @return the repository, never null
     *
     * @throws IllegalStateException if no fetcher was set
     */
    public PrototypeRepository build() {
      if (fetcher == null) {
        throw new IllegalStateException("fetcher must be set");
      }
      if (store == null) {
        store = new PrototypeStore(storeConfig == null
            ? StoreConfig.defaults() : storeConfig);
      }
      if (normalizer == null) {
        normalizer = new DefaultPrototypeNormalizer();
      }
      if (metrics == null) {
        metrics = new NoopProtocacheMetrics();
      }
      if (random == null) {
        random = new Random();
      }
      return new PrototypeRepository(this);
    }
  }
}
