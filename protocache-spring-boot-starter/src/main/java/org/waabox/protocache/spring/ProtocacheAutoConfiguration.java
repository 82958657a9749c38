package org.waabox.protocache.spring;

import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;

import org.waabox.protocache.FetchParams;
import org.waabox.protocache.PrototypeRepository;
import org.waabox.protocache.RepositoryListener;
import org.waabox.protocache.SnapshotFailure;
import org.waabox.protocache.SnapshotResult;
import org.waabox.protocache.fetch.PrototypeFetcher;
import org.waabox.protocache.fetch.http.HttpFetcherConfig;
import org.waabox.protocache.fetch.http.HttpPrototypeFetcher;
import org.waabox.protocache.metrics.ProtocacheMetrics;
import org.waabox.protocache.normalize.DefaultPrototypeNormalizer;
import org.waabox.protocache.normalize.PrototypeNormalizer;
import org.waabox.protocache.store.PrototypeStore;
import org.waabox.protocache.store.StoreConfig;

/**
 * Spring Boot auto-configuration for the Protocache snapshot cache.
 *
 * <p>This configuration creates a singleton {@link PrototypeRepository}
 * backed by a {@link PrototypeStore} configured from
 * {@link ProtocacheProperties}. The upstream is reached through the
 * {@link PrototypeFetcher} bean of the application context; when there is
 * none and {@code protocache.api.base-url} is set, an
 * {@link HttpPrototypeFetcher} is created. Optional
 * {@link ProtocacheMetrics} and {@link RepositoryListener} beans are wired
 * when present.
 *
 * <p>The first snapshot is loaded through Spring's {@link SmartLifecycle}
 * when {@code protocache.setup-on-start} is enabled.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@EnableConfigurationProperties(ProtocacheProperties.class)
public class ProtocacheAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      ProtocacheAutoConfiguration.class);

  /**
   * Creates the store configuration from the properties.
   *
   * @param properties the configuration properties, never null
   *
   * @return the validated store configuration, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public StoreConfig protocacheStoreConfig(
      final ProtocacheProperties properties) {
    return StoreConfig.builder()
        .ttl(properties.getTtl())
        .maxDataSizeBytes(properties.getMaxDataSizeBytes())
        .sizeEstimationFailurePolicy(
            properties.getSizeEstimationFailurePolicy())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public PrototypeStore prototypeStore(final StoreConfig storeConfig) {
    return new PrototypeStore(storeConfig);
  }

  @Bean
  @ConditionalOnMissingBean
  public PrototypeNormalizer prototypeNormalizer() {
    return new DefaultPrototypeNormalizer();
  }

  /**
   * Creates the HTTP fetcher for the configured upstream API.
   *
   * @param properties the configuration properties, never null
   *
   * @return the fetcher, never null
   */
  @Bean
  @ConditionalOnMissingBean(PrototypeFetcher.class)
  @ConditionalOnProperty(prefix = "protocache.api", name = "base-url")
  public HttpPrototypeFetcher httpPrototypeFetcher(
      final ProtocacheProperties properties) {
    final ProtocacheProperties.Api api = properties.getApi();
    final HttpFetcherConfig config = HttpFetcherConfig.builder()
        .baseUrl(api.getBaseUrl())
        .token(api.getToken())
        .timeout(api.getTimeout())
        .userAgent(api.getUserAgent())
        .build();
    log.info("Protocache fetching from {}", config.baseUrl());
    return new HttpPrototypeFetcher(config);
  }

  /**
   * Creates the singleton {@link PrototypeRepository} bean.
   *
   * @param fetcherProvider  provider for the PrototypeFetcher bean
   * @param store            the store, never null
   * @param normalizer       the normalizer, never null
   * @param metricsProvider  provider for an optional ProtocacheMetrics bean
   * @param listeners        the repository listeners, may be empty
   *
   * @return the repository, never null
   *
   * @throws IllegalStateException if there is not exactly one fetcher
   */
  @Bean
  @ConditionalOnMissingBean
  public PrototypeRepository prototypeRepository(
      final ObjectProvider<PrototypeFetcher> fetcherProvider,
      final PrototypeStore store,
      final PrototypeNormalizer normalizer,
      final ObjectProvider<ProtocacheMetrics> metricsProvider,
      final ObjectProvider<RepositoryListener> listeners) {

    final List<String> fetchers = fetcherProvider.orderedStream()
        .map(fetcher -> fetcher.getClass().getSimpleName())
        .collect(Collectors.toList());
    if (fetchers.size() != 1) {
      throw new IllegalStateException("Protocache requires exactly one "
          + "PrototypeFetcher bean (or protocache.api.base-url), but found "
          + fetchers.size() + (fetchers.isEmpty() ? ""
              : ": " + String.join(", ", fetchers)));
    }

    final PrototypeRepository.Builder builder = PrototypeRepository.builder()
        .fetcher(fetcherProvider.getObject())
        .store(store)
        .normalizer(normalizer);

    metricsProvider.ifAvailable(metrics -> {
      builder.metrics(metrics);
      log.info("Protocache using custom ProtocacheMetrics: {}",
          metrics.getClass().getSimpleName());
    });

    listeners.orderedStream().forEach(listener -> {
      builder.listener(listener);
      log.debug("Registered RepositoryListener: {}",
          listener.getClass().getSimpleName());
    });

    log.info("Protocache repository created with {}", store.getConfig());
    return builder.build();
  }

  /**
   * Creates a {@link SmartLifecycle} bean that loads the first snapshot.
   *
   * <p>The lifecycle starts late (phase {@code Integer.MAX_VALUE - 1}) so
   * every other bean is ready. A failed first load is logged and the
   * application keeps running with an empty snapshot. On stop, the
   * requests of an {@link HttpPrototypeFetcher} still in flight are
   * cancelled.
   *
   * @param repository      the repository, never null
   * @param properties      the configuration properties, never null
   * @param fetcherProvider provider for the PrototypeFetcher bean
   *
   * @return the lifecycle bean, never null
   */
  @Bean
  public SmartLifecycle protocacheLifecycle(
      final PrototypeRepository repository,
      final ProtocacheProperties properties,
      final ObjectProvider<PrototypeFetcher> fetcherProvider) {
    return new SmartLifecycle() {

      /** Whether the lifecycle is currently running. */
      private volatile boolean running = false;

      @Override
      public void start() {
        if (properties.isSetupOnStart()) {
          final FetchParams params = FetchParams.page(
              properties.getInitialOffset(), properties.getInitialLimit());
          log.info("Loading the first Protocache snapshot with {}", params);
          final SnapshotResult result = repository.setupSnapshot(params)
              .join();
          if (result instanceof SnapshotFailure failure) {
            log.warn("First Protocache snapshot failed: {} ({}), serving "
                + "an empty snapshot", failure.message(), failure.code());
          } else {
            log.info("First Protocache snapshot loaded with {} prototypes",
                repository.getStats().size());
          }
        }
        running = true;
      }

      @Override
      public void stop() {
        fetcherProvider.ifAvailable(fetcher -> {
          if (fetcher instanceof HttpPrototypeFetcher http) {
            http.cancelAll();
          }
        });
        running = false;
        log.info("Protocache lifecycle stopped.");
      }

      @Override
      public boolean isRunning() {
        return running;
      }

      @Override
      public int getPhase() {
        return Integer.MAX_VALUE - 1;
      }
    };
  }
}
