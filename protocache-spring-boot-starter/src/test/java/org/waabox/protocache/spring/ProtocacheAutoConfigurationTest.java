package org.waabox.protocache.spring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import org.waabox.protocache.FailureKind;
import org.waabox.protocache.FetchParams;
import org.waabox.protocache.PrototypeRepository;
import org.waabox.protocache.RepositoryListener;
import org.waabox.protocache.SnapshotOperation;
import org.waabox.protocache.fetch.FetchFailure;
import org.waabox.protocache.fetch.FetchSuccess;
import org.waabox.protocache.fetch.PrototypeFetcher;
import org.waabox.protocache.fetch.http.HttpPrototypeFetcher;
import org.waabox.protocache.model.UpstreamPrototype;
import org.waabox.protocache.store.SizeEstimationFailurePolicy;
import org.waabox.protocache.store.StoreConfig;
import org.waabox.protocache.store.StoreStats;

/**
 * Tests for {@link ProtocacheAutoConfiguration}.
 *
 * <p>Uses {@link ApplicationContextRunner} for fast, isolated testing
 * of the auto-configuration without bootstrapping a full Spring Boot
 * application.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ProtocacheAutoConfigurationTest {

  /** The application context runner configured with the auto-configuration. */
  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(
          AutoConfigurations.of(ProtocacheAutoConfiguration.class));

  @Test
  void whenContextLoads_givenNoFetcher_shouldFailToStart() {
    runner.run(context -> {
      final Throwable failure = context.getStartupFailure();
      assertNotNull(failure);
      Throwable root = failure;
      while (root.getCause() != null) {
        root = root.getCause();
      }
      assertInstanceOf(IllegalStateException.class, root);
      assertTrue(root.getMessage().contains("PrototypeFetcher"));
    });
  }

  /**
   * Verifies that the first snapshot is loaded on start with the
   * configured page.
   */
  @Test
  void whenContextLoads_givenFetcherBean_shouldLoadFirstSnapshot() {
    runner.withUserConfiguration(RecordingFetcherConfig.class)
        .withPropertyValues("protocache.initial-offset=20",
            "protocache.initial-limit=3")
        .run(context -> {
          final PrototypeRepository repository =
              context.getBean(PrototypeRepository.class);

          assertEquals(3, repository.getAllFromSnapshot().size());
          assertEquals(List.of(FetchParams.page(20, 3)),
              context.getBean(RecordingFetcher.class).calls);
          assertEquals(FetchParams.page(20, 3),
              repository.getLastFetchParams().orElseThrow());
        });
  }

  @Test
  void whenContextLoads_givenSetupOnStartDisabled_shouldNotFetch() {
    runner.withUserConfiguration(RecordingFetcherConfig.class)
        .withPropertyValues("protocache.setup-on-start=false")
        .run(context -> {
          final PrototypeRepository repository =
              context.getBean(PrototypeRepository.class);

          assertTrue(repository.getAllFromSnapshot().isEmpty());
          assertTrue(context.getBean(RecordingFetcher.class).calls.isEmpty());
          assertTrue(repository.getLastFetchParams().isEmpty());
        });
  }

  @Test
  void whenContextLoads_givenFailingFetcher_shouldStartWithEmptySnapshot() {
    runner.withUserConfiguration(FailingFetcherConfig.class)
        .run(context -> {
          final PrototypeRepository repository =
              context.getBean(PrototypeRepository.class);

          assertTrue(repository.getAllFromSnapshot().isEmpty());
          assertTrue(repository.getStats().expired());
        });
  }

  @Test
  void whenContextLoads_givenStoreProperties_shouldConfigureStore() {
    runner.withUserConfiguration(RecordingFetcherConfig.class)
        .withPropertyValues("protocache.ttl=5m",
            "protocache.max-data-size-bytes=2048",
            "protocache.size-estimation-failure-policy=fail-closed",
            "protocache.setup-on-start=false")
        .run(context -> {
          final StoreConfig config = context.getBean(StoreConfig.class);

          assertEquals(Duration.ofMinutes(5), config.getTtl());
          assertEquals(2048L, config.getMaxDataSizeBytes());
          assertEquals(SizeEstimationFailurePolicy.FAIL_CLOSED,
              config.getSizeEstimationFailurePolicy());
          assertEquals(config,
              context.getBean(PrototypeRepository.class).getConfig());
        });
  }

  @Test
  void whenContextLoads_givenLimitAboveCeiling_shouldFailToStart() {
    runner.withUserConfiguration(RecordingFetcherConfig.class)
        .withPropertyValues("protocache.max-data-size-bytes=999999999")
        .run(context -> assertNotNull(context.getStartupFailure()));
  }

  @Test
  void whenContextLoads_givenBaseUrl_shouldCreateHttpFetcher() {
    runner.withPropertyValues(
            "protocache.api.base-url=http://127.0.0.1:1/v2/api/",
            "protocache.api.token=secret",
            "protocache.api.timeout=3s",
            "protocache.setup-on-start=false")
        .run(context -> {
          final HttpPrototypeFetcher fetcher =
              context.getBean(HttpPrototypeFetcher.class);

          assertEquals("http://127.0.0.1:1/v2/api",
              fetcher.getConfig().baseUrl());
          assertEquals("secret", fetcher.getConfig().token().orElseThrow());
          assertEquals(Duration.ofSeconds(3), fetcher.getConfig().timeout());
          assertNotNull(context.getBean(PrototypeRepository.class));
        });
  }

  @Test
  void whenContextLoads_givenBaseUrlAndFetcherBean_shouldKeepTheBean() {
    runner.withUserConfiguration(RecordingFetcherConfig.class)
        .withPropertyValues(
            "protocache.api.base-url=http://127.0.0.1:1/v2/api",
            "protocache.setup-on-start=false")
        .run(context -> {
          assertFalse(context.containsBean("httpPrototypeFetcher"));
          assertEquals(1, context.getBeansOfType(PrototypeFetcher.class)
              .size());
        });
  }

  /**
   * Verifies that listener beans are registered and notified by the
   * first load.
   */
  @Test
  void whenContextLoads_givenListenerBean_shouldNotifyIt() {
    runner.withUserConfiguration(RecordingFetcherConfig.class,
            ListenerConfig.class)
        .run(context -> {
          final RecordingListener listener =
              context.getBean(RecordingListener.class);

          assertEquals(List.of("started:SETUP", "completed:SETUP:10"),
              listener.events);
        });
  }

  @Configuration(proxyBeanMethods = false)
  static class RecordingFetcherConfig {

    @Bean
    RecordingFetcher recordingFetcher() {
      return new RecordingFetcher();
    }
  }

  @Configuration(proxyBeanMethods = false)
  static class FailingFetcherConfig {

    @Bean
    PrototypeFetcher failingFetcher() {
      return params -> new FetchFailure(FailureKind.NETWORK, "ECONNREFUSED",
          "connection refused", null, null);
    }
  }

  @Configuration(proxyBeanMethods = false)
  static class ListenerConfig {

    @Bean
    RecordingListener recordingListener() {
      return new RecordingListener();
    }
  }

  /** A fetcher returning as many records as the requested limit. */
  static class RecordingFetcher implements PrototypeFetcher {

    /** The parameters of every call. */
    private final List<FetchParams> calls = new ArrayList<>();

    /** {@inheritDoc} */
    @Override
    public synchronized FetchSuccess fetchPage(final FetchParams params) {
      calls.add(params);
      final int limit = params.limit() == null
          ? FetchParams.DEFAULT_LIMIT : params.limit();
      final List<UpstreamPrototype> page = new ArrayList<>();
      for (int i = 1; i <= limit; i++) {
        page.add(UpstreamPrototype.builder(i).prototypeNm("Prototype " + i)
            .build());
      }
      return new FetchSuccess(page);
    }
  }

  /** A listener that records the events it receives. */
  static class RecordingListener implements RepositoryListener {

    /** The received events, in order. */
    private final List<String> events = new ArrayList<>();

    @Override
    public void snapshotStarted(final SnapshotOperation operation) {
      events.add("started:" + operation);
    }

    @Override
    public void snapshotCompleted(final SnapshotOperation operation,
        final StoreStats stats) {
      events.add("completed:" + operation + ":" + stats.size());
    }
  }
}
