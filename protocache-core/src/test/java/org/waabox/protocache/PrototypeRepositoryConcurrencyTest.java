package org.waabox.protocache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import org.waabox.protocache.fetch.FetchSuccess;
import org.waabox.protocache.model.Prototype;

/**
 * Concurrency tests for {@link PrototypeRepository}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class PrototypeRepositoryConcurrencyTest {

  /** The number of reader threads. */
  private static final int READER_COUNT = 4;

  /** The number of refreshes the writer performs. */
  private static final int REFRESH_COUNT = 50;

  @Test
  void whenRefreshing_givenSetupInFlight_shouldJoinWithoutFetchingAgain()
      throws Exception {
    final CountDownLatch fetching = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);
    final AtomicInteger fetches = new AtomicInteger();

    final PrototypeRepository repository = PrototypeRepository.builder()
        .fetcher(params -> {
          fetches.incrementAndGet();
          fetching.countDown();
          try {
            release.await(5, TimeUnit.SECONDS);
          } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          return new FetchSuccess(TestPrototypes.upstreams(1, 3));
        })
        .build();

    final ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      final Future<CompletableFuture<SnapshotResult>> setup = executor.submit(
          () -> repository.setupSnapshot(FetchParams.page(0, 3)));
      assertTrue(fetching.await(5, TimeUnit.SECONDS));

      final CompletableFuture<SnapshotResult> refresh =
          repository.refreshSnapshot();
      assertFalse(refresh.isDone());
      assertTrue(repository.getStats().refreshInFlight());

      release.countDown();

      assertSame(setup.get(5, TimeUnit.SECONDS), refresh);
      assertTrue(refresh.get(5, TimeUnit.SECONDS).isOk());
      assertEquals(1, fetches.get());
      assertEquals(FetchParams.page(0, 3),
          repository.getLastFetchParams().orElseThrow());
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void whenReading_givenConcurrentRefreshes_shouldNeverSeeMixedSnapshots()
      throws Exception {
    final AtomicInteger round = new AtomicInteger();
    final PrototypeRepository repository = PrototypeRepository.builder()
        .fetcher(params -> {
          final boolean even = round.getAndIncrement() % 2 == 0;
          return new FetchSuccess(even
              ? TestPrototypes.upstreams(1, 10)
              : TestPrototypes.upstreams(101, 110));
        })
        .build();
    repository.setupSnapshot().join();

    final CountDownLatch start = new CountDownLatch(1);
    final AtomicBoolean writing = new AtomicBoolean(true);
    final AtomicBoolean mixed = new AtomicBoolean(false);
    final ExecutorService executor = Executors.newFixedThreadPool(
        READER_COUNT);
    final List<Future<?>> readers = new ArrayList<>();
    try {
      for (int r = 0; r < READER_COUNT; r++) {
        readers.add(executor.submit(() -> {
          start.await();
          while (writing.get()) {
            final List<Prototype> all = repository.getAllFromSnapshot();
            final boolean low = all.get(0).getId() < 100;
            for (Prototype prototype : all) {
              if ((prototype.getId() < 100) != low) {
                mixed.set(true);
              }
            }
          }
          return null;
        }));
      }
      start.countDown();
      for (int i = 0; i < REFRESH_COUNT; i++) {
        assertTrue(repository.refreshSnapshot().join().isOk());
      }
      writing.set(false);
      for (Future<?> reader : readers) {
        reader.get(5, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    assertFalse(mixed.get());
  }
}
