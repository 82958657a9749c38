package org.waabox.protocache.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

/**
 * Concurrency tests for {@link PrototypeStore#runExclusive(RefreshTask)}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class PrototypeStoreExclusiveTest {

  /** The number of callers racing for the exclusive slot. */
  private static final int CALLER_COUNT = 8;

  @Test
  void whenRunningExclusive_givenIdleStore_shouldRunOnCallerThread()
      throws Exception {
    final PrototypeStore store = new PrototypeStore();
    final Thread caller = Thread.currentThread();

    final CompletableFuture<Boolean> future = store.runExclusive(
        () -> Thread.currentThread() == caller);

    assertTrue(future.isDone());
    assertTrue(future.get());
    assertFalse(store.isRefreshInFlight());
  }

  @Test
  void whenRunningExclusive_givenTaskInFlight_shouldShareItsFuture()
      throws Exception {
    final PrototypeStore store = new PrototypeStore();
    final CountDownLatch started = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);
    final AtomicInteger secondInvocations = new AtomicInteger();

    final ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      final Future<CompletableFuture<String>> first = executor.submit(
          () -> store.runExclusive(() -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return "first";
          }));

      assertTrue(started.await(5, TimeUnit.SECONDS));
      assertTrue(store.isRefreshInFlight());
      assertTrue(store.getStats().refreshInFlight());

      final CompletableFuture<String> second = store.runExclusive(() -> {
        secondInvocations.incrementAndGet();
        return "second";
      });
      assertFalse(second.isDone());

      release.countDown();

      assertSame(first.get(5, TimeUnit.SECONDS), second);
      assertEquals("first", second.get(5, TimeUnit.SECONDS));
      assertEquals(0, secondInvocations.get());
      assertFalse(store.isRefreshInFlight());
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void whenRunningExclusive_givenManyConcurrentCallers_shouldRunTaskOnce()
      throws Exception {
    final PrototypeStore store = new PrototypeStore();
    final AtomicInteger invocations = new AtomicInteger();
    final CountDownLatch go = new CountDownLatch(1);
    final CountDownLatch allArrived = new CountDownLatch(CALLER_COUNT - 1);
    final CountDownLatch running = new CountDownLatch(1);

    final ExecutorService executor = Executors.newFixedThreadPool(
        CALLER_COUNT);
    try {
      final Future<CompletableFuture<Integer>> owner = executor.submit(
          () -> store.runExclusive(() -> {
            running.countDown();
            go.await(5, TimeUnit.SECONDS);
            return invocations.incrementAndGet();
          }));
      assertTrue(running.await(5, TimeUnit.SECONDS));

      final List<Future<CompletableFuture<Integer>>> joiners =
          new ArrayList<>();
      for (int i = 0; i < CALLER_COUNT - 1; i++) {
        joiners.add(executor.submit(() -> {
          final CompletableFuture<Integer> joined = store.runExclusive(
              invocations::incrementAndGet);
          allArrived.countDown();
          return joined;
        }));
      }
      assertTrue(allArrived.await(5, TimeUnit.SECONDS));
      go.countDown();

      final CompletableFuture<Integer> shared = owner.get(5,
          TimeUnit.SECONDS);
      for (Future<CompletableFuture<Integer>> joiner : joiners) {
        assertSame(shared, joiner.get(5, TimeUnit.SECONDS));
      }
      assertEquals(1, (int) shared.get(5, TimeUnit.SECONDS));
      assertEquals(1, invocations.get());
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void whenRunningExclusive_givenFailingTask_shouldPropagateAndClearMarker()
      throws Exception {
    final PrototypeStore store = new PrototypeStore();

    final CompletableFuture<String> failed = store.runExclusive(() -> {
      throw new IllegalStateException("upstream exploded");
    });

    assertTrue(failed.isCompletedExceptionally());
    final ExecutionException error = assertThrows(ExecutionException.class,
        failed::get);
    assertTrue(error.getCause() instanceof IllegalStateException);
    assertEquals("upstream exploded", error.getCause().getMessage());
    assertFalse(store.isRefreshInFlight());

    final CompletableFuture<String> next = store.runExclusive(() -> "again");
    assertEquals("again", next.get());
  }
}
