package org.waabox.protocache.fetch.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.OutputStream;
import java.net.Authenticator;
import java.net.CookieHandler;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.ServerSocket;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import org.waabox.protocache.FailureKind;
import org.waabox.protocache.FetchParams;
import org.waabox.protocache.fetch.FetchErrorCodes;
import org.waabox.protocache.fetch.FetchFailure;
import org.waabox.protocache.fetch.FetchResult;
import org.waabox.protocache.fetch.FetchSuccess;
import org.waabox.protocache.model.UpstreamPrototype;

/**
 * Integration tests for {@link HttpPrototypeFetcher}.
 *
 * <p>These tests start a real HTTP server on localhost, bound to an
 * ephemeral port.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class HttpPrototypeFetcherTest {

  /** A listing with two records and unknown extra fields. */
  private static final String LISTING = "{\"metadata\":{\"title\":\"x\"},"
      + "\"count\":2,\"results\":["
      + "{\"id\":1,\"prototypeNm\":\"Lamp\",\"tags\":\"iot|maker\","
      + "\"status\":1,\"createDate\":\"2024-05-01 10:00:00.0\","
      + "\"extra\":true},"
      + "{\"id\":2,\"prototypeNm\":\"Robot\",\"status\":3}]}";

  /** The server, started by each test. */
  private HttpServer server;

  /** Released when a blocking handler may answer. */
  private final CountDownLatch release = new CountDownLatch(1);

  @AfterEach
  void tearDown() {
    release.countDown();
    if (server != null) {
      server.stop(0);
    }
  }

  private String start(final HttpHandler handler) throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(HttpPrototypeFetcher.LIST_PATH, handler);
    server.setExecutor(Executors.newCachedThreadPool());
    server.start();
    return "http://127.0.0.1:" + server.getAddress().getPort() + "/v2/api";
  }

  private static void respond(final HttpExchange exchange, final int status,
      final String body) throws IOException {
    final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().add("Content-Type", "application/json");
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }

  private static HttpPrototypeFetcher fetcher(final String baseUrl,
      final Duration timeout) {
    return new HttpPrototypeFetcher(HttpFetcherConfig.builder()
        .baseUrl(baseUrl)
        .token("secret")
        .timeout(timeout)
        .build());
  }

  @Test
  void whenFetching_givenListing_shouldDecodeResultsAndSendHeaders()
      throws Exception {
    final AtomicReference<HttpExchange> seen = new AtomicReference<>();
    final String baseUrl = start(exchange -> {
      seen.set(exchange);
      respond(exchange, 200, LISTING);
    });

    final FetchResult result = fetcher(baseUrl, Duration.ofSeconds(5))
        .fetchPage(FetchParams.page(0, 2).withPrototypeId(1));

    final FetchSuccess success = assertInstanceOf(FetchSuccess.class,
        result);
    final List<UpstreamPrototype> prototypes = success.prototypes();
    assertEquals(2, prototypes.size());
    assertEquals(1, prototypes.get(0).getId());
    assertEquals("Lamp", prototypes.get(0).getPrototypeNm());
    assertEquals("iot|maker", prototypes.get(0).getTags());
    assertEquals("Robot", prototypes.get(1).getPrototypeNm());

    final HttpExchange exchange = seen.get();
    assertEquals("GET", exchange.getRequestMethod());
    assertEquals("/v2/api/prototype/list",
        exchange.getRequestURI().getPath());
    assertEquals("offset=0&limit=2&prototypeId=1",
        exchange.getRequestURI().getQuery());
    assertEquals("Bearer secret",
        exchange.getRequestHeaders().getFirst("Authorization"));
    assertEquals(HttpFetcherConfig.DEFAULT_USER_AGENT,
        exchange.getRequestHeaders().getFirst("User-Agent"));
  }

  @Test
  void whenFetching_givenNotFound_shouldReturnHttpFailure() throws Exception {
    final String baseUrl = start(exchange ->
        respond(exchange, 404, "{\"message\":\"nope\"}"));

    final FetchResult result = fetcher(baseUrl, Duration.ofSeconds(5))
        .fetchPage(FetchParams.defaults());

    final FetchFailure failure = assertInstanceOf(FetchFailure.class, result);
    assertEquals(FailureKind.HTTP, failure.kind());
    assertEquals(FetchErrorCodes.CLIENT_NOT_FOUND, failure.code());
    assertEquals(Integer.valueOf(404), failure.status());
    assertEquals("Not Found",
        failure.details().getStatusText().orElseThrow());
    assertEquals("GET", failure.details().getRequestMethod().orElseThrow());
    assertTrue(failure.details().getRequestUrl().orElseThrow()
        .endsWith("/prototype/list?offset=0&limit=10"));
  }

  @Test
  void whenFetching_givenServerError_shouldMapServerCode() throws Exception {
    final String baseUrl = start(exchange -> respond(exchange, 503, "{}"));

    final FetchFailure failure = assertInstanceOf(FetchFailure.class,
        fetcher(baseUrl, Duration.ofSeconds(5))
            .fetchPage(FetchParams.defaults()));

    assertEquals(FetchErrorCodes.SERVER_SERVICE_UNAVAILABLE, failure.code());
    assertEquals("Service Unavailable",
        failure.details().getStatusText().orElseThrow());
  }

  @Test
  void whenFetching_givenSlowServer_shouldReturnTimeoutFailure()
      throws Exception {
    final String baseUrl = start(exchange -> {
      try {
        release.await(5, TimeUnit.SECONDS);
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      respond(exchange, 200, LISTING);
    });

    final long start = System.nanoTime();
    final FetchResult result = fetcher(baseUrl, Duration.ofMillis(200))
        .fetchPage(FetchParams.defaults());
    final long elapsedMs = TimeUnit.NANOSECONDS.toMillis(
        System.nanoTime() - start);

    final FetchFailure failure = assertInstanceOf(FetchFailure.class, result);
    assertEquals(FailureKind.TIMEOUT, failure.kind());
    assertEquals(FetchErrorCodes.TIMEOUT, failure.code());
    assertTrue(elapsedMs < 4_000, "took " + elapsedMs + " ms");
  }

  @Test
  void whenFetching_givenNothingListening_shouldReturnNetworkFailure()
      throws Exception {
    final int port;
    try (ServerSocket socket = new ServerSocket(0)) {
      port = socket.getLocalPort();
    }

    final FetchResult result = fetcher("http://127.0.0.1:" + port,
        Duration.ofSeconds(5)).fetchPage(FetchParams.defaults());

    final FetchFailure failure = assertInstanceOf(FetchFailure.class, result);
    assertEquals(FailureKind.NETWORK, failure.kind());
    assertEquals("ECONNREFUSED", failure.code());
    assertEquals("ECONNREFUSED", failure.details().getCode().orElseThrow());
  }

  @Test
  void whenCancelling_givenRequestInFlight_shouldReturnAbortFailure()
      throws Exception {
    final CountDownLatch received = new CountDownLatch(1);
    final String baseUrl = start(exchange -> {
      received.countDown();
      try {
        release.await(5, TimeUnit.SECONDS);
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      respond(exchange, 200, LISTING);
    });
    final HttpPrototypeFetcher fetcher = fetcher(baseUrl,
        Duration.ofSeconds(10));

    final ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      final Future<FetchResult> pending = executor.submit(
          () -> fetcher.fetchPage(FetchParams.defaults()));
      assertTrue(received.await(5, TimeUnit.SECONDS));

      final long deadline = System.nanoTime()
          + TimeUnit.SECONDS.toNanos(5);
      int cancelled = 0;
      while (cancelled == 0 && System.nanoTime() < deadline) {
        cancelled = fetcher.cancelAll();
      }
      assertEquals(1, cancelled);

      final FetchFailure failure = assertInstanceOf(FetchFailure.class,
          pending.get(5, TimeUnit.SECONDS));
      assertEquals(FailureKind.ABORT, failure.kind());
      assertEquals(FetchErrorCodes.ABORTED, failure.code());
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void whenCancelling_givenRequestBeingSent_shouldAbortIt() {
    final AtomicReference<HttpPrototypeFetcher> fetcher =
        new AtomicReference<>();
    final SendingHttpClient client = new SendingHttpClient(
        () -> assertEquals(1, fetcher.get().cancelAll()));
    fetcher.set(new HttpPrototypeFetcher(HttpFetcherConfig.builder()
        .baseUrl("http://127.0.0.1:1")
        .timeout(Duration.ofSeconds(10))
        .build(), client));

    final FetchFailure failure = assertInstanceOf(FetchFailure.class,
        fetcher.get().fetchPage(FetchParams.defaults()));

    assertEquals(FailureKind.ABORT, failure.kind());
    assertEquals(FetchErrorCodes.ABORTED, failure.code());
    assertTrue(client.sent.isCancelled());
  }

  @Test
  void whenCancelling_givenNothingInFlight_shouldCancelNothing() {
    final HttpPrototypeFetcher fetcher = fetcher("http://127.0.0.1:1",
        Duration.ofSeconds(1));

    assertEquals(0, fetcher.cancelAll());
  }

  @Test
  void whenFetching_givenResultsNotAnArray_shouldReturnEmptySuccess()
      throws Exception {
    final String baseUrl = start(exchange ->
        respond(exchange, 200, "{\"count\":0,\"results\":{}}"));

    final FetchSuccess success = assertInstanceOf(FetchSuccess.class,
        fetcher(baseUrl, Duration.ofSeconds(5))
            .fetchPage(FetchParams.defaults()));

    assertTrue(success.prototypes().isEmpty());
  }

  @Test
  void whenFetching_givenMalformedBody_shouldReturnUnknownFailure()
      throws Exception {
    final String baseUrl = start(exchange ->
        respond(exchange, 200, "<html>oops</html>"));

    final FetchFailure failure = assertInstanceOf(FetchFailure.class,
        fetcher(baseUrl, Duration.ofSeconds(5))
            .fetchPage(FetchParams.defaults()));

    assertEquals(FailureKind.UNKNOWN, failure.kind());
    assertEquals(FetchErrorCodes.UNKNOWN, failure.code());
    assertFalse(failure.message().isBlank());
  }

  @Test
  void whenBuildingUri_givenUnsetParams_shouldOmitThem() {
    final HttpPrototypeFetcher fetcher = fetcher("https://api.example.com/",
        Duration.ofSeconds(1));

    assertEquals("https://api.example.com/prototype/list",
        fetcher.uriFor(FetchParams.none()).toString());
    assertEquals("https://api.example.com/prototype/list?prototypeId=7",
        fetcher.uriFor(FetchParams.none().withPrototypeId(7)).toString());
  }

  @Test
  void whenBuildingConfig_givenInvalidValues_shouldFail() {
    assertThrows(IllegalArgumentException.class,
        () -> HttpFetcherConfig.builder().build());
    assertThrows(IllegalArgumentException.class,
        () -> HttpFetcherConfig.builder().baseUrl("ftp://example.com")
            .build());
    assertThrows(IllegalArgumentException.class,
        () -> HttpFetcherConfig.builder().baseUrl("http://example.com")
            .timeout(Duration.ZERO).build());
  }

  @Test
  void whenBuildingConfig_givenBlankToken_shouldSendNoAuthorization() {
    final HttpFetcherConfig config = HttpFetcherConfig.builder()
        .baseUrl("http://example.com").token("  ").build();

    assertTrue(config.token().isEmpty());
    assertEquals(HttpFetcherConfig.DEFAULT_TIMEOUT, config.timeout());
  }

  /**
   * An HTTP client that runs a callback while a request is being sent and
   * never answers it.
   */
  static class SendingHttpClient extends HttpClient {

    /** The client providing the settings. */
    private final HttpClient settings = HttpClient.newHttpClient();

    /** Runs inside sendAsync, before it returns. */
    private final Runnable whileSending;

    /** The future handed out by the last sendAsync call. */
    private volatile CompletableFuture<?> sent;

    SendingHttpClient(final Runnable theWhileSending) {
      whileSending = theWhileSending;
    }

    @Override
    public Optional<CookieHandler> cookieHandler() {
      return settings.cookieHandler();
    }

    @Override
    public Optional<Duration> connectTimeout() {
      return settings.connectTimeout();
    }

    @Override
    public Redirect followRedirects() {
      return settings.followRedirects();
    }

    @Override
    public Optional<ProxySelector> proxy() {
      return settings.proxy();
    }

    @Override
    public SSLContext sslContext() {
      return settings.sslContext();
    }

    @Override
    public SSLParameters sslParameters() {
      return settings.sslParameters();
    }

    @Override
    public Optional<Authenticator> authenticator() {
      return settings.authenticator();
    }

    @Override
    public Version version() {
      return settings.version();
    }

    @Override
    public Optional<Executor> executor() {
      return settings.executor();
    }

    @Override
    public <T> HttpResponse<T> send(final HttpRequest request,
        final HttpResponse.BodyHandler<T> handler) {
      throw new UnsupportedOperationException("send");
    }

    @Override
    public <T> CompletableFuture<HttpResponse<T>> sendAsync(
        final HttpRequest request, final HttpResponse.BodyHandler<T> handler) {
      final CompletableFuture<HttpResponse<T>> future =
          new CompletableFuture<>();
      sent = future;
      whileSending.run();
      return future;
    }

    @Override
    public <T> CompletableFuture<HttpResponse<T>> sendAsync(
        final HttpRequest request, final HttpResponse.BodyHandler<T> handler,
        final HttpResponse.PushPromiseHandler<T> pushPromiseHandler) {
      return sendAsync(request, handler);
    }
  }
}
