package org.waabox.protocache.fetch.http;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.protocache.FetchParams;
import org.waabox.protocache.fetch.ErrorClassifier;
import org.waabox.protocache.fetch.FetchAbortedException;
import org.waabox.protocache.fetch.FetchFailure;
import org.waabox.protocache.fetch.FetchResult;
import org.waabox.protocache.fetch.FetchSuccess;
import org.waabox.protocache.fetch.FetchTimeoutException;
import org.waabox.protocache.fetch.PrototypeFetcher;
import org.waabox.protocache.fetch.UpstreamApiException;
import org.waabox.protocache.model.UpstreamPrototype;

/**
 * {@link PrototypeFetcher} backed by {@code java.net.http.HttpClient}.
 *
 * <p>Every call issues one {@code GET {baseUrl}/prototype/list} request
 * with the page parameters as query string, waits at most the configured
 * timeout and decodes the {@code results} array of the response. Failures
 * are never thrown: they are turned into a {@link FetchFailure} by the
 * {@link ErrorClassifier}.
 *
 * <p>Typical usage:
 * <pre>{@code
 * HttpPrototypeFetcher fetcher = new HttpPrototypeFetcher(
 *     HttpFetcherConfig.builder().baseUrl("https://api.example.com/v2/api")
 *         .token(token).build());
 * PrototypeRepository repository = PrototypeRepository.builder()
 *     .fetcher(fetcher)
 *     .build();
 * // ... on shutdown
 * fetcher.cancelAll();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class HttpPrototypeFetcher implements PrototypeFetcher {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      HttpPrototypeFetcher.class);

  /** The path of the listing endpoint, relative to the base url. */
  static final String LIST_PATH = "/prototype/list";

  /** The HTTP method used for every request. */
  private static final String METHOD = "GET";

  /** Reason phrases, the JDK client does not expose the server's. */
  private static final Map<Integer, String> REASON_PHRASES = Map.ofEntries(
      Map.entry(400, "Bad Request"),
      Map.entry(401, "Unauthorized"),
      Map.entry(403, "Forbidden"),
      Map.entry(404, "Not Found"),
      Map.entry(405, "Method Not Allowed"),
      Map.entry(408, "Request Timeout"),
      Map.entry(409, "Conflict"),
      Map.entry(410, "Gone"),
      Map.entry(422, "Unprocessable Entity"),
      Map.entry(429, "Too Many Requests"),
      Map.entry(500, "Internal Server Error"),
      Map.entry(501, "Not Implemented"),
      Map.entry(502, "Bad Gateway"),
      Map.entry(503, "Service Unavailable"),
      Map.entry(504, "Gateway Timeout"));

  /** The configuration, never null. */
  private final HttpFetcherConfig config;

  /** The HTTP client, never null. */
  private final HttpClient client;

  /** The reader for the {@code results} array, never null. */
  private final ObjectReader resultsReader;

  /** The mapper used to parse the response envelope, never null. */
  private final ObjectMapper mapper;

  /** The requests currently waiting for a response. */
  private final Set<CompletableFuture<?>> inFlight =
      ConcurrentHashMap.newKeySet();

  /**
   * Creates a new fetcher with its own HTTP client.
   *
   * @param theConfig the configuration, never null
   */
  public HttpPrototypeFetcher(final HttpFetcherConfig theConfig) {
    this(theConfig, HttpClient.newBuilder()
        .connectTimeout(Objects.requireNonNull(theConfig,
            "config must not be null").timeout())
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build());
  }

  /**
   * Creates a new fetcher on top of the given HTTP client.
   *
   * @param theConfig the configuration, never null
   * @param theClient the HTTP client, never null
   */
  public HttpPrototypeFetcher(final HttpFetcherConfig theConfig,
      final HttpClient theClient) {
    config = Objects.requireNonNull(theConfig, "config must not be null");
    client = Objects.requireNonNull(theClient, "client must not be null");
    mapper = new ObjectMapper()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    resultsReader = mapper.readerForListOf(UpstreamPrototype.class);
  }

  /** {@inheritDoc} */
  @Override
  public FetchResult fetchPage(final FetchParams params) {
    Objects.requireNonNull(params, "params must not be null");
    final URI uri = uriFor(params);
    final long start = System.nanoTime();
    try {
      final List<UpstreamPrototype> prototypes = execute(uri);
      log.info("Fetched {} prototypes from {} in {} ms", prototypes.size(),
          uri, elapsedMs(start));
      return new FetchSuccess(prototypes);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return failed(uri, start, e);
    } catch (final Exception e) {
      return failed(uri, start, e);
    }
  }

  /**
   * Cancels every request still waiting for a response. Each cancelled
   * call returns an abort failure.
   *
   * @return the number of requests cancelled
   */
  public int cancelAll() {
    int cancelled = 0;
    for (final CompletableFuture<?> future : inFlight) {
      if (future.cancel(true)) {
        cancelled++;
      }
    }
    if (cancelled > 0) {
      log.info("Cancelled {} in-flight upstream requests", cancelled);
    }
    return cancelled;
  }

  /**
   * Returns the configuration of this fetcher.
   *
   * @return the configuration, never null
   */
  public HttpFetcherConfig getConfig() {
    return config;
  }

  /**
   * Sends the request and decodes the response.
   *
   * @param uri the request uri, never null
   *
   * @return the decoded records, never null
   *
   * @throws InterruptedException if the calling thread is interrupted
   * @throws ExecutionException if the transport fails
   * @throws IOException if the body cannot be decoded
   */
  private List<UpstreamPrototype> execute(final URI uri)
      throws InterruptedException, ExecutionException, IOException {

    final HttpRequest.Builder request = HttpRequest.newBuilder(uri)
        .GET()
        .timeout(config.timeout())
        .header("Accept", "application/json")
        .header("User-Agent", config.userAgent());
    config.token().ifPresent(token ->
        request.header("Authorization", "Bearer " + token));

    log.debug("{} {}", METHOD, uri);

    // Registered before sending so cancelAll() never misses the request.
    final CompletableFuture<HttpResponse<String>> future =
        new CompletableFuture<>();
    inFlight.add(future);

    final HttpResponse<String> response;
    try {
      if (future.isCancelled()) {
        throw new CancellationException();
      }
      final CompletableFuture<HttpResponse<String>> sending =
          client.sendAsync(request.build(),
              HttpResponse.BodyHandlers.ofString());
      future.whenComplete((result, error) -> {
        if (future.isCancelled()) {
          sending.cancel(true);
        }
      });
      sending.whenComplete((result, error) -> {
        if (error != null) {
          future.completeExceptionally(error);
        } else {
          future.complete(result);
        }
      });
      response = future.get(config.timeout().toMillis(),
          TimeUnit.MILLISECONDS);
    } catch (final TimeoutException e) {
      future.cancel(true);
      throw new FetchTimeoutException(config.timeout().toMillis(), e);
    } catch (final CancellationException e) {
      throw new FetchAbortedException("Request to " + uri
          + " was cancelled");
    } catch (final InterruptedException e) {
      future.cancel(true);
      throw e;
    } finally {
      inFlight.remove(future);
    }

    final int status = response.statusCode();
    if (status < 200 || status > 299) {
      throw new UpstreamApiException(status, reasonPhrase(status), METHOD,
          uri.toString());
    }
    return decode(response.body());
  }

  /**
   * Decodes the response envelope.
   *
   * @param body the response body, may be null
   *
   * @return the records, empty when the envelope has no results array
   *
   * @throws IOException if the body is not valid JSON
   */
  private List<UpstreamPrototype> decode(final String body)
      throws IOException {
    final JsonNode root = mapper.readTree(body == null ? "" : body);
    final JsonNode results = root == null ? null : root.get("results");
    if (results == null || !results.isArray()) {
      log.warn("Upstream API response \"results\" is not an array."
          + " Returning empty data.");
      return List.of();
    }
    return resultsReader.readValue(results);
  }

  private FetchFailure failed(final URI uri, final long start,
      final Throwable error) {
    final FetchFailure failure = ErrorClassifier.classify(error);
    log.warn("Fetch from {} failed after {} ms: {} ({})", uri,
        elapsedMs(start), failure.message(), failure.code());
    log.debug("Fetch failure cause", error);
    return failure;
  }

  /**
   * Builds the request uri, only the parameters that are set are sent.
   *
   * @param params the page parameters, never null
   *
   * @return the uri, never null
   */
  URI uriFor(final FetchParams params) {
    final StringBuilder url = new StringBuilder(config.baseUrl())
        .append(LIST_PATH);
    char separator = '?';
    if (params.offset() != null) {
      url.append(separator).append("offset=").append(params.offset());
      separator = '&';
    }
    if (params.limit() != null) {
      url.append(separator).append("limit=").append(params.limit());
      separator = '&';
    }
    if (params.prototypeId() != null) {
      url.append(separator).append("prototypeId=")
          .append(params.prototypeId());
    }
    return URI.create(url.toString());
  }

  static String reasonPhrase(final int status) {
    return REASON_PHRASES.getOrDefault(status, "");
  }

  private static long elapsedMs(final long start) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
  }
}
