package org.waabox.protocache.fetch;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.PortUnreachableException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import org.waabox.protocache.FailureDetails;
import org.waabox.protocache.FailureKind;

/**
 * Maps any throwable raised while fetching into a {@link FetchFailure}.
 *
 * <p>The classification is pure and deterministic: the same throwable
 * always yields an equal failure, and this class never throws. The first
 * matching rule wins:
 * <ol>
 *   <li>{@link UpstreamApiException}: {@link FailureKind#HTTP} with a code
 *       derived from the status.</li>
 *   <li>{@link FetchTimeoutException}, or a JDK
 *       {@link HttpTimeoutException} that is not a connect timeout:
 *       {@link FailureKind#TIMEOUT}.</li>
 *   <li>{@link FetchAbortedException}, {@link CancellationException} or
 *       {@link InterruptedException}: {@link FailureKind#ABORT}.</li>
 *   <li>A network code found anywhere on the cause chain:
 *       {@link FailureKind#NETWORK} with that code.</li>
 *   <li>One of the opaque messages browsers and fetch runtimes use when no
 *       diagnostics are available: {@link FailureKind#CORS}.</li>
 *   <li>Anything else: {@link FailureKind#UNKNOWN}.</li>
 * </ol>
 *
 * <p>{@link CompletionException} and {@link ExecutionException} wrappers
 * are removed before classifying.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ErrorClassifier {

  /** The message used for caller cancellations. */
  static final String ABORTED_MESSAGE = "Upstream request aborted";

  /** The message used for timeouts. */
  static final String TIMEOUT_MESSAGE = "Upstream request timed out";

  /** The message used when nothing better is known. */
  static final String UNKNOWN_MESSAGE = "Failed to fetch prototypes";

  /** How deep the cause chain is inspected. */
  private static final int MAX_CAUSE_DEPTH = 32;

  /** Messages of transport failures that carry no diagnostics. */
  private static final Set<String> OPAQUE_MESSAGES = Set.of(
      "Failed to fetch",
      "fetch failed",
      "Load failed",
      "NetworkError when attempting to fetch resource.");

  /** The codes of the HTTP statuses with a dedicated mapping. */
  private static final Map<Integer, String> STATUS_CODES = Map.ofEntries(
      Map.entry(400, FetchErrorCodes.CLIENT_BAD_REQUEST),
      Map.entry(401, FetchErrorCodes.CLIENT_UNAUTHORIZED),
      Map.entry(403, FetchErrorCodes.CLIENT_FORBIDDEN),
      Map.entry(404, FetchErrorCodes.CLIENT_NOT_FOUND),
      Map.entry(405, FetchErrorCodes.CLIENT_METHOD_NOT_ALLOWED),
      Map.entry(408, FetchErrorCodes.CLIENT_TIMEOUT),
      Map.entry(429, FetchErrorCodes.CLIENT_RATE_LIMITED),
      Map.entry(500, FetchErrorCodes.SERVER_INTERNAL_ERROR),
      Map.entry(502, FetchErrorCodes.SERVER_BAD_GATEWAY),
      Map.entry(503, FetchErrorCodes.SERVER_SERVICE_UNAVAILABLE),
      Map.entry(504, FetchErrorCodes.SERVER_GATEWAY_TIMEOUT));

  private ErrorClassifier() {
  }

  /**
   * Classifies the given throwable.
   *
   * @param error the throwable, may be null
   *
   * @return the failure, never null
   */
  public static FetchFailure classify(final Throwable error) {
    if (error == null) {
      return new FetchFailure(FailureKind.UNKNOWN, FetchErrorCodes.UNKNOWN,
          UNKNOWN_MESSAGE, null, FailureDetails.empty());
    }
    final Throwable root = unwrap(error);

    final UpstreamApiException http = find(root, UpstreamApiException.class);
    if (http != null) {
      return new FetchFailure(FailureKind.HTTP,
          codeForStatus(http.getStatus()), messageOf(http),
          http.getStatus(), FailureDetails.ofHttp(http.getMethod(),
              http.getUrl(), http.getStatusText()));
    }

    if (isTimeout(root)) {
      return new FetchFailure(FailureKind.TIMEOUT, FetchErrorCodes.TIMEOUT,
          TIMEOUT_MESSAGE, null,
          FailureDetails.ofCode(FetchErrorCodes.TIMEOUT));
    }

    if (find(root, FetchAbortedException.class) != null
        || find(root, CancellationException.class) != null
        || find(root, InterruptedException.class) != null) {
      return new FetchFailure(FailureKind.ABORT, FetchErrorCodes.ABORTED,
          ABORTED_MESSAGE, null,
          FailureDetails.ofCode(FetchErrorCodes.ABORTED));
    }

    final String networkCode = networkCode(root);
    if (networkCode != null) {
      return new FetchFailure(FailureKind.NETWORK, networkCode,
          messageOf(root), null, FailureDetails.ofCode(networkCode));
    }

    final String message = root.getMessage();
    if (message != null && OPAQUE_MESSAGES.contains(message)) {
      return new FetchFailure(FailureKind.CORS, FetchErrorCodes.CORS_BLOCKED,
          message, null,
          FailureDetails.ofCode(FetchErrorCodes.NETWORK_ERROR));
    }

    return new FetchFailure(FailureKind.UNKNOWN, FetchErrorCodes.UNKNOWN,
        messageOf(root), null, FailureDetails.empty());
  }

  /**
   * Maps an HTTP status to its failure code.
   *
   * @param status the HTTP status
   *
   * @return the code, never null
   */
  public static String codeForStatus(final int status) {
    final String code = STATUS_CODES.get(status);
    if (code != null) {
      return code;
    }
    if (status >= 500) {
      return FetchErrorCodes.SERVER_ERROR;
    }
    if (status >= 400) {
      return FetchErrorCodes.CLIENT_ERROR;
    }
    return FetchErrorCodes.UNKNOWN;
  }

  private static boolean isTimeout(final Throwable root) {
    if (find(root, FetchTimeoutException.class) != null) {
      return true;
    }
    final HttpTimeoutException timeout = find(root,
        HttpTimeoutException.class);
    return timeout != null && !(timeout instanceof HttpConnectTimeoutException);
  }

  /**
   * Looks for a network code on the throwable and its causes.
   *
   * @param root the throwable, never null
   *
   * @return the first code found, or null
   */
  private static String networkCode(final Throwable root) {
    Throwable current = root;
    for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH;
        depth++) {
      final String code = codeOf(current);
      if (code != null) {
        return code;
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
    }
    return null;
  }

  private static String codeOf(final Throwable error) {
    if (error instanceof NetworkException) {
      return ((NetworkException) error).getCode();
    }
    if (error instanceof UnknownHostException) {
      return "ENOTFOUND";
    }
    if (error instanceof HttpConnectTimeoutException
        || error instanceof SocketTimeoutException) {
      return "ETIMEDOUT";
    }
    if (error instanceof ConnectException) {
      return "ECONNREFUSED";
    }
    if (error instanceof NoRouteToHostException) {
      return "EHOSTUNREACH";
    }
    if (error instanceof PortUnreachableException) {
      return "EPORTUNREACH";
    }
    if (error instanceof SocketException && error.getMessage() != null
        && error.getMessage().contains("Connection reset")) {
      return "ECONNRESET";
    }
    return null;
  }

  private static <T extends Throwable> T find(final Throwable root,
      final Class<T> type) {
    Throwable current = root;
    for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH;
        depth++) {
      if (type.isInstance(current)) {
        return type.cast(current);
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
    }
    return null;
  }

  private static Throwable unwrap(final Throwable error) {
    Throwable current = error;
    int depth = 0;
    while ((current instanceof CompletionException
        || current instanceof ExecutionException)
        && current.getCause() != null && depth++ < MAX_CAUSE_DEPTH) {
      current = current.getCause();
    }
    return current;
  }

  private static String messageOf(final Throwable error) {
    final String message = error.getMessage();
    if (message != null && !message.isBlank()) {
      return message;
    }
    return error.getClass().getName();
  }
}
