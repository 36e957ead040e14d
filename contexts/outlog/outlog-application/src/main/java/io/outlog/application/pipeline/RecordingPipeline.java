package io.outlog.application.pipeline;

import io.outlog.application.port.HttpRequestObserver;
import io.outlog.application.port.RequestLogSink;
import io.outlog.application.redaction.Redactor;
import io.outlog.domain.config.OutlogConfiguration;
import io.outlog.domain.config.OutlogConfigurationHolder;
import io.outlog.domain.context.OutboundLogContext;
import io.outlog.domain.context.RecursionGuard;
import io.outlog.domain.error.OutlogException;
import io.outlog.domain.record.RequestLogRecord;
import jakarta.annotation.Nullable;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.LongSupplier;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client-agnostic recording algorithm shared by every interception adapter.
 *
 * <h3>Per call</h3>
 *
 * <ol>
 *   <li>Disabled (globally, for this library, or suppressed on this thread): call straight through.
 *   <li>Already inside an interception of the same library: enforce the depth limit when strict,
 *       then call straight through.
 *   <li>Excluded URL: call straight through, before any bookkeeping.
 *   <li>Otherwise increment the library's depth (always decremented in {@code finally}), snapshot
 *       request data plus context loggable/metadata, time the underlying call on the monotonic
 *       clock, then record.
 * </ol>
 *
 * <p>The underlying call's result or exception is returned or rethrown untouched. Recording
 * (redaction, serialization, sink write) is isolated: failures are logged at ERROR and dropped.
 * Observer failures are logged at WARN and dropped.
 */
public class RecordingPipeline {

  private static final Logger log = LoggerFactory.getLogger(RecordingPipeline.class);

  private static final double NANOS_PER_SECOND = 1_000_000_000d;

  private final RequestLogSink sink;
  private final Redactor redactor;
  private final List<HttpRequestObserver> observers;
  private final Supplier<OutlogConfiguration> configuration;
  private final Clock clock;
  private final LongSupplier monotonicNanos;

  public RecordingPipeline(
      RequestLogSink sink, Redactor redactor, List<HttpRequestObserver> observers) {
    this(
        sink,
        redactor,
        observers,
        OutlogConfigurationHolder::current,
        Clock.systemUTC(),
        System::nanoTime);
  }

  public RecordingPipeline(
      RequestLogSink sink,
      Redactor redactor,
      List<HttpRequestObserver> observers,
      Supplier<OutlogConfiguration> configuration,
      Clock clock,
      LongSupplier monotonicNanos) {
    this.sink = Objects.requireNonNull(sink, "sink");
    this.redactor = Objects.requireNonNull(redactor, "redactor");
    this.observers = List.copyOf(Objects.requireNonNull(observers, "observers"));
    this.configuration = Objects.requireNonNull(configuration, "configuration");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.monotonicNanos = Objects.requireNonNull(monotonicNanos, "monotonicNanos");
  }

  // -------------------------------------------------------------------------------------
  // Interception entry point
  // -------------------------------------------------------------------------------------

  /**
   * Runs {@code underlyingCall} and records it.
   *
   * @param libraryName adapter library name, keys the recursion counter
   * @param url full request URL
   * @param method HTTP method
   * @param requestData captures headers and body before the call
   * @param responseData normalizes the native response
   * @param underlyingCall the real send
   * @return whatever {@code underlyingCall} returned
   * @throws E whatever {@code underlyingCall} threw, unchanged
   */
  public <R, E extends Exception> R logHttpRequest(
      String libraryName,
      String url,
      String method,
      Supplier<RequestData> requestData,
      Function<? super R, ResponseData> responseData,
      UnderlyingCall<R, E> underlyingCall)
      throws E {
    final OutlogConfiguration config = configuration.get();

    if (!config.isEnabled()
        || !config.isAdapterEnabled(libraryName)
        || OutboundLogContext.isInterceptionSuppressed()) {
      return underlyingCall.call();
    }

    if (RecursionGuard.inRecursion(libraryName)) {
      RecursionGuard.checkDepth(libraryName, config);
      return underlyingCall.call();
    }

    if (!config.shouldLogUrl(url)) {
      return underlyingCall.call();
    }

    final String verb = canonicalMethod(method);
    RecursionGuard.increment(libraryName);
    try {
      final Snapshot request = snapshot(libraryName, requestData);
      final long start = monotonicNanos.getAsLong();
      final R response;
      try {
        response = underlyingCall.call();
      } catch (Exception e) {
        final double duration = elapsedSeconds(start);
        recordFailure(verb, url, request, e, duration);
        throw e;
      }
      final double duration = elapsedSeconds(start);
      recordResponse(config, libraryName, verb, url, request, response, responseData, duration);
      return response;
    } finally {
      RecursionGuard.decrement(libraryName);
    }
  }

  /**
   * Records a call that has already completed outside of {@link #logHttpRequest}.
   *
   * <p>Applies the same enablement, URL and content-type rules. Never throws for recording
   * problems.
   *
   * @return the sink identity when a record was stored
   */
  public Optional<Object> recordCompleted(
      String method,
      String url,
      RequestData requestData,
      ResponseData responseData,
      double durationSeconds) {
    final OutlogConfiguration config = configuration.get();
    if (!config.shouldLogUrl(url) || !config.shouldLogContentType(responseData.contentType())) {
      return Optional.empty();
    }
    final String verb = canonicalMethod(method);
    Snapshot request = new Snapshot(requestData, currentLoggable(), OutboundLogContext.metadata());
    Optional<Object> id = persist(verb, url, request, responseData, durationSeconds);
    notifyObservers(verb, url, responseData.statusCode(), durationSeconds, null);
    return id;
  }

  // -------------------------------------------------------------------------------------
  // Recording
  // -------------------------------------------------------------------------------------

  private record Snapshot(RequestData data, Object loggable, Map<String, Object> metadata) {}

  private Snapshot snapshot(String libraryName, Supplier<RequestData> requestData) {
    RequestData data;
    try {
      data = Objects.requireNonNullElse(requestData.get(), RequestData.empty());
    } catch (RuntimeException e) {
      log.warn("Could not capture request data for {}: {}", libraryName, e.toString());
      data = RequestData.empty();
    }
    return new Snapshot(data, currentLoggable(), OutboundLogContext.metadata());
  }

  private <R> void recordResponse(
      OutlogConfiguration config,
      String libraryName,
      String method,
      String url,
      Snapshot request,
      R response,
      Function<? super R, ResponseData> responseData,
      double duration) {
    final ResponseData normalized;
    try {
      normalized = responseData.apply(response);
    } catch (RuntimeException e) {
      log.error("Could not read {} response for logging: {}", libraryName, e.toString());
      return;
    }
    if (normalized == null || !config.shouldLogContentType(normalized.contentType())) {
      return;
    }
    persist(method, url, request, normalized, duration);
    notifyObservers(method, url, normalized.statusCode(), duration, null);
  }

  private void recordFailure(
      String method,
      String url,
      Snapshot request,
      Exception error,
      double duration) {
    ResponseData failure =
        new ResponseData(
            RequestLogRecord.TRANSPORT_FAILURE,
            Map.of(),
            "Error: " + error.getClass().getName() + ": " + error.getMessage());
    persist(method, url, request, failure, duration);
    notifyObservers(method, url, RequestLogRecord.TRANSPORT_FAILURE, duration, error);
  }

  private Optional<Object> persist(
      String method, String url, Snapshot request, ResponseData response, double duration) {
    try {
      RequestLogRecord record =
          RequestLogRecord.builder()
              .method(method)
              .url(url)
              .statusCode(response.statusCode())
              .requestHeaders(redactor.filterHeaders(request.data().headers()))
              .requestBody(redactor.filterBody(request.data().body()))
              .responseHeaders(redactor.filterHeaders(response.headers()))
              .responseBody(redactor.filterBody(response.body()))
              .durationSeconds(duration)
              .loggable(request.loggable())
              .metadata(request.metadata())
              .createdAt(clock.instant())
              .build();
      return Optional.ofNullable(sink.persist(record));
    } catch (OutlogException e) {
      log.error(
          "Failed to persist outbound request log [{}] for {}: {}",
          e.errorCode().code(),
          method,
          e.getMessage(),
          e);
    } catch (RuntimeException e) {
      log.error("Failed to persist outbound request log for {}: {}", method, e.toString(), e);
    }
    return Optional.empty();
  }

  private void notifyObservers(
      String method, String url, int statusCode, double duration, @Nullable Throwable error) {
    for (HttpRequestObserver observer : observers) {
      try {
        observer.onHttpRequest(method, url, statusCode, duration, error);
      } catch (RuntimeException e) {
        log.warn("Observer {} failed: {}", observer.getClass().getSimpleName(), e.toString());
      }
    }
  }

  private static String canonicalMethod(String method) {
    return method == null ? "GET" : method.toUpperCase(Locale.ROOT);
  }

  @Nullable
  private static Object currentLoggable() {
    return OutboundLogContext.loggable().orElse(null);
  }

  private double elapsedSeconds(long startNanos) {
    long elapsed = monotonicNanos.getAsLong() - startNanos;
    return Math.max(0L, elapsed) / NANOS_PER_SECOND;
  }
}
