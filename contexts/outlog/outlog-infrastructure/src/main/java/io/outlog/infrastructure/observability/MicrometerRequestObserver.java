package io.outlog.infrastructure.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.outlog.application.port.HttpRequestObserver;
import java.time.Duration;
import java.util.Objects;
import org.springframework.lang.Nullable;

/**
 * Publishes recorded calls as Micrometer meters.
 *
 * <ul>
 *   <li>{@code outlog.http.requests} (counter; tags: method, host, status)
 *   <li>{@code outlog.http.request.duration} (timer; tags: method, host)
 *   <li>{@code outlog.http.request.errors} (counter; tags: method, host, exception)
 *   <li>{@code outlog.http.requests.by.category} (counter; tags: category, host)
 * </ul>
 *
 * <p>Hosts are used as tags; keep the set of called hosts bounded.
 */
public class MicrometerRequestObserver implements HttpRequestObserver {

  public static final String REQUESTS = "outlog.http.requests";
  public static final String DURATION = "outlog.http.request.duration";
  public static final String ERRORS = "outlog.http.request.errors";
  public static final String BY_CATEGORY = "outlog.http.requests.by.category";

  private final MeterRegistry meters;

  public MicrometerRequestObserver(MeterRegistry meters) {
    this.meters = Objects.requireNonNull(meters, "meters");
  }

  @Override
  public void onHttpRequest(
      String method, String url, int statusCode, double durationSeconds, @Nullable Throwable error) {
    String host = UrlParts.host(url);

    Counter.builder(REQUESTS)
        .tag("method", method)
        .tag("host", host)
        .tag("status", Integer.toString(statusCode))
        .register(meters)
        .increment();

    Timer.builder(DURATION)
        .tag("method", method)
        .tag("host", host)
        .register(meters)
        .record(Duration.ofNanos(Math.round(durationSeconds * 1_000_000_000d)));

    if (error != null) {
      Counter.builder(ERRORS)
          .tag("method", method)
          .tag("host", host)
          .tag("exception", error.getClass().getName())
          .register(meters)
          .increment();
    }

    Counter.builder(BY_CATEGORY)
        .tag("category", UrlParts.statusCategory(statusCode))
        .tag("host", host)
        .register(meters)
        .increment();
  }
}
