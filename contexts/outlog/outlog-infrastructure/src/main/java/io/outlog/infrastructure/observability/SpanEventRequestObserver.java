package io.outlog.infrastructure.observability;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.Span;
import io.outlog.application.port.HttpRequestObserver;
import io.outlog.domain.config.OutlogConfiguration;
import io.outlog.domain.config.OutlogConfigurationHolder;
import java.util.Objects;
import java.util.function.Supplier;
import org.springframework.lang.Nullable;

/**
 * Adds an {@code outlog.http_request} event to the current OpenTelemetry span. A no-op when no span
 * is recording.
 */
public class SpanEventRequestObserver implements HttpRequestObserver {

  public static final String EVENT_NAME = "outlog.http_request";

  static final AttributeKey<String> METHOD = AttributeKey.stringKey("http.request.method");
  static final AttributeKey<String> URL = AttributeKey.stringKey("url.full");
  static final AttributeKey<Long> STATUS = AttributeKey.longKey("http.response.status_code");
  static final AttributeKey<Double> DURATION_MS = AttributeKey.doubleKey("outlog.duration_ms");
  static final AttributeKey<String> ERROR_TYPE = AttributeKey.stringKey("error.type");

  private final Supplier<OutlogConfiguration> configuration;

  public SpanEventRequestObserver() {
    this(OutlogConfigurationHolder::current);
  }

  public SpanEventRequestObserver(Supplier<OutlogConfiguration> configuration) {
    this.configuration = Objects.requireNonNull(configuration, "configuration");
  }

  @Override
  public void onHttpRequest(
      String method, String url, int statusCode, double durationSeconds, @Nullable Throwable error) {
    Span span = Span.current();
    if (!span.isRecording()) {
      return;
    }
    AttributesBuilder attributes =
        Attributes.builder()
            .put(METHOD, method)
            .put(URL, UrlParts.sanitize(url, configuration.get()))
            .put(STATUS, (long) statusCode)
            .put(DURATION_MS, Math.round(durationSeconds * 100_000d) / 100d);
    if (error != null) {
      attributes.put(ERROR_TYPE, error.getClass().getName());
    }
    span.addEvent(EVENT_NAME, attributes.build());
  }
}
