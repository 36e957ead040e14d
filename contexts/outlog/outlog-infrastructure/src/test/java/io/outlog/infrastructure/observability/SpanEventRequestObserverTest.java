package io.outlog.infrastructure.observability;

import static org.assertj.core.api.Assertions.assertThat;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.opentelemetry.sdk.testing.junit5.OpenTelemetryExtension;
import io.opentelemetry.sdk.trace.data.EventData;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.outlog.domain.config.OutlogConfiguration;
import java.net.SocketTimeoutException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

class SpanEventRequestObserverTest {

  @RegisterExtension static final OpenTelemetryExtension otel = OpenTelemetryExtension.create();

  private final SpanEventRequestObserver observer =
      new SpanEventRequestObserver(OutlogConfiguration::defaults);

  @Test
  void addsAnEventToTheCurrentSpan() {
    Tracer tracer = otel.getOpenTelemetry().getTracer("test");
    Span span = tracer.spanBuilder("job").startSpan();
    try (Scope ignored = span.makeCurrent()) {
      observer.onHttpRequest(
          "POST", "https://api.example.com/login?password=x", 0, 0.5, new SocketTimeoutException());
    } finally {
      span.end();
    }

    SpanData data = otel.getSpans().get(0);
    assertThat(data.getEvents()).hasSize(1);
    EventData event = data.getEvents().get(0);
    assertThat(event.getName()).isEqualTo(SpanEventRequestObserver.EVENT_NAME);
    assertThat(event.getAttributes().get(SpanEventRequestObserver.METHOD)).isEqualTo("POST");
    assertThat(event.getAttributes().get(SpanEventRequestObserver.URL))
        .isEqualTo("https://api.example.com/login");
    assertThat(event.getAttributes().get(SpanEventRequestObserver.STATUS)).isZero();
    assertThat(event.getAttributes().get(SpanEventRequestObserver.DURATION_MS)).isEqualTo(500.0);
    assertThat(event.getAttributes().get(SpanEventRequestObserver.ERROR_TYPE))
        .isEqualTo("java.net.SocketTimeoutException");
  }

  @Test
  void withoutASpanNothingHappens() {
    observer.onHttpRequest("GET", "https://api.example.com", 200, 0.1, null);

    assertThat(otel.getSpans()).isEmpty();
  }
}
