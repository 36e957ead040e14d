package io.outlog.infrastructure.observability;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.net.ConnectException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class MicrometerRequestObserverTest {

  private final SimpleMeterRegistry meters = new SimpleMeterRegistry();
  private final MicrometerRequestObserver observer = new MicrometerRequestObserver(meters);

  @Test
  void countsAndTimesRequestsPerHost() {
    observer.onHttpRequest("GET", "https://api.example.com/users?page=2", 200, 0.25, null);
    observer.onHttpRequest("GET", "https://api.example.com/users", 200, 0.75, null);

    assertThat(
            meters
                .get(MicrometerRequestObserver.REQUESTS)
                .tags("method", "GET", "host", "api.example.com", "status", "200")
                .counter()
                .count())
        .isEqualTo(2.0);
    assertThat(
            meters
                .get(MicrometerRequestObserver.DURATION)
                .tags("host", "api.example.com")
                .timer()
                .totalTime(TimeUnit.MILLISECONDS))
        .isEqualTo(1000.0);
    assertThat(
            meters
                .get(MicrometerRequestObserver.BY_CATEGORY)
                .tags("category", "2xx")
                .counter()
                .count())
        .isEqualTo(2.0);
  }

  @Test
  void errorsAreCountedByExceptionClass() {
    observer.onHttpRequest("POST", "https://pay.example.com/charge", 0, 0.01, new ConnectException());

    assertThat(
            meters
                .get(MicrometerRequestObserver.ERRORS)
                .tags("exception", "java.net.ConnectException", "host", "pay.example.com")
                .counter()
                .count())
        .isEqualTo(1.0);
    assertThat(
            meters
                .get(MicrometerRequestObserver.BY_CATEGORY)
                .tags("category", "unknown")
                .counter()
                .count())
        .isEqualTo(1.0);
  }

  @Test
  void unparseableUrlsUseAnUnknownHost() {
    observer.onHttpRequest("GET", "not a url", 404, 0.01, null);

    assertThat(meters.get(MicrometerRequestObserver.REQUESTS).tags("host", "unknown").counter())
        .isNotNull();
  }
}
