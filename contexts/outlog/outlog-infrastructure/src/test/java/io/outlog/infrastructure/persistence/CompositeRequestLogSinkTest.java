package io.outlog.infrastructure.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.outlog.application.port.RequestLogSink;
import io.outlog.domain.error.RequestLogPersistenceException;
import io.outlog.domain.record.RequestLogRecord;
import io.outlog.testing.InMemoryRequestLogStore;
import java.util.List;
import org.junit.jupiter.api.Test;

class CompositeRequestLogSinkTest {

  private final RequestLogRecord record =
      RequestLogRecord.builder().method("GET").url("https://api.example.com").statusCode(200).build();

  @Test
  void returnsThePrimaryIdentityAndFeedsSecondaries() {
    InMemoryRequestLogStore primary = new InMemoryRequestLogStore();
    InMemoryRequestLogStore secondary = new InMemoryRequestLogStore();

    Object id = new CompositeRequestLogSink(primary, List.of(secondary)).persist(record);

    assertThat(id).isEqualTo(1L);
    assertThat(secondary.records()).containsExactly(record);
  }

  @Test
  void secondaryFailuresAreIsolated() {
    InMemoryRequestLogStore primary = new InMemoryRequestLogStore();
    RequestLogSink broken =
        r -> {
          throw new RequestLogPersistenceException("secondary down");
        };

    Object id = new CompositeRequestLogSink(primary, List.of(broken)).persist(record);

    assertThat(id).isEqualTo(1L);
  }

  @Test
  void primaryFailuresPropagate() {
    RequestLogSink broken =
        r -> {
          throw new RequestLogPersistenceException("primary down");
        };
    InMemoryRequestLogStore secondary = new InMemoryRequestLogStore();

    assertThatThrownBy(
            () -> new CompositeRequestLogSink(broken, List.of(secondary)).persist(record))
        .isInstanceOf(RequestLogPersistenceException.class);
    assertThat(secondary.size()).isZero();
  }

  @Test
  void noopSinkDiscards() {
    assertThat(NoopRequestLogSink.INSTANCE.persist(record)).isNull();
  }
}
