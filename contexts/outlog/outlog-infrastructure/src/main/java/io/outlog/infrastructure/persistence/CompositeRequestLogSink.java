package io.outlog.infrastructure.persistence;

import io.outlog.application.port.RequestLogSink;
import io.outlog.domain.record.RequestLogRecord;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every record to a primary sink and then to secondary sinks.
 *
 * <p>The primary's identity is returned and its failures propagate. Secondary failures are logged
 * and never affect the primary write.
 */
public class CompositeRequestLogSink implements RequestLogSink {

  private static final Logger log = LoggerFactory.getLogger(CompositeRequestLogSink.class);

  private final RequestLogSink primary;
  private final List<RequestLogSink> secondaries;

  public CompositeRequestLogSink(
      RequestLogSink primary, List<? extends RequestLogSink> secondaries) {
    this.primary = Objects.requireNonNull(primary, "primary");
    this.secondaries = List.copyOf(Objects.requireNonNull(secondaries, "secondaries"));
  }

  @Override
  public Object persist(RequestLogRecord record) {
    Object id = primary.persist(record);
    for (RequestLogSink secondary : secondaries) {
      try {
        secondary.persist(record);
      } catch (RuntimeException e) {
        log.error("Secondary request log sink {} failed: {}", secondary, e.toString(), e);
      }
    }
    return id;
  }

  public RequestLogSink primary() {
    return primary;
  }
}
