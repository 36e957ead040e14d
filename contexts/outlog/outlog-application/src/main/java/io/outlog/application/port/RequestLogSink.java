package io.outlog.application.port;

import io.outlog.domain.record.RequestLogRecord;

/**
 * Durable destination of recorded calls.
 *
 * <p>Implementations must accept concurrent {@link #persist} calls from many threads. Any exception
 * thrown here is caught by the recording pipeline and never reaches the instrumented call site.
 */
@FunctionalInterface
public interface RequestLogSink {

  /**
   * Stores a fully built record.
   *
   * @return the identity assigned by the sink
   */
  Object persist(RequestLogRecord record);
}
