package io.outlog.infrastructure.persistence;

import io.outlog.application.port.RequestLogSink;
import io.outlog.domain.record.RequestLogRecord;

/** Discards records; used when no store is configured so that observers still run. */
public enum NoopRequestLogSink implements RequestLogSink {
  INSTANCE;

  @Override
  public Object persist(RequestLogRecord record) {
    return null;
  }
}
