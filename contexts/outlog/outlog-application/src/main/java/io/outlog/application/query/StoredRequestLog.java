package io.outlog.application.query;

import io.outlog.domain.record.RequestLogRecord;
import java.util.Objects;

/**
 * A record as read back from a log store, paired with the identity the store assigned.
 *
 * @param id store identity
 * @param record the persisted record
 */
public record StoredRequestLog(Object id, RequestLogRecord record) {

  public StoredRequestLog {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(record, "record");
  }
}
