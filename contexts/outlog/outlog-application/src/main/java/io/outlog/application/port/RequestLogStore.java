package io.outlog.application.port;

import io.outlog.application.query.RequestLogQuery;
import io.outlog.application.query.RequestLogStatistics;
import io.outlog.application.query.StoredRequestLog;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * A sink that can also read its records back. Results are ordered newest first.
 */
public interface RequestLogStore extends RequestLogSink {

  List<StoredRequestLog> find(RequestLogQuery query);

  long count(RequestLogQuery query);

  Optional<StoredRequestLog> findById(Object id);

  RequestLogStatistics statistics(RequestLogQuery query);

  /**
   * Deletes records created more than {@code olderThan} ago.
   *
   * @return number of deleted records
   */
  int cleanup(Duration olderThan);
}
