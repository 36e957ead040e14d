package io.outlog.application.query;

/**
 * Aggregates over the records matching a query.
 *
 * @param total number of records
 * @param successful records with a 2xx/3xx status
 * @param failed records with a 4xx/5xx status or a transport failure
 * @param averageDurationMillis mean duration, {@code 0} when there are no records
 */
public record RequestLogStatistics(
    long total, long successful, long failed, double averageDurationMillis) {

  public static final RequestLogStatistics EMPTY = new RequestLogStatistics(0, 0, 0, 0d);

  /** Share of successful records in percent, rounded to two decimals. */
  public double successRate() {
    if (total == 0) {
      return 0d;
    }
    return Math.round(successful * 10_000d / total) / 100d;
  }
}
