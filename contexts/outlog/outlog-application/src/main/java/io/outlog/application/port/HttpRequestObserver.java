package io.outlog.application.port;

import jakarta.annotation.Nullable;

/**
 * Observability hook notified after every recorded call. Failures are caught and logged by the
 * pipeline.
 */
@FunctionalInterface
public interface HttpRequestObserver {

  /**
   * @param method uppercase HTTP method
   * @param url full request URL
   * @param statusCode response status, {@code 0} for transport failures
   * @param durationSeconds duration of the underlying call
   * @param error the failure of the underlying call, if any
   */
  void onHttpRequest(
      String method, String url, int statusCode, double durationSeconds, @Nullable Throwable error);
}
