package io.outlog.infrastructure.observability;

import io.outlog.application.port.HttpRequestObserver;
import io.outlog.domain.config.OutlogConfiguration;
import io.outlog.domain.config.OutlogConfigurationHolder;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.event.Level;
import org.springframework.lang.Nullable;

/**
 * Writes one key=value log line per recorded call, plus a slow-call line above the configured
 * threshold.
 *
 * <p>Level follows the status: 2xx/3xx INFO, 4xx WARN, 5xx ERROR, transport failures WARN, anything
 * else DEBUG. Slow calls log at INFO, or WARN from twice the threshold. Query parameters with
 * sensitive names are dropped from the logged URL. MDC keys {@code outlog.method} and {@code
 * outlog.status} are set for the duration of the log call.
 */
public class StructuredLogRequestObserver implements HttpRequestObserver {

  static final String MDC_METHOD = "outlog.method";
  static final String MDC_STATUS = "outlog.status";

  private final Logger logger;
  private final Supplier<OutlogConfiguration> configuration;

  public StructuredLogRequestObserver() {
    this(LoggerFactory.getLogger("io.outlog.http.requests"), OutlogConfigurationHolder::current);
  }

  public StructuredLogRequestObserver(
      Logger logger, Supplier<OutlogConfiguration> configuration) {
    this.logger = Objects.requireNonNull(logger, "logger");
    this.configuration = Objects.requireNonNull(configuration, "configuration");
  }

  @Override
  public void onHttpRequest(
      String method, String url, int statusCode, double durationSeconds, @Nullable Throwable error) {
    OutlogConfiguration config = configuration.get();
    String safeUrl = UrlParts.sanitize(url, config);
    String durationMs = String.format(Locale.ROOT, "%.2f", durationSeconds * 1000d);

    try (MDC.MDCCloseable m = MDC.putCloseable(MDC_METHOD, method);
        MDC.MDCCloseable s = MDC.putCloseable(MDC_STATUS, Integer.toString(statusCode))) {
      Level level = levelFor(statusCode, error);
      if (logger.isEnabledForLevel(level)) {
        logger
            .atLevel(level)
            .log(
                "HTTP {} {} {} category=http_request method={} status={} duration_ms={} success={}{}",
                method,
                safeUrl,
                statusCode,
                method,
                statusCode,
                durationMs,
                statusCode >= 200 && statusCode < 300,
                error == null ? "" : " error=" + error.getClass().getName());
      }
      slowCall(method, safeUrl, durationSeconds, durationMs, config.slowRequestThreshold());
    }
  }

  private void slowCall(
      String method, String url, double durationSeconds, String durationMs, Duration threshold) {
    double thresholdSeconds = threshold.toNanos() / 1_000_000_000d;
    if (thresholdSeconds <= 0 || durationSeconds < thresholdSeconds) {
      return;
    }
    boolean severe = durationSeconds >= thresholdSeconds * 2;
    Level level = severe ? Level.WARN : Level.INFO;
    if (logger.isEnabledForLevel(level)) {
      logger
          .atLevel(level)
          .log(
              "Slow outbound request {} {} operation=http_request duration_ms={} threshold_ms={}"
                  + " performance_warning={}",
              method,
              url,
              durationMs,
              threshold.toMillis(),
              severe);
    }
  }

  static Level levelFor(int statusCode, @Nullable Throwable error) {
    if (error != null) {
      return Level.WARN;
    }
    if (statusCode >= 200 && statusCode < 400) {
      return Level.INFO;
    }
    if (statusCode >= 400 && statusCode < 500) {
      return Level.WARN;
    }
    if (statusCode >= 500 && statusCode < 600) {
      return Level.ERROR;
    }
    return Level.DEBUG;
  }
}
