package io.outlog.domain.record;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * One recorded outbound HTTP call, as handed to a sink.
 *
 * <p>Immutable and fully built before persistence starts. Headers and bodies are already redacted.
 * Identity is assigned by the sink.
 *
 * @param method canonical uppercase HTTP method
 * @param url full request URL
 * @param statusCode response status, or {@link #TRANSPORT_FAILURE} when no response was received
 * @param requestHeaders redacted request headers
 * @param requestBody redacted request body, may be null
 * @param responseHeaders redacted response headers
 * @param responseBody redacted response body or error description, may be null
 * @param durationSeconds monotonic duration of the underlying call only
 * @param loggable application correlation handle, may be null
 * @param metadata free-form context metadata
 * @param createdAt wall-clock time the record was built
 */
public record RequestLogRecord(
    String method,
    String url,
    int statusCode,
    Map<String, String> requestHeaders,
    String requestBody,
    Map<String, String> responseHeaders,
    String responseBody,
    double durationSeconds,
    Object loggable,
    Map<String, Object> metadata,
    Instant createdAt) {

  /** Status code recorded when the call failed before any response arrived. */
  public static final int TRANSPORT_FAILURE = 0;

  public RequestLogRecord {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(url, "url");
    method = method.toUpperCase(Locale.ROOT);
    requestHeaders = copy(requestHeaders);
    responseHeaders = copy(responseHeaders);
    metadata = copy(metadata);
    if (durationSeconds < 0) {
      throw new IllegalArgumentException("durationSeconds must be >= 0");
    }
    createdAt = createdAt == null ? Instant.now() : createdAt;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Duration in milliseconds, rounded to two decimals. */
  public double durationMillis() {
    return Math.round(durationSeconds * 100_000d) / 100d;
  }

  /** 2xx and 3xx responses. */
  public boolean isSuccessful() {
    return statusCode >= 200 && statusCode < 400;
  }

  /** 4xx, 5xx and transport failures. */
  public boolean isFailed() {
    return statusCode >= 400 || statusCode == TRANSPORT_FAILURE;
  }

  public boolean isTransportFailure() {
    return statusCode == TRANSPORT_FAILURE;
  }

  public boolean isSlow(Duration threshold) {
    return durationSeconds * 1_000_000_000d > threshold.toNanos();
  }

  /** Persisted identity of the loggable, or null. */
  public LoggableRef loggableRef() {
    return LoggableRef.from(loggable);
  }

  private static <V> Map<String, V> copy(Map<String, V> in) {
    if (in == null || in.isEmpty()) {
      return Map.of();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(in));
  }

  /** Fluent builder; {@link #build()} may be called once per record. */
  public static final class Builder {
    private String method;
    private String url;
    private int statusCode;
    private Map<String, String> requestHeaders;
    private String requestBody;
    private Map<String, String> responseHeaders;
    private String responseBody;
    private double durationSeconds;
    private Object loggable;
    private Map<String, Object> metadata;
    private Instant createdAt;

    private Builder() {}

    public Builder method(String method) {
      this.method = method;
      return this;
    }

    public Builder url(String url) {
      this.url = url;
      return this;
    }

    public Builder statusCode(int statusCode) {
      this.statusCode = statusCode;
      return this;
    }

    public Builder requestHeaders(Map<String, String> requestHeaders) {
      this.requestHeaders = requestHeaders;
      return this;
    }

    public Builder requestBody(String requestBody) {
      this.requestBody = requestBody;
      return this;
    }

    public Builder responseHeaders(Map<String, String> responseHeaders) {
      this.responseHeaders = responseHeaders;
      return this;
    }

    public Builder responseBody(String responseBody) {
      this.responseBody = responseBody;
      return this;
    }

    public Builder durationSeconds(double durationSeconds) {
      this.durationSeconds = durationSeconds;
      return this;
    }

    public Builder loggable(Object loggable) {
      this.loggable = loggable;
      return this;
    }

    public Builder metadata(Map<String, Object> metadata) {
      this.metadata = metadata;
      return this;
    }

    public Builder createdAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    public RequestLogRecord build() {
      return new RequestLogRecord(
          method,
          url,
          statusCode,
          requestHeaders,
          requestBody,
          responseHeaders,
          responseBody,
          durationSeconds,
          loggable,
          metadata,
          createdAt);
    }
  }
}
