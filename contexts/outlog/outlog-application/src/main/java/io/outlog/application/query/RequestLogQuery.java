package io.outlog.application.query;

import io.outlog.domain.record.LoggableRef;
import io.outlog.domain.record.RequestLogRecord;
import jakarta.annotation.Nullable;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Criteria for reading recorded calls back from a log store. All criteria are combined with AND;
 * an empty query matches everything.
 *
 * <p>{@link #matches(RequestLogRecord)} is the reference semantics; SQL-backed stores translate the
 * same criteria into a {@code WHERE} clause.
 */
public final class RequestLogQuery {

  /** Default page size when no limit is given. */
  public static final int DEFAULT_LIMIT = 100;

  /** Record fields a substring can be searched in. */
  public enum Field {
    URL,
    REQUEST_BODY,
    RESPONSE_BODY,
    REQUEST_HEADERS,
    RESPONSE_HEADERS,
    METADATA
  }

  private final Set<Integer> statusCodes;
  @Nullable private final Integer minStatus;
  @Nullable private final Integer maxStatus;
  private final Set<String> methods;
  @Nullable private final String urlContains;
  @Nullable private final Instant createdFrom;
  @Nullable private final Instant createdTo;
  @Nullable private final Double minDurationMillis;
  @Nullable private final Double maxDurationMillis;
  @Nullable private final LoggableRef loggable;
  @Nullable private final String text;
  private final Map<Field, String> contains;
  private final Map<String, String> metadataEntries;
  private final int limit;

  private RequestLogQuery(Builder b) {
    this.statusCodes = Collections.unmodifiableSet(new LinkedHashSet<>(b.statusCodes));
    this.minStatus = b.minStatus;
    this.maxStatus = b.maxStatus;
    this.methods = Collections.unmodifiableSet(new LinkedHashSet<>(b.methods));
    this.urlContains = b.urlContains;
    this.createdFrom = b.createdFrom;
    this.createdTo = b.createdTo;
    this.minDurationMillis = b.minDurationMillis;
    this.maxDurationMillis = b.maxDurationMillis;
    this.loggable = b.loggable;
    this.text = b.text;
    this.contains = Collections.unmodifiableMap(new LinkedHashMap<>(b.contains));
    this.metadataEntries = Collections.unmodifiableMap(new LinkedHashMap<>(b.metadataEntries));
    this.limit = b.limit;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Matches everything, newest first, default limit. */
  public static RequestLogQuery all() {
    return builder().build();
  }

  // ---------------- Evaluation ----------------

  /** In-memory evaluation of every criterion except the limit. */
  public boolean matches(RequestLogRecord r) {
    Objects.requireNonNull(r, "record");
    if (!statusCodes.isEmpty() && !statusCodes.contains(r.statusCode())) {
      return false;
    }
    if (minStatus != null && r.statusCode() < minStatus) {
      return false;
    }
    if (maxStatus != null && r.statusCode() > maxStatus) {
      return false;
    }
    if (!methods.isEmpty() && !methods.contains(r.method())) {
      return false;
    }
    if (urlContains != null && !containsIgnoreCase(r.url(), urlContains)) {
      return false;
    }
    if (createdFrom != null && r.createdAt().isBefore(createdFrom)) {
      return false;
    }
    if (createdTo != null && r.createdAt().isAfter(createdTo)) {
      return false;
    }
    if (minDurationMillis != null && r.durationMillis() < minDurationMillis) {
      return false;
    }
    if (maxDurationMillis != null && r.durationMillis() > maxDurationMillis) {
      return false;
    }
    if (loggable != null && !matchesLoggable(r.loggableRef())) {
      return false;
    }
    if (text != null
        && !(containsIgnoreCase(r.url(), text)
            || containsIgnoreCase(r.requestBody(), text)
            || containsIgnoreCase(r.responseBody(), text))) {
      return false;
    }
    for (Map.Entry<Field, String> c : contains.entrySet()) {
      if (!containsIgnoreCase(render(r, c.getKey()), c.getValue())) {
        return false;
      }
    }
    for (Map.Entry<String, String> e : metadataEntries.entrySet()) {
      Object value = r.metadata().get(e.getKey());
      if (value == null || !String.valueOf(value).equals(e.getValue())) {
        return false;
      }
    }
    return true;
  }

  private boolean matchesLoggable(@Nullable LoggableRef ref) {
    if (ref == null || !loggable.type().equals(ref.type())) {
      return false;
    }
    return loggable.id() == null || loggable.id().equals(ref.id());
  }

  private static String render(RequestLogRecord r, Field field) {
    return switch (field) {
      case URL -> r.url();
      case REQUEST_BODY -> r.requestBody();
      case RESPONSE_BODY -> r.responseBody();
      case REQUEST_HEADERS -> r.requestHeaders().toString();
      case RESPONSE_HEADERS -> r.responseHeaders().toString();
      case METADATA -> r.metadata().toString();
    };
  }

  private static boolean containsIgnoreCase(@Nullable String haystack, String needle) {
    return haystack != null
        && haystack.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
  }

  // ---------------- Accessors ----------------

  public Set<Integer> statusCodes() {
    return statusCodes;
  }

  @Nullable
  public Integer minStatus() {
    return minStatus;
  }

  @Nullable
  public Integer maxStatus() {
    return maxStatus;
  }

  public Set<String> methods() {
    return methods;
  }

  @Nullable
  public String urlContains() {
    return urlContains;
  }

  @Nullable
  public Instant createdFrom() {
    return createdFrom;
  }

  @Nullable
  public Instant createdTo() {
    return createdTo;
  }

  @Nullable
  public Double minDurationMillis() {
    return minDurationMillis;
  }

  @Nullable
  public Double maxDurationMillis() {
    return maxDurationMillis;
  }

  @Nullable
  public LoggableRef loggable() {
    return loggable;
  }

  @Nullable
  public String text() {
    return text;
  }

  public Map<Field, String> contains() {
    return contains;
  }

  public Map<String, String> metadataEntries() {
    return metadataEntries;
  }

  public int limit() {
    return limit;
  }

  // -------------------------------------------------------------------------------------
  // Builder
  // -------------------------------------------------------------------------------------

  public static final class Builder {
    private final Set<Integer> statusCodes = new LinkedHashSet<>();
    private Integer minStatus;
    private Integer maxStatus;
    private final Set<String> methods = new LinkedHashSet<>();
    private String urlContains;
    private Instant createdFrom;
    private Instant createdTo;
    private Double minDurationMillis;
    private Double maxDurationMillis;
    private LoggableRef loggable;
    private String text;
    private final Map<Field, String> contains = new LinkedHashMap<>();
    private final Map<String, String> metadataEntries = new LinkedHashMap<>();
    private int limit = DEFAULT_LIMIT;

    private Builder() {}

    public Builder statusCodes(Collection<Integer> codes) {
      this.statusCodes.addAll(codes);
      return this;
    }

    public Builder statusCode(int code) {
      this.statusCodes.add(code);
      return this;
    }

    /** 2xx and 3xx. */
    public Builder successful() {
      this.minStatus = 200;
      this.maxStatus = 399;
      return this;
    }

    /** 4xx and above. */
    public Builder failed() {
      this.minStatus = 400;
      this.maxStatus = null;
      return this;
    }

    public Builder methods(Collection<String> methods) {
      methods.forEach(this::method);
      return this;
    }

    public Builder method(String method) {
      this.methods.add(method.toUpperCase(Locale.ROOT));
      return this;
    }

    /** Case-insensitive substring of the URL. */
    public Builder urlContains(String fragment) {
      this.urlContains = blankToNull(fragment);
      return this;
    }

    public Builder createdBetween(@Nullable Instant from, @Nullable Instant to) {
      this.createdFrom = from;
      this.createdTo = to;
      return this;
    }

    public Builder minDuration(Duration min) {
      this.minDurationMillis = min.toNanos() / 1_000_000d;
      return this;
    }

    public Builder maxDuration(Duration max) {
      this.maxDurationMillis = max.toNanos() / 1_000_000d;
      return this;
    }

    /** Strictly slower than {@code threshold}. */
    public Builder slowerThan(Duration threshold) {
      this.minDurationMillis = threshold.toNanos() / 1_000_000d + 0.01d;
      return this;
    }

    /** Records of one loggable; a null id matches every id of the type. */
    public Builder loggable(LoggableRef ref) {
      this.loggable = Objects.requireNonNull(ref, "ref");
      return this;
    }

    /** Case-insensitive search over URL, request body and response body. */
    public Builder text(String text) {
      this.text = blankToNull(text);
      return this;
    }

    /** Case-insensitive substring containment in one field. */
    public Builder contains(Field field, String fragment) {
      Objects.requireNonNull(field, "field");
      String f = blankToNull(fragment);
      if (f != null) {
        this.contains.put(field, f);
      }
      return this;
    }

    /** Exact match of one metadata value, compared in string form. */
    public Builder metadataEntry(String key, Object value) {
      this.metadataEntries.put(
          Objects.requireNonNull(key, "key"), String.valueOf(Objects.requireNonNull(value)));
      return this;
    }

    public Builder limit(int limit) {
      if (limit < 1) {
        throw new IllegalArgumentException("limit must be >= 1");
      }
      this.limit = limit;
      return this;
    }

    public RequestLogQuery build() {
      return new RequestLogQuery(this);
    }

    private static String blankToNull(String s) {
      return (s == null || s.isBlank()) ? null : s.trim();
    }
  }
}
