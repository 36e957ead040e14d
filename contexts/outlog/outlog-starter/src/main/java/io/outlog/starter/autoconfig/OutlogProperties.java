package io.outlog.starter.autoconfig;

import io.outlog.domain.config.OutlogConfiguration;
import io.outlog.infrastructure.persistence.JdbcRequestLogStore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.lang.Nullable;
import org.springframework.validation.annotation.Validated;

/**
 * Prefix: outlog
 *
 * <pre>
 * outlog.enabled: true
 * outlog.url-exclusions: ["/health", "/ping"]
 * outlog.max-body-size: 10000
 * outlog.slow-request-threshold: 1s
 * outlog.disabled-adapters: [okhttp]
 * outlog.jdbc.table: outbound_request_logs
 * outlog.jdbc.initialize-schema: false
 * outlog.observability.metrics: true
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "outlog")
public class OutlogProperties {

  /** Master switch for recording outbound calls. */
  private boolean enabled = true;

  /** Regular expressions; matching URLs are never recorded. */
  @NotNull
  private List<String> urlExclusions = new ArrayList<>(OutlogConfiguration.DEFAULT_URL_EXCLUSIONS);

  /** Response content-type prefixes that are never recorded. */
  @NotNull
  private List<String> contentTypeExclusions =
      new ArrayList<>(OutlogConfiguration.DEFAULT_CONTENT_TYPE_EXCLUSIONS);

  /** Header names (case-insensitive substring) whose values are masked. */
  @NotNull
  private Set<String> sensitiveHeaders =
      new LinkedHashSet<>(OutlogConfiguration.DEFAULT_SENSITIVE_HEADERS);

  /** JSON keys (case-insensitive substring) whose values are masked. */
  @NotNull
  private Set<String> sensitiveBodyKeys =
      new LinkedHashSet<>(OutlogConfiguration.DEFAULT_SENSITIVE_BODY_KEYS);

  @Min(0)
  private int maxBodySize = OutlogConfiguration.DEFAULT_MAX_BODY_SIZE;

  @Min(1)
  private int maxRecursionDepth = OutlogConfiguration.DEFAULT_MAX_RECURSION_DEPTH;

  /** Fail nested same-library calls beyond the depth limit instead of passing through. */
  private boolean strictRecursionDetection = false;

  /** Library names or aliases that are not recorded. */
  @NotNull private Set<String> disabledAdapters = new LinkedHashSet<>();

  private boolean debugLogging = false;

  @NotNull
  private Duration slowRequestThreshold = OutlogConfiguration.DEFAULT_SLOW_REQUEST_THRESHOLD;

  @Valid private final Jdbc jdbc = new Jdbc();

  @Valid private final Observability observability = new Observability();

  /** Builds the runtime configuration from the bound values. */
  public OutlogConfiguration toConfiguration() {
    return OutlogConfiguration.builder()
        .enabled(enabled)
        .urlExclusions(urlExclusions)
        .contentTypeExclusions(contentTypeExclusions)
        .sensitiveHeaders(sensitiveHeaders)
        .sensitiveBodyKeys(sensitiveBodyKeys)
        .maxBodySize(maxBodySize)
        .maxRecursionDepth(maxRecursionDepth)
        .strictRecursionDetection(strictRecursionDetection)
        .disabledAdapters(disabledAdapters)
        .debugLogging(debugLogging)
        .slowRequestThreshold(slowRequestThreshold)
        .build();
  }

  // Getters / Setters
  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public List<String> getUrlExclusions() {
    return Collections.unmodifiableList(urlExclusions);
  }

  public void setUrlExclusions(List<String> urlExclusions) {
    this.urlExclusions =
        (urlExclusions == null) ? new ArrayList<>() : new ArrayList<>(urlExclusions);
  }

  public List<String> getContentTypeExclusions() {
    return Collections.unmodifiableList(contentTypeExclusions);
  }

  public void setContentTypeExclusions(List<String> contentTypeExclusions) {
    this.contentTypeExclusions =
        (contentTypeExclusions == null)
            ? new ArrayList<>()
            : new ArrayList<>(contentTypeExclusions);
  }

  public Set<String> getSensitiveHeaders() {
    return Collections.unmodifiableSet(sensitiveHeaders);
  }

  public void setSensitiveHeaders(Set<String> sensitiveHeaders) {
    this.sensitiveHeaders =
        (sensitiveHeaders == null) ? new LinkedHashSet<>() : new LinkedHashSet<>(sensitiveHeaders);
  }

  public Set<String> getSensitiveBodyKeys() {
    return Collections.unmodifiableSet(sensitiveBodyKeys);
  }

  public void setSensitiveBodyKeys(Set<String> sensitiveBodyKeys) {
    this.sensitiveBodyKeys =
        (sensitiveBodyKeys == null)
            ? new LinkedHashSet<>()
            : new LinkedHashSet<>(sensitiveBodyKeys);
  }

  public int getMaxBodySize() {
    return maxBodySize;
  }

  public void setMaxBodySize(int maxBodySize) {
    this.maxBodySize = maxBodySize;
  }

  public int getMaxRecursionDepth() {
    return maxRecursionDepth;
  }

  public void setMaxRecursionDepth(int maxRecursionDepth) {
    this.maxRecursionDepth = maxRecursionDepth;
  }

  public boolean isStrictRecursionDetection() {
    return strictRecursionDetection;
  }

  public void setStrictRecursionDetection(boolean strictRecursionDetection) {
    this.strictRecursionDetection = strictRecursionDetection;
  }

  public Set<String> getDisabledAdapters() {
    return Collections.unmodifiableSet(disabledAdapters);
  }

  public void setDisabledAdapters(Set<String> disabledAdapters) {
    this.disabledAdapters =
        (disabledAdapters == null) ? new LinkedHashSet<>() : new LinkedHashSet<>(disabledAdapters);
  }

  public boolean isDebugLogging() {
    return debugLogging;
  }

  public void setDebugLogging(boolean debugLogging) {
    this.debugLogging = debugLogging;
  }

  public Duration getSlowRequestThreshold() {
    return slowRequestThreshold;
  }

  public void setSlowRequestThreshold(Duration slowRequestThreshold) {
    this.slowRequestThreshold = slowRequestThreshold;
  }

  public Jdbc getJdbc() {
    return jdbc;
  }

  public Observability getObservability() {
    return observability;
  }

  // ---------------- Nested ----------------

  /** Prefix: outlog.jdbc */
  public static class Jdbc {

    private boolean enabled = true;

    @NotNull
    @Pattern(regexp = "[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?")
    private String table = JdbcRequestLogStore.DEFAULT_TABLE;

    /** Create the table and its indexes on startup when missing. */
    private boolean initializeSchema = false;

    /** Optional second database that receives a copy of every record. */
    @Nullable private String secondaryUrl;

    @Nullable private String secondaryUsername;

    @Nullable private String secondaryPassword;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getTable() {
      return table;
    }

    public void setTable(String table) {
      this.table = table;
    }

    public boolean isInitializeSchema() {
      return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
      this.initializeSchema = initializeSchema;
    }

    public @Nullable String getSecondaryUrl() {
      return secondaryUrl;
    }

    public void setSecondaryUrl(@Nullable String secondaryUrl) {
      this.secondaryUrl = secondaryUrl;
    }

    public @Nullable String getSecondaryUsername() {
      return secondaryUsername;
    }

    public void setSecondaryUsername(@Nullable String secondaryUsername) {
      this.secondaryUsername = secondaryUsername;
    }

    public @Nullable String getSecondaryPassword() {
      return secondaryPassword;
    }

    public void setSecondaryPassword(@Nullable String secondaryPassword) {
      this.secondaryPassword = secondaryPassword;
    }
  }

  /** Prefix: outlog.observability */
  public static class Observability {

    /** Micrometer meters, when a MeterRegistry is present. */
    private boolean metrics = true;

    /** One key=value log line per recorded call. */
    private boolean structuredLog = true;

    /** Span events on the current OpenTelemetry span. */
    private boolean spanEvents = true;

    public boolean isMetrics() {
      return metrics;
    }

    public void setMetrics(boolean metrics) {
      this.metrics = metrics;
    }

    public boolean isStructuredLog() {
      return structuredLog;
    }

    public void setStructuredLog(boolean structuredLog) {
      this.structuredLog = structuredLog;
    }

    public boolean isSpanEvents() {
      return spanEvents;
    }

    public void setSpanEvents(boolean spanEvents) {
      this.spanEvents = spanEvents;
    }
  }
}
