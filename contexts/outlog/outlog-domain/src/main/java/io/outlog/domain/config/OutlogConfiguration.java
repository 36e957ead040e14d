package io.outlog.domain.config;

import io.outlog.domain.error.InvalidConfigurationException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Immutable configuration of the outbound logging layer.
 *
 * <p>Holds enablement, URL/content-type exclusion rules, redaction rule sets, size limits and
 * recursion-detection parameters. Pure data plus predicate evaluation; no I/O.
 *
 * <p>Instances are never patched in place. A change is a new instance built from {@link
 * #toBuilder()}, which is what makes thread-scoped overrides (see {@link
 * OutlogConfigurationHolder}) safe without read-side locking.
 *
 * <h3>Defaults</h3>
 *
 * <ul>
 *   <li>disabled until explicitly enabled
 *   <li>URL exclusions: Sentry ingest hosts, {@code /health}, {@code /ping}
 *   <li>content-type exclusions: markup, scripts, stylesheets and binary media
 *   <li>body size cutoff: 10&nbsp;000 characters
 *   <li>recursion depth limit: 3, strict detection off
 * </ul>
 */
public final class OutlogConfiguration {

  public static final int DEFAULT_MAX_BODY_SIZE = 10_000;
  public static final int DEFAULT_MAX_RECURSION_DEPTH = 3;
  public static final Duration DEFAULT_SLOW_REQUEST_THRESHOLD = Duration.ofSeconds(1);

  public static final List<String> DEFAULT_URL_EXCLUSIONS =
      List.of("https://o\\d+\\.ingest\\..*\\.sentry\\.io", "/health", "/ping");

  public static final List<String> DEFAULT_CONTENT_TYPE_EXCLUSIONS =
      List.of(
          "text/html",
          "text/css",
          "text/javascript",
          "application/javascript",
          "image/",
          "video/",
          "audio/",
          "font/");

  public static final Set<String> DEFAULT_SENSITIVE_HEADERS =
      Collections.unmodifiableSet(
          new LinkedHashSet<>(
              List.of(
                  "authorization",
                  "cookie",
                  "set-cookie",
                  "x-api-key",
                  "x-auth-token",
                  "x-access-token",
                  "bearer")));

  public static final Set<String> DEFAULT_SENSITIVE_BODY_KEYS =
      Collections.unmodifiableSet(
          new LinkedHashSet<>(
              List.of("password", "secret", "token", "key", "auth", "credential", "private")));

  private static final OutlogConfiguration DEFAULTS = builder().build();

  private final boolean enabled;
  private final List<Pattern> urlExclusionPatterns;
  private final List<String> contentTypeExclusionPrefixes;
  private final Set<String> sensitiveHeaderNames;
  private final Set<String> sensitiveBodyKeys;
  private final int maxBodySize;
  private final int maxRecursionDepth;
  private final boolean strictRecursionDetection;
  private final Set<String> disabledAdapters;
  private final boolean debugLogging;
  private final Duration slowRequestThreshold;

  private OutlogConfiguration(Builder b) {
    this.enabled = b.enabled;
    this.urlExclusionPatterns = List.copyOf(b.urlExclusionPatterns);
    this.contentTypeExclusionPrefixes = List.copyOf(b.contentTypeExclusionPrefixes);
    this.sensitiveHeaderNames = Collections.unmodifiableSet(lowercase(b.sensitiveHeaderNames));
    this.sensitiveBodyKeys = Collections.unmodifiableSet(lowercase(b.sensitiveBodyKeys));
    this.maxBodySize = b.maxBodySize;
    this.maxRecursionDepth = b.maxRecursionDepth;
    this.strictRecursionDetection = b.strictRecursionDetection;
    this.disabledAdapters = Collections.unmodifiableSet(lowercase(b.disabledAdapters));
    this.debugLogging = b.debugLogging;
    this.slowRequestThreshold = b.slowRequestThreshold;
  }

  /** Returns the shared default configuration (disabled). */
  public static OutlogConfiguration defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns a builder pre-populated with this configuration's values. */
  public Builder toBuilder() {
    return new Builder(this);
  }

  // ---------------- Predicates ----------------

  /**
   * Whether a call to {@code url} should be recorded.
   *
   * <p>False when disabled, when the URL is null or empty, or when any exclusion pattern is found
   * anywhere in the full URL string (not just the path).
   */
  public boolean shouldLogUrl(String url) {
    if (!enabled) {
      return false;
    }
    if (url == null || url.isEmpty()) {
      return false;
    }
    for (Pattern pattern : urlExclusionPatterns) {
      if (pattern.matcher(url).find()) {
        return false;
      }
    }
    return true;
  }

  /**
   * Whether a response with the given content type should be recorded.
   *
   * <p>Accepts a plain string, or a collection whose first element is used. A missing or empty
   * content type is never excluded.
   */
  public boolean shouldLogContentType(Object contentType) {
    String value = normalizeContentType(contentType);
    if (value == null || value.isEmpty()) {
      return true;
    }
    for (String prefix : contentTypeExclusionPrefixes) {
      if (value.startsWith(prefix)) {
        return false;
      }
    }
    return true;
  }

  /** Case-insensitive exact match against the sensitive header names. */
  public boolean isSensitiveHeader(String headerName) {
    return headerName != null
        && sensitiveHeaderNames.contains(headerName.toLowerCase(Locale.ROOT));
  }

  /** Case-insensitive substring match of a JSON key against the sensitive body keys. */
  public boolean isSensitiveBodyKey(String key) {
    if (key == null) {
      return false;
    }
    String lower = key.toLowerCase(Locale.ROOT);
    for (String sensitive : sensitiveBodyKeys) {
      if (lower.contains(sensitive)) {
        return true;
      }
    }
    return false;
  }

  /** Whether interception for the given library has not been switched off individually. */
  public boolean isAdapterEnabled(String libraryName) {
    return libraryName == null || !disabledAdapters.contains(libraryName.toLowerCase(Locale.ROOT));
  }

  private static String normalizeContentType(Object contentType) {
    if (contentType == null) {
      return null;
    }
    if (contentType instanceof String s) {
      return s;
    }
    if (contentType instanceof Collection<?> c) {
      if (c.isEmpty()) {
        return null;
      }
      Object first = c.iterator().next();
      return first == null ? null : first.toString();
    }
    return contentType.toString();
  }

  // ---------------- Accessors ----------------

  public boolean isEnabled() {
    return enabled;
  }

  public List<Pattern> urlExclusionPatterns() {
    return urlExclusionPatterns;
  }

  public List<String> contentTypeExclusionPrefixes() {
    return contentTypeExclusionPrefixes;
  }

  /** Lowercase sensitive header names. */
  public Set<String> sensitiveHeaderNames() {
    return sensitiveHeaderNames;
  }

  /** Lowercase sensitive body key substrings. */
  public Set<String> sensitiveBodyKeys() {
    return sensitiveBodyKeys;
  }

  public int maxBodySize() {
    return maxBodySize;
  }

  public int maxRecursionDepth() {
    return maxRecursionDepth;
  }

  public boolean isStrictRecursionDetection() {
    return strictRecursionDetection;
  }

  /** Lowercase names of libraries whose interception is switched off. */
  public Set<String> disabledAdapters() {
    return disabledAdapters;
  }

  public boolean isDebugLogging() {
    return debugLogging;
  }

  public Duration slowRequestThreshold() {
    return slowRequestThreshold;
  }

  @Override
  public String toString() {
    return "OutlogConfiguration{"
        + "enabled="
        + enabled
        + ", urlExclusions="
        + urlExclusionPatterns.size()
        + ", maxBodySize="
        + maxBodySize
        + ", maxRecursionDepth="
        + maxRecursionDepth
        + ", strictRecursionDetection="
        + strictRecursionDetection
        + ", disabledAdapters="
        + disabledAdapters
        + '}';
  }

  private static Set<String> lowercase(Collection<String> values) {
    Set<String> out = new LinkedHashSet<>();
    for (String v : values) {
      if (v != null && !v.isBlank()) {
        out.add(v.trim().toLowerCase(Locale.ROOT));
      }
    }
    return out;
  }

  // -------------------------------------------------------------------------------------
  // Builder
  // -------------------------------------------------------------------------------------

  /** Mutable builder. Not thread-safe; build one per override. */
  public static final class Builder {
    private boolean enabled = false;
    private List<Pattern> urlExclusionPatterns = compileAll(DEFAULT_URL_EXCLUSIONS);
    private List<String> contentTypeExclusionPrefixes =
        new ArrayList<>(DEFAULT_CONTENT_TYPE_EXCLUSIONS);
    private Set<String> sensitiveHeaderNames = new LinkedHashSet<>(DEFAULT_SENSITIVE_HEADERS);
    private Set<String> sensitiveBodyKeys = new LinkedHashSet<>(DEFAULT_SENSITIVE_BODY_KEYS);
    private int maxBodySize = DEFAULT_MAX_BODY_SIZE;
    private int maxRecursionDepth = DEFAULT_MAX_RECURSION_DEPTH;
    private boolean strictRecursionDetection = false;
    private Set<String> disabledAdapters = new LinkedHashSet<>();
    private boolean debugLogging = false;
    private Duration slowRequestThreshold = DEFAULT_SLOW_REQUEST_THRESHOLD;

    private Builder() {}

    private Builder(OutlogConfiguration c) {
      this.enabled = c.enabled;
      this.urlExclusionPatterns = new ArrayList<>(c.urlExclusionPatterns);
      this.contentTypeExclusionPrefixes = new ArrayList<>(c.contentTypeExclusionPrefixes);
      this.sensitiveHeaderNames = new LinkedHashSet<>(c.sensitiveHeaderNames);
      this.sensitiveBodyKeys = new LinkedHashSet<>(c.sensitiveBodyKeys);
      this.maxBodySize = c.maxBodySize;
      this.maxRecursionDepth = c.maxRecursionDepth;
      this.strictRecursionDetection = c.strictRecursionDetection;
      this.disabledAdapters = new LinkedHashSet<>(c.disabledAdapters);
      this.debugLogging = c.debugLogging;
      this.slowRequestThreshold = c.slowRequestThreshold;
    }

    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    /**
     * Replaces the URL exclusion rules with the given regular expressions.
     *
     * @throws InvalidConfigurationException if any expression does not compile
     */
    public Builder urlExclusions(Collection<String> regexes) {
      this.urlExclusionPatterns = compileAll(Objects.requireNonNull(regexes, "regexes"));
      return this;
    }

    public Builder urlExclusionPatterns(Collection<Pattern> patterns) {
      this.urlExclusionPatterns = new ArrayList<>(Objects.requireNonNull(patterns, "patterns"));
      return this;
    }

    /** Appends one URL exclusion rule. */
    public Builder excludeUrl(String regex) {
      this.urlExclusionPatterns.add(compile(regex));
      return this;
    }

    public Builder contentTypeExclusions(Collection<String> prefixes) {
      this.contentTypeExclusionPrefixes =
          new ArrayList<>(Objects.requireNonNull(prefixes, "prefixes"));
      return this;
    }

    public Builder sensitiveHeaders(Collection<String> names) {
      this.sensitiveHeaderNames = new LinkedHashSet<>(Objects.requireNonNull(names, "names"));
      return this;
    }

    public Builder sensitiveBodyKeys(Collection<String> keys) {
      this.sensitiveBodyKeys = new LinkedHashSet<>(Objects.requireNonNull(keys, "keys"));
      return this;
    }

    public Builder maxBodySize(int maxBodySize) {
      if (maxBodySize < 0) {
        throw new InvalidConfigurationException("maxBodySize must be >= 0: " + maxBodySize);
      }
      this.maxBodySize = maxBodySize;
      return this;
    }

    public Builder maxRecursionDepth(int maxRecursionDepth) {
      if (maxRecursionDepth < 1) {
        throw new InvalidConfigurationException(
            "maxRecursionDepth must be >= 1: " + maxRecursionDepth);
      }
      this.maxRecursionDepth = maxRecursionDepth;
      return this;
    }

    public Builder strictRecursionDetection(boolean strict) {
      this.strictRecursionDetection = strict;
      return this;
    }

    public Builder disabledAdapters(Collection<String> libraryNames) {
      this.disabledAdapters =
          new LinkedHashSet<>(Objects.requireNonNull(libraryNames, "libraryNames"));
      return this;
    }

    public Builder disableAdapter(String libraryName) {
      this.disabledAdapters.add(Objects.requireNonNull(libraryName, "libraryName"));
      return this;
    }

    public Builder enableAdapter(String libraryName) {
      Objects.requireNonNull(libraryName, "libraryName");
      this.disabledAdapters.removeIf(n -> n.equalsIgnoreCase(libraryName));
      return this;
    }

    public Builder debugLogging(boolean debugLogging) {
      this.debugLogging = debugLogging;
      return this;
    }

    public Builder slowRequestThreshold(Duration threshold) {
      Objects.requireNonNull(threshold, "threshold");
      if (threshold.isNegative()) {
        throw new InvalidConfigurationException("slowRequestThreshold must not be negative");
      }
      this.slowRequestThreshold = threshold;
      return this;
    }

    public OutlogConfiguration build() {
      return new OutlogConfiguration(this);
    }

    private static List<Pattern> compileAll(Collection<String> regexes) {
      List<Pattern> out = new ArrayList<>(regexes.size());
      for (String r : regexes) {
        out.add(compile(r));
      }
      return out;
    }

    private static Pattern compile(String regex) {
      Objects.requireNonNull(regex, "regex");
      try {
        return Pattern.compile(regex);
      } catch (PatternSyntaxException e) {
        throw new InvalidConfigurationException("Invalid URL exclusion pattern: " + regex, e);
      }
    }
  }
}
