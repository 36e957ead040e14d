package io.outlog.domain.error;

/**
 * Stable error codes carried by every {@link OutlogException}.
 *
 * <p>Codes are part of the public contract (they appear in log lines and may be matched by callers),
 * so existing values must not be renamed.
 */
public enum OutlogErrorCode {
  /** Nested interception of the same library exceeded the configured depth. */
  RECURSION_LIMIT_EXCEEDED("recursion-limit-exceeded", true),

  /** An adapter name was not recognised by the registry. */
  UNSUPPORTED_ADAPTER("unsupported-adapter", true),

  /** A configuration value could not be accepted (bad pattern, negative size, ...). */
  INVALID_CONFIGURATION("invalid-configuration", true),

  /** A sink failed to serialize or write a record. Never surfaced to the instrumented call site. */
  PERSISTENCE_FAILED("persistence-failed", false);

  private final String code;
  private final boolean fatal;

  OutlogErrorCode(String code, boolean fatal) {
    this.code = code;
    this.fatal = fatal;
  }

  /** Kebab-case identifier used in logs. */
  public String code() {
    return code;
  }

  /**
   * Whether the error reaches the caller of the operation that raised it. Non-fatal errors are
   * recovered inside the recording pipeline.
   */
  public boolean isFatal() {
    return fatal;
  }
}
