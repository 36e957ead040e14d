package io.outlog.domain.config;

import java.util.Locale;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Process-wide kill switch read from {@value #VARIABLE}.
 *
 * <p>Only an explicit {@code false}, {@code 0}, {@code no} or {@code off} (trimmed,
 * case-insensitive) disables interception. Unset, empty and unrecognised values leave it enabled.
 * The process environment is read once.
 */
public final class EnvironmentSwitch {

  public static final String VARIABLE = "ENABLE_OUTBOUND_HTTP_LOGGER";

  private static final Set<String> DISABLING_VALUES = Set.of("false", "0", "no", "off");

  private EnvironmentSwitch() {}

  /** Parses a raw value of the switch. */
  public static boolean isEnabled(String rawValue) {
    if (rawValue == null) {
      return true;
    }
    String normalized = rawValue.trim().toLowerCase(Locale.ROOT);
    return !DISABLING_VALUES.contains(normalized);
  }

  /** Reads the switch through an arbitrary environment lookup. */
  public static boolean isEnabled(UnaryOperator<String> environment) {
    return isEnabled(environment.apply(VARIABLE));
  }

  /** Value of the switch in this process, read on first access and cached. */
  public static boolean isEnabledForProcess() {
    return ProcessValue.ENABLED;
  }

  private static final class ProcessValue {
    private static final boolean ENABLED = isEnabled(System.getenv(VARIABLE));
  }
}
