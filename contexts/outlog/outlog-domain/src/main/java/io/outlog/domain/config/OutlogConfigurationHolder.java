package io.outlog.domain.config;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Resolves the effective {@link OutlogConfiguration} for the calling thread.
 *
 * <p>- A process-wide default held in a volatile reference; reads never lock. <br>
 * - A per-thread override, invisible to every other thread. <br>
 * - Overrides are built on a copy of the currently effective configuration, which may itself be an
 * override, and are restored in stack order.
 */
public final class OutlogConfigurationHolder {

  private static final Object GLOBAL_LOCK = new Object();

  private static volatile OutlogConfiguration global = OutlogConfiguration.defaults();

  private static final ThreadLocal<OutlogConfiguration> TL_OVERRIDE = new ThreadLocal<>();

  private OutlogConfigurationHolder() {}

  // ---------------- Resolution ----------------

  /** Returns the thread override when present, otherwise the global default. */
  public static OutlogConfiguration current() {
    OutlogConfiguration override = TL_OVERRIDE.get();
    return override != null ? override : global;
  }

  /** Returns the global default, ignoring any override on this thread. */
  public static OutlogConfiguration global() {
    return global;
  }

  /** Returns this thread's override, if one is active. */
  public static Optional<OutlogConfiguration> override() {
    return Optional.ofNullable(TL_OVERRIDE.get());
  }

  // ---------------- Global mutation ----------------

  /** Replaces the global default. */
  public static void setGlobal(OutlogConfiguration configuration) {
    Objects.requireNonNull(configuration, "configuration");
    synchronized (GLOBAL_LOCK) {
      global = configuration;
    }
  }

  /**
   * Applies {@code changes} to a copy of the global default and publishes the result atomically.
   *
   * @return the new global default
   */
  public static OutlogConfiguration configure(Consumer<OutlogConfiguration.Builder> changes) {
    Objects.requireNonNull(changes, "changes");
    synchronized (GLOBAL_LOCK) {
      OutlogConfiguration.Builder builder = global.toBuilder();
      changes.accept(builder);
      OutlogConfiguration next = builder.build();
      global = next;
      return next;
    }
  }

  /** Restores the built-in defaults and drops this thread's override. */
  public static void reset() {
    setGlobal(OutlogConfiguration.defaults());
    TL_OVERRIDE.remove();
  }

  /**
   * Installs {@code configuration} as this thread's override without opening a scope; {@code null}
   * drops it. Callers are responsible for restoring the previous value.
   */
  public static void setOverride(OutlogConfiguration configuration) {
    if (configuration == null) {
      TL_OVERRIDE.remove();
    } else {
      TL_OVERRIDE.set(configuration);
    }
  }

  /** Drops this thread's override, if any. */
  public static void clearOverride() {
    TL_OVERRIDE.remove();
  }

  // ---------------- Scoping ----------------

  /**
   * Opens an override built from the currently effective configuration with {@code overrides}
   * applied. Close the returned scope in a finally block.
   */
  public static Scope open(Consumer<OutlogConfiguration.Builder> overrides) {
    Objects.requireNonNull(overrides, "overrides");
    OutlogConfiguration.Builder builder = current().toBuilder();
    overrides.accept(builder);
    return open(builder.build());
  }

  /** Opens an override with a fully built configuration. */
  public static Scope open(OutlogConfiguration configuration) {
    Objects.requireNonNull(configuration, "configuration");
    final OutlogConfiguration previous = TL_OVERRIDE.get();
    TL_OVERRIDE.set(configuration);
    return new Scope(previous);
  }

  /**
   * Runs {@code body} with a thread-local configuration override and restores the previous state
   * on every exit path.
   */
  public static <T> T withScopedConfiguration(
      Consumer<OutlogConfiguration.Builder> overrides, Supplier<T> body) {
    Objects.requireNonNull(body, "body");
    try (Scope ignored = open(overrides)) {
      return body.get();
    }
  }

  /** Runnable variant of {@link #withScopedConfiguration(Consumer, Supplier)}. */
  public static void withScopedConfiguration(
      Consumer<OutlogConfiguration.Builder> overrides, Runnable body) {
    Objects.requireNonNull(body, "body");
    try (Scope ignored = open(overrides)) {
      body.run();
    }
  }

  // ---------------- Scope ----------------

  /** Restores the override that was active when the scope was opened. */
  public static final class Scope implements AutoCloseable, Serializable {
    @Serial private static final long serialVersionUID = 1L;

    private final transient OutlogConfiguration previous;

    private Scope(OutlogConfiguration previous) {
      this.previous = previous;
    }

    @Override
    public void close() {
      if (previous == null) {
        TL_OVERRIDE.remove();
      } else {
        TL_OVERRIDE.set(previous);
      }
    }
  }
}
