package io.outlog.domain.context;

import io.outlog.domain.config.OutlogConfiguration;
import io.outlog.domain.config.OutlogConfigurationHolder;
import java.io.Serial;
import java.io.Serializable;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Thread-confined context of outbound HTTP logging.
 *
 * <p>- Holds the loggable (correlation handle), free-form metadata and per-library recursion
 * depth for the calling thread. <br>
 * - State is created lazily and never shared across threads; hand-off to another thread is
 * explicit via {@link #wrap(Runnable)} / {@link #wrap(Callable)}. <br>
 * - Every scoped helper restores the previous values on every exit path.
 *
 * <pre>{@code
 * try (OutboundLogContext.Scope scope = OutboundLogContext.open(user, Map.of("action", "sync"))) {
 *   client.send(request, BodyHandlers.ofString());
 * }
 * }</pre>
 */
public final class OutboundLogContext {

  private static final ThreadLocal<State> TL_STATE = new ThreadLocal<>();

  private OutboundLogContext() {}

  // ---------------- State ----------------

  /** Mutable per-thread state; only ever touched by its owning thread. */
  static final class State {
    Object loggable;
    Map<String, Object> metadata;
    final Map<String, Integer> recursionDepth = new HashMap<>();
    int suppressions;
    boolean reportingRecursion;

    State copyForIsolation() {
      State copy = new State();
      copy.loggable = loggable;
      copy.metadata = metadata == null ? null : new LinkedHashMap<>(metadata);
      copy.recursionDepth.putAll(recursionDepth);
      copy.suppressions = suppressions;
      copy.reportingRecursion = reportingRecursion;
      return copy;
    }

    boolean isEmpty() {
      return loggable == null
          && (metadata == null || metadata.isEmpty())
          && recursionDepth.isEmpty()
          && suppressions == 0
          && !reportingRecursion;
    }
  }

  static State state() {
    State s = TL_STATE.get();
    if (s == null) {
      s = new State();
      TL_STATE.set(s);
    }
    return s;
  }

  static State peek() {
    return TL_STATE.get();
  }

  // ---------------- Mutators ----------------

  /** Sets the loggable for subsequent calls on this thread; {@code null} removes it. */
  public static void setLoggable(Object loggable) {
    state().loggable = loggable;
  }

  /** Replaces the metadata wholesale; {@code null} removes it. */
  public static void setMetadata(Map<String, ?> metadata) {
    state().metadata = metadata == null ? null : new LinkedHashMap<>(metadata);
  }

  /** Shallow-merges {@code metadata} into the current metadata, creating it if absent. */
  public static void mergeMetadata(Map<String, ?> metadata) {
    if (metadata == null || metadata.isEmpty()) {
      return;
    }
    State s = state();
    if (s.metadata == null) {
      s.metadata = new LinkedHashMap<>();
    }
    s.metadata.putAll(metadata);
  }

  /** Resets loggable, metadata and all recursion counters of this thread. */
  public static void clear() {
    TL_STATE.remove();
  }

  /** {@link #clear()} plus removal of this thread's configuration override. */
  public static void clearAll() {
    TL_STATE.remove();
    OutlogConfigurationHolder.clearOverride();
  }

  // ---------------- Accessors ----------------

  public static Optional<Object> loggable() {
    State s = TL_STATE.get();
    return Optional.ofNullable(s == null ? null : s.loggable);
  }

  /** Returns an unmodifiable snapshot of the metadata; empty when none is set. */
  public static Map<String, Object> metadata() {
    State s = TL_STATE.get();
    if (s == null || s.metadata == null) {
      return Map.of();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(s.metadata));
  }

  /** Whether anything is held for this thread, including an active configuration override. */
  public static boolean isPresent() {
    State s = TL_STATE.get();
    return (s != null && !s.isEmpty()) || OutlogConfigurationHolder.override().isPresent();
  }

  // ---------------- Scoping ----------------

  /**
   * Opens a scope that applies the given loggable and metadata.
   *
   * <p>A {@code null} loggable or a null/empty metadata map leaves the respective current value in
   * place. {@link Scope#close()} restores both previous values.
   */
  public static Scope open(Object loggable, Map<String, ?> metadata) {
    State s = state();
    final Object prevLoggable = s.loggable;
    final Map<String, Object> prevMetadata = s.metadata;

    if (loggable != null) {
      s.loggable = loggable;
    }
    if (metadata != null && !metadata.isEmpty()) {
      s.metadata = new LinkedHashMap<>(metadata);
    }
    return new Scope(prevLoggable, prevMetadata);
  }

  /** Runs {@code body} with the given loggable and metadata, restoring the previous values. */
  public static <T> T withScopedContext(Object loggable, Map<String, ?> metadata, Supplier<T> body) {
    Objects.requireNonNull(body, "body");
    try (Scope ignored = open(loggable, metadata)) {
      return body.get();
    }
  }

  /** Runnable variant of {@link #withScopedContext(Object, Map, Supplier)}. */
  public static void withScopedContext(Object loggable, Map<String, ?> metadata, Runnable body) {
    Objects.requireNonNull(body, "body");
    try (Scope ignored = open(loggable, metadata)) {
      body.run();
    }
  }

  /**
   * Runs {@code body} with complete isolation of this thread's logging state.
   *
   * <p>Snapshots the context (including recursion counters) and the configuration override,
   * optionally applies {@code configOverrides}, {@code loggable} and {@code metadata}, and restores
   * the snapshot unconditionally afterwards.
   */
  public static <T> T withIsolatedContext(
      Consumer<OutlogConfiguration.Builder> configOverrides,
      Object loggable,
      Map<String, ?> metadata,
      Supplier<T> body) {
    Objects.requireNonNull(body, "body");
    final State backup = TL_STATE.get();
    final State working = backup == null ? new State() : backup.copyForIsolation();
    final Optional<OutlogConfiguration> overrideBackup = OutlogConfigurationHolder.override();
    TL_STATE.set(working);
    try {
      if (configOverrides != null) {
        OutlogConfiguration.Builder builder = OutlogConfigurationHolder.current().toBuilder();
        configOverrides.accept(builder);
        OutlogConfigurationHolder.setOverride(builder.build());
      }
      if (loggable != null) {
        working.loggable = loggable;
      }
      if (metadata != null && !metadata.isEmpty()) {
        working.metadata = new LinkedHashMap<>(metadata);
      }
      return body.get();
    } finally {
      if (backup == null) {
        TL_STATE.remove();
      } else {
        TL_STATE.set(backup);
      }
      OutlogConfigurationHolder.setOverride(overrideBackup.orElse(null));
    }
  }

  // ---------------- Suppression ----------------

  /**
   * Runs {@code body} with interception suppressed on this thread: instrumented clients call
   * straight through and nothing is recorded. Nests.
   */
  public static <T> T withInterceptionSuppressed(Supplier<T> body) {
    Objects.requireNonNull(body, "body");
    State s = state();
    s.suppressions++;
    try {
      return body.get();
    } finally {
      s.suppressions--;
    }
  }

  /** Runnable variant of {@link #withInterceptionSuppressed(Supplier)}. */
  public static void withInterceptionSuppressed(Runnable body) {
    Objects.requireNonNull(body, "body");
    withInterceptionSuppressed(
        () -> {
          body.run();
          return null;
        });
  }

  public static boolean isInterceptionSuppressed() {
    State s = TL_STATE.get();
    return s != null && s.suppressions > 0;
  }

  // ---------------- Cross-thread helpers ----------------

  /**
   * Captures loggable, metadata and configuration override of the calling thread and applies them
   * around {@code delegate} on whichever thread runs it. Recursion counters are not carried over.
   */
  public static Runnable wrap(Runnable delegate) {
    Objects.requireNonNull(delegate, "delegate");
    final Snapshot captured = Snapshot.capture();
    if (captured.isEmpty()) {
      return delegate;
    }
    return () -> {
      try (Restore ignored = captured.apply()) {
        delegate.run();
      }
    };
  }

  /** {@link Callable} variant of {@link #wrap(Runnable)}. */
  public static <V> Callable<V> wrap(Callable<V> delegate) {
    Objects.requireNonNull(delegate, "delegate");
    final Snapshot captured = Snapshot.capture();
    if (captured.isEmpty()) {
      return delegate;
    }
    return () -> {
      try (Restore ignored = captured.apply()) {
        return delegate.call();
      }
    };
  }

  private record Snapshot(
      Object loggable, Map<String, Object> metadata, OutlogConfiguration override) {

    static Snapshot capture() {
      State s = TL_STATE.get();
      Object loggable = s == null ? null : s.loggable;
      Map<String, Object> metadata =
          (s == null || s.metadata == null) ? null : new LinkedHashMap<>(s.metadata);
      return new Snapshot(loggable, metadata, OutlogConfigurationHolder.override().orElse(null));
    }

    boolean isEmpty() {
      return loggable == null && metadata == null && override == null;
    }

    Restore apply() {
      final Scope contextScope = open(loggable, metadata);
      final OutlogConfigurationHolder.Scope configScope =
          override == null ? null : OutlogConfigurationHolder.open(override);
      return () -> {
        if (configScope != null) {
          configScope.close();
        }
        contextScope.close();
      };
    }
  }

  private interface Restore extends AutoCloseable {
    @Override
    void close();
  }

  // ---------------- Scope ----------------

  /**
   * Restores the loggable and metadata that were visible when the scope was opened.
   *
   * <p>Instances are created by {@link OutboundLogContext#open(Object, Map)}.
   */
  public static final class Scope implements AutoCloseable, Serializable {
    @Serial private static final long serialVersionUID = 1L;

    private final transient Object previousLoggable;
    private final transient Map<String, Object> previousMetadata;

    private Scope(Object previousLoggable, Map<String, Object> previousMetadata) {
      this.previousLoggable = previousLoggable;
      this.previousMetadata = previousMetadata;
    }

    @Override
    public void close() {
      State s = state();
      s.loggable = previousLoggable;
      s.metadata = previousMetadata;
      if (s.isEmpty()) {
        TL_STATE.remove();
      }
    }
  }
}
