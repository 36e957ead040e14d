package io.outlog.application.adapter;

import io.outlog.application.pipeline.RecordingPipeline;
import io.outlog.domain.config.OutlogConfigurationHolder;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interception of one HTTP client library.
 *
 * <p>Interception is by decoration: {@link #instrument(Object)} returns a client that routes every
 * send through the {@link RecordingPipeline}. The client type itself is never modified.
 *
 * <h3>Lifecycle</h3>
 *
 * <ul>
 *   <li>{@link #apply()} switches the adapter live. Idempotent, and at most one concurrent caller
 *       runs {@link #install()}. A missing client library makes it a no-op; an install failure is
 *       logged and swallowed so the host application still starts.
 *   <li>Only an applied adapter instruments; before that {@link #instrument(Object)} hands the
 *       client back unchanged.
 *   <li>{@link #reset()} clears the bookkeeping for tests. Clients instrumented earlier keep
 *       recording.
 * </ul>
 *
 * @param <C> the client type being decorated
 */
public abstract class InterceptionAdapter<C> {

  private static final Logger log = LoggerFactory.getLogger(InterceptionAdapter.class);

  private final AtomicBoolean applied = new AtomicBoolean(false);

  protected final RecordingPipeline pipeline;

  protected InterceptionAdapter(RecordingPipeline pipeline) {
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
  }

  /** Stable lowercase name; keys recursion counters, configuration and the registry. */
  public abstract String libraryName();

  /** Human-readable name for logs. */
  public abstract String displayName();

  /** Additional names the registry resolves to this adapter. */
  public Set<String> aliases() {
    return Set.of();
  }

  /** Fully qualified name of a class that must be loadable for this adapter to work. */
  protected abstract String targetClassName();

  /** Decorates {@code client}, or returns it unchanged while the adapter is not applied. */
  public final C instrument(C client) {
    Objects.requireNonNull(client, "client");
    if (!isApplied()) {
      return client;
    }
    return decorate(client);
  }

  /** Builds the recording decorator around {@code client}. */
  protected abstract C decorate(C client);

  /** One-time global setup run by the first successful {@link #apply()}. */
  protected void install() {}

  // ---------------- Lifecycle ----------------

  public boolean isLibraryAvailable() {
    try {
      Class.forName(targetClassName(), false, getClass().getClassLoader());
      return true;
    } catch (ClassNotFoundException | LinkageError e) {
      return false;
    }
  }

  public boolean isApplied() {
    return applied.get();
  }

  /**
   * Switches interception live.
   *
   * @return true if this call applied the adapter
   */
  public final boolean apply() {
    if (applied.get()) {
      return false;
    }
    if (!isLibraryAvailable()) {
      log.debug("{} not on the classpath; interception not applied", displayName());
      return false;
    }
    if (!applied.compareAndSet(false, true)) {
      return false;
    }
    try {
      install();
    } catch (RuntimeException | LinkageError e) {
      applied.set(false);
      log.error("Failed to apply {} interception: {}", displayName(), e.toString(), e);
      return false;
    }
    if (OutlogConfigurationHolder.current().isDebugLogging()) {
      log.debug("{} interception applied", displayName());
    }
    return true;
  }

  /** Test-only: forgets that the adapter was applied. */
  public void reset() {
    applied.set(false);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + libraryName() + ", applied=" + isApplied() + "]";
  }
}
