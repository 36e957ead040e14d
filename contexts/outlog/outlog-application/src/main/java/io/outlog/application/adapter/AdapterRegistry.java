package io.outlog.application.adapter;

import io.outlog.domain.config.EnvironmentSwitch;
import io.outlog.domain.config.OutlogConfiguration;
import io.outlog.domain.config.OutlogConfigurationHolder;
import io.outlog.domain.error.UnsupportedAdapterException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Named set of interception adapters with status reporting and per-library switches. */
public class AdapterRegistry {

  private static final Logger log = LoggerFactory.getLogger(AdapterRegistry.class);

  private final Map<String, InterceptionAdapter<?>> adapters = new LinkedHashMap<>();
  private final Map<String, InterceptionAdapter<?>> byAlias = new LinkedHashMap<>();
  private final BooleanSupplier processSwitch;

  public AdapterRegistry(Collection<? extends InterceptionAdapter<?>> adapters) {
    this(adapters, EnvironmentSwitch::isEnabledForProcess);
  }

  public AdapterRegistry(
      Collection<? extends InterceptionAdapter<?>> adapters, BooleanSupplier processSwitch) {
    this.processSwitch = Objects.requireNonNull(processSwitch, "processSwitch");
    for (InterceptionAdapter<?> adapter : adapters) {
      String name = key(adapter.libraryName());
      if (this.adapters.putIfAbsent(name, adapter) != null) {
        throw new IllegalArgumentException("Duplicate adapter: " + name);
      }
      byAlias.put(name, adapter);
      for (String alias : adapter.aliases()) {
        byAlias.putIfAbsent(key(alias), adapter);
      }
    }
  }

  // ---------------- Lookup ----------------

  /**
   * Resolves an adapter by library name or alias, case-insensitively.
   *
   * @throws UnsupportedAdapterException for unknown names
   */
  public InterceptionAdapter<?> adapter(String name) {
    InterceptionAdapter<?> adapter = name == null ? null : byAlias.get(key(name));
    if (adapter == null) {
      throw new UnsupportedAdapterException(String.valueOf(name), adapters.keySet());
    }
    return adapter;
  }

  /** Typed variant of {@link #adapter(String)}. */
  public <A extends InterceptionAdapter<?>> A adapter(String name, Class<A> type) {
    return type.cast(adapter(name));
  }

  public Collection<InterceptionAdapter<?>> adapters() {
    return Collections.unmodifiableCollection(adapters.values());
  }

  // ---------------- Lifecycle ----------------

  /**
   * Applies every adapter that is enabled in the current configuration.
   *
   * <p>A no-op when the process-wide switch is off.
   *
   * @return names of the adapters applied by this call
   */
  public List<String> applyAll() {
    if (!processSwitch.getAsBoolean()) {
      log.info("Outbound HTTP interception disabled by {}", EnvironmentSwitch.VARIABLE);
      return List.of();
    }
    OutlogConfiguration config = OutlogConfigurationHolder.current();
    List<String> applied = new ArrayList<>();
    for (InterceptionAdapter<?> adapter : adapters.values()) {
      if (config.isAdapterEnabled(adapter.libraryName()) && adapter.apply()) {
        applied.add(adapter.libraryName());
      }
    }
    return applied;
  }

  /**
   * Re-enables one library in the global configuration and applies its adapter.
   *
   * @throws UnsupportedAdapterException for unknown names
   */
  public void enableAdapter(String name) {
    InterceptionAdapter<?> adapter = adapter(name);
    OutlogConfigurationHolder.configure(b -> b.enableAdapter(adapter.libraryName()));
    if (processSwitch.getAsBoolean()) {
      adapter.apply();
    }
  }

  /**
   * Switches recording off for one library in the global configuration. Instrumented clients keep
   * calling through, unrecorded.
   *
   * @throws UnsupportedAdapterException for unknown names
   */
  public void disableAdapter(String name) {
    InterceptionAdapter<?> adapter = adapter(name);
    OutlogConfigurationHolder.configure(b -> b.disableAdapter(adapter.libraryName()));
  }

  /** Test-only: resets the applied bookkeeping of every adapter. */
  public void resetAll() {
    adapters.values().forEach(InterceptionAdapter::reset);
  }

  // ---------------- Status ----------------

  public Map<String, AdapterStatus> status() {
    OutlogConfiguration config = OutlogConfigurationHolder.current();
    Map<String, AdapterStatus> out = new LinkedHashMap<>();
    for (InterceptionAdapter<?> adapter : adapters.values()) {
      String name = adapter.libraryName();
      out.put(
          name,
          new AdapterStatus(
              name,
              config.isEnabled() && config.isAdapterEnabled(name),
              adapter.isApplied(),
              adapter.isLibraryAvailable()));
    }
    return out;
  }

  public List<String> availableAdapters() {
    return status().values().stream()
        .filter(AdapterStatus::libraryAvailable)
        .map(AdapterStatus::libraryName)
        .toList();
  }

  public List<String> appliedAdapters() {
    return status().values().stream()
        .filter(AdapterStatus::applied)
        .map(AdapterStatus::libraryName)
        .toList();
  }

  public List<String> activeAdapters() {
    return status().values().stream()
        .filter(AdapterStatus::active)
        .map(AdapterStatus::libraryName)
        .toList();
  }

  private static String key(String name) {
    return name.trim().toLowerCase(Locale.ROOT);
  }
}
