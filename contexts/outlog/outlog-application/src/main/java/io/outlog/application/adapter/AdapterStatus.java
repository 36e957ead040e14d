package io.outlog.application.adapter;

/**
 * Point-in-time status of one adapter.
 *
 * @param libraryName adapter name
 * @param enabled recording is enabled globally and not switched off for this library
 * @param applied interception has been applied
 * @param libraryAvailable the client library is on the classpath
 */
public record AdapterStatus(
    String libraryName, boolean enabled, boolean applied, boolean libraryAvailable) {

  /** Enabled, applied and backed by an available library. */
  public boolean active() {
    return enabled && applied && libraryAvailable;
  }
}
