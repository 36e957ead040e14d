package io.outlog.domain.record;

/**
 * Implemented by application entities that want to be correlated with the outbound calls made on
 * their behalf.
 */
public interface Loggable {

  /** Stable identity persisted alongside each recorded call. */
  LoggableRef loggableRef();
}
