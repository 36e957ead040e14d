package io.outlog.domain.error;

import java.io.Serial;

/** A configuration value was rejected while building an {@code OutlogConfiguration}. */
public final class InvalidConfigurationException extends OutlogException {

  @Serial private static final long serialVersionUID = 1L;

  public InvalidConfigurationException(String message) {
    super(OutlogErrorCode.INVALID_CONFIGURATION, message);
  }

  public InvalidConfigurationException(String message, Throwable cause) {
    super(OutlogErrorCode.INVALID_CONFIGURATION, message, cause);
  }
}
