package io.outlog.domain.error;

import java.io.Serial;

/**
 * A sink could not serialize or store a record. Sinks throw it; the recording pipeline catches it,
 * logs it and carries on.
 */
public final class RequestLogPersistenceException extends OutlogException {

  @Serial private static final long serialVersionUID = 1L;

  public RequestLogPersistenceException(String message) {
    super(OutlogErrorCode.PERSISTENCE_FAILED, message);
  }

  public RequestLogPersistenceException(String message, Throwable cause) {
    super(OutlogErrorCode.PERSISTENCE_FAILED, message, cause);
  }
}
