package io.outlog.domain.error;

import java.io.Serial;
import java.util.Objects;

/**
 * Base type of every exception raised by the outbound logging layer.
 *
 * <p>Framework-agnostic and unchecked. Subclasses pin an {@link OutlogErrorCode}; the message must
 * never contain request/response payloads or header values.
 */
public abstract class OutlogException extends RuntimeException {

  @Serial private static final long serialVersionUID = 1L;

  private final OutlogErrorCode errorCode;

  protected OutlogException(OutlogErrorCode errorCode, String message) {
    super(message);
    this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
  }

  protected OutlogException(OutlogErrorCode errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
  }

  public OutlogErrorCode errorCode() {
    return errorCode;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + errorCode.code() + "]: " + getMessage();
  }
}
