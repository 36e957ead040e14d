package io.outlog.domain.record;

import java.util.Objects;

/**
 * Persisted identity of a loggable: a type name and an optional id.
 *
 * @param type entity type, e.g. {@code "User"}
 * @param id entity id, or {@code null} when the loggable has none
 */
public record LoggableRef(String type, String id) {

  public LoggableRef {
    Objects.requireNonNull(type, "type");
    if (type.isBlank()) {
      throw new IllegalArgumentException("type must not be blank");
    }
  }

  public static LoggableRef of(String type, Object id) {
    return new LoggableRef(type, id == null ? null : String.valueOf(id));
  }

  /**
   * Derives the persisted identity of an arbitrary context loggable.
   *
   * <p>{@link LoggableRef} passes through, {@link Loggable} supplies its own, anything else is
   * identified by its simple class name only.
   *
   * @return the reference, or {@code null} for a null loggable
   */
  public static LoggableRef from(Object loggable) {
    if (loggable == null) {
      return null;
    }
    if (loggable instanceof LoggableRef ref) {
      return ref;
    }
    if (loggable instanceof Loggable l) {
      return l.loggableRef();
    }
    String type = loggable.getClass().getSimpleName();
    return new LoggableRef(type.isEmpty() ? loggable.getClass().getName() : type, null);
  }
}
