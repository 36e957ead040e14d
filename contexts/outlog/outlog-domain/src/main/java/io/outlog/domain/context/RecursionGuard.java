package io.outlog.domain.context;

import io.outlog.domain.config.OutlogConfiguration;
import io.outlog.domain.error.InfiniteRecursionException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-library recursion depth of the calling thread.
 *
 * <p>Counters live in {@link OutboundLogContext} and are keyed by library name. An entry is removed
 * as soon as its depth returns to zero, so a long-lived thread does not accumulate keys.
 */
public final class RecursionGuard {

  private static final Logger log = LoggerFactory.getLogger(RecursionGuard.class);

  private RecursionGuard() {}

  /** Increments the depth for {@code libraryName} and returns the new value. */
  public static int increment(String libraryName) {
    Objects.requireNonNull(libraryName, "libraryName");
    return OutboundLogContext.state().recursionDepth.merge(libraryName, 1, Integer::sum);
  }

  /**
   * Decrements the depth for {@code libraryName}, flooring at zero. The entry is removed when it
   * reaches zero.
   *
   * @return the new depth
   */
  public static int decrement(String libraryName) {
    Objects.requireNonNull(libraryName, "libraryName");
    OutboundLogContext.State s = OutboundLogContext.peek();
    if (s == null) {
      return 0;
    }
    Integer next = s.recursionDepth.computeIfPresent(libraryName, (k, d) -> d > 1 ? d - 1 : null);
    return next == null ? 0 : next;
  }

  public static int currentDepth(String libraryName) {
    OutboundLogContext.State s = OutboundLogContext.peek();
    if (s == null || libraryName == null) {
      return 0;
    }
    return s.recursionDepth.getOrDefault(libraryName, 0);
  }

  /** Whether an interception for {@code libraryName} is already in progress on this thread. */
  public static boolean inRecursion(String libraryName) {
    return currentDepth(libraryName) > 0;
  }

  /** Whether this thread holds no counter for any library. */
  public static boolean isIdle() {
    OutboundLogContext.State s = OutboundLogContext.peek();
    return s == null || s.recursionDepth.isEmpty();
  }

  /**
   * Fails when strict detection is on and the depth for {@code libraryName} has reached the
   * configured maximum. A no-op otherwise.
   *
   * @throws InfiniteRecursionException when the limit is reached under strict detection
   */
  public static void checkDepth(String libraryName, OutlogConfiguration configuration) {
    Objects.requireNonNull(configuration, "configuration");
    if (!configuration.isStrictRecursionDetection()) {
      return;
    }
    int depth = currentDepth(libraryName);
    int max = configuration.maxRecursionDepth();
    if (depth < max) {
      return;
    }
    InfiniteRecursionException error = new InfiniteRecursionException(libraryName, depth, max);
    report(error);
    throw error;
  }

  // The log call may itself go through an instrumented appender; only report once per thread.
  private static void report(InfiniteRecursionException error) {
    OutboundLogContext.State s = OutboundLogContext.state();
    if (s.reportingRecursion) {
      return;
    }
    s.reportingRecursion = true;
    try {
      log.error(
          "Outbound HTTP logging recursion limit reached: library={} depth={}",
          error.libraryName(),
          error.depth());
    } catch (RuntimeException e) {
      // diagnostics only
      log.debug("Could not report recursion limit", e);
    } finally {
      s.reportingRecursion = false;
    }
  }
}
