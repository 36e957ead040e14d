package io.outlog.domain.error;

import java.io.Serial;

/**
 * Raised when strict recursion detection is on and the interception depth for one library has
 * reached the configured maximum.
 */
public final class InfiniteRecursionException extends OutlogException {

  @Serial private static final long serialVersionUID = 1L;

  private final String libraryName;
  private final int depth;

  public InfiniteRecursionException(String libraryName, int depth, int maxDepth) {
    super(
        OutlogErrorCode.RECURSION_LIMIT_EXCEEDED,
        "Infinite recursion detected in "
            + libraryName
            + " (depth: "
            + depth
            + ", max: "
            + maxDepth
            + ")");
    this.libraryName = libraryName;
    this.depth = depth;
  }

  public String libraryName() {
    return libraryName;
  }

  public int depth() {
    return depth;
  }
}
