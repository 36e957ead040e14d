package io.outlog.application.pipeline;

import jakarta.annotation.Nullable;
import java.util.Map;

/**
 * Request side of a call, captured by an adapter in the common shape before the call is made.
 *
 * @param headers request headers, one value per name
 * @param body request body (string, bytes or a structured value), may be null
 */
public record RequestData(Map<String, String> headers, @Nullable Object body) {

  private static final RequestData EMPTY = new RequestData(Map.of(), null);

  public RequestData {
    headers = headers == null ? Map.of() : headers;
  }

  public static RequestData empty() {
    return EMPTY;
  }
}
