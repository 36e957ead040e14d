package io.outlog.application.pipeline;

import jakarta.annotation.Nullable;
import java.util.Map;

/**
 * Response side of a call, normalized by an adapter from its client's native response type.
 *
 * @param statusCode HTTP status
 * @param headers response headers, one value per name
 * @param body response body, may be null
 */
public record ResponseData(int statusCode, Map<String, String> headers, @Nullable Object body) {

  public ResponseData {
    headers = headers == null ? Map.of() : headers;
  }

  /** Looks up {@code Content-Type} regardless of header name casing. */
  @Nullable
  public String contentType() {
    for (Map.Entry<String, String> e : headers.entrySet()) {
      if ("content-type".equalsIgnoreCase(e.getKey())) {
        return e.getValue();
      }
    }
    return null;
  }
}
