package io.outlog.http;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Header conversions shared by the client adapters. */
public final class HttpHeaderSupport {

  private HttpHeaderSupport() {}

  /**
   * Flattens multi-valued headers to one value per name, joining repeated values with {@code ", "}.
   * Name casing and iteration order are preserved.
   */
  public static Map<String, String> flatten(Map<String, ? extends List<String>> headers) {
    if (headers == null || headers.isEmpty()) {
      return Map.of();
    }
    Map<String, String> out = new LinkedHashMap<>();
    headers.forEach(
        (name, values) -> {
          if (name != null && values != null && !values.isEmpty()) {
            out.put(name, String.join(", ", values));
          }
        });
    return Collections.unmodifiableMap(out);
  }
}
