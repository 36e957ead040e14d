package io.outlog.infrastructure.observability;

import io.outlog.domain.config.OutlogConfiguration;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/** URL helpers for metric tags and log lines. */
final class UrlParts {

  static final String UNKNOWN_HOST = "unknown";

  private UrlParts() {}

  static String host(String url) {
    try {
      String host = URI.create(url).getHost();
      return host == null ? UNKNOWN_HOST : host;
    } catch (IllegalArgumentException e) {
      return UNKNOWN_HOST;
    }
  }

  /** Drops query parameters whose name is a sensitive body key. Unparseable URLs pass through. */
  static String sanitize(String url, OutlogConfiguration config) {
    int q = url.indexOf('?');
    if (q < 0) {
      return url;
    }
    int hash = url.indexOf('#', q);
    String query = hash < 0 ? url.substring(q + 1) : url.substring(q + 1, hash);
    List<String> kept = new ArrayList<>();
    for (String pair : query.split("&")) {
      if (pair.isEmpty()) {
        continue;
      }
      int eq = pair.indexOf('=');
      String name = eq < 0 ? pair : pair.substring(0, eq);
      if (!config.isSensitiveBodyKey(name)) {
        kept.add(pair);
      }
    }
    StringBuilder out = new StringBuilder(url.substring(0, q));
    if (!kept.isEmpty()) {
      out.append('?').append(String.join("&", kept));
    }
    if (hash >= 0) {
      out.append(url.substring(hash));
    }
    return out.toString();
  }

  static String statusCategory(int status) {
    if (status >= 200 && status < 300) {
      return "2xx";
    }
    if (status >= 300 && status < 400) {
      return "3xx";
    }
    if (status >= 400 && status < 500) {
      return "4xx";
    }
    if (status >= 500 && status < 600) {
      return "5xx";
    }
    return "unknown";
  }
}
