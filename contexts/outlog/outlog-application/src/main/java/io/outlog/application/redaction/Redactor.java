package io.outlog.application.redaction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.outlog.domain.config.OutlogConfiguration;
import io.outlog.domain.config.OutlogConfigurationHolder;
import io.outlog.domain.error.RequestLogPersistenceException;
import jakarta.annotation.Nullable;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Header and body redaction applied before a record reaches a sink.
 *
 * <h3>Body policy</h3>
 *
 * <ul>
 *   <li>{@code null} stays {@code null}.
 *   <li>Bodies longer than {@link OutlogConfiguration#maxBodySize()} are returned <b>unfiltered and
 *       untruncated</b>. The limit only bounds parsing cost; sensitive values inside such bodies are
 *       stored as-is.
 *   <li>A string that parses as a JSON object has every key containing a sensitive substring
 *       replaced by {@link #MARKER}, at any depth, and is re-serialized.
 *   <li>Non-JSON strings, JSON arrays and JSON scalars pass through unchanged.
 *   <li>Structured bodies ({@link Map}, {@link JsonNode}, POJOs) are converted to a JSON tree and
 *       go through the same rules, so they come back as a JSON string.
 * </ul>
 *
 * <p>Arrays are not descended into, so objects nested inside arrays keep their values.
 */
public class Redactor {

  /** Replacement for every redacted header or body value. */
  public static final String MARKER = "[FILTERED]";

  private final ObjectMapper json;
  private final ObjectReader strictReader;
  private final Supplier<OutlogConfiguration> configuration;

  /** Uses the configuration effective on the calling thread. */
  public Redactor(ObjectMapper json) {
    this(json, OutlogConfigurationHolder::current);
  }

  public Redactor(ObjectMapper json, Supplier<OutlogConfiguration> configuration) {
    this.json = Objects.requireNonNull(json, "json");
    this.strictReader =
        json.reader()
            .with(
                DeserializationFeature.FAIL_ON_TRAILING_TOKENS,
                DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS,
                DeserializationFeature.USE_BIG_INTEGER_FOR_INTS);
    this.configuration = Objects.requireNonNull(configuration, "configuration");
  }

  // ---------------- Headers ----------------

  /**
   * Returns a copy of {@code headers} with sensitive values replaced by {@link #MARKER}. Original
   * key casing is preserved. Applying it twice yields the same result as applying it once.
   */
  public Map<String, String> filterHeaders(@Nullable Map<String, String> headers) {
    if (headers == null || headers.isEmpty()) {
      return new LinkedHashMap<>();
    }
    OutlogConfiguration config = configuration.get();
    Map<String, String> filtered = new LinkedHashMap<>(headers);
    for (Map.Entry<String, String> e : filtered.entrySet()) {
      if (config.isSensitiveHeader(e.getKey())) {
        e.setValue(MARKER);
      }
    }
    return filtered;
  }

  // ---------------- Bodies ----------------

  /**
   * Redacts a request or response body according to the body policy above.
   *
   * @throws RequestLogPersistenceException if a structured body cannot be serialized
   */
  @Nullable
  public String filterBody(@Nullable Object body) {
    if (body == null) {
      return null;
    }
    OutlogConfiguration config = configuration.get();
    if (body instanceof CharSequence cs) {
      return filterText(cs.toString(), config);
    }
    if (body instanceof byte[] bytes) {
      return filterText(new String(bytes, StandardCharsets.UTF_8), config);
    }
    return filterStructured(body, config);
  }

  private String filterText(String body, OutlogConfiguration config) {
    if (body.length() > config.maxBodySize()) {
      return body;
    }
    JsonNode tree;
    try {
      tree = strictReader.readTree(body);
    } catch (JsonProcessingException notJson) {
      return body;
    }
    if (tree == null || !tree.isObject()) {
      return body;
    }
    redactKeys((ObjectNode) tree, config);
    return write(tree);
  }

  private String filterStructured(Object body, OutlogConfiguration config) {
    JsonNode tree;
    try {
      tree = body instanceof JsonNode node ? node.deepCopy() : json.valueToTree(body);
    } catch (IllegalArgumentException e) {
      throw new RequestLogPersistenceException(
          "Body of type " + body.getClass().getName() + " is not serializable", e);
    }
    String serialized = write(tree);
    if (serialized.length() > config.maxBodySize() || !tree.isObject()) {
      return serialized;
    }
    redactKeys((ObjectNode) tree, config);
    return write(tree);
  }

  private static void redactKeys(ObjectNode node, OutlogConfiguration config) {
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (config.isSensitiveBodyKey(field.getKey())) {
        field.setValue(TextNode.valueOf(MARKER));
      } else if (field.getValue().isObject()) {
        redactKeys((ObjectNode) field.getValue(), config);
      }
    }
  }

  private String write(JsonNode tree) {
    try {
      return json.writeValueAsString(tree);
    } catch (JsonProcessingException e) {
      throw new RequestLogPersistenceException("Body serialization failed", e);
    }
  }
}
