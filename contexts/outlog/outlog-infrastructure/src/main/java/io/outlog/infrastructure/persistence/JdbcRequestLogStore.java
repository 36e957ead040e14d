package io.outlog.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.outlog.application.port.RequestLogStore;
import io.outlog.application.query.RequestLogQuery;
import io.outlog.application.query.RequestLogStatistics;
import io.outlog.application.query.StoredRequestLog;
import io.outlog.domain.error.InvalidConfigurationException;
import io.outlog.domain.error.RequestLogPersistenceException;
import io.outlog.domain.record.LoggableRef;
import io.outlog.domain.record.RequestLogRecord;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.lang.Nullable;

/**
 * {@link RequestLogStore} backed by a relational table, one row per recorded call.
 *
 * <h3>Storage model</h3>
 *
 * <pre>
 * CREATE TABLE outbound_request_logs (
 *   id               BIGSERIAL PRIMARY KEY,
 *   http_method      VARCHAR(16) NOT NULL,
 *   url              TEXT        NOT NULL,
 *   status_code      INTEGER     NOT NULL,
 *   request_headers  JSONB,
 *   request_body     JSONB,
 *   response_headers JSONB,
 *   response_body    JSONB,
 *   metadata         JSONB,
 *   duration_seconds DECIMAL(10,6),
 *   duration_ms      DECIMAL(10,2),
 *   loggable_type    VARCHAR(255),
 *   loggable_id      VARCHAR(255),
 *   created_at       TIMESTAMPTZ NOT NULL
 * );
 * </pre>
 *
 * <p>On PostgreSQL, bodies that parse as JSON are stored as JSON documents and everything else as a
 * JSON string. The generic dialect stores the redacted text as is. See {@link JdbcDialect}.
 *
 * <h3>Metrics (optional)</h3>
 *
 * <ul>
 *   <li>{@code outlog.store.persist.ok}
 *   <li>{@code outlog.store.persist.err}
 * </ul>
 */
public class JdbcRequestLogStore implements RequestLogStore {

  private static final Logger log = LoggerFactory.getLogger(JdbcRequestLogStore.class);

  public static final String DEFAULT_TABLE = "outbound_request_logs";

  private static final Pattern TABLE_NAME =
      Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

  private static final TypeReference<Map<String, String>> HEADERS = new TypeReference<>() {};
  private static final TypeReference<Map<String, Object>> METADATA = new TypeReference<>() {};

  private static final String COLUMNS =
      "id, http_method, url, status_code, request_headers, request_body, response_headers,"
          + " response_body, metadata, duration_seconds, duration_ms, loggable_type, loggable_id,"
          + " created_at";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "JdbcTemplate is a shared, thread-safe Spring bean; field is never exposed.")
  private final JdbcTemplate jdbc;

  private final ObjectMapper json;
  private final JdbcDialect dialect;
  private final String table;
  private final Clock clock;
  private final String insertSql;

  @Nullable private final Counter mPersistOk;
  @Nullable private final Counter mPersistErr;

  private final RowMapper<StoredRequestLog> rowMapper = this::mapRow;

  public JdbcRequestLogStore(JdbcTemplate jdbc, ObjectMapper json) {
    this(
        jdbc,
        json,
        JdbcDialect.detect(Objects.requireNonNull(jdbc.getDataSource(), "dataSource")),
        DEFAULT_TABLE,
        null,
        Clock.systemUTC());
  }

  public JdbcRequestLogStore(
      JdbcTemplate jdbc,
      ObjectMapper json,
      JdbcDialect dialect,
      String table,
      @Nullable MeterRegistry meterRegistry,
      Clock clock) {
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    this.json = Objects.requireNonNull(json, "json");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.table = validTableName(table);
    this.clock = Objects.requireNonNull(clock, "clock");

    if (meterRegistry != null) {
      mPersistOk = Counter.builder("outlog.store.persist.ok").register(meterRegistry);
      mPersistErr = Counter.builder("outlog.store.persist.err").register(meterRegistry);
    } else {
      mPersistOk = mPersistErr = null;
    }

    String j = dialect.jsonParameter();
    this.insertSql =
        """
        INSERT INTO %s (
            http_method, url, status_code, request_headers, request_body, response_headers,
            response_body, metadata, duration_seconds, duration_ms, loggable_type, loggable_id,
            created_at
        )
        VALUES (?, ?, ?, %s, %s, %s, %s, %s, ?, ?, ?, ?, ?)
        """
            .formatted(this.table, j, j, j, j, j);
  }

  /** Creates the table and its indexes if they do not exist. */
  public void initializeSchema() {
    for (String ddl : dialect.schema(table)) {
      jdbc.execute(ddl);
    }
    log.info("Outbound request log table {} ready ({})", table, dialect);
  }

  public JdbcDialect dialect() {
    return dialect;
  }

  public String table() {
    return table;
  }

  // -------------------------------------------------------------------------------------
  // RequestLogSink
  // -------------------------------------------------------------------------------------

  @Override
  public Object persist(RequestLogRecord record) {
    Objects.requireNonNull(record, "record");
    final String requestHeaders;
    final String responseHeaders;
    final String metadata;
    try {
      requestHeaders = json.writeValueAsString(record.requestHeaders());
      responseHeaders = json.writeValueAsString(record.responseHeaders());
      metadata = json.writeValueAsString(record.metadata());
    } catch (JsonProcessingException e) {
      if (mPersistErr != null) mPersistErr.increment();
      throw new RequestLogPersistenceException("Request log serialization failed", e);
    }
    final String requestBody = bodyColumn(record.requestBody());
    final String responseBody = bodyColumn(record.responseBody());
    final LoggableRef loggable = record.loggableRef();

    KeyHolder keys = new GeneratedKeyHolder();
    try {
      jdbc.update(
          con -> {
            PreparedStatement ps = con.prepareStatement(insertSql, new String[] {"id"});
            ps.setString(1, record.method());
            ps.setString(2, record.url());
            ps.setInt(3, record.statusCode());
            ps.setString(4, requestHeaders);
            setNullableString(ps, 5, requestBody);
            ps.setString(6, responseHeaders);
            setNullableString(ps, 7, responseBody);
            ps.setString(8, metadata);
            ps.setBigDecimal(9, scaled(record.durationSeconds(), 6));
            ps.setBigDecimal(10, scaled(record.durationMillis(), 2));
            setNullableString(ps, 11, loggable == null ? null : loggable.type());
            setNullableString(ps, 12, loggable == null ? null : loggable.id());
            ps.setTimestamp(13, Timestamp.from(record.createdAt()));
            return ps;
          },
          keys);
    } catch (DataAccessException e) {
      if (mPersistErr != null) mPersistErr.increment();
      throw new RequestLogPersistenceException("Failed to insert outbound request log", e);
    }
    Number id = keys.getKey();
    if (id == null) {
      if (mPersistErr != null) mPersistErr.increment();
      throw new RequestLogPersistenceException("Insert returned no generated id");
    }
    if (mPersistOk != null) mPersistOk.increment();
    log.debug("Outbound request log stored: id={}, method={}", id, record.method());
    return id.longValue();
  }

  // -------------------------------------------------------------------------------------
  // RequestLogStore
  // -------------------------------------------------------------------------------------

  @Override
  public List<StoredRequestLog> find(RequestLogQuery query) {
    Where where = where(query);
    List<Object> args = new ArrayList<>(where.args());
    args.add(query.limit());
    String sql =
        "SELECT "
            + COLUMNS
            + " FROM "
            + table
            + where.sql()
            + " ORDER BY created_at DESC, id DESC LIMIT ?";
    try {
      return jdbc.query(sql, rowMapper, args.toArray());
    } catch (DataAccessException e) {
      throw new RequestLogPersistenceException("Failed to query outbound request logs", e);
    }
  }

  @Override
  public long count(RequestLogQuery query) {
    Where where = where(query);
    try {
      Long n =
          jdbc.queryForObject(
              "SELECT COUNT(*) FROM " + table + where.sql(), Long.class, where.args().toArray());
      return n == null ? 0L : n;
    } catch (DataAccessException e) {
      throw new RequestLogPersistenceException("Failed to count outbound request logs", e);
    }
  }

  @Override
  public Optional<StoredRequestLog> findById(Object id) {
    final long key;
    try {
      key = id instanceof Number n ? n.longValue() : Long.parseLong(String.valueOf(id));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
    try {
      List<StoredRequestLog> rows =
          jdbc.query("SELECT " + COLUMNS + " FROM " + table + " WHERE id = ?", rowMapper, key);
      return rows.stream().findFirst();
    } catch (DataAccessException e) {
      throw new RequestLogPersistenceException("Failed to read outbound request log " + id, e);
    }
  }

  @Override
  public RequestLogStatistics statistics(RequestLogQuery query) {
    Where where = where(query);
    String sql =
        """
        SELECT COUNT(*) AS total,
               COALESCE(SUM(CASE WHEN status_code BETWEEN 200 AND 399 THEN 1 ELSE 0 END), 0) AS ok,
               COALESCE(SUM(CASE WHEN status_code >= 400 OR status_code = 0 THEN 1 ELSE 0 END), 0)
                   AS failed,
               AVG(duration_ms) AS avg_ms
        FROM %s"""
                .formatted(table)
            + where.sql();
    try {
      RequestLogStatistics stats =
          jdbc.queryForObject(
              sql,
              (rs, n) ->
                  new RequestLogStatistics(
                      rs.getLong("total"),
                      rs.getLong("ok"),
                      rs.getLong("failed"),
                      Math.round(rs.getDouble("avg_ms") * 100d) / 100d),
              where.args().toArray());
      return stats == null || stats.total() == 0 ? RequestLogStatistics.EMPTY : stats;
    } catch (DataAccessException e) {
      throw new RequestLogPersistenceException("Failed to aggregate outbound request logs", e);
    }
  }

  @Override
  public int cleanup(Duration olderThan) {
    Objects.requireNonNull(olderThan, "olderThan");
    Instant cutoff = clock.instant().minus(olderThan);
    try {
      int rows =
          jdbc.update("DELETE FROM " + table + " WHERE created_at < ?", Timestamp.from(cutoff));
      log.info("Deleted {} outbound request logs older than {}", rows, cutoff);
      return rows;
    } catch (DataAccessException e) {
      throw new RequestLogPersistenceException("Failed to clean up outbound request logs", e);
    }
  }

  // -------------------------------------------------------------------------------------
  // Query translation
  // -------------------------------------------------------------------------------------

  record Where(String sql, List<Object> args) {}

  Where where(RequestLogQuery q) {
    Objects.requireNonNull(q, "query");
    List<String> clauses = new ArrayList<>();
    List<Object> args = new ArrayList<>();

    if (!q.statusCodes().isEmpty()) {
      clauses.add("status_code IN (" + placeholders(q.statusCodes().size()) + ")");
      args.addAll(q.statusCodes());
    }
    if (q.minStatus() != null) {
      clauses.add("status_code >= ?");
      args.add(q.minStatus());
    }
    if (q.maxStatus() != null) {
      clauses.add("status_code <= ?");
      args.add(q.maxStatus());
    }
    if (!q.methods().isEmpty()) {
      clauses.add("http_method IN (" + placeholders(q.methods().size()) + ")");
      args.addAll(q.methods());
    }
    if (q.urlContains() != null) {
      clauses.add(like("url"));
      args.add(containsPattern(q.urlContains()));
    }
    if (q.createdFrom() != null) {
      clauses.add("created_at >= ?");
      args.add(Timestamp.from(q.createdFrom()));
    }
    if (q.createdTo() != null) {
      clauses.add("created_at <= ?");
      args.add(Timestamp.from(q.createdTo()));
    }
    if (q.minDurationMillis() != null) {
      clauses.add("duration_ms >= ?");
      args.add(q.minDurationMillis());
    }
    if (q.maxDurationMillis() != null) {
      clauses.add("duration_ms <= ?");
      args.add(q.maxDurationMillis());
    }
    if (q.loggable() != null) {
      clauses.add("loggable_type = ?");
      args.add(q.loggable().type());
      if (q.loggable().id() != null) {
        clauses.add("loggable_id = ?");
        args.add(q.loggable().id());
      }
    }
    if (q.text() != null) {
      String pattern = containsPattern(q.text());
      clauses.add(
          "("
              + like("url")
              + " OR "
              + like(dialect.textOf("request_body"))
              + " OR "
              + like(dialect.textOf("response_body"))
              + ")");
      args.add(pattern);
      args.add(pattern);
      args.add(pattern);
    }
    for (Map.Entry<RequestLogQuery.Field, String> c : q.contains().entrySet()) {
      clauses.add(like(dialect.textOf(column(c.getKey()))));
      args.add(containsPattern(c.getValue()));
    }
    for (Map.Entry<String, String> e : q.metadataEntries().entrySet()) {
      metadataClause(e.getKey(), e.getValue(), clauses, args);
    }

    if (clauses.isEmpty()) {
      return new Where("", List.of());
    }
    return new Where(" WHERE " + String.join(" AND ", clauses), args);
  }

  private void metadataClause(String key, String value, List<String> clauses, List<Object> args) {
    if (dialect.nativeJson()) {
      clauses.add("(metadata ->> ?) = ?");
      args.add(key);
      args.add(value);
      return;
    }
    // JSON text written by Jackson has no whitespace: match "key":value or "key":"value"
    // followed by a separator.
    final String jsonKey;
    final String jsonString;
    try {
      jsonKey = json.writeValueAsString(key);
      jsonString = json.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new RequestLogPersistenceException("Metadata criterion not serializable", e);
    }
    List<String> alternatives = new ArrayList<>();
    for (String v : List.of(jsonString, value)) {
      for (String end : List.of(",", "}")) {
        alternatives.add("metadata LIKE ? ESCAPE '\\'");
        args.add("%" + escapeLike(jsonKey + ":" + v + end) + "%");
      }
    }
    clauses.add("(" + String.join(" OR ", alternatives) + ")");
  }

  private static String column(RequestLogQuery.Field field) {
    return switch (field) {
      case URL -> "url";
      case REQUEST_BODY -> "request_body";
      case RESPONSE_BODY -> "response_body";
      case REQUEST_HEADERS -> "request_headers";
      case RESPONSE_HEADERS -> "response_headers";
      case METADATA -> "metadata";
    };
  }

  private static String like(String expression) {
    return "LOWER(" + expression + ") LIKE ? ESCAPE '\\'";
  }

  private static String containsPattern(String fragment) {
    return "%" + escapeLike(fragment.toLowerCase(Locale.ROOT)) + "%";
  }

  private static String escapeLike(String s) {
    return s.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }

  private static String placeholders(int n) {
    return String.join(", ", Collections.nCopies(n, "?"));
  }

  // -------------------------------------------------------------------------------------
  // Row mapping
  // -------------------------------------------------------------------------------------

  private StoredRequestLog mapRow(ResultSet rs, int rowNum) throws SQLException {
    String loggableType = rs.getString("loggable_type");
    Timestamp createdAt = rs.getTimestamp("created_at");
    RequestLogRecord record =
        RequestLogRecord.builder()
            .method(rs.getString("http_method"))
            .url(rs.getString("url"))
            .statusCode(rs.getInt("status_code"))
            .requestHeaders(readJson(rs.getString("request_headers"), HEADERS))
            .requestBody(readBody(rs.getString("request_body")))
            .responseHeaders(readJson(rs.getString("response_headers"), HEADERS))
            .responseBody(readBody(rs.getString("response_body")))
            .metadata(readJson(rs.getString("metadata"), METADATA))
            .durationSeconds(rs.getDouble("duration_seconds"))
            .loggable(
                loggableType == null
                    ? null
                    : new LoggableRef(loggableType, rs.getString("loggable_id")))
            .createdAt(createdAt.toInstant())
            .build();
    return new StoredRequestLog(rs.getLong("id"), record);
  }

  private <T> T readJson(@Nullable String text, TypeReference<T> type) {
    if (text == null || text.isBlank()) {
      return null;
    }
    try {
      return json.readValue(text, type);
    } catch (JsonProcessingException e) {
      throw new RequestLogPersistenceException("Corrupt JSON column in " + table, e);
    }
  }

  @Nullable
  private String readBody(@Nullable String stored) {
    if (stored == null || !dialect.nativeJson()) {
      return stored;
    }
    try {
      JsonNode node = json.readTree(stored);
      return node.isTextual() ? node.textValue() : json.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      return stored;
    }
  }

  /** Body as bound to the insert: JSON documents stay JSON, anything else becomes a JSON string. */
  @Nullable
  private String bodyColumn(@Nullable String body) {
    if (body == null || !dialect.nativeJson()) {
      return body;
    }
    try {
      json.readTree(body);
      return body;
    } catch (JsonProcessingException notJson) {
      try {
        return json.writeValueAsString(body);
      } catch (JsonProcessingException e) {
        throw new RequestLogPersistenceException("Body not serializable", e);
      }
    }
  }

  private static void setNullableString(PreparedStatement ps, int index, @Nullable String value)
      throws SQLException {
    if (value == null) {
      ps.setNull(index, Types.VARCHAR);
    } else {
      ps.setString(index, value);
    }
  }

  private static BigDecimal scaled(double value, int scale) {
    return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP);
  }

  private static String validTableName(String table) {
    if (table == null || !TABLE_NAME.matcher(table).matches()) {
      throw new InvalidConfigurationException("Invalid log table name: " + table);
    }
    return table;
  }
}
