package io.outlog.infrastructure.persistence;

import java.sql.DatabaseMetaData;
import java.util.Locale;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.support.JdbcUtils;
import org.springframework.jdbc.support.MetaDataAccessException;

/**
 * SQL differences between the supported databases.
 *
 * <p>{@link #POSTGRESQL} stores headers, bodies and metadata as {@code jsonb} and queries metadata
 * with JSON operators. {@link #GENERIC} stores them as JSON text in {@code CLOB} columns and is
 * exercised against H2.
 */
public enum JdbcDialect {
  POSTGRESQL("jsonb", "CAST(? AS jsonb)", "TIMESTAMPTZ", "BIGSERIAL PRIMARY KEY", "TEXT"),
  GENERIC(
      "CLOB",
      "?",
      "TIMESTAMP WITH TIME ZONE",
      "BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY",
      "VARCHAR(4096)");

  private static final Logger log = LoggerFactory.getLogger(JdbcDialect.class);

  private final String jsonType;
  private final String jsonParameter;
  private final String timestampType;
  private final String identityColumn;
  private final String urlType;

  JdbcDialect(
      String jsonType,
      String jsonParameter,
      String timestampType,
      String identityColumn,
      String urlType) {
    this.jsonType = jsonType;
    this.jsonParameter = jsonParameter;
    this.timestampType = timestampType;
    this.identityColumn = identityColumn;
    this.urlType = urlType;
  }

  /** Picks the dialect from the database product name; {@link #GENERIC} when unknown. */
  public static JdbcDialect detect(DataSource dataSource) {
    try {
      String product =
          JdbcUtils.extractDatabaseMetaData(dataSource, DatabaseMetaData::getDatabaseProductName);
      return product != null && product.toLowerCase(Locale.ROOT).contains("postgres")
          ? POSTGRESQL
          : GENERIC;
    } catch (MetaDataAccessException e) {
      log.warn("Could not detect database product, using generic SQL: {}", e.toString());
      return GENERIC;
    }
  }

  /** Whether JSON columns are native JSON rather than text. */
  public boolean nativeJson() {
    return this == POSTGRESQL;
  }

  String jsonParameter() {
    return jsonParameter;
  }

  /** Expression rendering a JSON column as text for {@code LIKE}. */
  String textOf(String column) {
    return nativeJson() ? "CAST(" + column + " AS TEXT)" : column;
  }

  /** DDL for the log table and its indexes. */
  String[] schema(String table) {
    String prefix = table.replace('.', '_');
    String create =
        """
        CREATE TABLE IF NOT EXISTS %s (
          id               %s,
          http_method      VARCHAR(16)  NOT NULL,
          url              %s NOT NULL,
          status_code      INTEGER      NOT NULL,
          request_headers  %s,
          request_body     %s,
          response_headers %s,
          response_body    %s,
          metadata         %s,
          duration_seconds DECIMAL(10,6),
          duration_ms      DECIMAL(10,2),
          loggable_type    VARCHAR(255),
          loggable_id      VARCHAR(255),
          created_at       %s NOT NULL
        )
        """
            .formatted(
                table,
                identityColumn,
                urlType,
                jsonType,
                jsonType,
                jsonType,
                jsonType,
                jsonType,
                timestampType);
    String createdAt =
        "CREATE INDEX IF NOT EXISTS %s_created_at_idx ON %s (created_at)".formatted(prefix, table);
    String loggable =
        "CREATE INDEX IF NOT EXISTS %s_loggable_idx ON %s (loggable_type, loggable_id)"
            .formatted(prefix, table);
    if (this == POSTGRESQL) {
      return new String[] {
        create,
        createdAt,
        loggable,
        "CREATE INDEX IF NOT EXISTS %s_metadata_gin ON %s USING gin (metadata)"
            .formatted(prefix, table),
        "CREATE INDEX IF NOT EXISTS %s_status_idx ON %s (status_code)".formatted(prefix, table)
      };
    }
    return new String[] {
      create,
      createdAt,
      loggable,
      "CREATE INDEX IF NOT EXISTS %s_status_idx ON %s (status_code)".formatted(prefix, table)
    };
  }
}
