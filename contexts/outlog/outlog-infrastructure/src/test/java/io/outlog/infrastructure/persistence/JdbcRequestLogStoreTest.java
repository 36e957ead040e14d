package io.outlog.infrastructure.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.outlog.application.pipeline.RecordingPipeline;
import io.outlog.application.pipeline.RequestData;
import io.outlog.application.pipeline.ResponseData;
import io.outlog.application.query.RequestLogQuery;
import io.outlog.application.query.RequestLogStatistics;
import io.outlog.application.query.StoredRequestLog;
import io.outlog.application.redaction.Redactor;
import io.outlog.domain.config.OutlogConfigurationHolder;
import io.outlog.domain.error.InvalidConfigurationException;
import io.outlog.domain.error.RequestLogPersistenceException;
import io.outlog.domain.record.LoggableRef;
import io.outlog.domain.record.RequestLogRecord;
import io.outlog.testing.OutlogIsolationExtension;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

@ExtendWith(OutlogIsolationExtension.class)
class JdbcRequestLogStoreTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  private final ObjectMapper json = new ObjectMapper();
  private final SimpleMeterRegistry meters = new SimpleMeterRegistry();

  private JdbcTemplate jdbc;
  private JdbcRequestLogStore store;

  @BeforeEach
  void setUp() {
    DriverManagerDataSource dataSource =
        new DriverManagerDataSource("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    jdbc = new JdbcTemplate(dataSource);
    store =
        new JdbcRequestLogStore(
            jdbc,
            json,
            JdbcDialect.detect(dataSource),
            JdbcRequestLogStore.DEFAULT_TABLE,
            meters,
            Clock.fixed(NOW, ZoneOffset.UTC));
    store.initializeSchema();
  }

  private static RequestLogRecord.Builder record() {
    return RequestLogRecord.builder()
        .method("GET")
        .url("https://api.example.com/users")
        .statusCode(200)
        .durationSeconds(0.25)
        .createdAt(NOW);
  }

  @Test
  void h2UsesTheGenericDialect() {
    assertThat(store.dialect()).isEqualTo(JdbcDialect.GENERIC);
  }

  @Test
  void persistedRecordsReadBackUnchanged() {
    RequestLogRecord original =
        record()
            .method("post")
            .statusCode(201)
            .requestHeaders(Map.of("Authorization", "[FILTERED]", "Accept", "application/json"))
            .requestBody("{\"name\":\"a\"}")
            .responseHeaders(Map.of("Content-Type", "application/json"))
            .responseBody("plain text")
            .metadata(Map.<String, Object>of("job", "sync", "attempt", 2))
            .loggable(LoggableRef.of("User", 7))
            .durationSeconds(0.123456)
            .build();

    Object id = store.persist(original);
    StoredRequestLog stored = store.findById(id).orElseThrow();

    assertThat(stored.id()).isEqualTo(id);
    assertThat(stored.record()).isEqualTo(original);
    assertThat(meters.counter("outlog.store.persist.ok").count()).isEqualTo(1.0);
  }

  @Test
  void nullBodiesAndMissingLoggableRoundTrip() {
    RequestLogRecord original = record().build();

    RequestLogRecord stored = store.findById(store.persist(original)).orElseThrow().record();

    assertThat(stored.requestBody()).isNull();
    assertThat(stored.loggable()).isNull();
    assertThat(stored.metadata()).isEmpty();
  }

  @Test
  void findIsNewestFirstAndLimited() {
    store.persist(record().url("https://a.example.com/1").createdAt(NOW.minusSeconds(30)).build());
    store.persist(record().url("https://a.example.com/2").createdAt(NOW.minusSeconds(10)).build());
    store.persist(record().url("https://a.example.com/3").createdAt(NOW.minusSeconds(20)).build());

    List<StoredRequestLog> page = store.find(RequestLogQuery.builder().limit(2).build());

    assertThat(page)
        .extracting(s -> s.record().url())
        .containsExactly("https://a.example.com/2", "https://a.example.com/3");
  }

  @Test
  void criteriaTranslateToSql() {
    store.persist(record().statusCode(200).build());
    store.persist(record().statusCode(404).method("DELETE").build());
    store.persist(record().statusCode(0).url("https://payments.example.com/charge").build());
    store.persist(
        record()
            .statusCode(500)
            .responseBody("{\"error\":\"Upstream_Timeout 100%\"}")
            .durationSeconds(2.5)
            .build());

    assertThat(store.count(RequestLogQuery.builder().successful().build())).isEqualTo(1);
    assertThat(store.count(RequestLogQuery.builder().failed().build())).isEqualTo(2);
    assertThat(store.count(RequestLogQuery.builder().statusCodes(List.of(0, 404)).build()))
        .isEqualTo(2);
    assertThat(store.count(RequestLogQuery.builder().method("delete").build())).isEqualTo(1);
    assertThat(store.count(RequestLogQuery.builder().urlContains("PAYMENTS").build()))
        .isEqualTo(1);
    assertThat(store.count(RequestLogQuery.builder().text("upstream_timeout 100%").build()))
        .isEqualTo(1);
    assertThat(store.count(RequestLogQuery.builder().text("timeout 1000").build())).isZero();
    assertThat(store.count(RequestLogQuery.builder().slowerThan(Duration.ofSeconds(1)).build()))
        .isEqualTo(1);
    assertThat(store.count(RequestLogQuery.builder().maxDuration(Duration.ofMillis(250)).build()))
        .isEqualTo(3);
  }

  @Test
  void sqlAndInMemorySemanticsAgree() {
    List<RequestLogRecord> records =
        List.of(
            record().requestHeaders(Map.of("X-Trace", "abc123")).build(),
            record().metadata(Map.<String, Object>of("tenant", "acme", "attempt", 2)).build(),
            record().metadata(Map.<String, Object>of("tenant", "acme-eu", "attempt", 25)).build(),
            record().loggable(LoggableRef.of("User", 7)).build(),
            record().loggable(LoggableRef.of("User", 8)).createdAt(NOW.minusSeconds(3600)).build());
    records.forEach(store::persist);

    List<RequestLogQuery> queries =
        List.of(
            RequestLogQuery.builder()
                .contains(RequestLogQuery.Field.REQUEST_HEADERS, "ABC123")
                .build(),
            RequestLogQuery.builder().metadataEntry("tenant", "acme").build(),
            RequestLogQuery.builder().metadataEntry("attempt", 2).build(),
            RequestLogQuery.builder().contains(RequestLogQuery.Field.METADATA, "acme").build(),
            RequestLogQuery.builder().loggable(new LoggableRef("User", null)).build(),
            RequestLogQuery.builder().loggable(LoggableRef.of("User", 8)).build(),
            RequestLogQuery.builder().createdBetween(NOW.minusSeconds(60), NOW).build());

    for (RequestLogQuery query : queries) {
      long expected = records.stream().filter(query::matches).count();
      assertThat(store.count(query)).as(query.toString()).isEqualTo(expected);
    }
  }

  @Test
  void statisticsAggregateInSql() {
    store.persist(record().statusCode(200).durationSeconds(0.1).build());
    store.persist(record().statusCode(301).durationSeconds(0.2).build());
    store.persist(record().statusCode(503).durationSeconds(0.3).build());
    store.persist(record().statusCode(0).durationSeconds(0.4).build());

    RequestLogStatistics stats = store.statistics(RequestLogQuery.all());

    assertThat(stats).isEqualTo(new RequestLogStatistics(4, 2, 2, 250.0));
    assertThat(stats.successRate()).isEqualTo(50.0);
    assertThat(store.statistics(RequestLogQuery.builder().statusCode(418).build()))
        .isEqualTo(RequestLogStatistics.EMPTY);
  }

  @Test
  void cleanupDeletesOlderRecords() {
    store.persist(record().createdAt(NOW.minus(Duration.ofDays(90))).build());
    store.persist(record().createdAt(NOW.minus(Duration.ofDays(1))).build());

    assertThat(store.cleanup(Duration.ofDays(30))).isEqualTo(1);
    assertThat(store.count(RequestLogQuery.all())).isEqualTo(1);
  }

  @Test
  void unknownIdsAreEmpty() {
    assertThat(store.findById(12345L)).isEmpty();
    assertThat(store.findById("not-a-number")).isEmpty();
  }

  @Test
  void databaseFailuresSurfaceAsPersistenceExceptions() {
    jdbc.execute("DROP TABLE " + JdbcRequestLogStore.DEFAULT_TABLE);

    assertThatThrownBy(() -> store.persist(record().build()))
        .isInstanceOf(RequestLogPersistenceException.class);
    assertThat(meters.counter("outlog.store.persist.err").count()).isEqualTo(1.0);
  }

  @Test
  void tableNamesAreValidated() {
    assertThatThrownBy(
            () ->
                new JdbcRequestLogStore(
                    jdbc, json, JdbcDialect.GENERIC, "logs; DROP TABLE x", null, Clock.systemUTC()))
        .isInstanceOf(InvalidConfigurationException.class);
  }

  @Test
  void recordingPipelineWritesThroughTheStore() {
    OutlogConfigurationHolder.configure(b -> b.enabled(true));
    RecordingPipeline pipeline =
        new RecordingPipeline(store, new Redactor(json), List.of());

    Object id =
        pipeline
            .recordCompleted(
                "GET",
                "https://api.example.com/users",
                new RequestData(Map.of("Authorization", "Bearer x"), null),
                new ResponseData(200, Map.of(), "{\"users\":[]}"),
                0.05)
            .orElseThrow();

    RequestLogRecord stored = store.findById(id).orElseThrow().record();
    assertThat(stored.requestHeaders()).containsEntry("Authorization", "[FILTERED]");
    assertThat(stored.responseBody()).isEqualTo("{\"users\":[]}");
  }
}
