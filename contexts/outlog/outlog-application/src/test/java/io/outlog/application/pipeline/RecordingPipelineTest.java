package io.outlog.application.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.outlog.application.port.HttpRequestObserver;
import io.outlog.application.port.RequestLogSink;
import io.outlog.application.redaction.Redactor;
import io.outlog.domain.config.OutlogConfiguration;
import io.outlog.domain.config.OutlogConfigurationHolder;
import io.outlog.domain.context.OutboundLogContext;
import io.outlog.domain.context.RecursionGuard;
import io.outlog.domain.error.InfiniteRecursionException;
import io.outlog.domain.error.RequestLogPersistenceException;
import io.outlog.domain.record.LoggableRef;
import io.outlog.domain.record.RequestLogRecord;
import java.io.IOException;
import java.net.ConnectException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RecordingPipelineTest {

  private static final String LIB = "test_client";
  private static final String URL = "https://api.example.com/users";
  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  private final List<RequestLogRecord> records = new CopyOnWriteArrayList<>();
  private final RequestLogSink sink =
      record -> {
        records.add(record);
        return records.size();
      };
  private final HttpRequestObserver observer = mock(HttpRequestObserver.class);
  private final AtomicLong nanos = new AtomicLong();

  private RecordingPipeline pipeline;

  @BeforeEach
  void setUp() {
    OutlogConfigurationHolder.configure(b -> b.enabled(true).urlExclusions(List.of()));
    pipeline = pipelineWith(sink);
  }

  @AfterEach
  void tearDown() {
    OutboundLogContext.clearAll();
    OutlogConfigurationHolder.reset();
  }

  private RecordingPipeline pipelineWith(RequestLogSink target) {
    return new RecordingPipeline(
        target,
        new Redactor(new ObjectMapper()),
        List.of(observer),
        OutlogConfigurationHolder::current,
        Clock.fixed(NOW, ZoneOffset.UTC),
        () -> nanos.addAndGet(5_000_000));
  }

  private String send(String url, int status, Map<String, String> responseHeaders, String body) {
    return pipeline.logHttpRequest(
        LIB,
        url,
        "get",
        () -> new RequestData(Map.of("Authorization", "Bearer xyz"), null),
        response -> new ResponseData(status, responseHeaders, body),
        () -> "native-response");
  }

  @Test
  void recordsASuccessfulCallWithRedactedHeaders() {
    String response = send(URL, 200, Map.of("Content-Type", "application/json"), "{\"users\":[]}");

    assertThat(response).isEqualTo("native-response");
    assertThat(records).hasSize(1);
    RequestLogRecord record = records.get(0);
    assertThat(record.method()).isEqualTo("GET");
    assertThat(record.url()).isEqualTo(URL);
    assertThat(record.statusCode()).isEqualTo(200);
    assertThat(record.requestHeaders()).containsEntry("Authorization", "[FILTERED]");
    assertThat(record.responseBody()).isEqualTo("{\"users\":[]}");
    assertThat(record.durationSeconds()).isEqualTo(0.005);
    assertThat(record.createdAt()).isEqualTo(NOW);
    verify(observer).onHttpRequest("GET", URL, 200, 0.005, null);
  }

  @Test
  void excludedUrlsCallThroughWithoutRecordingOrBookkeeping() {
    OutlogConfigurationHolder.configure(b -> b.urlExclusions(List.of("/health")));
    AtomicInteger depthDuringCall = new AtomicInteger(-1);

    String response =
        pipeline.logHttpRequest(
            LIB,
            "https://api.example.com/health",
            "GET",
            RequestData::empty,
            r -> new ResponseData(200, Map.of(), null),
            () -> {
              depthDuringCall.set(RecursionGuard.currentDepth(LIB));
              return "ok";
            });

    assertThat(response).isEqualTo("ok");
    assertThat(records).isEmpty();
    assertThat(depthDuringCall).hasValue(0);
    verify(observer, never()).onHttpRequest(anyString(), anyString(), anyInt(), anyDouble(), any());
  }

  @Test
  void disabledConfigurationIsAZeroOverheadPassThrough() {
    OutlogConfigurationHolder.configure(b -> b.enabled(false));

    send(URL, 200, Map.of(), "{}");

    assertThat(records).isEmpty();
  }

  @Test
  void aDisabledAdapterIsNotRecorded() {
    OutlogConfigurationHolder.configure(b -> b.disableAdapter(LIB));

    send(URL, 200, Map.of(), "{}");

    assertThat(records).isEmpty();
  }

  @Test
  void suppressedThreadsAreNotRecorded() {
    OutboundLogContext.withInterceptionSuppressed(() -> send(URL, 200, Map.of(), "{}"));

    assertThat(records).isEmpty();
  }

  @Test
  void excludedContentTypesAreNotRecorded() {
    send(URL, 200, Map.of("content-type", "text/html; charset=utf-8"), "<html/>");

    assertThat(records).isEmpty();
  }

  @Test
  void transportFailuresAreRecordedAndRethrownUnchanged() {
    ConnectException failure = new ConnectException("Connection refused");

    assertThatThrownBy(
            () ->
                pipeline.logHttpRequest(
                    LIB,
                    URL,
                    "POST",
                    () -> new RequestData(Map.of(), "{\"password\":\"p\"}"),
                    r -> new ResponseData(200, Map.of(), null),
                    () -> {
                      throw failure;
                    }))
        .isSameAs(failure);

    assertThat(records).hasSize(1);
    RequestLogRecord record = records.get(0);
    assertThat(record.statusCode()).isZero();
    assertThat(record.responseBody())
        .isEqualTo("Error: java.net.ConnectException: Connection refused");
    assertThat(record.requestBody()).isEqualTo("{\"password\":\"[FILTERED]\"}");
    assertThat(record.responseHeaders()).isEmpty();
    assertThat(RecursionGuard.currentDepth(LIB)).isZero();
    verify(observer).onHttpRequest(eq("POST"), eq(URL), eq(0), anyDouble(), eq(failure));
  }

  @Test
  void checkedExceptionsKeepTheirDeclaredType() {
    UnderlyingCall<String, IOException> call =
        () -> {
          throw new IOException("reset");
        };

    assertThatThrownBy(
            () ->
                pipeline.logHttpRequest(
                    LIB, URL, "GET", RequestData::empty, r -> null, call))
        .isInstanceOf(IOException.class)
        .hasMessage("reset");
  }

  @Test
  void sinkFailuresNeverReachTheCaller() {
    pipeline =
        pipelineWith(
            record -> {
              throw new RequestLogPersistenceException("database down");
            });

    String response = send(URL, 201, Map.of(), "{}");

    assertThat(response).isEqualTo("native-response");
    verify(observer).onHttpRequest("GET", URL, 201, 0.005, null);
  }

  @Test
  void sinkFailuresDoNotReplaceTheCallersException() {
    pipeline =
        pipelineWith(
            record -> {
              throw new IllegalStateException("database down");
            });
    IllegalArgumentException failure = new IllegalArgumentException("bad request");

    assertThatThrownBy(
            () ->
                pipeline.logHttpRequest(
                    LIB,
                    URL,
                    "GET",
                    RequestData::empty,
                    r -> new ResponseData(200, Map.of(), null),
                    () -> {
                      throw failure;
                    }))
        .isSameAs(failure);
  }

  @Test
  void observerFailuresAreSwallowed() {
    willThrow(new IllegalStateException("metrics down"))
        .given(observer)
        .onHttpRequest(anyString(), anyString(), anyInt(), anyDouble(), isNull());

    assertThat(send(URL, 200, Map.of(), "{}")).isEqualTo("native-response");
    assertThat(records).hasSize(1);
  }

  @Test
  void responseNormalizationFailuresAreSwallowed() {
    String response =
        pipeline.logHttpRequest(
            LIB,
            URL,
            "GET",
            RequestData::empty,
            r -> {
              throw new IllegalStateException("unreadable");
            },
            () -> "native-response");

    assertThat(response).isEqualTo("native-response");
    assertThat(records).isEmpty();
  }

  @Test
  void nestedCallsToTheSameLibraryBypassThePipeline() {
    AtomicInteger innerDepth = new AtomicInteger(-1);

    pipeline.logHttpRequest(
        LIB,
        URL,
        "GET",
        RequestData::empty,
        r -> new ResponseData(200, Map.of(), null),
        () ->
            pipeline.logHttpRequest(
                LIB,
                "https://api.example.com/inner",
                "GET",
                RequestData::empty,
                r -> new ResponseData(200, Map.of(), null),
                () -> {
                  innerDepth.set(RecursionGuard.currentDepth(LIB));
                  return "inner";
                }));

    assertThat(innerDepth).hasValue(1);
    assertThat(records).extracting(RequestLogRecord::url).containsExactly(URL);
    assertThat(RecursionGuard.currentDepth(LIB)).isZero();
  }

  @Test
  void otherLibrariesAreRecordedWhileOneIsInProgress() {
    pipeline.logHttpRequest(
        LIB,
        URL,
        "GET",
        RequestData::empty,
        r -> new ResponseData(200, Map.of(), null),
        () ->
            pipeline.logHttpRequest(
                "other_client",
                "https://api.example.com/inner",
                "GET",
                RequestData::empty,
                r -> new ResponseData(200, Map.of(), null),
                () -> "inner"));

    assertThat(records)
        .extracting(RequestLogRecord::url)
        .containsExactly("https://api.example.com/inner", URL);
  }

  @Test
  void strictDetectionFailsAtTheDepthLimit() {
    OutlogConfigurationHolder.configure(
        b -> b.strictRecursionDetection(true).maxRecursionDepth(1));

    assertThatThrownBy(
            () ->
                pipeline.logHttpRequest(
                    LIB,
                    URL,
                    "GET",
                    RequestData::empty,
                    r -> new ResponseData(200, Map.of(), null),
                    () ->
                        pipeline.logHttpRequest(
                            LIB,
                            URL,
                            "GET",
                            RequestData::empty,
                            r -> new ResponseData(200, Map.of(), null),
                            () -> "inner")))
        .isInstanceOf(InfiniteRecursionException.class);

    assertThat(RecursionGuard.currentDepth(LIB)).isZero();
  }

  @Test
  void contextLoggableAndMetadataAreAttached() {
    LoggableRef user = new LoggableRef("User", "7");

    OutboundLogContext.withScopedContext(
        user, Map.of("action", "sync"), () -> send(URL, 200, Map.of(), "{}"));

    assertThat(records.get(0).loggable()).isEqualTo(user);
    assertThat(records.get(0).metadata()).containsEntry("action", "sync");
  }

  @Test
  void requestCaptureFailuresStillRecordTheCall() {
    String response =
        pipeline.logHttpRequest(
            LIB,
            URL,
            "GET",
            () -> {
              throw new IllegalStateException("body not replayable");
            },
            r -> new ResponseData(200, Map.of(), null),
            () -> "native-response");

    assertThat(response).isEqualTo("native-response");
    assertThat(records).hasSize(1);
    assertThat(records.get(0).requestHeaders()).isEmpty();
  }

  @Test
  void recordCompletedAppliesTheSameRules() {
    assertThat(
            pipeline.recordCompleted(
                "delete",
                URL,
                RequestData.empty(),
                new ResponseData(204, Map.of(), null),
                0.2))
        .contains(1);
    assertThat(
            pipeline.recordCompleted(
                "GET",
                URL,
                RequestData.empty(),
                new ResponseData(200, Map.of("Content-Type", "image/png"), null),
                0.2))
        .isEmpty();

    assertThat(records).extracting(RequestLogRecord::method).containsExactly("DELETE");
  }

  @Test
  void configurationOverridesApplyPerThread() {
    OutlogConfiguration disabled = OutlogConfigurationHolder.current().toBuilder().enabled(false).build();

    try (OutlogConfigurationHolder.Scope ignored = OutlogConfigurationHolder.open(disabled)) {
      send(URL, 200, Map.of(), "{}");
    }
    send(URL, 200, Map.of(), "{}");

    assertThat(records).hasSize(1);
  }
}
