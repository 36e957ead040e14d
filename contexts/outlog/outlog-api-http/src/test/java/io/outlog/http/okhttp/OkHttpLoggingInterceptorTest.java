package io.outlog.http.okhttp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.outlog.application.pipeline.RecordingPipeline;
import io.outlog.application.redaction.Redactor;
import io.outlog.domain.config.OutlogConfigurationHolder;
import io.outlog.domain.record.RequestLogRecord;
import io.outlog.testing.InMemoryRequestLogStore;
import io.outlog.testing.OutlogIsolationExtension;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

@ExtendWith(OutlogIsolationExtension.class)
class OkHttpLoggingInterceptorTest {

  private static final MediaType JSON = MediaType.get("application/json");

  private final InMemoryRequestLogStore store = new InMemoryRequestLogStore();
  private final RecordingPipeline pipeline =
      new RecordingPipeline(store, new Redactor(new ObjectMapper()), List.of());
  private final OkHttpAdapter adapter = new OkHttpAdapter(pipeline);

  private MockWebServer server;
  private OkHttpClient client;

  @BeforeEach
  void setUp() throws IOException {
    OutlogConfigurationHolder.configure(b -> b.enabled(true));
    server = new MockWebServer();
    server.start();
    adapter.apply();
    client =
        adapter.instrument(
            new OkHttpClient.Builder().connectTimeout(2, TimeUnit.SECONDS).build());
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  @Test
  void callerStillReadsTheFullBody() throws IOException {
    server.enqueue(
        new MockResponse()
            .addHeader("Content-Type", "application/json")
            .addHeader("Set-Cookie", "session=abc")
            .setBody("{\"users\":[],\"secret\":\"s\"}"));

    try (Response response =
        client
            .newCall(
                new Request.Builder().url(server.url("/users")).header("X-Api-Key", "k").build())
            .execute()) {
      assertThat(response.body().string()).isEqualTo("{\"users\":[],\"secret\":\"s\"}");
    }

    RequestLogRecord record = store.lastRecord().orElseThrow();
    assertThat(record.method()).isEqualTo("GET");
    assertThat(record.requestHeaders()).containsEntry("x-api-key", "[FILTERED]");
    assertThat(record.responseHeaders()).containsEntry("set-cookie", "[FILTERED]");
    assertThat(record.responseBody()).isEqualTo("{\"users\":[],\"secret\":\"[FILTERED]\"}");
  }

  @Test
  void requestBodiesAreBufferedWithTheirContentType() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(422).setBody("{\"error\":\"bad\"}"));

    try (Response response =
        client
            .newCall(
                new Request.Builder()
                    .url(server.url("/login"))
                    .post(RequestBody.create("{\"user\":\"u\",\"password\":\"p\"}", JSON))
                    .build())
            .execute()) {
      assertThat(response.code()).isEqualTo(422);
    }

    RequestLogRecord record = store.lastRecord().orElseThrow();
    assertThat(record.method()).isEqualTo("POST");
    assertThat(record.statusCode()).isEqualTo(422);
    assertThat(record.requestHeaders())
        .containsEntry("content-type", "application/json; charset=utf-8");
    assertThat(record.requestBody()).isEqualTo("{\"user\":\"u\",\"password\":\"[FILTERED]\"}");
    assertThat(server.takeRequest().getBody().readUtf8())
        .isEqualTo("{\"user\":\"u\",\"password\":\"p\"}");
  }

  @Test
  void responseBodiesOverTheLimitAreRecordedWholeAndUnfiltered() throws IOException {
    OutlogConfigurationHolder.configure(b -> b.maxBodySize(20));
    String body =
        "{\"password\":\"p\",\"items\":[\"alpha\",\"beta\",\"gamma\",\"delta\"],"
            + "\"note\":\"long\"}";
    server.enqueue(new MockResponse().addHeader("Content-Type", "application/json").setBody(body));

    try (Response response =
        client.newCall(new Request.Builder().url(server.url("/big")).build()).execute()) {
      assertThat(response.body().string()).isEqualTo(body);
    }

    assertThat(store.lastRecord().orElseThrow().responseBody()).isEqualTo(body);
  }

  @Test
  void multibyteResponseBodiesAreSizedInCharacters() throws IOException {
    OutlogConfigurationHolder.configure(b -> b.maxBodySize(30));
    String body = "{\"password\":\"p\",\"n\":\"\u00e9\u00e9\u00e9\u00e9\u00e9\u00e9\u00e9\"}";
    server.enqueue(
        new MockResponse()
            .addHeader("Content-Type", "application/json; charset=utf-8")
            .setBody(body));

    try (Response response =
        client.newCall(new Request.Builder().url(server.url("/accents")).build()).execute()) {
      assertThat(response.body().string()).isEqualTo(body);
    }

    assertThat(store.lastRecord().orElseThrow().responseBody())
        .isEqualTo(
            "{\"password\":\"[FILTERED]\",\"n\":\"\u00e9\u00e9\u00e9\u00e9\u00e9\u00e9\u00e9\"}");
  }

  @Test
  void transportFailuresAreRecordedAndRethrown() throws IOException {
    HttpUrl url = server.url("/gone");
    server.shutdown();

    assertThatThrownBy(() -> client.newCall(new Request.Builder().url(url).build()).execute())
        .isInstanceOf(IOException.class);

    RequestLogRecord record = store.lastRecord().orElseThrow();
    assertThat(record.isTransportFailure()).isTrue();
    assertThat(record.responseBody()).startsWith("Error: java.net.");
  }

  @Test
  void disablingTheAdapterStopsRecording() throws IOException {
    OutlogConfigurationHolder.configure(b -> b.disableAdapter(OkHttpAdapter.LIBRARY_NAME));
    server.enqueue(new MockResponse().setBody("{}"));

    try (Response response =
        client.newCall(new Request.Builder().url(server.url("/")).build()).execute()) {
      assertThat(response.isSuccessful()).isTrue();
    }

    assertThat(store.size()).isZero();
  }

  @Test
  void instrumentingTwiceAddsOneInterceptor() {
    OkHttpClient again = adapter.instrument(client);

    assertThat(again.interceptors()).hasSize(1);
    assertThat(again).isSameAs(client);
  }
}
