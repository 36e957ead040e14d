package io.outlog.http.okhttp;

import io.outlog.application.pipeline.RecordingPipeline;
import io.outlog.application.pipeline.RequestData;
import io.outlog.application.pipeline.ResponseData;
import io.outlog.http.HttpHeaderSupport;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OkHttp application interceptor that records each call through a {@link RecordingPipeline}.
 *
 * <p>The response body is peeked, never consumed: the caller reads the full stream as usual. The
 * whole body is decoded with the response charset and handed to redaction as is; bodies above
 * {@link #MAX_PEEK_BYTES} are not captured.
 * One-shot and duplex request bodies are not captured.
 */
public class OkHttpLoggingInterceptor implements Interceptor {

  private static final Logger log = LoggerFactory.getLogger(OkHttpLoggingInterceptor.class);

  /** Upper bound on the bytes peeked from a response; larger bodies are recorded without body. */
  static final long MAX_PEEK_BYTES = 16L * 1024 * 1024;

  private final RecordingPipeline pipeline;

  public OkHttpLoggingInterceptor(RecordingPipeline pipeline) {
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
  }

  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    return pipeline.logHttpRequest(
        OkHttpAdapter.LIBRARY_NAME,
        request.url().toString(),
        request.method(),
        () -> requestData(request),
        this::responseData,
        () -> chain.proceed(request));
  }

  private RequestData requestData(Request request) {
    Map<String, String> headers =
        new LinkedHashMap<>(HttpHeaderSupport.flatten(request.headers().toMultimap()));
    RequestBody body = request.body();
    if (body == null) {
      return new RequestData(headers, null);
    }
    MediaType contentType = body.contentType();
    if (contentType != null && request.header("Content-Type") == null) {
      headers.put("content-type", contentType.toString());
    }
    if (body.isOneShot() || body.isDuplex()) {
      return new RequestData(headers, null);
    }
    try {
      Buffer buffer = new Buffer();
      body.writeTo(buffer);
      return new RequestData(headers, buffer.readByteArray());
    } catch (IOException e) {
      log.warn("Could not buffer request body of {}: {}", request.url(), e.toString());
      return new RequestData(headers, null);
    }
  }

  private ResponseData responseData(Response response) {
    Map<String, String> headers = HttpHeaderSupport.flatten(response.headers().toMultimap());
    String body = null;
    if (response.body() != null) {
      try {
        ResponseBody peeked = response.peekBody(MAX_PEEK_BYTES + 1L);
        if (peeked.contentLength() > MAX_PEEK_BYTES) {
          log.debug(
              "Response body of {} exceeds {} bytes; not captured",
              response.request().url(),
              MAX_PEEK_BYTES);
        } else {
          body = peeked.string();
        }
      } catch (IOException e) {
        log.warn("Could not peek response body of {}: {}", response.request().url(), e.toString());
      }
    }
    return new ResponseData(response.code(), headers, body);
  }
}
