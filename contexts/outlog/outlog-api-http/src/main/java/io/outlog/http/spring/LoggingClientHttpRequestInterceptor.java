package io.outlog.http.spring;

import io.outlog.application.pipeline.RecordingPipeline;
import io.outlog.application.pipeline.RequestData;
import io.outlog.application.pipeline.ResponseData;
import io.outlog.http.HttpHeaderSupport;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;

/**
 * Records {@code RestTemplate} and {@code RestClient} exchanges through a {@link
 * RecordingPipeline}.
 *
 * <p>The response body is buffered so that message converters can still read it.
 */
public class LoggingClientHttpRequestInterceptor implements ClientHttpRequestInterceptor {

  private final RecordingPipeline pipeline;

  public LoggingClientHttpRequestInterceptor(RecordingPipeline pipeline) {
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
  }

  @Override
  public ClientHttpResponse intercept(
      HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
    return pipeline.logHttpRequest(
        SpringRestAdapter.LIBRARY_NAME,
        request.getURI().toString(),
        request.getMethod().name(),
        () ->
            new RequestData(
                HttpHeaderSupport.flatten(request.getHeaders()),
                body == null || body.length == 0 ? null : body),
        LoggingClientHttpRequestInterceptor::responseData,
        () -> BufferedClientHttpResponse.buffer(execution.execute(request, body)));
  }

  private static ResponseData responseData(BufferedClientHttpResponse response) {
    try {
      return new ResponseData(
          response.getStatusCode().value(),
          HttpHeaderSupport.flatten(response.getHeaders()),
          response.bodyBytes());
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
