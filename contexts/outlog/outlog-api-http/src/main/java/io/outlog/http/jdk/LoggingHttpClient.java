package io.outlog.http.jdk;

import io.outlog.application.pipeline.RecordingPipeline;
import io.outlog.application.pipeline.RequestData;
import io.outlog.application.pipeline.ResponseData;
import io.outlog.http.HttpHeaderSupport;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.Authenticator;
import java.net.CookieHandler;
import java.net.ProxySelector;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;

/**
 * {@link HttpClient} that records every synchronous {@link #send} through a {@link
 * RecordingPipeline} and delegates everything else.
 *
 * <p>Bodies are captured when they are already in memory: request bodies from publishers that emit
 * synchronously with a known length ({@code ofString}, {@code ofByteArray}), response bodies when
 * the body handler produced a {@code String} or {@code byte[]}. Streamed bodies are recorded
 * without content.
 *
 * <p>{@link #sendAsync} is delegated unrecorded: the calling thread's context is not available on
 * the completion thread.
 */
public class LoggingHttpClient extends HttpClient {

  private final HttpClient delegate;
  private final RecordingPipeline pipeline;

  public LoggingHttpClient(HttpClient delegate, RecordingPipeline pipeline) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
  }

  /** The undecorated client. */
  public HttpClient delegate() {
    return delegate;
  }

  @Override
  public <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler)
      throws IOException, InterruptedException {
    try {
      return pipeline.logHttpRequest(
          JdkHttpClientAdapter.LIBRARY_NAME,
          request.uri().toString(),
          request.method(),
          () -> requestData(request),
          LoggingHttpClient::responseData,
          () -> delegate.send(request, handler));
    } catch (IOException | InterruptedException | RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new IOException(e);
    }
  }

  @Override
  public <T> CompletableFuture<HttpResponse<T>> sendAsync(
      HttpRequest request, HttpResponse.BodyHandler<T> handler) {
    return delegate.sendAsync(request, handler);
  }

  @Override
  public <T> CompletableFuture<HttpResponse<T>> sendAsync(
      HttpRequest request,
      HttpResponse.BodyHandler<T> handler,
      HttpResponse.PushPromiseHandler<T> pushPromiseHandler) {
    return delegate.sendAsync(request, handler, pushPromiseHandler);
  }

  // ---------------- Capture ----------------

  static RequestData requestData(HttpRequest request) {
    return new RequestData(
        HttpHeaderSupport.flatten(request.headers().map()),
        request.bodyPublisher().map(LoggingHttpClient::readInMemory).orElse(null));
  }

  static ResponseData responseData(HttpResponse<?> response) {
    Object body = response.body();
    return new ResponseData(
        response.statusCode(),
        HttpHeaderSupport.flatten(response.headers().map()),
        (body instanceof String || body instanceof byte[]) ? body : null);
  }

  private static byte[] readInMemory(HttpRequest.BodyPublisher publisher) {
    if (publisher.contentLength() <= 0) {
      return null;
    }
    ByteCollector collector = new ByteCollector();
    publisher.subscribe(collector);
    try {
      return collector.result.getNow(null);
    } catch (CompletionException e) {
      return null;
    }
  }

  /** Collects a publisher's buffers; completes only if the publisher emits synchronously. */
  private static final class ByteCollector implements Flow.Subscriber<ByteBuffer> {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final CompletableFuture<byte[]> result = new CompletableFuture<>();

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
      subscription.request(Long.MAX_VALUE);
    }

    @Override
    public void onNext(ByteBuffer item) {
      byte[] chunk = new byte[item.remaining()];
      item.get(chunk);
      out.write(chunk, 0, chunk.length);
    }

    @Override
    public void onError(Throwable throwable) {
      result.completeExceptionally(throwable);
    }

    @Override
    public void onComplete() {
      result.complete(out.toByteArray());
    }
  }

  // ---------------- Delegation ----------------

  @Override
  public Optional<CookieHandler> cookieHandler() {
    return delegate.cookieHandler();
  }

  @Override
  public Optional<Duration> connectTimeout() {
    return delegate.connectTimeout();
  }

  @Override
  public Redirect followRedirects() {
    return delegate.followRedirects();
  }

  @Override
  public Optional<ProxySelector> proxy() {
    return delegate.proxy();
  }

  @Override
  public SSLContext sslContext() {
    return delegate.sslContext();
  }

  @Override
  public SSLParameters sslParameters() {
    return delegate.sslParameters();
  }

  @Override
  public Optional<Authenticator> authenticator() {
    return delegate.authenticator();
  }

  @Override
  public Version version() {
    return delegate.version();
  }

  @Override
  public Optional<Executor> executor() {
    return delegate.executor();
  }

  @Override
  public WebSocket.Builder newWebSocketBuilder() {
    return delegate.newWebSocketBuilder();
  }
}
