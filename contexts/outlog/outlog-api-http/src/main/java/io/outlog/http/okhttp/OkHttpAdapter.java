package io.outlog.http.okhttp;

import io.outlog.application.adapter.InterceptionAdapter;
import io.outlog.application.pipeline.RecordingPipeline;
import java.util.Set;
import okhttp3.OkHttpClient;

/**
 * Records OkHttp calls by adding an {@link OkHttpLoggingInterceptor} to a client copy.
 *
 * <p>Clients built elsewhere can register {@link #interceptor()} directly.
 */
public class OkHttpAdapter extends InterceptionAdapter<OkHttpClient> {

  public static final String LIBRARY_NAME = "okhttp";

  private final OkHttpLoggingInterceptor interceptor;

  public OkHttpAdapter(RecordingPipeline pipeline) {
    super(pipeline);
    this.interceptor = new OkHttpLoggingInterceptor(pipeline);
  }

  public OkHttpLoggingInterceptor interceptor() {
    return interceptor;
  }

  @Override
  public String libraryName() {
    return LIBRARY_NAME;
  }

  @Override
  public String displayName() {
    return "OkHttp";
  }

  @Override
  public Set<String> aliases() {
    return Set.of("okhttp3");
  }

  @Override
  protected String targetClassName() {
    return "okhttp3.OkHttpClient";
  }

  @Override
  protected OkHttpClient decorate(OkHttpClient client) {
    boolean present =
        client.interceptors().stream().anyMatch(OkHttpLoggingInterceptor.class::isInstance);
    if (present) {
      return client;
    }
    return client.newBuilder().addInterceptor(interceptor).build();
  }
}
