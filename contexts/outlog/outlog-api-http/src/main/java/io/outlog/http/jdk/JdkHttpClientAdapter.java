package io.outlog.http.jdk;

import io.outlog.application.adapter.InterceptionAdapter;
import io.outlog.application.pipeline.RecordingPipeline;
import java.net.http.HttpClient;
import java.util.Set;

/** Records calls made through {@link HttpClient#send}. */
public class JdkHttpClientAdapter extends InterceptionAdapter<HttpClient> {

  public static final String LIBRARY_NAME = "jdk_http_client";

  public JdkHttpClientAdapter(RecordingPipeline pipeline) {
    super(pipeline);
  }

  @Override
  public String libraryName() {
    return LIBRARY_NAME;
  }

  @Override
  public String displayName() {
    return "java.net.http.HttpClient";
  }

  @Override
  public Set<String> aliases() {
    return Set.of("httpclient", "java.net.http");
  }

  @Override
  protected String targetClassName() {
    return "java.net.http.HttpClient";
  }

  @Override
  protected HttpClient decorate(HttpClient client) {
    if (client instanceof LoggingHttpClient) {
      return client;
    }
    return new LoggingHttpClient(client, pipeline);
  }
}
