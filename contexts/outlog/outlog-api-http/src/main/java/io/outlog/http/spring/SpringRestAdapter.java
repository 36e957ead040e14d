package io.outlog.http.spring;

import io.outlog.application.adapter.InterceptionAdapter;
import io.outlog.application.pipeline.RecordingPipeline;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.web.client.RestTemplate;

/**
 * Records {@link RestTemplate} exchanges by registering a {@link
 * LoggingClientHttpRequestInterceptor} on the template.
 */
public class SpringRestAdapter extends InterceptionAdapter<RestTemplate> {

  public static final String LIBRARY_NAME = "spring_rest";

  private final LoggingClientHttpRequestInterceptor interceptor;

  public SpringRestAdapter(RecordingPipeline pipeline) {
    super(pipeline);
    this.interceptor = new LoggingClientHttpRequestInterceptor(pipeline);
  }

  /** Interceptor for {@code RestClient.Builder#requestInterceptor} and similar hooks. */
  public LoggingClientHttpRequestInterceptor interceptor() {
    return interceptor;
  }

  @Override
  public String libraryName() {
    return LIBRARY_NAME;
  }

  @Override
  public String displayName() {
    return "Spring RestTemplate";
  }

  @Override
  public Set<String> aliases() {
    return Set.of("resttemplate", "restclient");
  }

  @Override
  protected String targetClassName() {
    return "org.springframework.web.client.RestTemplate";
  }

  @Override
  protected RestTemplate decorate(RestTemplate client) {
    boolean present =
        client.getInterceptors().stream()
            .anyMatch(LoggingClientHttpRequestInterceptor.class::isInstance);
    if (!present) {
      List<ClientHttpRequestInterceptor> interceptors = new ArrayList<>(client.getInterceptors());
      interceptors.add(interceptor);
      client.setInterceptors(interceptors);
    }
    return client;
  }
}
