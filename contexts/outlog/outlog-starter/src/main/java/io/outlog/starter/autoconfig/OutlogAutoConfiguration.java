package io.outlog.starter.autoconfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.outlog.application.adapter.AdapterRegistry;
import io.outlog.application.adapter.InterceptionAdapter;
import io.outlog.application.pipeline.RecordingPipeline;
import io.outlog.application.port.HttpRequestObserver;
import io.outlog.application.port.RequestLogSink;
import io.outlog.application.redaction.Redactor;
import io.outlog.domain.config.OutlogConfiguration;
import io.outlog.domain.config.OutlogConfigurationHolder;
import io.outlog.http.jdk.JdkHttpClientAdapter;
import io.outlog.infrastructure.persistence.NoopRequestLogSink;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;

/**
 * Core wiring: publishes the bound {@link OutlogProperties} as the global configuration and builds
 * the redactor, recording pipeline and adapter registry.
 *
 * <p>Active when {@code outlog.enabled} is not {@code false} and the process-wide switch allows
 * interception. Adapters are applied when the registry is created, so HTTP client beans built
 * afterwards are instrumented.
 */
@AutoConfiguration
@EnableConfigurationProperties(OutlogProperties.class)
@ConditionalOnProperty(prefix = "outlog", name = "enabled", matchIfMissing = true)
@Conditional(ProcessSwitchCondition.class)
public class OutlogAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(OutlogAutoConfiguration.class);

  /** Builds the configuration and installs it as the process-wide global. */
  @Bean
  @ConditionalOnMissingBean
  public OutlogConfiguration outlogConfiguration(OutlogProperties props) {
    OutlogConfiguration configuration = props.toConfiguration();
    OutlogConfigurationHolder.setGlobal(configuration);
    return configuration;
  }

  @Bean
  @ConditionalOnMissingBean
  public Redactor outlogRedactor(ObjectProvider<ObjectMapper> objectMapper) {
    return new Redactor(objectMapper.getIfAvailable(ObjectMapper::new));
  }

  /**
   * Pipeline writing to the primary {@link RequestLogSink} (records are dropped when there is
   * none) and notifying every {@link HttpRequestObserver} in order.
   */
  @Bean
  @ConditionalOnMissingBean
  public RecordingPipeline outlogRecordingPipeline(
      OutlogConfiguration configuration,
      Redactor redactor,
      ObjectProvider<RequestLogSink> sink,
      ObjectProvider<HttpRequestObserver> observers) {
    RequestLogSink target = sink.getIfAvailable(() -> NoopRequestLogSink.INSTANCE);
    if (target == NoopRequestLogSink.INSTANCE) {
      log.warn("No RequestLogSink available; outbound requests will not be persisted");
    }
    return new RecordingPipeline(target, redactor, observers.orderedStream().toList());
  }

  @Bean
  @ConditionalOnMissingBean
  public JdkHttpClientAdapter jdkHttpClientAdapter(RecordingPipeline pipeline) {
    return new JdkHttpClientAdapter(pipeline);
  }

  /** Registry over every adapter bean; adapters enabled in the configuration are applied here. */
  @Bean
  @ConditionalOnMissingBean
  public AdapterRegistry outlogAdapterRegistry(List<InterceptionAdapter<?>> adapters) {
    AdapterRegistry registry = new AdapterRegistry(adapters);
    List<String> applied = registry.applyAll();
    log.info("Outbound HTTP interception applied for {}", applied);
    return registry;
  }
}
