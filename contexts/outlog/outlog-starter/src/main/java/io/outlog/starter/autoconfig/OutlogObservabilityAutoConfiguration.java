package io.outlog.starter.autoconfig;

import io.micrometer.core.instrument.MeterRegistry;
import io.outlog.infrastructure.observability.MicrometerRequestObserver;
import io.outlog.infrastructure.observability.SpanEventRequestObserver;
import io.outlog.infrastructure.observability.StructuredLogRequestObserver;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;

/**
 * Observers notified after every recorded call. Toggled by {@code outlog.observability.*}.
 *
 * <ul>
 *   <li>Micrometer meters, when a {@link MeterRegistry} bean exists.
 *   <li>Span events, when the OpenTelemetry API is on the classpath.
 *   <li>Structured log lines, always.
 * </ul>
 */
@AutoConfiguration(
    before = OutlogAutoConfiguration.class,
    afterName =
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnProperty(prefix = "outlog", name = "enabled", matchIfMissing = true)
@Conditional(ProcessSwitchCondition.class)
public class OutlogObservabilityAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(
      prefix = "outlog.observability",
      name = "structured-log",
      matchIfMissing = true)
  public StructuredLogRequestObserver structuredLogRequestObserver() {
    return new StructuredLogRequestObserver();
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(name = "io.micrometer.core.instrument.MeterRegistry")
  @ConditionalOnBean(type = "io.micrometer.core.instrument.MeterRegistry")
  @ConditionalOnProperty(prefix = "outlog.observability", name = "metrics", matchIfMissing = true)
  static class MetricsConfiguration {

    @Bean
    @ConditionalOnMissingBean
    MicrometerRequestObserver micrometerRequestObserver(MeterRegistry meters) {
      return new MicrometerRequestObserver(meters);
    }
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(name = "io.opentelemetry.api.trace.Span")
  @ConditionalOnProperty(
      prefix = "outlog.observability",
      name = "span-events",
      matchIfMissing = true)
  static class SpanEventConfiguration {

    @Bean
    @ConditionalOnMissingBean
    SpanEventRequestObserver spanEventRequestObserver() {
      return new SpanEventRequestObserver();
    }
  }
}
