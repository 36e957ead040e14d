package io.outlog.starter.autoconfig;

import io.outlog.application.adapter.AdapterRegistry;
import io.outlog.application.pipeline.RecordingPipeline;
import io.outlog.http.okhttp.OkHttpAdapter;
import io.outlog.http.okhttp.OkHttpLoggingInterceptor;
import io.outlog.http.spring.SpringRestAdapter;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.web.client.RestTemplateCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Adapters for client libraries found on the classpath, plus the hooks Spring applications use to
 * pick them up: a {@link RestTemplateCustomizer} and an OkHttp interceptor bean.
 */
@AutoConfiguration(after = OutlogAutoConfiguration.class)
@ConditionalOnBean(RecordingPipeline.class)
public class OutlogHttpClientAutoConfiguration {

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(name = "org.springframework.web.client.RestTemplate")
  static class SpringRestConfiguration {

    @Bean
    @ConditionalOnMissingBean
    SpringRestAdapter springRestAdapter(RecordingPipeline pipeline) {
      return new SpringRestAdapter(pipeline);
    }

    /** Instruments every template built through {@code RestTemplateBuilder}. */
    @Bean
    RestTemplateCustomizer outlogRestTemplateCustomizer(AdapterRegistry registry) {
      SpringRestAdapter adapter =
          registry.adapter(SpringRestAdapter.LIBRARY_NAME, SpringRestAdapter.class);
      return adapter::instrument;
    }
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(name = "okhttp3.OkHttpClient")
  static class OkHttpConfiguration {

    @Bean
    @ConditionalOnMissingBean
    OkHttpAdapter okHttpAdapter(RecordingPipeline pipeline) {
      return new OkHttpAdapter(pipeline);
    }

    /** For {@code OkHttpClient.Builder#addInterceptor}. */
    @Bean
    @ConditionalOnMissingBean
    OkHttpLoggingInterceptor outlogOkHttpInterceptor(OkHttpAdapter adapter) {
      return adapter.interceptor();
    }
  }
}
