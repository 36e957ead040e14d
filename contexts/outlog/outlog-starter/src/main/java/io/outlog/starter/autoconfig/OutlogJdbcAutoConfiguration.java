package io.outlog.starter.autoconfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.outlog.application.port.RequestLogSink;
import io.outlog.application.port.RequestLogStore;
import io.outlog.infrastructure.persistence.CompositeRequestLogSink;
import io.outlog.infrastructure.persistence.JdbcDialect;
import io.outlog.infrastructure.persistence.JdbcRequestLogStore;
import java.time.Clock;
import java.util.List;
import javax.sql.DataSource;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

/**
 * Auto-configuration wiring a JDBC-backed {@link RequestLogStore} on the application's {@link
 * JdbcTemplate}.
 *
 * <p>With {@code outlog.jdbc.secondary-url} set, a second store on that database receives a copy
 * of every record through a {@link CompositeRequestLogSink}.
 */
@AutoConfiguration(
    after = JdbcTemplateAutoConfiguration.class,
    before = OutlogAutoConfiguration.class)
@EnableConfigurationProperties(OutlogProperties.class)
@ConditionalOnClass(JdbcTemplate.class)
@ConditionalOnBean(JdbcTemplate.class)
@ConditionalOnProperty(prefix = "outlog", name = "enabled", matchIfMissing = true)
@Conditional(ProcessSwitchCondition.class)
public class OutlogJdbcAutoConfiguration {

  /** Creates the primary store with optional Micrometer metrics. */
  @Bean
  @ConditionalOnMissingBean(RequestLogStore.class)
  @ConditionalOnProperty(prefix = "outlog.jdbc", name = "enabled", matchIfMissing = true)
  public JdbcRequestLogStore outlogRequestLogStore(
      JdbcTemplate jdbc,
      OutlogProperties props,
      ObjectProvider<ObjectMapper> objectMapper,
      ObjectProvider<MeterRegistry> meters) {
    return store(jdbc, props, objectMapper, meters);
  }

  /** Fans records out to the primary store and the secondary database. */
  @Bean
  @Primary
  @ConditionalOnExpression("${outlog.jdbc.enabled:true} and '${outlog.jdbc.secondary-url:}' != ''")
  public CompositeRequestLogSink outlogCompositeRequestLogSink(
      JdbcRequestLogStore primary,
      OutlogProperties props,
      ObjectProvider<ObjectMapper> objectMapper,
      ObjectProvider<MeterRegistry> meters) {
    OutlogProperties.Jdbc p = props.getJdbc();
    DataSource secondaryDs =
        new DriverManagerDataSource(
            p.getSecondaryUrl(), p.getSecondaryUsername(), p.getSecondaryPassword());
    JdbcRequestLogStore secondary =
        store(new JdbcTemplate(secondaryDs), props, objectMapper, meters);
    return new CompositeRequestLogSink(primary, List.<RequestLogSink>of(secondary));
  }

  private static JdbcRequestLogStore store(
      JdbcTemplate jdbc,
      OutlogProperties props,
      ObjectProvider<ObjectMapper> objectMapper,
      ObjectProvider<MeterRegistry> meters) {
    DataSource dataSource = jdbc.getDataSource();
    if (dataSource == null) {
      throw new IllegalStateException("JdbcTemplate has no DataSource");
    }
    JdbcRequestLogStore store =
        new JdbcRequestLogStore(
            jdbc,
            objectMapper.getIfAvailable(ObjectMapper::new),
            JdbcDialect.detect(dataSource),
            props.getJdbc().getTable(),
            meters.getIfAvailable(),
            Clock.systemUTC());
    if (props.getJdbc().isInitializeSchema()) {
      store.initializeSchema();
    }
    return store;
  }
}
