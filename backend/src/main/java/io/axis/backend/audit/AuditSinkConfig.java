package io.axis.backend.audit;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableConfigurationProperties(AuditProperties.class)
public class AuditSinkConfig {

  @Bean
  @ConditionalOnProperty(prefix = "axis.audit", name = "sink-mode", havingValue = "async")
  public ThreadPoolTaskExecutor auditExecutor(AuditProperties properties) {
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.asyncPoolSize());
    executor.setMaxPoolSize(properties.asyncPoolSize());
    executor.setQueueCapacity(properties.asyncQueueCapacity());
    executor.setThreadNamePrefix("audit-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }

  @Bean
  public AuditSink auditSink(
      ActionRecordRepository repository,
      AuditProperties properties,
      ObjectProvider<ThreadPoolTaskExecutor> auditExecutor) {
    var database = new DatabaseAuditSink(repository);
    if (properties.sinkMode() == AuditProperties.SinkMode.ASYNC) {
      return new AsyncAuditSink(database, auditExecutor.getObject());
    }
    return database;
  }
}
