package io.shogun.api.config;

import io.shogun.api.retention.LogRetentionProperties;
import io.shogun.api.shipping.AxiomProperties;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Shared infrastructure for the audit pipeline: the clock used for retention cutoffs and the
 * scheduler that runs the shipper's flush timer, the daily retention cleanup and detached
 * shipping tasks.
 */
@Configuration
@EnableConfigurationProperties({AxiomProperties.class, LogRetentionProperties.class})
public class AuditPipelineConfig {

  @Bean
  Clock clock() {
    return Clock.systemDefaultZone();
  }

  @Bean
  ThreadPoolTaskScheduler auditPipelineScheduler() {
    var scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(4);
    scheduler.setThreadNamePrefix("audit-pipeline-");
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(30);
    return scheduler;
  }
}
