package io.shogun.api.retention;

import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.validation.annotation.Validated;

/**
 * Retention policy configuration for audit logs.
 *
 * <p>{@code cron} is a six-field Spring cron expression evaluated in the system time zone, so the
 * cleanup keeps its wall-clock hour across daylight saving changes.
 */
@Validated
@ConfigurationProperties(prefix = "shogun.retention")
public record LogRetentionProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("90") @Positive int authDays,
    @DefaultValue("180") @Positive int errorDays,
    @DefaultValue("30") @Positive int crudDays,
    @DefaultValue("60") @Positive int defaultDays,
    @DefaultValue("1000") @Positive int batchSize,
    @DefaultValue("100ms") Duration batchDelay,
    @DefaultValue("true") boolean archiveToAxiom,
    @DefaultValue("0 0 2 * * *") String cron,
    @DefaultValue("5m") Duration initialDelay) {

  public LogRetentionProperties {
    batchDelay = nonNegative("batch-delay", batchDelay);
    initialDelay = nonNegative("initial-delay", initialDelay);
    if (cron == null || cron.isBlank()) {
      cron = "0 0 2 * * *";
    }
    if (!CronExpression.isValidExpression(cron)) {
      throw new IllegalArgumentException(
          "shogun.retention.cron is not a valid cron expression: '" + cron + "'");
    }
  }

  private static Duration nonNegative(String name, Duration value) {
    if (value == null) {
      return Duration.ZERO;
    }
    if (value.isNegative()) {
      throw new IllegalArgumentException(
          "shogun.retention." + name + " must not be negative, got " + value);
    }
    return value;
  }
}
