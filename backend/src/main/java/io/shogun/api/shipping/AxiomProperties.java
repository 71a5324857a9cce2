package io.shogun.api.shipping;

import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for shipping audit logs to Axiom.
 *
 * @param enabled master switch; when false the shipper never buffers anything
 * @param apiToken Axiom API token, sent as a bearer token
 * @param dataset target dataset name
 * @param orgId Axiom organization id, sent as {@code X-Axiom-Org-Id}
 * @param url datasets base URL; the ingest path is {@code {url}/{dataset}/ingest}
 * @param batchSize records per ingest call, and the buffer length that triggers a flush
 * @param flushInterval period of the background flush timer
 * @param connectTimeout sink connect timeout
 * @param readTimeout sink read timeout
 * @param environment deployment environment name stamped on every shipped record
 */
@Validated
@ConfigurationProperties(prefix = "shogun.axiom")
public record AxiomProperties(
    @DefaultValue("false") boolean enabled,
    @DefaultValue("") String apiToken,
    @DefaultValue("shogun-audit-logs") String dataset,
    @DefaultValue("") String orgId,
    @DefaultValue("https://api.axiom.co/v1/datasets") String url,
    @DefaultValue("100") @Positive int batchSize,
    @DefaultValue("30s") Duration flushInterval,
    @DefaultValue("5s") Duration connectTimeout,
    @DefaultValue("10s") Duration readTimeout,
    @DefaultValue("development") String environment) {

  /** Buffer length above which the oldest records are dropped. */
  public static final int MAX_QUEUED_BATCHES = 10;

  public AxiomProperties {
    requirePositive("flush-interval", flushInterval);
    requirePositive("connect-timeout", connectTimeout);
    requirePositive("read-timeout", readTimeout);
  }

  /** Enabled and carrying a token, an org id and a dataset name. */
  public boolean isConfigured() {
    return enabled && hasText(apiToken) && hasText(orgId) && hasText(dataset);
  }

  public int maxQueueSize() {
    return batchSize * MAX_QUEUED_BATCHES;
  }

  private static void requirePositive(String name, Duration value) {
    if (value == null || value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(
          "shogun.axiom." + name + " must be a positive duration, got " + value);
    }
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
