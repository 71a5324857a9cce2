package io.shogun.api.shipping;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.shogun.api.audit.AuditLog;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * {@link LogSink} that posts batches to the Axiom ingest API. Any non-2xx response is a failure
 * regardless of its body.
 */
@Component
public class AxiomLogSink implements LogSink {

  private static final Logger log = LoggerFactory.getLogger(AxiomLogSink.class);

  static final String ORG_ID_HEADER = "X-Axiom-Org-Id";

  private final AxiomProperties properties;
  private final RestClient restClient;

  @Autowired
  public AxiomLogSink(AxiomProperties properties) {
    this(properties, RestClient.builder().requestFactory(timeoutRequestFactory(properties)));
  }

  AxiomLogSink(AxiomProperties properties, RestClient.Builder restClientBuilder) {
    this.properties = properties;
    this.restClient = restClientBuilder.baseUrl(properties.url()).build();
  }

  @Override
  public void send(List<AuditLog> logs) {
    var events = logs.stream().map(l -> AxiomLogEvent.from(l, properties.environment())).toList();
    try {
      var result =
          restClient
              .post()
              .uri("/{dataset}/ingest", properties.dataset())
              .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiToken())
              .header(ORG_ID_HEADER, properties.orgId())
              .contentType(MediaType.APPLICATION_JSON)
              .body(events)
              .retrieve()
              .onStatus(
                  status -> !status.is2xxSuccessful(),
                  (request, response) -> {
                    String body =
                        new String(response.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    throw new LogSinkException(
                        "Axiom API error: " + response.getStatusCode().value() + " - " + body,
                        response.getStatusCode().value());
                  })
              .body(IngestResult.class);
      log.debug("Sent {} logs to Axiom: {}", logs.size(), result);
    } catch (RestClientException e) {
      throw new LogSinkException("Axiom request failed: " + e.getMessage(), e);
    }
  }

  private static SimpleClientHttpRequestFactory timeoutRequestFactory(AxiomProperties properties) {
    var factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout(properties.connectTimeout());
    factory.setReadTimeout(properties.readTimeout());
    return factory;
  }

  /** Subset of the Axiom ingest response that is worth logging. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record IngestResult(long ingested, long failed, long processedBytes) {}
}
