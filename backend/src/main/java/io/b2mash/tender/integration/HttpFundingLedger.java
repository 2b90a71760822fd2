package io.b2mash.tender.integration;

import io.b2mash.tender.config.IntegrationProperties;
import io.b2mash.tender.exception.DependencyFailureException;
import java.math.BigDecimal;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/** Funding ledger reached over HTTP: {@code POST {base-url}/disbursements}. */
@Component
public class HttpFundingLedger implements FundingLedger {

  static final String DEPENDENCY = "FundingLedger";

  private static final Logger log = LoggerFactory.getLogger(HttpFundingLedger.class);

  private final RestClient restClient;

  public HttpFundingLedger(
      RestClient.Builder restClientBuilder, IntegrationProperties integrationProperties) {
    this.restClient =
        restClientBuilder.baseUrl(integrationProperties.fundingLedger().baseUrl()).build();
  }

  @Override
  public void disburse(BigDecimal amount, UUID projectId) {
    try {
      restClient
          .post()
          .uri("/disbursements")
          .contentType(MediaType.APPLICATION_JSON)
          .body(new DisbursementRequest(projectId, amount))
          .retrieve()
          .toBodilessEntity();
      log.info("Disbursed {} to project {}", amount.toPlainString(), projectId);
    } catch (RestClientException e) {
      log.warn("Disbursement of {} to project {} failed: {}", amount, projectId, e.getMessage());
      throw new DependencyFailureException(
          DEPENDENCY, "Funding ledger rejected disbursement to project " + projectId, e);
    }
  }

  record DisbursementRequest(UUID projectId, BigDecimal amount) {}
}
