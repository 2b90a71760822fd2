package io.b2mash.tender.integration;

import io.b2mash.tender.config.IntegrationProperties;
import io.b2mash.tender.exception.DependencyFailureException;
import io.b2mash.tender.exception.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Company directory reached over HTTP: {@code GET {base-url}/companies/{companyId}} answering
 * {@code {"companyId": 7, "representative": "..."}}.
 */
@Component
public class HttpCompanyDirectory implements CompanyDirectory {

  static final String DEPENDENCY = "CompanyDirectory";

  private static final Logger log = LoggerFactory.getLogger(HttpCompanyDirectory.class);

  private final RestClient restClient;

  public HttpCompanyDirectory(
      RestClient.Builder restClientBuilder, IntegrationProperties integrationProperties) {
    this.restClient =
        restClientBuilder.baseUrl(integrationProperties.companyDirectory().baseUrl()).build();
  }

  @Override
  public String lookupRepresentative(long companyId) {
    CompanyResponse response;
    try {
      response =
          restClient
              .get()
              .uri("/companies/{companyId}", companyId)
              .retrieve()
              .body(CompanyResponse.class);
    } catch (HttpClientErrorException.NotFound e) {
      throw new ResourceNotFoundException("Company", companyId);
    } catch (RestClientException e) {
      log.warn("Company directory lookup failed for company {}: {}", companyId, e.getMessage());
      throw new DependencyFailureException(
          DEPENDENCY, "Company directory lookup failed for company " + companyId, e);
    }
    if (response == null
        || response.representative() == null
        || response.representative().isBlank()) {
      throw new DependencyFailureException(
          DEPENDENCY,
          "Company directory returned no representative for company " + companyId,
          null);
    }
    return response.representative();
  }

  record CompanyResponse(Long companyId, String representative) {}
}
