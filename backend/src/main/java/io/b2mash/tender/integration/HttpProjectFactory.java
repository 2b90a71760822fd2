package io.b2mash.tender.integration;

import io.b2mash.tender.config.IntegrationProperties;
import io.b2mash.tender.exception.DependencyFailureException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Project factory reached over HTTP. {@code POST {base-url}/projects} creates a project and answers
 * {@code {"projectId": "..."}}; {@code DELETE {base-url}/projects/{projectId}} discards one.
 */
@Component
public class HttpProjectFactory implements ProjectFactory {

  static final String DEPENDENCY = "ProjectFactory";

  private static final Logger log = LoggerFactory.getLogger(HttpProjectFactory.class);

  private final RestClient restClient;

  public HttpProjectFactory(
      RestClient.Builder restClientBuilder, IntegrationProperties integrationProperties) {
    this.restClient =
        restClientBuilder.baseUrl(integrationProperties.projectFactory().baseUrl()).build();
  }

  @Override
  public UUID createProject(UUID tenderId, long companyId) {
    ProjectResponse response;
    try {
      response =
          restClient
              .post()
              .uri("/projects")
              .contentType(MediaType.APPLICATION_JSON)
              .body(new CreateProjectRequest(tenderId, companyId))
              .retrieve()
              .body(ProjectResponse.class);
    } catch (RestClientException e) {
      log.warn("Project creation for tender {} failed: {}", tenderId, e.getMessage());
      throw new DependencyFailureException(
          DEPENDENCY, "Project factory failed to create a project for tender " + tenderId, e);
    }
    if (response == null || response.projectId() == null) {
      throw new DependencyFailureException(
          DEPENDENCY, "Project factory returned no project id for tender " + tenderId, null);
    }
    return response.projectId();
  }

  @Override
  public void discardProject(UUID projectId) {
    try {
      restClient.delete().uri("/projects/{projectId}", projectId).retrieve().toBodilessEntity();
      log.info("Discarded project {}", projectId);
    } catch (RestClientException e) {
      throw new DependencyFailureException(
          DEPENDENCY, "Project factory failed to discard project " + projectId, e);
    }
  }

  record CreateProjectRequest(UUID tenderId, long companyId) {}

  record ProjectResponse(UUID projectId) {}
}
