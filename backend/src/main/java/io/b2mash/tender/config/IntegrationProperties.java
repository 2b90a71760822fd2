package io.b2mash.tender.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Endpoints of the external collaborators. The base URLs double as the collaborator references
 * stored on each tender at creation.
 */
@ConfigurationProperties(prefix = "tender.integration")
public record IntegrationProperties(
    Endpoint companyDirectory, Endpoint fundingLedger, Endpoint projectFactory) {

  /** @param baseUrl root URL the adapter prefixes to every request path */
  public record Endpoint(String baseUrl) {}
}
