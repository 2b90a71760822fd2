package io.b2mash.tender.integration;

import java.util.UUID;

/** Port to the service that creates a project record for an awarded tender. */
public interface ProjectFactory {

  /** Creates the project for the winning company and returns its id. */
  UUID createProject(UUID tenderId, long companyId);

  /** Removes a project created by a failed award. */
  void discardProject(UUID projectId);
}
