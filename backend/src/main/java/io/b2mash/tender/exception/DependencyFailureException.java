package io.b2mash.tender.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when an external collaborator (company directory, funding ledger, project factory) fails
 * or rejects a call. Results in HTTP 502 Bad Gateway. The core never retries.
 */
public class DependencyFailureException extends ErrorResponseException {

  private final String dependency;

  public DependencyFailureException(String dependency, String detail, Throwable cause) {
    super(HttpStatus.BAD_GATEWAY, createProblem(dependency, detail), cause);
    this.dependency = dependency;
  }

  public String getDependency() {
    return dependency;
  }

  private static ProblemDetail createProblem(String dependency, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_GATEWAY);
    problem.setTitle(dependency + " unavailable");
    problem.setDetail(detail);
    problem.setProperty("errorKind", "DEPENDENCY_FAILURE");
    problem.setProperty("dependency", dependency);
    return problem;
  }
}
