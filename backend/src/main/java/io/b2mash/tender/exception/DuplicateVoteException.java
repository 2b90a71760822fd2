package io.b2mash.tender.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a voter tries to vote a second time in the same round: once per tender for approval
 * votes, once per proposal for proposal votes. Results in HTTP 409 Conflict.
 */
public class DuplicateVoteException extends ErrorResponseException {

  public DuplicateVoteException(String detail) {
    super(HttpStatus.CONFLICT, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Duplicate vote");
    problem.setDetail(detail);
    problem.setProperty("errorKind", "DUPLICATE_VOTE");
    return problem;
  }
}
