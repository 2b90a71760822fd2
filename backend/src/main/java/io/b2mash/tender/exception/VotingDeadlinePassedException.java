package io.b2mash.tender.exception;

import java.time.Instant;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when an approval vote arrives after the tender's voting deadline. HTTP 422. */
public class VotingDeadlinePassedException extends ErrorResponseException {

  public VotingDeadlinePassedException(UUID tenderId, Instant votingDeadline) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(tenderId, votingDeadline), null);
  }

  private static ProblemDetail createProblem(UUID tenderId, Instant votingDeadline) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Voting deadline passed");
    problem.setDetail(
        "Approval voting for tender " + tenderId + " closed at " + votingDeadline);
    problem.setProperty("errorKind", "DEADLINE");
    problem.setProperty("votingDeadline", votingDeadline.toString());
    return problem;
  }
}
