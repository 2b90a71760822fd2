package io.b2mash.tender.exception;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Locale;
import java.util.Set;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private static final Set<String> DUPLICATE_VOTE_CONSTRAINTS =
      Set.of("uq_approval_votes_voter", "uq_proposal_votes_voter");

  @ExceptionHandler(ForbiddenException.class)
  public ResponseEntity<ProblemDetail> handleForbidden(
      ForbiddenException ex, HttpServletRequest request) {
    log.warn(
        "Forbidden: path={}, method={}, reason={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getBody().getDetail());
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(ex.getBody());
  }

  @ExceptionHandler(DependencyFailureException.class)
  public ResponseEntity<ProblemDetail> handleDependencyFailure(
      DependencyFailureException ex, HttpServletRequest request) {
    log.warn(
        "Dependency failure: path={}, dependency={}, detail={}",
        request.getRequestURI(),
        ex.getDependency(),
        ex.getBody().getDetail());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ex.getBody());
  }

  @ExceptionHandler(DataIntegrityViolationException.class)
  public ResponseEntity<ProblemDetail> handleDataIntegrityViolation(
      DataIntegrityViolationException ex) {
    String constraint = constraintName(ex);
    log.warn(
        "Data integrity violation: constraint={}, cause={}",
        constraint,
        ex.getMostSpecificCause().getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    if (constraint != null && DUPLICATE_VOTE_CONSTRAINTS.contains(constraint)) {
      problem.setTitle("Duplicate vote");
      problem.setDetail("This voter has already voted.");
      problem.setProperty("errorKind", "DUPLICATE_VOTE");
    } else {
      problem.setTitle("Conflicting write");
      problem.setDetail("The request conflicts with data recorded concurrently.");
      problem.setProperty("errorKind", "CONFLICT");
    }
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }

  /** Name of the violated database constraint, lower-cased, or null when it is not reported. */
  private static String constraintName(Throwable ex) {
    for (Throwable cause = ex; cause != null; cause = cause.getCause()) {
      if (cause instanceof ConstraintViolationException violation
          && violation.getConstraintName() != null) {
        return violation.getConstraintName().toLowerCase(Locale.ROOT);
      }
    }
    return null;
  }

  @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
  public ResponseEntity<ProblemDetail> handleOptimisticLock(
      ObjectOptimisticLockingFailureException ex) {
    log.warn("Optimistic locking failure: {}", ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Concurrent modification");
    problem.setDetail("Tender was modified concurrently. Please retry.");
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }
}
