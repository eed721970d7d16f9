package io.b2mash.timeledger.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Base for the ledger's recoverable errors. Each subclass fixes the HTTP status; the title and
 * detail end up in the {@link ProblemDetail} body returned to the caller.
 */
public abstract class LedgerProblemException extends ErrorResponseException {

  protected LedgerProblemException(HttpStatus status, String title, String detail) {
    super(status, createProblem(status, title, detail), null);
  }

  public String getTitle() {
    return getBody().getTitle();
  }

  private static ProblemDetail createProblem(HttpStatus status, String title, String detail) {
    var problem = ProblemDetail.forStatus(status);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
