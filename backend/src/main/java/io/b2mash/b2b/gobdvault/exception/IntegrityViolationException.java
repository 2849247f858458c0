package io.b2mash.b2b.gobdvault.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Stored data no longer matches what was written: GCM authentication tag failure, content hash
 * mismatch or a diverged hash chain. Never caught and converted into a silent success.
 */
public class IntegrityViolationException extends ErrorResponseException {

  public IntegrityViolationException(String title, String detail, Throwable cause) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(title, detail), cause);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
