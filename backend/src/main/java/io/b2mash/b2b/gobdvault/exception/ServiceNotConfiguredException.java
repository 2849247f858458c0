package io.b2mash.b2b.gobdvault.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class ServiceNotConfiguredException extends ErrorResponseException {

  public ServiceNotConfiguredException(String service, String detail) {
    super(HttpStatus.SERVICE_UNAVAILABLE, createProblem(service + " not configured", detail), null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
