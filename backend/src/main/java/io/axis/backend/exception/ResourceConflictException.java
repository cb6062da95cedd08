package io.axis.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A write collided with existing state, such as a duplicate active record. */
public class ResourceConflictException extends ErrorResponseException {

  public ResourceConflictException(String title, String detail) {
    this(title, detail, null);
  }

  public ResourceConflictException(String title, String detail, Throwable cause) {
    super(HttpStatus.CONFLICT, createProblem(title, detail), cause);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
