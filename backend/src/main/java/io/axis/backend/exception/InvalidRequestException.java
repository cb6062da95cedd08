package io.axis.backend.exception;

import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A request parameter is missing or out of range. The offending parameter names are exposed as the
 * {@code parameters} property of the problem body.
 */
public class InvalidRequestException extends ErrorResponseException {

  private final List<String> parameters;

  private InvalidRequestException(String title, String detail, List<String> parameters) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, detail, parameters), null);
    this.parameters = parameters;
  }

  public static InvalidRequestException outOfRange(String parameter, String detail) {
    return new InvalidRequestException("Invalid range", detail, List.of(parameter));
  }

  /** None of the alternative filter parameters was supplied. */
  public static InvalidRequestException missingFilter(String... parameters) {
    return new InvalidRequestException(
        "Missing filter",
        "One of " + String.join(", ", parameters) + " must be provided",
        List.of(parameters));
  }

  public List<String> getParameters() {
    return parameters;
  }

  private static ProblemDetail createProblem(
      String title, String detail, List<String> parameters) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("parameters", parameters);
    return problem;
  }
}
