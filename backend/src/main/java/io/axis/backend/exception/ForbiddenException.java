package io.axis.backend.exception;

import java.util.Locale;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Authorization denial for an authenticated caller. Always rendered as 403. */
public class ForbiddenException extends ErrorResponseException {

  private static final String ACCESS_DENIED = "Access denied";

  public ForbiddenException(String title, String detail) {
    super(HttpStatus.FORBIDDEN, createProblem(title, detail), null);
  }

  /** Denial of {@code operation} (for example "view" or "update") on an object of a given type. */
  public static ForbiddenException forObject(String operation, String objectType) {
    return new ForbiddenException(
        ACCESS_DENIED,
        "You do not have permission to "
            + operation.toLowerCase(Locale.ROOT)
            + " this "
            + objectType);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
