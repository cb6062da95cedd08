package io.axis.backend.exception;

import io.axis.backend.multitenancy.TenantContextResolver;
import io.axis.backend.security.ActorResolver;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Renders denials as 403 problems and logs who was denied under which client context. The
 * request itself is recorded by the audit filter; this log line carries the denial reason.
 */
@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private final ActorResolver actorResolver;

  public GlobalExceptionHandler(ActorResolver actorResolver) {
    this.actorResolver = actorResolver;
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ProblemDetail> handleAccessDenied(
      AccessDeniedException ex, HttpServletRequest request) {
    logDenial(request, "insufficient_role");

    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Access denied");
    problem.setDetail("Your role does not permit this operation");
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problem);
  }

  @ExceptionHandler(ForbiddenException.class)
  public ResponseEntity<ProblemDetail> handleForbidden(
      ForbiddenException ex, HttpServletRequest request) {
    logDenial(request, ex.getBody().getDetail());
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(ex.getBody());
  }

  private void logDenial(HttpServletRequest request, String reason) {
    log.warn(
        "security.access_denied: path={}, method={}, actor={}, client={}, reason={}",
        request.getRequestURI(),
        request.getMethod(),
        actorResolver.currentActor().id(),
        TenantContextResolver.resolve(request),
        reason);
  }
}
