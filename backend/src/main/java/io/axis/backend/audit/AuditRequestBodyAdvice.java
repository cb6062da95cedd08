package io.axis.backend.audit;

import java.lang.reflect.Type;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.servlet.mvc.method.annotation.RequestBodyAdviceAdapter;

/**
 * Keeps the deserialized {@code @RequestBody} on the request so {@link AuditFilter} can record
 * the payload the handler actually received.
 */
@ControllerAdvice
public class AuditRequestBodyAdvice extends RequestBodyAdviceAdapter {

  public static final String PARSED_BODY_ATTRIBUTE =
      AuditRequestBodyAdvice.class.getName() + ".PARSED_BODY";

  @Override
  public boolean supports(
      MethodParameter methodParameter,
      Type targetType,
      Class<? extends HttpMessageConverter<?>> converterType) {
    return true;
  }

  @Override
  public Object afterBodyRead(
      Object body,
      HttpInputMessage inputMessage,
      MethodParameter parameter,
      Type targetType,
      Class<? extends HttpMessageConverter<?>> converterType) {
    RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
    if (attributes != null && body != null) {
      attributes.setAttribute(PARSED_BODY_ATTRIBUTE, body, RequestAttributes.SCOPE_REQUEST);
    }
    return body;
  }
}
