package io.axis.backend.audit;

import jakarta.servlet.http.HttpServletRequest;
import java.beans.Introspector;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Attributes a request to a domain entity using the matched handler's {@link AuditedEntity}
 * declaration and the URI template variables. Never throws; anything it cannot work out yields
 * {@link ResolvedEntity#UNKNOWN}.
 */
@Component
public class EntityResolver {

  private static final Logger log = LoggerFactory.getLogger(EntityResolver.class);

  private static final List<String> DEFAULT_LOOKUP_FIELDS = List.of("id", "pk", "uuid");

  public ResolvedEntity resolve(HttpServletRequest request) {
    try {
      return resolve(
          request.getAttribute(HandlerMapping.BEST_MATCHING_HANDLER_ATTRIBUTE),
          uriVariables(request));
    } catch (RuntimeException e) {
      log.debug("Entity resolution failed for {}: {}", request.getRequestURI(), e.toString());
      return ResolvedEntity.UNKNOWN;
    }
  }

  public ResolvedEntity resolve(Object handler, Map<String, String> uriVariables) {
    try {
      if (!(handler instanceof HandlerMethod handlerMethod)) {
        return ResolvedEntity.UNKNOWN;
      }
      AuditedEntity declaration = findDeclaration(handlerMethod);
      if (declaration == null || declaration.value().isBlank()) {
        return ResolvedEntity.UNKNOWN;
      }
      String entityType = declaration.value();
      return new ResolvedEntity(entityType, lookupId(declaration, entityType, uriVariables));
    } catch (RuntimeException e) {
      log.debug("Entity resolution failed: {}", e.toString());
      return ResolvedEntity.UNKNOWN;
    }
  }

  @SuppressWarnings("unchecked")
  static Map<String, String> uriVariables(HttpServletRequest request) {
    Object attribute = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
    return attribute instanceof Map<?, ?> map ? (Map<String, String>) map : Map.of();
  }

  private static AuditedEntity findDeclaration(HandlerMethod handlerMethod) {
    var onMethod =
        AnnotatedElementUtils.findMergedAnnotation(handlerMethod.getMethod(), AuditedEntity.class);
    if (onMethod != null) {
      return onMethod;
    }
    return AnnotatedElementUtils.findMergedAnnotation(
        handlerMethod.getBeanType(), AuditedEntity.class);
  }

  private static String lookupId(
      AuditedEntity declaration, String entityType, Map<String, String> uriVariables) {
    if (uriVariables == null || uriVariables.isEmpty()) {
      return null;
    }
    if (!declaration.lookupField().isBlank()) {
      return nonBlank(uriVariables.get(declaration.lookupField()));
    }
    for (String field : DEFAULT_LOOKUP_FIELDS) {
      String value = nonBlank(uriVariables.get(field));
      if (value != null) {
        return value;
      }
    }
    return nonBlank(uriVariables.get(Introspector.decapitalize(entityType) + "Id"));
  }

  private static String nonBlank(String value) {
    return value != null && !value.isBlank() ? value : null;
  }
}
