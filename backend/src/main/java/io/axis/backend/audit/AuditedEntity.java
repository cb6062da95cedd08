package io.axis.backend.audit;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares which domain entity a controller (or a single handler method) operates on, so audited
 * requests can be attributed to it. A method-level annotation overrides the class-level one.
 */
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface AuditedEntity {

  /** Entity type name recorded on the action record, e.g. {@code "Document"}. */
  String value();

  /**
   * URI template variable holding the entity id. When empty, {@code id}, {@code pk}, {@code uuid}
   * and {@code <entityType>Id} are tried in that order.
   */
  String lookupField() default "";
}
