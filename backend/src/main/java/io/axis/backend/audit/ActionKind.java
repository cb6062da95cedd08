package io.axis.backend.audit;

import java.util.Locale;

/** What a recorded request did. Only the HTTP-derived kinds are produced by request auditing. */
public enum ActionKind {
  CREATE,
  UPDATE,
  DELETE,
  LOGIN,
  LOGOUT,
  APPROVE,
  REJECT,
  LIST,
  OTHER;

  public static ActionKind fromHttpMethod(String method) {
    if (method == null) {
      return OTHER;
    }
    return switch (method.toUpperCase(Locale.ROOT)) {
      case "POST" -> CREATE;
      case "PUT", "PATCH" -> UPDATE;
      case "DELETE" -> DELETE;
      default -> OTHER;
    };
  }
}
