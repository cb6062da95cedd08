package io.axis.backend.audit;

/** Entity type and id a request was attributed to. Either may be null. */
public record ResolvedEntity(String entityType, String entityId) {

  public static final ResolvedEntity UNKNOWN = new ResolvedEntity(null, null);
}
