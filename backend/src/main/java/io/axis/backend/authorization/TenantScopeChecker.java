package io.axis.backend.authorization;

/** Answers whether an actor may operate within a tenant at all. */
public interface TenantScopeChecker {

  boolean canAccessTenant(Actor actor, String tenantId);
}
