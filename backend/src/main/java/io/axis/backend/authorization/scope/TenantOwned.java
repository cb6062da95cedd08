package io.axis.backend.authorization.scope;

/** Domain objects related to a tenant-shaped object rather than holding its id. */
public interface TenantOwned {

  /** Returns the related tenant, or null when the relation is not set. */
  TenantIdentity tenant();
}
