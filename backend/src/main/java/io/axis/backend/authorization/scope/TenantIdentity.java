package io.axis.backend.authorization.scope;

/** A tenant-shaped object, such as a client record. */
public interface TenantIdentity {

  String getId();
}
