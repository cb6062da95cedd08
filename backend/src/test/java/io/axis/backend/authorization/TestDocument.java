package io.axis.backend.authorization;

import io.axis.backend.authorization.scope.HasTenantScope;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/** Minimal client-scoped, owned, optionally confidential domain object. */
record TestDocument(String clientId, String uploadedBy, boolean confidential)
    implements HasTenantScope, OwnedResource, ConfidentialResource {

  static TestDocument of(String clientId, String uploadedBy) {
    return new TestDocument(clientId, uploadedBy, false);
  }

  @Override
  public Optional<String> tenantId() {
    return Optional.ofNullable(clientId);
  }

  @Override
  public Collection<String> ownerReferences() {
    return uploadedBy != null ? Set.of(uploadedBy) : Set.of();
  }

  @Override
  public boolean isConfidential() {
    return confidential;
  }
}
