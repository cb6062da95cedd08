package io.axis.backend.authorization.grant.dto;

import io.axis.backend.authorization.ActorRole;
import io.axis.backend.authorization.grant.TenantAuthorizationGrant;
import java.time.Instant;
import java.util.UUID;

public record GrantResponse(
    UUID id,
    String actorId,
    String tenantId,
    ActorRole grantRole,
    Instant grantedAt,
    String grantedBy,
    String notes,
    boolean active) {

  public static GrantResponse from(TenantAuthorizationGrant grant) {
    return new GrantResponse(
        grant.getId(),
        grant.getActorId(),
        grant.getTenantId(),
        grant.getGrantRole(),
        grant.getGrantedAt(),
        grant.getGrantedBy(),
        grant.getNotes(),
        grant.isActive());
  }
}
