package io.axis.backend.authorization.grant;

import io.axis.backend.authorization.ActorRole;
import io.axis.backend.authorization.OwnedResource;
import io.axis.backend.authorization.scope.HasTenantScope;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Links an actor to a tenant they may act within. Revocation sets {@code deletedAt}; rows are never
 * hard-deleted. At most one active grant exists per (actor, tenant), enforced by a partial unique
 * index.
 */
@Entity
@Table(name = "tenant_authorization_grants")
public class TenantAuthorizationGrant implements HasTenantScope, OwnedResource {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "actor_id", nullable = false, length = 255)
  private String actorId;

  @Column(name = "tenant_id", nullable = false, length = 255)
  private String tenantId;

  @Enumerated(EnumType.STRING)
  @Column(name = "grant_role", length = 20)
  private ActorRole grantRole;

  @Column(name = "granted_at", nullable = false, updatable = false)
  private Instant grantedAt;

  @Column(name = "granted_by", length = 255)
  private String grantedBy;

  @Column(name = "notes", columnDefinition = "TEXT")
  private String notes;

  @Column(name = "deleted_at")
  private Instant deletedAt;

  protected TenantAuthorizationGrant() {}

  public TenantAuthorizationGrant(
      String actorId,
      String tenantId,
      ActorRole grantRole,
      String grantedBy,
      String notes,
      Instant grantedAt) {
    this.actorId = actorId;
    this.tenantId = tenantId;
    this.grantRole = grantRole;
    this.grantedBy = grantedBy;
    this.notes = notes;
    this.grantedAt = grantedAt;
  }

  public void revoke(Instant at) {
    if (deletedAt != null) {
      throw new IllegalStateException("Grant " + id + " is already revoked");
    }
    this.deletedAt = at;
  }

  public boolean isActive() {
    return deletedAt == null;
  }

  /** Whether this grant lets its holder modify objects they do not own within the tenant. */
  public boolean isManagerLevel() {
    return grantRole != null && grantRole.isElevated();
  }

  @Override
  public Optional<String> tenantId() {
    return Optional.ofNullable(tenantId);
  }

  @Override
  public Collection<String> ownerReferences() {
    return actorId != null ? List.of(actorId) : List.of();
  }

  public UUID getId() {
    return id;
  }

  public String getActorId() {
    return actorId;
  }

  public String getTenantId() {
    return tenantId;
  }

  public ActorRole getGrantRole() {
    return grantRole;
  }

  public Instant getGrantedAt() {
    return grantedAt;
  }

  public String getGrantedBy() {
    return grantedBy;
  }

  public String getNotes() {
    return notes;
  }

  public Instant getDeletedAt() {
    return deletedAt;
  }
}
