package io.axis.backend.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Immutable record of one state-changing API request, persisted to {@code action_records}. Rows
 * cannot be updated or deleted (enforced by a database trigger), so there are no mutators.
 *
 * <p>{@code actorId} is the token subject rather than a foreign key, so records outlive the actors
 * they describe.
 */
@Entity
@Table(name = "action_records")
public class ActionRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "actor_id", length = 255, updatable = false)
  private String actorId;

  @Enumerated(EnumType.STRING)
  @Column(name = "action", nullable = false, length = 20, updatable = false)
  private ActionKind action;

  @Column(name = "entity_type", length = 100, updatable = false)
  private String entityType;

  @Column(name = "entity_id", length = 255, updatable = false)
  private String entityId;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "context", columnDefinition = "jsonb", nullable = false, updatable = false)
  private AuditEnvelope context;

  @Column(name = "ip_address", length = 45, updatable = false)
  private String ipAddress;

  @Column(name = "user_agent", length = 500, updatable = false)
  private String userAgent;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected ActionRecord() {}

  public ActionRecord(
      String actorId,
      ActionKind action,
      String entityType,
      String entityId,
      AuditEnvelope context,
      String ipAddress,
      String userAgent,
      Instant createdAt) {
    this.actorId = actorId;
    this.action = action;
    this.entityType = entityType;
    this.entityId = entityId;
    this.context = context;
    this.ipAddress = ipAddress;
    this.userAgent = userAgent;
    this.createdAt = createdAt;
  }

  public UUID getId() {
    return id;
  }

  public String getActorId() {
    return actorId;
  }

  public ActionKind getAction() {
    return action;
  }

  public String getEntityType() {
    return entityType;
  }

  public String getEntityId() {
    return entityId;
  }

  public AuditEnvelope getContext() {
    return context;
  }

  public String getIpAddress() {
    return ipAddress;
  }

  public String getUserAgent() {
    return userAgent;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
