package io.axis.backend.changes;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * One lifecycle change of a domain entity, with optional before/after snapshots. At most one record
 * exists per (entity type, entity id, changed-at). The active flag and soft deletion are
 * independent: an inactive change is still listed and searchable, a deleted one is hidden.
 */
@Entity
@Table(name = "entity_changes")
public class EntityChangeRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "entity_type", nullable = false, length = 100, updatable = false)
  private String entityType;

  @Column(name = "entity_id", nullable = false, length = 255, updatable = false)
  private String entityId;

  @Enumerated(EnumType.STRING)
  @Column(name = "change_kind", nullable = false, length = 20, updatable = false)
  private ChangeKind changeKind;

  @Column(name = "changed_at", nullable = false, updatable = false)
  private Instant changedAt;

  @Column(name = "changed_by", length = 255, updatable = false)
  private String changedBy;

  @Column(name = "reason", columnDefinition = "TEXT", updatable = false)
  private String reason;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "before_data", columnDefinition = "jsonb", updatable = false)
  private Map<String, Object> beforeData;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "after_data", columnDefinition = "jsonb", updatable = false)
  private Map<String, Object> afterData;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "metadata", columnDefinition = "jsonb", nullable = false, updatable = false)
  private Map<String, Object> metadata;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "deleted_at")
  private Instant deletedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected EntityChangeRecord() {}

  public EntityChangeRecord(
      String entityType,
      String entityId,
      ChangeKind changeKind,
      Instant changedAt,
      String changedBy,
      String reason,
      Map<String, Object> beforeData,
      Map<String, Object> afterData,
      Map<String, Object> metadata) {
    this.entityType = entityType;
    this.entityId = entityId;
    this.changeKind = changeKind;
    this.changedAt = changedAt;
    this.changedBy = changedBy;
    this.reason = reason;
    this.beforeData = beforeData;
    this.afterData = afterData;
    this.metadata = metadata != null ? metadata : Map.of();
    this.active = true;
    this.createdAt = changedAt;
  }

  public void softDelete(Instant at) {
    this.deletedAt = at;
  }

  public void restore() {
    this.deletedAt = null;
  }

  public void deactivate() {
    this.active = false;
  }

  public void activate() {
    this.active = true;
  }

  public boolean isDeleted() {
    return deletedAt != null;
  }

  public UUID getId() {
    return id;
  }

  public String getEntityType() {
    return entityType;
  }

  public String getEntityId() {
    return entityId;
  }

  public ChangeKind getChangeKind() {
    return changeKind;
  }

  public Instant getChangedAt() {
    return changedAt;
  }

  public String getChangedBy() {
    return changedBy;
  }

  public String getReason() {
    return reason;
  }

  public Map<String, Object> getBeforeData() {
    return beforeData;
  }

  public Map<String, Object> getAfterData() {
    return afterData;
  }

  public Map<String, Object> getMetadata() {
    return metadata;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getDeletedAt() {
    return deletedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
