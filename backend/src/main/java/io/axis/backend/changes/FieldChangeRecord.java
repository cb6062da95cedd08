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
import java.util.Objects;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/** A single field's old and new value within an {@link EntityChangeRecord}. */
@Entity
@Table(name = "field_changes")
public class FieldChangeRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "entity_change_id", nullable = false, updatable = false)
  private UUID entityChangeId;

  @Column(name = "field_name", nullable = false, length = 100, updatable = false)
  private String fieldName;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "old_value", columnDefinition = "jsonb", updatable = false)
  private Object oldValue;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "new_value", columnDefinition = "jsonb", updatable = false)
  private Object newValue;

  @Enumerated(EnumType.STRING)
  @Column(name = "change_kind", nullable = false, length = 20, updatable = false)
  private ChangeKind changeKind;

  @Column(name = "deleted_at")
  private Instant deletedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected FieldChangeRecord() {}

  public FieldChangeRecord(
      UUID entityChangeId,
      String fieldName,
      Object oldValue,
      Object newValue,
      ChangeKind changeKind,
      Instant createdAt) {
    this.entityChangeId = entityChangeId;
    this.fieldName = fieldName;
    this.oldValue = oldValue;
    this.newValue = newValue;
    this.changeKind = changeKind;
    this.createdAt = createdAt;
  }

  /** Whether the old and new values differ. Callers may record unchanged fields. */
  public boolean hasChanged() {
    return !Objects.equals(oldValue, newValue);
  }

  public UUID getId() {
    return id;
  }

  public UUID getEntityChangeId() {
    return entityChangeId;
  }

  public String getFieldName() {
    return fieldName;
  }

  public Object getOldValue() {
    return oldValue;
  }

  public Object getNewValue() {
    return newValue;
  }

  public ChangeKind getChangeKind() {
    return changeKind;
  }

  public Instant getDeletedAt() {
    return deletedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
