package io.axis.backend.changes;

import io.axis.backend.exception.InvalidRequestException;
import io.axis.backend.exception.ResourceNotFoundException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Durable per-entity change history. Domain services call it directly whenever they create, modify
 * or retire an entity; request auditing is handled separately.
 *
 * <p>Timestamps come from the injected {@link Clock}, truncated to microseconds to match the
 * database precision. Two changes of the same entity at the same instant are rejected with {@link
 * ChangeConflictException}; nothing retries them.
 */
@Service
public class ChangeStore {

  private static final Logger log = LoggerFactory.getLogger(ChangeStore.class);

  private final EntityChangeRepository entityChangeRepository;
  private final FieldChangeRepository fieldChangeRepository;
  private final Clock clock;

  public ChangeStore(
      EntityChangeRepository entityChangeRepository,
      FieldChangeRepository fieldChangeRepository,
      Clock clock) {
    this.entityChangeRepository = entityChangeRepository;
    this.fieldChangeRepository = fieldChangeRepository;
    this.clock = clock;
  }

  @Transactional
  public EntityChangeRecord recordChange(
      String entityType,
      String entityId,
      ChangeKind changeKind,
      String actorId,
      String reason,
      Map<String, Object> before,
      Map<String, Object> after,
      Map<String, Object> metadata) {
    if (entityType == null || entityType.isBlank() || entityId == null || entityId.isBlank()) {
      throw new IllegalArgumentException("entityType and entityId are required");
    }
    if (changeKind == null) {
      throw new IllegalArgumentException("changeKind is required");
    }
    Instant changedAt = now();
    var record =
        new EntityChangeRecord(
            entityType, entityId, changeKind, changedAt, actorId, reason, before, after, metadata);
    try {
      var saved = entityChangeRepository.saveAndFlush(record);
      log.debug(
          "Recorded change: kind={}, entity={}/{}, actor={}",
          changeKind,
          entityType,
          entityId,
          actorId);
      return saved;
    } catch (DataIntegrityViolationException e) {
      throw new ChangeConflictException(entityType, entityId, changedAt, e);
    }
  }

  @Transactional
  public FieldChangeRecord recordFieldChange(
      EntityChangeRecord parent,
      String fieldName,
      Object oldValue,
      Object newValue,
      ChangeKind changeKind) {
    if (parent == null || parent.getId() == null) {
      throw new IllegalArgumentException("Field changes require a persisted parent change");
    }
    if (fieldName == null || fieldName.isBlank()) {
      throw new IllegalArgumentException("fieldName is required");
    }
    return fieldChangeRepository.save(
        new FieldChangeRecord(
            parent.getId(),
            fieldName,
            oldValue,
            newValue,
            changeKind != null ? changeKind : parent.getChangeKind(),
            now()));
  }

  /**
   * Records the change and one field change per field whose value differs between {@code before}
   * and {@code after}.
   */
  @Transactional
  public EntityChangeRecord recordChangeWithFieldDiff(
      String entityType,
      String entityId,
      ChangeKind changeKind,
      String actorId,
      String reason,
      Map<String, Object> before,
      Map<String, Object> after,
      Map<String, Object> metadata) {
    var parent =
        recordChange(entityType, entityId, changeKind, actorId, reason, before, after, metadata);
    for (var diff : SnapshotDiff.diff(before, after)) {
      recordFieldChange(parent, diff.fieldName(), diff.oldValue(), diff.newValue(), changeKind);
    }
    return parent;
  }

  @Transactional(readOnly = true)
  public EntityChangeRecord findById(UUID id) {
    return entityChangeRepository
        .findByIdAndDeletedAtIsNull(id)
        .orElseThrow(() -> new ResourceNotFoundException("EntityChange", id));
  }

  /** All non-deleted changes of one entity, oldest first. */
  @Transactional(readOnly = true)
  public List<EntityChangeRecord> history(String entityType, String entityId) {
    return entityChangeRepository
        .findByEntityTypeAndEntityIdAndDeletedAtIsNullOrderByChangedAtAsc(entityType, entityId);
  }

  @Transactional(readOnly = true)
  public Page<EntityChangeRecord> search(EntityChangeFilter filter, Pageable pageable) {
    return entityChangeRepository.findByFilter(
        filter.entityType(),
        filter.entityId(),
        filter.changedBy(),
        filter.changeKind(),
        filter.active(),
        filter.from(),
        filter.to(),
        pageable);
  }

  /** Changes from the last {@code days} days, newest first. */
  @Transactional(readOnly = true)
  public List<EntityChangeRecord> recent(int days) {
    if (days < 1) {
      throw InvalidRequestException.outOfRange("days", "days must be at least 1");
    }
    return entityChangeRepository
        .findByChangedAtGreaterThanEqualAndDeletedAtIsNullOrderByChangedAtDesc(
            clock.instant().minus(Duration.ofDays(days)));
  }

  @Transactional(readOnly = true)
  public List<FieldChangeRecord> fieldChanges(UUID entityChangeId) {
    return fieldChangeRepository.findByEntityChangeIdAndDeletedAtIsNullOrderByFieldNameAsc(
        entityChangeId);
  }

  /** Field changes of one parent whose old and new values actually differ. */
  @Transactional(readOnly = true)
  public List<FieldChangeRecord> changedFieldsOnly(UUID entityChangeId) {
    return fieldChanges(entityChangeId).stream().filter(FieldChangeRecord::hasChanged).toList();
  }

  /** Every recorded value transition of one field, oldest first. */
  @Transactional(readOnly = true)
  public List<FieldHistoryEntry> fieldHistory(
      String entityType, String entityId, String fieldName) {
    return fieldChangeRepository.findFieldHistory(entityType, entityId, fieldName);
  }

  /** Marks a change inactive. It stays visible to history and to searches on the active flag. */
  @Transactional
  public EntityChangeRecord deactivate(UUID id) {
    var record = findById(id);
    if (!record.isActive()) {
      return record;
    }
    record.deactivate();
    var saved = entityChangeRepository.save(record);
    log.info("Deactivated change {}", id);
    return saved;
  }

  @Transactional
  public EntityChangeRecord activate(UUID id) {
    var record = findById(id);
    if (record.isActive()) {
      return record;
    }
    record.activate();
    var saved = entityChangeRepository.save(record);
    log.info("Activated change {}", id);
    return saved;
  }

  @Transactional
  public EntityChangeRecord softDelete(UUID id) {
    var record = findById(id);
    Instant at = now();
    record.softDelete(at);
    entityChangeRepository.save(record);
    int children = fieldChangeRepository.softDeleteByEntityChangeId(id, at);
    log.info("Soft-deleted change {} with {} field changes", id, children);
    return record;
  }

  @Transactional
  public EntityChangeRecord restore(UUID id) {
    var record =
        entityChangeRepository
            .findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("EntityChange", id));
    if (!record.isDeleted()) {
      return record;
    }
    record.restore();
    entityChangeRepository.save(record);
    int children = fieldChangeRepository.restoreByEntityChangeId(id);
    log.info("Restored change {} with {} field changes", id, children);
    return record;
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MICROS);
  }
}
