package io.axis.backend.changes;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Read-only access to entity and field change history. */
@RestController
@RequestMapping("/api/audit")
@PreAuthorize("hasAnyRole('MANAGER', 'ADMIN', 'SUPERUSER')")
public class EntityChangeController {

  private final ChangeStore changeStore;

  public EntityChangeController(ChangeStore changeStore) {
    this.changeStore = changeStore;
  }

  @GetMapping("/entity-changes")
  public ResponseEntity<Page<EntityChangeResponse>> listEntityChanges(
      @RequestParam(required = false) String entityType,
      @RequestParam(required = false) String entityId,
      @RequestParam(required = false) String changedBy,
      @RequestParam(required = false) ChangeKind changeKind,
      @RequestParam(required = false) Boolean active,
      @RequestParam(required = false) Instant from,
      @RequestParam(required = false) Instant to,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "50") int size) {

    var filter =
        new EntityChangeFilter(entityType, entityId, changedBy, changeKind, active, from, to);
    var changes = changeStore.search(filter, PageRequest.of(page, Math.min(size, 200)));
    return ResponseEntity.ok(changes.map(EntityChangeResponse::from));
  }

  @GetMapping("/entity-changes/{id}")
  public ResponseEntity<EntityChangeResponse> getEntityChange(@PathVariable UUID id) {
    return ResponseEntity.ok(EntityChangeResponse.from(changeStore.findById(id)));
  }

  @GetMapping("/entity-changes/entity/{entityType}/{entityId}")
  public ResponseEntity<List<EntityChangeResponse>> entityHistory(
      @PathVariable String entityType, @PathVariable String entityId) {
    return ResponseEntity.ok(
        changeStore.history(entityType, entityId).stream()
            .map(EntityChangeResponse::from)
            .toList());
  }

  @GetMapping("/entity-changes/recent")
  public ResponseEntity<List<EntityChangeResponse>> recentEntityChanges(
      @RequestParam(defaultValue = "7") int days) {
    return ResponseEntity.ok(
        changeStore.recent(days).stream().map(EntityChangeResponse::from).toList());
  }

  @GetMapping("/entity-changes/{id}/field-changes")
  public ResponseEntity<List<FieldChangeResponse>> fieldChanges(
      @PathVariable UUID id, @RequestParam(defaultValue = "false") boolean changedOnly) {
    changeStore.findById(id);
    var fields = changedOnly ? changeStore.changedFieldsOnly(id) : changeStore.fieldChanges(id);
    return ResponseEntity.ok(fields.stream().map(FieldChangeResponse::from).toList());
  }

  @GetMapping("/field-history/{entityType}/{entityId}/{fieldName}")
  public ResponseEntity<List<FieldHistoryEntry>> fieldHistory(
      @PathVariable String entityType,
      @PathVariable String entityId,
      @PathVariable String fieldName) {
    return ResponseEntity.ok(changeStore.fieldHistory(entityType, entityId, fieldName));
  }

  // --- DTOs ---

  public record EntityChangeResponse(
      UUID id,
      String entityType,
      String entityId,
      ChangeKind changeKind,
      Instant changedAt,
      String changedBy,
      String reason,
      Map<String, Object> beforeData,
      Map<String, Object> afterData,
      Map<String, Object> metadata,
      boolean active) {

    public static EntityChangeResponse from(EntityChangeRecord record) {
      return new EntityChangeResponse(
          record.getId(),
          record.getEntityType(),
          record.getEntityId(),
          record.getChangeKind(),
          record.getChangedAt(),
          record.getChangedBy(),
          record.getReason(),
          record.getBeforeData(),
          record.getAfterData(),
          record.getMetadata(),
          record.isActive());
    }
  }

  public record FieldChangeResponse(
      UUID id,
      UUID entityChangeId,
      String fieldName,
      Object oldValue,
      Object newValue,
      ChangeKind changeKind,
      boolean changed) {

    public static FieldChangeResponse from(FieldChangeRecord record) {
      return new FieldChangeResponse(
          record.getId(),
          record.getEntityChangeId(),
          record.getFieldName(),
          record.getOldValue(),
          record.getNewValue(),
          record.getChangeKind(),
          record.hasChanged());
    }
  }
}
