package io.axis.backend.audit;

import java.time.Instant;
import java.util.List;
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

@RestController
@RequestMapping("/api/audit/action-records")
@PreAuthorize("hasAnyRole('MANAGER', 'ADMIN', 'SUPERUSER')")
public class ActionRecordController {

  private final ActionLogService actionLogService;

  public ActionRecordController(ActionLogService actionLogService) {
    this.actionLogService = actionLogService;
  }

  @GetMapping
  public ResponseEntity<Page<ActionRecordResponse>> listActionRecords(
      @RequestParam(required = false) String actorId,
      @RequestParam(required = false) ActionKind action,
      @RequestParam(required = false) String entityType,
      @RequestParam(required = false) String entityId,
      @RequestParam(required = false) String ipAddress,
      @RequestParam(required = false) Instant from,
      @RequestParam(required = false) Instant to,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "50") int size) {

    var filter = new ActionRecordFilter(actorId, action, entityType, entityId, ipAddress, from, to);
    var records = actionLogService.search(filter, PageRequest.of(page, Math.min(size, 200)));
    return ResponseEntity.ok(records.map(ActionRecordResponse::from));
  }

  @GetMapping("/{id}")
  public ResponseEntity<ActionRecordResponse> getActionRecord(@PathVariable UUID id) {
    return ResponseEntity.ok(ActionRecordResponse.from(actionLogService.findById(id)));
  }

  @GetMapping("/recent")
  public ResponseEntity<List<ActionRecordResponse>> recentActionRecords(
      @RequestParam(defaultValue = "7") int days) {
    return ResponseEntity.ok(
        actionLogService.recent(days).stream().map(ActionRecordResponse::from).toList());
  }

  @GetMapping("/actor/{actorId}")
  public ResponseEntity<Page<ActionRecordResponse>> actorActivity(
      @PathVariable String actorId,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "50") int size) {
    var records = actionLogService.activityFor(actorId, PageRequest.of(page, Math.min(size, 200)));
    return ResponseEntity.ok(records.map(ActionRecordResponse::from));
  }

  // --- DTO ---

  public record ActionRecordResponse(
      UUID id,
      String actorId,
      ActionKind action,
      String entityType,
      String entityId,
      AuditEnvelope context,
      String ipAddress,
      String userAgent,
      Instant createdAt) {

    public static ActionRecordResponse from(ActionRecord record) {
      return new ActionRecordResponse(
          record.getId(),
          record.getActorId(),
          record.getAction(),
          record.getEntityType(),
          record.getEntityId(),
          record.getContext(),
          record.getIpAddress(),
          record.getUserAgent(),
          record.getCreatedAt());
    }
  }
}
