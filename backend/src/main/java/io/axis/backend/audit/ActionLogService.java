package io.axis.backend.audit;

import io.axis.backend.exception.InvalidRequestException;
import io.axis.backend.exception.ResourceNotFoundException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Read side of the action log. Records are written only through {@link AuditSink}. */
@Service
public class ActionLogService {

  private final ActionRecordRepository repository;
  private final Clock clock;

  public ActionLogService(ActionRecordRepository repository, Clock clock) {
    this.repository = repository;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public ActionRecord findById(UUID id) {
    return repository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("ActionRecord", id));
  }

  @Transactional(readOnly = true)
  public Page<ActionRecord> search(ActionRecordFilter filter, Pageable pageable) {
    return repository.findByFilter(
        filter.actorId(),
        filter.action(),
        filter.entityType(),
        filter.entityId(),
        filter.ipAddress(),
        filter.from(),
        filter.to(),
        pageable);
  }

  /** Records created in the last {@code days} days, newest first. */
  @Transactional(readOnly = true)
  public List<ActionRecord> recent(int days) {
    if (days < 1) {
      throw InvalidRequestException.outOfRange("days", "days must be at least 1");
    }
    var since = clock.instant().minus(Duration.ofDays(days));
    return repository.findByCreatedAtGreaterThanEqualOrderByCreatedAtDesc(since);
  }

  @Transactional(readOnly = true)
  public Page<ActionRecord> activityFor(String actorId, Pageable pageable) {
    return repository.findByActorIdOrderByCreatedAtDesc(actorId, pageable);
  }
}
