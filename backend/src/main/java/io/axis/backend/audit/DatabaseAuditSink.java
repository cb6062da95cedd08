package io.axis.backend.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes action records on the calling thread. */
public class DatabaseAuditSink implements AuditSink {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditSink.class);

  private final ActionRecordRepository repository;

  public DatabaseAuditSink(ActionRecordRepository repository) {
    this.repository = repository;
  }

  @Override
  public void write(ActionRecord record) {
    var saved = repository.save(record);
    log.debug(
        "Recorded action: action={}, entity={}/{}, actor={}",
        saved.getAction(),
        saved.getEntityType(),
        saved.getEntityId(),
        saved.getActorId());
  }
}
