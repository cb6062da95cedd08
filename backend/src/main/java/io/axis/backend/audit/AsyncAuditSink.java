package io.axis.backend.audit;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands records to a bounded executor so persistence happens off the request thread. When the
 * executor is saturated the record is dropped and logged; the request is never blocked.
 */
public class AsyncAuditSink implements AuditSink {

  private static final Logger log = LoggerFactory.getLogger(AsyncAuditSink.class);

  private final AuditSink delegate;
  private final Executor executor;

  public AsyncAuditSink(AuditSink delegate, Executor executor) {
    this.delegate = delegate;
    this.executor = executor;
  }

  @Override
  public void write(ActionRecord record) {
    try {
      executor.execute(() -> writeQuietly(record));
    } catch (RejectedExecutionException e) {
      log.error(
          "audit.dropped: action={}, path={}, actor={}, reason=executor_saturated",
          record.getAction(),
          record.getContext() != null ? record.getContext().path() : null,
          record.getActorId());
    }
  }

  private void writeQuietly(ActionRecord record) {
    try {
      delegate.write(record);
    } catch (RuntimeException e) {
      log.error(
          "audit.persist_failed: action={}, path={}, actor={}",
          record.getAction(),
          record.getContext() != null ? record.getContext().path() : null,
          record.getActorId(),
          e);
    }
  }
}
