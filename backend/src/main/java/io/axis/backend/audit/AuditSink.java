package io.axis.backend.audit;

/** Destination for captured action records. */
public interface AuditSink {

  void write(ActionRecord record);
}
