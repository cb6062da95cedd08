package io.axis.backend.audit;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AsyncAuditSinkTest {

  @Mock private AuditSink delegate;

  private static ActionRecord record() {
    var envelope =
        new AuditEnvelope(
            "POST",
            "/api/documents",
            Map.of(),
            null,
            "10.0.0.1",
            null,
            201,
            5,
            Map.of(),
            AuditExtensions.NONE);
    return new ActionRecord(
        "user_1", ActionKind.CREATE, null, null, envelope, "10.0.0.1", null, Instant.now());
  }

  @Test
  void write_handsRecordToExecutor() {
    var sink = new AsyncAuditSink(delegate, Runnable::run);
    var record = record();

    sink.write(record);

    verify(delegate).write(record);
  }

  @Test
  void write_saturatedExecutor_dropsRecordWithoutThrowing() {
    Executor saturated =
        task -> {
          throw new RejectedExecutionException("queue full");
        };
    var sink = new AsyncAuditSink(delegate, saturated);

    assertThatCode(() -> sink.write(record())).doesNotThrowAnyException();
    verifyNoInteractions(delegate);
  }

  @Test
  void write_delegateFailure_isContainedInWorker() {
    doThrow(new IllegalStateException("database down")).when(delegate).write(any());
    var sink = new AsyncAuditSink(delegate, Runnable::run);

    assertThatCode(() -> sink.write(record())).doesNotThrowAnyException();
  }
}
