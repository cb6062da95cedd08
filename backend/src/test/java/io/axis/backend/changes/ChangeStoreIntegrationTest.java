package io.axis.backend.changes;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.axis.backend.TestcontainersConfiguration;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class ChangeStoreIntegrationTest {

  private static final String CASE = "Case";

  @Autowired private ChangeStore changeStore;
  @Autowired private EntityChangeRepository entityChangeRepository;
  @Autowired private FieldChangeRepository fieldChangeRepository;

  private EntityChangeRecord diff(
      String caseId,
      ChangeKind kind,
      String actorId,
      Map<String, Object> before,
      Map<String, Object> after) {
    return changeStore.recordChangeWithFieldDiff(
        CASE, caseId, kind, actorId, null, before, after, null);
  }

  @Test
  void historyIsReturnedOldestFirst() {
    String caseId = UUID.randomUUID().toString();
    var created =
        changeStore.recordChange(
            CASE, caseId, ChangeKind.CREATE, "user_1", null, null, Map.of("status", "open"), null);
    var updated =
        changeStore.recordChange(
            CASE,
            caseId,
            ChangeKind.UPDATE,
            "user_2",
            "triage",
            Map.of("status", "open"),
            Map.of("status", "review"),
            Map.of("source", "api"));

    var history = changeStore.history(CASE, caseId);

    assertThat(history)
        .extracting(EntityChangeRecord::getId)
        .containsExactly(created.getId(), updated.getId());
    assertThat(history.get(1).getMetadata()).containsEntry("source", "api");
    assertThat(history.get(1).getReason()).isEqualTo("triage");
  }

  @Test
  void sameEntityAtSameInstant_isRejectedAsConflict() {
    var fixed = Clock.fixed(Instant.parse("2026-03-01T10:15:30.123456Z"), ZoneOffset.UTC);
    var store = new ChangeStore(entityChangeRepository, fieldChangeRepository, fixed);
    String caseId = UUID.randomUUID().toString();

    store.recordChange(CASE, caseId, ChangeKind.UPDATE, "user_1", null, null, null, null);

    assertThatThrownBy(
            () ->
                store.recordChange(
                    CASE, caseId, ChangeKind.UPDATE, "user_2", null, null, null, null))
        .isInstanceOf(ChangeConflictException.class);
    assertThat(changeStore.history(CASE, caseId)).hasSize(1);
  }

  @Test
  void fieldDiffIsRecorded_andFieldHistorySpansChanges() {
    String caseId = UUID.randomUUID().toString();
    diff(caseId, ChangeKind.CREATE, "user_1", null, Map.of("status", "open", "title", "Lease"));
    var second =
        diff(
            caseId,
            ChangeKind.UPDATE,
            "user_2",
            Map.of("status", "open", "title", "Lease"),
            Map.of("status", "closed", "title", "Lease"));

    assertThat(changeStore.fieldChanges(second.getId()))
        .extracting(FieldChangeRecord::getFieldName)
        .containsExactly("status");

    var statusHistory = changeStore.fieldHistory(CASE, caseId, "status");
    assertThat(statusHistory).hasSize(2);
    assertThat(statusHistory.get(0).newValue()).isEqualTo("open");
    assertThat(statusHistory.get(1).oldValue()).isEqualTo("open");
    assertThat(statusHistory.get(1).newValue()).isEqualTo("closed");
    assertThat(statusHistory.get(1).changedBy()).isEqualTo("user_2");
  }

  @Test
  void softDeleteHidesChangeAndFields_restoreBringsThemBack() {
    String caseId = UUID.randomUUID().toString();
    var change =
        diff(caseId, ChangeKind.UPDATE, "user_1", Map.of("status", "open"), Map.of("status", "x"));

    changeStore.softDelete(change.getId());

    assertThat(changeStore.history(CASE, caseId)).isEmpty();
    assertThat(changeStore.fieldChanges(change.getId())).isEmpty();
    var deleted = entityChangeRepository.findById(change.getId()).orElseThrow();
    assertThat(deleted.isDeleted()).isTrue();
    assertThat(deleted.isActive()).isTrue();

    changeStore.restore(change.getId());

    assertThat(changeStore.history(CASE, caseId)).hasSize(1);
    assertThat(changeStore.fieldChanges(change.getId())).hasSize(1);
  }

  @Test
  void inactiveChangeIsFoundByActiveFilter_andStaysInHistory() {
    String caseId = UUID.randomUUID().toString();
    var first =
        diff(caseId, ChangeKind.UPDATE, "user_1", Map.of("status", "open"), Map.of("status", "x"));
    diff(caseId, ChangeKind.UPDATE, "user_1", Map.of("status", "x"), Map.of("status", "y"));

    changeStore.deactivate(first.getId());

    var inactive =
        changeStore.search(
            new EntityChangeFilter(CASE, caseId, null, null, false, null, null),
            PageRequest.of(0, 10));
    assertThat(inactive.getContent())
        .extracting(EntityChangeRecord::getId)
        .containsExactly(first.getId());
    var active =
        changeStore.search(
            new EntityChangeFilter(CASE, caseId, null, null, true, null, null),
            PageRequest.of(0, 10));
    assertThat(active.getContent()).hasSize(1).noneMatch(c -> c.getId().equals(first.getId()));
    assertThat(changeStore.history(CASE, caseId)).hasSize(2);
  }
}
