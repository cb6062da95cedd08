package io.axis.backend.changes;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface FieldChangeRepository extends JpaRepository<FieldChangeRecord, UUID> {

  List<FieldChangeRecord> findByEntityChangeIdAndDeletedAtIsNullOrderByFieldNameAsc(
      UUID entityChangeId);

  @Query(
      """
      SELECT new io.axis.backend.changes.FieldHistoryEntry(
          f.id, e.id, f.fieldName, f.oldValue, f.newValue, f.changeKind, e.changedAt, e.changedBy)
      FROM FieldChangeRecord f, EntityChangeRecord e
      WHERE f.entityChangeId = e.id
        AND e.entityType = :entityType
        AND e.entityId = :entityId
        AND f.fieldName = :fieldName
        AND f.deletedAt IS NULL
        AND e.deletedAt IS NULL
      ORDER BY e.changedAt ASC
      """)
  List<FieldHistoryEntry> findFieldHistory(
      @Param("entityType") String entityType,
      @Param("entityId") String entityId,
      @Param("fieldName") String fieldName);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE FieldChangeRecord f SET f.deletedAt = :deletedAt
      WHERE f.entityChangeId = :entityChangeId AND f.deletedAt IS NULL
      """)
  int softDeleteByEntityChangeId(
      @Param("entityChangeId") UUID entityChangeId, @Param("deletedAt") Instant deletedAt);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE FieldChangeRecord f SET f.deletedAt = NULL
      WHERE f.entityChangeId = :entityChangeId
      """)
  int restoreByEntityChangeId(@Param("entityChangeId") UUID entityChangeId);
}
