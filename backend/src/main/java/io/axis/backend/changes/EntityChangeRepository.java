package io.axis.backend.changes;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface EntityChangeRepository extends JpaRepository<EntityChangeRecord, UUID> {

  Optional<EntityChangeRecord> findByIdAndDeletedAtIsNull(UUID id);

  List<EntityChangeRecord> findByEntityTypeAndEntityIdAndDeletedAtIsNullOrderByChangedAtAsc(
      String entityType, String entityId);

  List<EntityChangeRecord> findByChangedAtGreaterThanEqualAndDeletedAtIsNullOrderByChangedAtDesc(
      Instant since);

  /**
   * Nullable-filter search over non-deleted records, newest first. Each parameter follows the
   * {@code (:param IS NULL OR e.field = :param)} pattern.
   */
  @Query(
      """
      SELECT e FROM EntityChangeRecord e
      WHERE e.deletedAt IS NULL
        AND (:entityType IS NULL OR e.entityType = :entityType)
        AND (:entityId IS NULL OR e.entityId = :entityId)
        AND (:changedBy IS NULL OR e.changedBy = :changedBy)
        AND (:changeKind IS NULL OR e.changeKind = :changeKind)
        AND (:active IS NULL OR e.active = :active)
        AND (CAST(:from AS timestamp) IS NULL OR e.changedAt >= :from)
        AND (CAST(:to AS timestamp) IS NULL OR e.changedAt < :to)
      ORDER BY e.changedAt DESC
      """)
  Page<EntityChangeRecord> findByFilter(
      @Param("entityType") String entityType,
      @Param("entityId") String entityId,
      @Param("changedBy") String changedBy,
      @Param("changeKind") ChangeKind changeKind,
      @Param("active") Boolean active,
      @Param("from") Instant from,
      @Param("to") Instant to,
      Pageable pageable);
}
