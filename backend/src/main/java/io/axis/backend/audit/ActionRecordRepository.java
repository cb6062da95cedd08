package io.axis.backend.audit;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

/** Append-only access to action records: no update or delete methods are exposed. */
public interface ActionRecordRepository extends Repository<ActionRecord, UUID> {

  ActionRecord save(ActionRecord record);

  Optional<ActionRecord> findById(UUID id);

  long count();

  @Query(
      """
      SELECT r FROM ActionRecord r
      WHERE (:actorId IS NULL OR r.actorId = :actorId)
        AND (:action IS NULL OR r.action = :action)
        AND (:entityType IS NULL OR r.entityType = :entityType)
        AND (:entityId IS NULL OR r.entityId = :entityId)
        AND (:ipAddress IS NULL OR r.ipAddress = :ipAddress)
        AND (CAST(:from AS timestamp) IS NULL OR r.createdAt >= :from)
        AND (CAST(:to AS timestamp) IS NULL OR r.createdAt < :to)
      ORDER BY r.createdAt DESC
      """)
  Page<ActionRecord> findByFilter(
      @Param("actorId") String actorId,
      @Param("action") ActionKind action,
      @Param("entityType") String entityType,
      @Param("entityId") String entityId,
      @Param("ipAddress") String ipAddress,
      @Param("from") Instant from,
      @Param("to") Instant to,
      Pageable pageable);

  List<ActionRecord> findByCreatedAtGreaterThanEqualOrderByCreatedAtDesc(Instant since);

  Page<ActionRecord> findByActorIdOrderByCreatedAtDesc(String actorId, Pageable pageable);
}
