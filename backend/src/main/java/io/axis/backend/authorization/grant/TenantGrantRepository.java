package io.axis.backend.authorization.grant;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TenantGrantRepository extends JpaRepository<TenantAuthorizationGrant, UUID> {

  @Query(
      """
      SELECT g FROM TenantAuthorizationGrant g
      WHERE g.actorId = :actorId
        AND g.tenantId = :tenantId
        AND g.deletedAt IS NULL
      """)
  Optional<TenantAuthorizationGrant> findActiveGrant(
      @Param("actorId") String actorId, @Param("tenantId") String tenantId);

  Optional<TenantAuthorizationGrant> findByIdAndDeletedAtIsNull(UUID id);

  List<TenantAuthorizationGrant> findByActorIdAndDeletedAtIsNullOrderByGrantedAtAsc(
      String actorId);

  List<TenantAuthorizationGrant> findByTenantIdAndDeletedAtIsNullOrderByGrantedAtAsc(
      String tenantId);
}
