package io.axis.backend.authorization.grant;

import io.axis.backend.authorization.ActorRole;
import io.axis.backend.exception.ResourceConflictException;
import io.axis.backend.exception.ResourceNotFoundException;
import io.axis.backend.security.ActorResolver;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TenantGrantService {

  private static final Logger log = LoggerFactory.getLogger(TenantGrantService.class);

  private final TenantGrantRepository grantRepository;
  private final ActorResolver actorResolver;
  private final Clock clock;

  public TenantGrantService(
      TenantGrantRepository grantRepository, ActorResolver actorResolver, Clock clock) {
    this.grantRepository = grantRepository;
    this.actorResolver = actorResolver;
    this.clock = clock;
  }

  /**
   * Grants an actor access to a tenant. The current actor is recorded as the grantor. Fails with
   * 409 if the actor already holds an active grant for that tenant.
   */
  @Transactional
  public TenantAuthorizationGrant grant(
      String actorId, String tenantId, ActorRole grantRole, String notes) {
    if (grantRepository.findActiveGrant(actorId, tenantId).isPresent()) {
      throw duplicate(actorId, tenantId, null);
    }
    var grantedBy = actorResolver.currentActor().id();
    var grant =
        new TenantAuthorizationGrant(
            actorId, tenantId, grantRole, grantedBy, notes, clock.instant());
    try {
      grant = grantRepository.saveAndFlush(grant);
    } catch (DataIntegrityViolationException e) {
      throw duplicate(actorId, tenantId, e);
    }
    log.info(
        "Granted tenant access: actor={}, tenant={}, role={}, grantedBy={}",
        actorId,
        tenantId,
        grantRole,
        grantedBy);
    return grant;
  }

  @Transactional
  public TenantAuthorizationGrant revoke(UUID grantId) {
    var grant =
        grantRepository
            .findByIdAndDeletedAtIsNull(grantId)
            .orElseThrow(() -> new ResourceNotFoundException("Grant", grantId));
    grant.revoke(clock.instant());
    grantRepository.save(grant);
    log.info(
        "Revoked tenant access: actor={}, tenant={}, revokedBy={}",
        grant.getActorId(),
        grant.getTenantId(),
        actorResolver.currentActor().id());
    return grant;
  }

  @Transactional(readOnly = true)
  public TenantAuthorizationGrant findById(UUID grantId) {
    return grantRepository
        .findById(grantId)
        .orElseThrow(() -> new ResourceNotFoundException("Grant", grantId));
  }

  @Transactional(readOnly = true)
  public Optional<TenantAuthorizationGrant> findActiveGrant(String actorId, String tenantId) {
    return grantRepository.findActiveGrant(actorId, tenantId);
  }

  @Transactional(readOnly = true)
  public List<TenantAuthorizationGrant> activeGrantsForActor(String actorId) {
    return grantRepository.findByActorIdAndDeletedAtIsNullOrderByGrantedAtAsc(actorId);
  }

  @Transactional(readOnly = true)
  public List<TenantAuthorizationGrant> activeGrantsForTenant(String tenantId) {
    return grantRepository.findByTenantIdAndDeletedAtIsNullOrderByGrantedAtAsc(tenantId);
  }

  private static ResourceConflictException duplicate(
      String actorId, String tenantId, Throwable cause) {
    return new ResourceConflictException(
        "Grant already exists",
        "Actor " + actorId + " already has active access to client " + tenantId,
        cause);
  }
}
