package io.axis.backend.authorization;

import io.axis.backend.authorization.grant.TenantAuthorizationGrant;
import io.axis.backend.authorization.grant.TenantGrantRepository;
import io.axis.backend.authorization.scope.ScopeResolver;
import java.util.Collection;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Object-level read/write decisions for a single actor and domain object.
 *
 * <p>Elevated actors (manager and above) are allowed everything. Everyone else needs an active
 * {@link TenantAuthorizationGrant} for the object's tenant; objects with no discoverable tenant
 * follow {@link AuthorizationProperties#scopelessPolicy()}. Writes additionally require ownership
 * of the object or a manager-level grant. Confidential objects are readable only by their owners.
 */
@Service
@EnableConfigurationProperties(AuthorizationProperties.class)
public class AuthorizationDecider implements TenantScopeChecker {

  private static final Logger log = LoggerFactory.getLogger(AuthorizationDecider.class);

  private final ScopeResolver scopeResolver;
  private final TenantGrantRepository grantRepository;
  private final AuthorizationProperties properties;

  public AuthorizationDecider(
      ScopeResolver scopeResolver,
      TenantGrantRepository grantRepository,
      AuthorizationProperties properties) {
    this.scopeResolver = scopeResolver;
    this.grantRepository = grantRepository;
    this.properties = properties;
  }

  @Transactional(readOnly = true)
  public boolean canRead(Actor actor, Object object) {
    if (actor == null || !actor.authenticated()) {
      return false;
    }
    if (actor.isElevated()) {
      return true;
    }
    if (!passesTenantScope(actor, object)) {
      return false;
    }
    if (object instanceof ConfidentialResource confidential && confidential.isConfidential()) {
      return owns(actor, object);
    }
    return true;
  }

  @Transactional(readOnly = true)
  public boolean canWrite(Actor actor, ObjectAction action, Object object) {
    if (actor == null || !actor.authenticated()) {
      return false;
    }
    if (actor.isElevated()) {
      return true;
    }
    if (action == null || !action.isStateChanging()) {
      return canRead(actor, object);
    }
    if (!canRead(actor, object)) {
      return false;
    }
    if (owns(actor, object)) {
      return true;
    }
    return scopeResolver
        .resolve(object)
        .flatMap(tenantId -> grantRepository.findActiveGrant(actor.id(), tenantId))
        .map(TenantAuthorizationGrant::isManagerLevel)
        .orElse(false);
  }

  @Override
  @Transactional(readOnly = true)
  public boolean canAccessTenant(Actor actor, String tenantId) {
    if (actor == null || !actor.authenticated()) {
      return false;
    }
    if (actor.isElevated()) {
      return true;
    }
    if (tenantId == null || tenantId.isBlank()) {
      return false;
    }
    return grantRepository.findActiveGrant(actor.id(), tenantId).isPresent();
  }

  private boolean passesTenantScope(Actor actor, Object object) {
    Optional<String> scope = scopeResolver.resolve(object);
    if (scope.isEmpty()) {
      boolean allowed = properties.scopelessPolicy() != ScopelessPolicy.DENY;
      log.debug(
          "authz.scopeless_object: actor={}, type={}, allowed={}",
          actor.id(),
          object != null ? object.getClass().getSimpleName() : null,
          allowed);
      return allowed;
    }
    return grantRepository.findActiveGrant(actor.id(), scope.get()).isPresent();
  }

  private static boolean owns(Actor actor, Object object) {
    if (!(object instanceof OwnedResource owned) || actor.id() == null) {
      return false;
    }
    Collection<String> owners = owned.ownerReferences();
    return owners != null && owners.contains(actor.id());
  }
}
