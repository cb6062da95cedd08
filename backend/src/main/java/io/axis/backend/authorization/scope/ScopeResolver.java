package io.axis.backend.authorization.scope;

import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Resolves the tenant scope of an arbitrary domain object. Strategies, first hit wins:
 *
 * <ol>
 *   <li>{@link HasTenantScope}: the object's own tenant id
 *   <li>{@link TenantOwned}: the id of the related tenant
 *   <li>{@link ScopeDelegating}: strategies 1 and 2 applied to each delegate, one level deep
 * </ol>
 *
 * <p>Blank identifiers count as unresolved. Stateless.
 */
@Component
public class ScopeResolver {

  public Optional<String> resolve(Object object) {
    if (object == null) {
      return Optional.empty();
    }
    var direct = resolveDirect(object);
    if (direct.isPresent()) {
      return direct;
    }
    if (object instanceof ScopeDelegating delegating) {
      List<Object> delegates = delegating.scopeDelegates();
      if (delegates == null) {
        return Optional.empty();
      }
      for (Object delegate : delegates) {
        if (delegate == null) {
          continue;
        }
        var resolved = resolveDirect(delegate);
        if (resolved.isPresent()) {
          return resolved;
        }
      }
    }
    return Optional.empty();
  }

  private Optional<String> resolveDirect(Object object) {
    if (object instanceof HasTenantScope scoped) {
      Optional<String> tenantScope = scoped.tenantId();
      if (tenantScope != null) {
        var id = tenantScope.filter(ScopeResolver::isPresent);
        if (id.isPresent()) {
          return id;
        }
      }
    }
    if (object instanceof TenantOwned owned) {
      TenantIdentity tenant = owned.tenant();
      if (tenant != null && isPresent(tenant.getId())) {
        return Optional.of(tenant.getId());
      }
    }
    return Optional.empty();
  }

  private static boolean isPresent(String id) {
    return id != null && !id.isBlank();
  }
}
