package io.axis.backend.authorization.scope;

import java.util.Optional;

/** Domain objects that carry their tenant (client) identifier directly. */
public interface HasTenantScope {

  Optional<String> tenantId();
}
