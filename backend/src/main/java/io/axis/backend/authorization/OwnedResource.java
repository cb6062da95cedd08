package io.axis.backend.authorization;

import java.util.Collection;

/**
 * Domain objects that record who owns them. Implementations return every actor reference held in
 * their owner-like fields (user, owner, created-by, uploaded-by); nulls are ignored.
 */
public interface OwnedResource {

  Collection<String> ownerReferences();
}
