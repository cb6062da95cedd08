package io.axis.backend.authorization;

import io.axis.backend.exception.ForbiddenException;
import io.axis.backend.security.ActorResolver;
import org.springframework.stereotype.Component;

/**
 * Controller-facing wrapper around {@link AuthorizationDecider} that evaluates against the current
 * request's actor and turns a denial into a 403.
 */
@Component
public class ObjectAccessGuard {

  private final AuthorizationDecider decider;
  private final ActorResolver actorResolver;

  public ObjectAccessGuard(AuthorizationDecider decider, ActorResolver actorResolver) {
    this.decider = decider;
    this.actorResolver = actorResolver;
  }

  public <T> T requireRead(T object) {
    var actor = actorResolver.currentActor();
    if (!decider.canRead(actor, object)) {
      throw ForbiddenException.forObject("view", describe(object));
    }
    return object;
  }

  public <T> T requireWrite(ObjectAction action, T object) {
    var actor = actorResolver.currentActor();
    if (!decider.canWrite(actor, action, object)) {
      throw ForbiddenException.forObject(action.name(), describe(object));
    }
    return object;
  }

  private static String describe(Object object) {
    return object != null ? object.getClass().getSimpleName() : "resource";
  }
}
