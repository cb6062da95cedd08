package io.axis.backend.authorization.scope;

import java.util.List;

/**
 * Domain objects whose tenant is reached through one of their relations, e.g. a service session
 * that references a person or a contract, which in turn belongs to a client.
 */
public interface ScopeDelegating {

  /** Related objects to inspect, in priority order. Null entries are skipped. */
  List<Object> scopeDelegates();
}
