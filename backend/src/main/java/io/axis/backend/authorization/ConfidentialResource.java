package io.axis.backend.authorization;

/** Domain objects that can be flagged confidential. Only owners and elevated actors read them. */
public interface ConfidentialResource {

  boolean isConfidential();
}
