package io.axis.backend.authorization;

/** Action requested on a domain object. Everything except {@link #READ} changes state. */
public enum ObjectAction {
  READ,
  CREATE,
  UPDATE,
  PARTIAL_UPDATE,
  DESTROY,
  PUBLISH,
  ARCHIVE,
  CREATE_VERSION,
  OTHER;

  public boolean isStateChanging() {
    return this != READ;
  }
}
