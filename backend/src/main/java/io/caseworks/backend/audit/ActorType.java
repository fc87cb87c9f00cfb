package io.caseworks.backend.audit;

/** Who caused an audited change: a signed-in user, or the application itself. */
public enum ActorType {
  USER,
  SYSTEM
}
