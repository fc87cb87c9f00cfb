package io.caseworks.backend.ruleresolution;

import io.caseworks.backend.rulepack.ScopeType;

/** One (scope type, scope id) the resolver searches for an active pack. */
public record ScopeCandidate(ScopeType scopeType, String scopeId) {

  @Override
  public String toString() {
    return scopeType + "/" + scopeId;
  }
}
