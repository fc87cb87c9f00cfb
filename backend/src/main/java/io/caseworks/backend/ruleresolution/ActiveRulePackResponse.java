package io.caseworks.backend.ruleresolution;

import io.caseworks.backend.rulepack.dto.RulePackResponse;
import java.util.List;

/**
 * Result of a resolution query. Both {@code rulePack} and {@code resolvedScope} are null when no
 * scope in the chain has an applicable pack.
 */
public record ActiveRulePackResponse(
    RulePackResponse rulePack, ScopeCandidate resolvedScope, List<ScopeCandidate> searchedScopes) {

  public static ActiveRulePackResponse none(List<ScopeCandidate> searchedScopes) {
    return new ActiveRulePackResponse(null, null, searchedScopes);
  }
}
