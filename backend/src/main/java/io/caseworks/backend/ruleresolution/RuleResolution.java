package io.caseworks.backend.ruleresolution;

import io.caseworks.backend.rulepack.RulePack;
import java.util.List;

/**
 * The pack that applies to a query, the scope it was found at, and every scope searched on the
 * way, most specific first.
 */
public record RuleResolution(
    RulePack pack, ScopeCandidate resolvedScope, List<ScopeCandidate> searchedScopes) {}
