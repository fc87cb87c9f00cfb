package io.caseworks.backend.ruleresolution;

import io.caseworks.backend.exception.InvalidStateException;
import io.caseworks.backend.plan.PlanDirectory;
import io.caseworks.backend.plan.PlanInstance;
import io.caseworks.backend.rulecatalog.PlanType;
import io.caseworks.backend.rulepack.RulePackResponseAssembler;
import io.caseworks.backend.rulepack.ScopeType;
import io.caseworks.backend.security.Actor;
import io.caseworks.backend.security.ComplianceAction;
import io.caseworks.backend.security.CompliancePermissions;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class RuleResolutionService {

  private final ScopeResolver scopeResolver;
  private final RulePackResponseAssembler responseAssembler;
  private final PlanDirectory planDirectory;
  private final Clock clock;

  public RuleResolutionService(
      ScopeResolver scopeResolver,
      RulePackResponseAssembler responseAssembler,
      PlanDirectory planDirectory,
      Clock clock) {
    this.scopeResolver = scopeResolver;
    this.responseAssembler = responseAssembler;
    this.planDirectory = planDirectory;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public ActiveRulePackResponse resolveActive(
      Actor actor,
      ScopeType scopeType,
      String scopeId,
      PlanType planType,
      Instant asOf,
      ResolutionHints hints) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.VIEW_RULE_PACKS);
    if (scopeId == null || scopeId.isBlank()) {
      throw new InvalidStateException("Invalid scope", "scopeId must not be blank");
    }
    return resolve(scopeType, scopeId.trim(), planType, asOf, hints);
  }

  /**
   * Resolves the pack governing a plan: the query starts at the plan's school (or its district, or
   * its state when nothing more specific is recorded) and the plan's district and state are passed
   * as hints.
   */
  @Transactional(readOnly = true)
  public ActiveRulePackResponse resolveForPlan(Actor actor, UUID planId, Instant asOf) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.RESOLVE_PLAN_RULE_PACK);
    PlanInstance plan = planDirectory.requirePlan(planId);

    PlanType planType = plan.rulePlanType();
    if (planType == null) {
      throw new InvalidStateException(
          "Unsupported plan type",
          "Plan " + planId + " has type " + plan.getPlanTypeCode() + " which has no rule packs");
    }

    var hints = new ResolutionHints(plan.getDistrictId(), plan.getStateCode());
    if (isPresent(plan.getSchoolId())) {
      return resolve(ScopeType.SCHOOL, plan.getSchoolId(), planType, asOf, hints);
    }
    if (isPresent(plan.getDistrictId())) {
      return resolve(ScopeType.DISTRICT, plan.getDistrictId(), planType, asOf, hints);
    }
    return resolve(ScopeType.STATE, plan.getStateCode(), planType, asOf, hints);
  }

  private ActiveRulePackResponse resolve(
      ScopeType scopeType, String scopeId, PlanType planType, Instant asOf, ResolutionHints hints) {
    Instant at = asOf != null ? asOf : clock.instant();
    return scopeResolver
        .resolveActivePack(scopeType, scopeId, planType, at, hints)
        .map(
            resolution ->
                new ActiveRulePackResponse(
                    responseAssembler.toResponse(resolution.pack(), true),
                    resolution.resolvedScope(),
                    resolution.searchedScopes()))
        .orElseGet(
            () ->
                ActiveRulePackResponse.none(
                    scopeResolver.candidateChain(scopeType, scopeId, hintsOrNone(hints))));
  }

  private static ResolutionHints hintsOrNone(ResolutionHints hints) {
    return hints != null ? hints : ResolutionHints.none();
  }

  private static boolean isPresent(String value) {
    return value != null && !value.isBlank();
  }
}
