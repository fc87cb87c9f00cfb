package io.caseworks.backend.ruleresolution;

import io.caseworks.backend.rulecatalog.PlanType;
import io.caseworks.backend.rulepack.ScopeType;
import io.caseworks.backend.security.ActorResolver;
import java.time.Instant;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RuleResolutionController {

  private final RuleResolutionService ruleResolutionService;
  private final ActorResolver actorResolver;

  public RuleResolutionController(
      RuleResolutionService ruleResolutionService, ActorResolver actorResolver) {
    this.ruleResolutionService = ruleResolutionService;
    this.actorResolver = actorResolver;
  }

  @GetMapping("/api/rule-packs/active")
  @PreAuthorize("hasAnyRole('ADMIN', 'CASE_MANAGER')")
  public ResponseEntity<ActiveRulePackResponse> resolveActivePack(
      @RequestParam ScopeType scopeType,
      @RequestParam String scopeId,
      @RequestParam PlanType planType,
      @RequestParam(required = false) String districtId,
      @RequestParam(required = false) String stateCode,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant asOf) {
    return ResponseEntity.ok(
        ruleResolutionService.resolveActive(
            actorResolver.requireActor(),
            scopeType,
            scopeId,
            planType,
            asOf,
            new ResolutionHints(districtId, stateCode)));
  }

  @GetMapping("/api/plans/{planId}/rule-pack")
  @PreAuthorize("hasAnyRole('ADMIN', 'CASE_MANAGER', 'TEACHER')")
  public ResponseEntity<ActiveRulePackResponse> resolveForPlan(
      @PathVariable UUID planId,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant asOf) {
    return ResponseEntity.ok(
        ruleResolutionService.resolveForPlan(actorResolver.requireActor(), planId, asOf));
  }
}
