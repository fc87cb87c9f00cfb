package io.caseworks.backend.rulepack;

import io.caseworks.backend.rulecatalog.PlanType;
import io.caseworks.backend.rulepack.dto.AttachRuleRequest;
import io.caseworks.backend.rulepack.dto.CreateRulePackRequest;
import io.caseworks.backend.rulepack.dto.ReplaceRulesRequest;
import io.caseworks.backend.rulepack.dto.RulePackResponse;
import io.caseworks.backend.rulepack.dto.RuleResponse;
import io.caseworks.backend.rulepack.dto.UpdateRulePackRequest;
import io.caseworks.backend.rulepack.dto.UpdateRuleRequest;
import io.caseworks.backend.security.ActorResolver;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/rule-packs")
public class RulePackController {

  private final RulePackService rulePackService;
  private final ActorResolver actorResolver;

  public RulePackController(RulePackService rulePackService, ActorResolver actorResolver) {
    this.rulePackService = rulePackService;
    this.actorResolver = actorResolver;
  }

  @GetMapping
  @PreAuthorize("hasAnyRole('ADMIN', 'CASE_MANAGER')")
  public ResponseEntity<List<RulePackResponse>> listPacks(
      @RequestParam(required = false) ScopeType scopeType,
      @RequestParam(required = false) String scopeId,
      @RequestParam(required = false) PlanType planType,
      @RequestParam(required = false) Boolean isActive) {
    return ResponseEntity.ok(
        rulePackService.listPacks(
            actorResolver.requireActor(), scopeType, scopeId, planType, isActive));
  }

  @GetMapping("/{id}")
  @PreAuthorize("hasAnyRole('ADMIN', 'CASE_MANAGER')")
  public ResponseEntity<RulePackResponse> getPack(@PathVariable UUID id) {
    return ResponseEntity.ok(rulePackService.getPack(actorResolver.requireActor(), id));
  }

  @PostMapping
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<RulePackResponse> createPack(
      @Valid @RequestBody CreateRulePackRequest request) {
    var response = rulePackService.createPack(actorResolver.requireActor(), request);
    return ResponseEntity.created(URI.create("/api/rule-packs/" + response.id())).body(response);
  }

  @PatchMapping("/{id}")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<RulePackResponse> updatePack(
      @PathVariable UUID id, @Valid @RequestBody UpdateRulePackRequest request) {
    return ResponseEntity.ok(rulePackService.updatePack(actorResolver.requireActor(), id, request));
  }

  @DeleteMapping("/{id}")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<Void> deletePack(@PathVariable UUID id) {
    rulePackService.deletePack(actorResolver.requireActor(), id);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{id}/rules")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<RuleResponse> attachRule(
      @PathVariable UUID id, @Valid @RequestBody AttachRuleRequest request) {
    var response = rulePackService.attachRule(actorResolver.requireActor(), id, request);
    return ResponseEntity.created(URI.create("/api/rule-packs/" + id + "/rules/" + response.id()))
        .body(response);
  }

  @PutMapping("/{id}/rules")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<RulePackResponse> replaceRules(
      @PathVariable UUID id, @Valid @RequestBody ReplaceRulesRequest request) {
    return ResponseEntity.ok(
        rulePackService.replaceRules(actorResolver.requireActor(), id, request));
  }

  @PatchMapping("/{id}/rules/{ruleId}")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<RuleResponse> updateRule(
      @PathVariable UUID id,
      @PathVariable UUID ruleId,
      @Valid @RequestBody UpdateRuleRequest request) {
    return ResponseEntity.ok(
        rulePackService.updateRule(actorResolver.requireActor(), id, ruleId, request));
  }

  @DeleteMapping("/{id}/rules/{ruleId}")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<Void> detachRule(@PathVariable UUID id, @PathVariable UUID ruleId) {
    rulePackService.detachRule(actorResolver.requireActor(), id, ruleId);
    return ResponseEntity.noContent().build();
  }
}
