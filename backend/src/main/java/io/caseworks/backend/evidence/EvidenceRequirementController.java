package io.caseworks.backend.evidence;

import io.caseworks.backend.rulepack.dto.EvidenceRequirementResponse;
import io.caseworks.backend.rulepack.dto.RuleResponse;
import io.caseworks.backend.security.ActorResolver;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/rule-packs/{packId}")
public class EvidenceRequirementController {

  private final EvidenceRequirementService evidenceRequirementService;
  private final ActorResolver actorResolver;

  public EvidenceRequirementController(
      EvidenceRequirementService evidenceRequirementService, ActorResolver actorResolver) {
    this.evidenceRequirementService = evidenceRequirementService;
    this.actorResolver = actorResolver;
  }

  @GetMapping("/evidence-requirements")
  @PreAuthorize("hasAnyRole('ADMIN', 'CASE_MANAGER')")
  public ResponseEntity<List<PackEvidenceRequirement>> listRequirements(
      @PathVariable UUID packId) {
    return ResponseEntity.ok(
        evidenceRequirementService.listRequirements(actorResolver.requireActor(), packId));
  }

  @PostMapping("/rules/{ruleId}/evidence")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<EvidenceRequirementResponse> attachEvidence(
      @PathVariable UUID packId,
      @PathVariable UUID ruleId,
      @Valid @RequestBody AttachEvidenceRequest request) {
    var response =
        evidenceRequirementService.attachEvidence(
            actorResolver.requireActor(), packId, ruleId, request);
    return ResponseEntity.created(
            URI.create(
                "/api/rule-packs/" + packId + "/rules/" + ruleId + "/evidence/" + response.id()))
        .body(response);
  }

  @PutMapping("/rules/{ruleId}/evidence")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<RuleResponse> replaceEvidence(
      @PathVariable UUID packId,
      @PathVariable UUID ruleId,
      @Valid @RequestBody ReplaceEvidenceRequest request) {
    return ResponseEntity.ok(
        evidenceRequirementService.replaceEvidence(
            actorResolver.requireActor(), packId, ruleId, request));
  }

  @DeleteMapping("/rules/{ruleId}/evidence/{evidenceId}")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<Void> detachEvidence(
      @PathVariable UUID packId, @PathVariable UUID ruleId, @PathVariable UUID evidenceId) {
    evidenceRequirementService.detachEvidence(
        actorResolver.requireActor(), packId, ruleId, evidenceId);
    return ResponseEntity.noContent().build();
  }
}
