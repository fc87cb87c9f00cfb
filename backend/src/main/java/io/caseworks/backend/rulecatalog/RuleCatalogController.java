package io.caseworks.backend.rulecatalog;

import io.caseworks.backend.security.ActorResolver;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/rule-packs")
public class RuleCatalogController {

  private final RuleCatalogService ruleCatalogService;
  private final ActorResolver actorResolver;

  public RuleCatalogController(
      RuleCatalogService ruleCatalogService, ActorResolver actorResolver) {
    this.ruleCatalogService = ruleCatalogService;
    this.actorResolver = actorResolver;
  }

  @GetMapping("/definitions")
  @PreAuthorize("hasAnyRole('ADMIN', 'CASE_MANAGER')")
  public ResponseEntity<List<RuleDefinitionResponse>> listRuleDefinitions() {
    var definitions = ruleCatalogService.listRuleDefinitions(actorResolver.requireActor());
    return ResponseEntity.ok(definitions.stream().map(RuleDefinitionResponse::from).toList());
  }

  @GetMapping("/evidence-types")
  @PreAuthorize("hasAnyRole('ADMIN', 'CASE_MANAGER')")
  public ResponseEntity<List<EvidenceTypeResponse>> listEvidenceTypes(
      @RequestParam(required = false) PlanType planType) {
    var types = ruleCatalogService.listEvidenceTypes(actorResolver.requireActor(), planType);
    return ResponseEntity.ok(types.stream().map(EvidenceTypeResponse::from).toList());
  }

  // --- DTOs ---

  public record RuleDefinitionResponse(
      UUID id, String key, String name, String description, Map<String, Object> defaultConfig) {

    public static RuleDefinitionResponse from(RuleDefinition definition) {
      return new RuleDefinitionResponse(
          definition.getId(),
          definition.getKey(),
          definition.getName(),
          definition.getDescription(),
          definition.getDefaultConfig());
    }
  }

  public record EvidenceTypeResponse(UUID id, String key, String name, PlanType planType) {

    public static EvidenceTypeResponse from(EvidenceType evidenceType) {
      return new EvidenceTypeResponse(
          evidenceType.getId(),
          evidenceType.getKey(),
          evidenceType.getName(),
          evidenceType.getPlanType());
    }
  }
}
