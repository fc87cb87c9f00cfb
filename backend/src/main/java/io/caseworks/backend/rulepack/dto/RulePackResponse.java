package io.caseworks.backend.rulepack.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.caseworks.backend.rulecatalog.PlanType;
import io.caseworks.backend.rulepack.RulePack;
import io.caseworks.backend.rulepack.ScopeType;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record RulePackResponse(
    UUID id,
    ScopeType scopeType,
    String scopeId,
    PlanType planType,
    int version,
    String name,
    @JsonProperty("isActive") boolean isActive,
    Instant effectiveFrom,
    Instant effectiveTo,
    Instant createdAt,
    Instant updatedAt,
    List<RuleResponse> rules) {

  public static RulePackResponse from(RulePack pack, List<RuleResponse> rules) {
    return new RulePackResponse(
        pack.getId(),
        pack.getScopeType(),
        pack.getScopeId(),
        pack.getPlanType(),
        pack.getVersion(),
        pack.getName(),
        pack.isActive(),
        pack.getEffectiveFrom(),
        pack.getEffectiveTo(),
        pack.getCreatedAt(),
        pack.getUpdatedAt(),
        rules);
  }
}
