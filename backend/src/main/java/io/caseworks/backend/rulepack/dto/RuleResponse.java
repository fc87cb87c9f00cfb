package io.caseworks.backend.rulepack.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A rule in a pack. {@code config} is the stored override (null when none); {@code
 * effectiveConfig} is the override or, without one, the definition default.
 */
public record RuleResponse(
    UUID id,
    UUID ruleDefinitionId,
    String ruleKey,
    String ruleName,
    @JsonProperty("isEnabled") boolean isEnabled,
    Map<String, Object> config,
    Map<String, Object> effectiveConfig,
    int sortOrder,
    List<EvidenceRequirementResponse> evidenceRequirements) {}
