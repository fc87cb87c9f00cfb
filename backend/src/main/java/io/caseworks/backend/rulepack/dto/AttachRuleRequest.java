package io.caseworks.backend.rulepack.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import java.util.Map;
import java.util.UUID;

public record AttachRuleRequest(
    @NotNull UUID ruleDefinitionId,
    @JsonProperty("isEnabled") Boolean isEnabled,
    Map<String, Object> config,
    Integer sortOrder) {}
