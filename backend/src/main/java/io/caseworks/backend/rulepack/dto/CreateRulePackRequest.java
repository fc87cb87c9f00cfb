package io.caseworks.backend.rulepack.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.caseworks.backend.rulecatalog.PlanType;
import io.caseworks.backend.rulepack.ScopeType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;

public record CreateRulePackRequest(
    @NotNull ScopeType scopeType,
    @NotBlank @Size(max = 100) String scopeId,
    @NotNull PlanType planType,
    @NotBlank @Size(max = 200) String name,
    @NotNull Instant effectiveFrom,
    Instant effectiveTo,
    @JsonProperty("isActive") Boolean isActive) {}
