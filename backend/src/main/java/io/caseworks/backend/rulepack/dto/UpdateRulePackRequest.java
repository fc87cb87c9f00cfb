package io.caseworks.backend.rulepack.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import java.time.Instant;

/**
 * Partial update of a rule pack. Null fields are left unchanged; {@code clearEffectiveTo} makes the
 * pack open-ended.
 */
public record UpdateRulePackRequest(
    @Size(min = 1, max = 200) String name,
    @JsonProperty("isActive") Boolean isActive,
    Instant effectiveFrom,
    Instant effectiveTo,
    boolean clearEffectiveTo) {}
