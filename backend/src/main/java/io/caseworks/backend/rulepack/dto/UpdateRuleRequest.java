package io.caseworks.backend.rulepack.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Partial update of a rule in a pack. {@code clearConfig} drops the override so the definition
 * default applies again.
 */
public record UpdateRuleRequest(
    @JsonProperty("isEnabled") Boolean isEnabled,
    Map<String, Object> config,
    boolean clearConfig,
    Integer sortOrder) {}
