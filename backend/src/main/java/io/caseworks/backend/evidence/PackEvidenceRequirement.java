package io.caseworks.backend.evidence;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One evidence requirement of an enabled rule, flattened for checklists. */
public record PackEvidenceRequirement(
    String ruleKey,
    String evidenceTypeKey,
    String evidenceTypeName,
    @JsonProperty("isRequired") boolean isRequired) {}
