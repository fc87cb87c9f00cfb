package io.caseworks.backend.rulepack.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.UUID;

public record EvidenceRequirementResponse(
    UUID id,
    UUID evidenceTypeId,
    String evidenceTypeKey,
    String evidenceTypeName,
    @JsonProperty("isRequired") boolean isRequired) {}
