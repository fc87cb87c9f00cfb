package io.caseworks.backend.evidence;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;

public record AttachEvidenceRequest(
    @NotNull UUID evidenceTypeId, @JsonProperty("isRequired") Boolean isRequired) {}
