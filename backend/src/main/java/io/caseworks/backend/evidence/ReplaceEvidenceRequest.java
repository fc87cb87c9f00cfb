package io.caseworks.backend.evidence;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record ReplaceEvidenceRequest(@NotNull @Valid List<AttachEvidenceRequest> evidence) {}
