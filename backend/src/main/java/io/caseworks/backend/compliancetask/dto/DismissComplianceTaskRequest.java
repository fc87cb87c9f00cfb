package io.caseworks.backend.compliancetask.dto;

import jakarta.validation.constraints.NotBlank;

public record DismissComplianceTaskRequest(@NotBlank String reason) {}
