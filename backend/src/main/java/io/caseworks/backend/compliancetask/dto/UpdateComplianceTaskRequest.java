package io.caseworks.backend.compliancetask.dto;

import io.caseworks.backend.compliancetask.ComplianceTaskStatus;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;
import java.util.UUID;

/** Partial update; null fields are left unchanged. */
public record UpdateComplianceTaskRequest(
    @Size(min = 1, max = 300) String title,
    String description,
    LocalDate dueDate,
    boolean clearDueDate,
    @Min(1) @Max(5) Integer priority,
    ComplianceTaskStatus status,
    UUID assignedToUserId,
    boolean clearAssignee) {}
