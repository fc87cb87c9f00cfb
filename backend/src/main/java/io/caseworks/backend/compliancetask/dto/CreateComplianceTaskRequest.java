package io.caseworks.backend.compliancetask.dto;

import io.caseworks.backend.compliancetask.ComplianceTaskType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;
import java.util.UUID;

public record CreateComplianceTaskRequest(
    @NotNull ComplianceTaskType taskType,
    @NotBlank @Size(max = 300) String title,
    String description,
    LocalDate dueDate,
    @Min(1) @Max(5) Integer priority,
    UUID assignedToUserId,
    UUID reviewScheduleId,
    UUID planInstanceId,
    UUID studentId) {}
