package io.caseworks.backend.compliancetask.dto;

import io.caseworks.backend.compliancetask.ComplianceTask;
import io.caseworks.backend.compliancetask.ComplianceTaskStatus;
import io.caseworks.backend.compliancetask.ComplianceTaskType;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

public record ComplianceTaskResponse(
    UUID id,
    ComplianceTaskType taskType,
    ComplianceTaskStatus status,
    String title,
    String description,
    LocalDate dueDate,
    int priority,
    UUID assignedToUserId,
    UUID reviewScheduleId,
    UUID planInstanceId,
    UUID studentId,
    UUID createdByUserId,
    Instant completedAt,
    UUID completedByUserId,
    Instant dismissedAt,
    UUID dismissedByUserId,
    String dismissReason,
    Instant createdAt,
    Instant updatedAt) {

  public static ComplianceTaskResponse from(ComplianceTask task) {
    return new ComplianceTaskResponse(
        task.getId(),
        task.getTaskType(),
        task.getStatus(),
        task.getTitle(),
        task.getDescription(),
        task.getDueDate(),
        task.getPriority(),
        task.getAssignedToUserId(),
        task.getReviewScheduleId(),
        task.getPlanInstanceId(),
        task.getStudentId(),
        task.getCreatedByUserId(),
        task.getCompletedAt(),
        task.getCompletedByUserId(),
        task.getDismissedAt(),
        task.getDismissedByUserId(),
        task.getDismissReason(),
        task.getCreatedAt(),
        task.getUpdatedAt());
  }
}
