package io.caseworks.backend.review.dto;

import io.caseworks.backend.review.ReviewSchedule;
import io.caseworks.backend.review.ReviewScheduleStatus;
import io.caseworks.backend.review.ScheduleType;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

public record ReviewScheduleResponse(
    UUID id,
    UUID planInstanceId,
    ScheduleType scheduleType,
    String scheduleTypeLabel,
    LocalDate dueDate,
    int leadDays,
    ReviewScheduleStatus status,
    String notes,
    UUID assignedToUserId,
    UUID createdByUserId,
    Instant completedAt,
    UUID completedByUserId,
    Instant createdAt,
    Instant updatedAt) {

  public static ReviewScheduleResponse from(ReviewSchedule schedule) {
    return new ReviewScheduleResponse(
        schedule.getId(),
        schedule.getPlanInstanceId(),
        schedule.getScheduleType(),
        schedule.getScheduleType().getLabel(),
        schedule.getDueDate(),
        schedule.getLeadDays(),
        schedule.getStatus(),
        schedule.getNotes(),
        schedule.getAssignedToUserId(),
        schedule.getCreatedByUserId(),
        schedule.getCompletedAt(),
        schedule.getCompletedByUserId(),
        schedule.getCreatedAt(),
        schedule.getUpdatedAt());
  }
}
