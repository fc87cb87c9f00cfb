package io.caseworks.backend.review.dto;

import io.caseworks.backend.review.ScheduleType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import java.util.UUID;

/** {@code leadDays} falls back to the configured default when omitted. */
public record CreateReviewScheduleRequest(
    @NotNull ScheduleType scheduleType,
    @NotNull LocalDate dueDate,
    @Min(1) @Max(365) Integer leadDays,
    String notes,
    UUID assignedToUserId) {}
