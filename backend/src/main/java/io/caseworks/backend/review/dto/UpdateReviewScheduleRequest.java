package io.caseworks.backend.review.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.time.LocalDate;
import java.util.UUID;

public record UpdateReviewScheduleRequest(
    LocalDate dueDate,
    @Min(1) @Max(365) Integer leadDays,
    String notes,
    UUID assignedToUserId,
    boolean clearAssignee) {}
