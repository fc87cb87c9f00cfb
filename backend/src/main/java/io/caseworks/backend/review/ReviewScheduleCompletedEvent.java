package io.caseworks.backend.review;

import java.time.Instant;
import java.util.UUID;

public record ReviewScheduleCompletedEvent(
    UUID reviewScheduleId,
    UUID planInstanceId,
    UUID completedByUserId,
    int tasksCompleted,
    Instant occurredAt) {}
