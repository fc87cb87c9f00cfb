package io.caseworks.backend.review;

import java.time.Instant;
import java.util.UUID;

public record ReviewScheduleDeletedEvent(
    UUID reviewScheduleId,
    UUID planInstanceId,
    UUID deletedByUserId,
    int tasksDeleted,
    Instant occurredAt) {}
