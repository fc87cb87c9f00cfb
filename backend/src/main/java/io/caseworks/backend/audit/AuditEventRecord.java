package io.caseworks.backend.audit;

import io.caseworks.backend.security.Role;
import java.util.Map;
import java.util.UUID;

/**
 * What {@link AuditService#log(AuditEventRecord)} persists; build it with {@link
 * AuditEventBuilder}.
 *
 * @param eventType {@code {entity}.{action}}, e.g. {@code review_schedule.completed}
 * @param entityId id of the affected row; kept after the row itself is deleted
 * @param actorRole the role the user acted in; null for SYSTEM events
 * @param details changed fields and identifiers worth keeping; nullable
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    UUID actorId,
    ActorType actorType,
    Role actorRole,
    AuditSource source,
    String ipAddress,
    String userAgent,
    Map<String, Object> details) {}
