package io.caseworks.backend.audit;

import io.caseworks.backend.security.Actor;
import io.caseworks.backend.security.Role;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.UUID;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Assembles an {@link AuditEventRecord}. Events with an {@link Actor} are USER events carrying the
 * actor's role; events without one are SYSTEM events. Source, client address and user agent come
 * from the current HTTP request when there is one.
 *
 * <pre>{@code
 * auditService.log(
 *     AuditEventBuilder.builder()
 *         .eventType("rule_pack.created")
 *         .entityType("rule_pack")
 *         .entityId(pack.getId())
 *         .actor(actor)
 *         .details(Map.of("version", pack.getVersion()))
 *         .build());
 * }</pre>
 */
public class AuditEventBuilder {

  static final int MAX_USER_AGENT_LENGTH = 500;

  private String eventType;
  private String entityType;
  private UUID entityId;
  private Actor actor;
  private AuditSource source;
  private Map<String, Object> details;

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder actor(Actor actor) {
    this.actor = actor;
    return this;
  }

  /** Overrides the source otherwise inferred from the request context. */
  public AuditEventBuilder source(AuditSource source) {
    this.source = source;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  public AuditEventRecord build() {
    HttpServletRequest request = currentRequest();

    AuditSource resolvedSource = source;
    if (resolvedSource == null) {
      resolvedSource = request != null ? AuditSource.API : AuditSource.INTERNAL;
    }

    UUID actorId = actor != null ? actor.id() : null;
    Role actorRole = actor != null ? actor.role() : null;

    return new AuditEventRecord(
        eventType,
        entityType,
        entityId,
        actorId,
        actor != null ? ActorType.USER : ActorType.SYSTEM,
        actorRole,
        resolvedSource,
        request != null ? request.getRemoteAddr() : null,
        request != null ? truncate(request.getHeader("User-Agent")) : null,
        details);
  }

  private static String truncate(String userAgent) {
    if (userAgent == null || userAgent.length() <= MAX_USER_AGENT_LENGTH) {
      return userAgent;
    }
    return userAgent.substring(0, MAX_USER_AGENT_LENGTH);
  }

  private static HttpServletRequest currentRequest() {
    if (RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes attrs) {
      return attrs.getRequest();
    }
    return null;
  }
}
