package io.caseworks.backend.audit;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes audit events to {@code audit_events} inside the caller's transaction, so an audited change
 * and its audit row commit or roll back together.
 */
@Service
public class DatabaseAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditService.class);

  private final AuditEventRepository auditEventRepository;
  private final Clock clock;

  public DatabaseAuditService(AuditEventRepository auditEventRepository, Clock clock) {
    this.auditEventRepository = auditEventRepository;
    this.clock = clock;
  }

  @Override
  @Transactional
  public void log(AuditEventRecord record) {
    auditEventRepository.save(new AuditEvent(record, clock.instant()));
    log.debug(
        "Recorded audit event: type={}, entity={}/{}, actor={} ({})",
        record.eventType(),
        record.entityType(),
        record.entityId(),
        record.actorId(),
        record.actorRole());
  }
}
