package io.caseworks.backend.audit;

/** Records who changed compliance configuration, review schedules and tasks. */
public interface AuditService {

  /** Persists {@code record} in the current transaction; it rolls back with the caller. */
  void log(AuditEventRecord record);
}
