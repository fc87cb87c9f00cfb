package io.caseworks.backend.audit;

/** Where an audited change came from. */
public enum AuditSource {
  /** An HTTP request to the REST API. */
  API,
  /** Application code outside a request, such as catalog seeding at startup. */
  INTERNAL,
  /** A scheduled job, such as the overdue review sweep. */
  SCHEDULED
}
