package io.caseworks.backend.security;

/** Operations on compliance data that are subject to a role check. */
public enum ComplianceAction {
  VIEW_RULE_PACKS,
  MANAGE_RULE_PACKS,
  RESOLVE_PLAN_RULE_PACK,
  VIEW_REVIEW_SCHEDULES,
  MANAGE_REVIEW_SCHEDULES,
  DELETE_REVIEW_SCHEDULE,
  VIEW_COMPLIANCE_TASKS,
  MANAGE_COMPLIANCE_TASKS
}
