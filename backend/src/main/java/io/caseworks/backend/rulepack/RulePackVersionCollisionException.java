package io.caseworks.backend.rulepack;

import org.springframework.dao.DataIntegrityViolationException;

/**
 * Raised when a rule pack insert lost the race for its version number. Only this failure is
 * retried; other integrity violations propagate unchanged.
 */
public class RulePackVersionCollisionException extends RuntimeException {

  static final String VERSION_CONSTRAINT = "uq_rule_packs_scope_plan_version";

  public RulePackVersionCollisionException(DataIntegrityViolationException cause) {
    super("Rule pack version already taken", cause);
  }

  static boolean isVersionCollision(DataIntegrityViolationException ex) {
    String message = ex.getMostSpecificCause().getMessage();
    return message != null && message.contains(VERSION_CONSTRAINT);
  }
}
