package io.caseworks.backend.compliancetask;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/** Compliance task lifecycle. COMPLETE and DISMISSED are terminal. */
public enum ComplianceTaskStatus {
  OPEN,
  IN_PROGRESS,
  COMPLETE,
  DISMISSED;

  /** Statuses of tasks that still need work. */
  public static final Set<ComplianceTaskStatus> ACTIVE = EnumSet.of(OPEN, IN_PROGRESS);

  private static final Map<ComplianceTaskStatus, Set<ComplianceTaskStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          OPEN, Set.of(IN_PROGRESS, COMPLETE, DISMISSED),
          IN_PROGRESS, Set.of(OPEN, COMPLETE, DISMISSED),
          COMPLETE, Set.of(),
          DISMISSED, Set.of());

  public Set<ComplianceTaskStatus> allowedTransitions() {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of());
  }

  public boolean canTransitionTo(ComplianceTaskStatus target) {
    return allowedTransitions().contains(target);
  }

  public boolean isTerminal() {
    return this == COMPLETE || this == DISMISSED;
  }
}
