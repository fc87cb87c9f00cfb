package io.caseworks.backend.review;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Review schedule lifecycle. OPEN and OVERDUE both count as outstanding and may move between each
 * other; COMPLETE is terminal.
 */
public enum ReviewScheduleStatus {
  OPEN,
  OVERDUE,
  COMPLETE;

  public static final Set<ReviewScheduleStatus> OUTSTANDING = EnumSet.of(OPEN, OVERDUE);

  private static final Map<ReviewScheduleStatus, Set<ReviewScheduleStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          OPEN, Set.of(OVERDUE, COMPLETE),
          OVERDUE, Set.of(OPEN, COMPLETE),
          COMPLETE, Set.of());

  public Set<ReviewScheduleStatus> allowedTransitions() {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of());
  }

  public boolean canTransitionTo(ReviewScheduleStatus target) {
    return allowedTransitions().contains(target);
  }

  public boolean isTerminal() {
    return this == COMPLETE;
  }
}
