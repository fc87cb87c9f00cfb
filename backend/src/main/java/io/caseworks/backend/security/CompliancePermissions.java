package io.caseworks.backend.security;

import io.caseworks.backend.exception.ForbiddenException;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Role policy for compliance operations. {@link #isPermitted(Actor, ComplianceAction)} depends on
 * nothing but its arguments.
 */
public final class CompliancePermissions {

  private static final Set<Role> STAFF = EnumSet.of(Role.ADMIN, Role.CASE_MANAGER);
  private static final Set<Role> ALL_ROLES = EnumSet.allOf(Role.class);

  private static final Map<ComplianceAction, Set<Role>> ALLOWED_ROLES =
      Map.of(
          ComplianceAction.VIEW_RULE_PACKS, STAFF,
          ComplianceAction.MANAGE_RULE_PACKS, EnumSet.of(Role.ADMIN),
          ComplianceAction.RESOLVE_PLAN_RULE_PACK, ALL_ROLES,
          ComplianceAction.VIEW_REVIEW_SCHEDULES, ALL_ROLES,
          ComplianceAction.MANAGE_REVIEW_SCHEDULES, STAFF,
          ComplianceAction.DELETE_REVIEW_SCHEDULE, EnumSet.of(Role.ADMIN),
          ComplianceAction.VIEW_COMPLIANCE_TASKS, ALL_ROLES,
          ComplianceAction.MANAGE_COMPLIANCE_TASKS, STAFF);

  public static boolean isPermitted(Actor actor, ComplianceAction action) {
    if (actor == null || action == null) {
      return false;
    }
    return ALLOWED_ROLES.getOrDefault(action, Set.of()).contains(actor.role());
  }

  /** Throws {@link ForbiddenException} unless the actor's role allows the action. */
  public static void requirePermitted(Actor actor, ComplianceAction action) {
    if (!isPermitted(actor, action)) {
      throw new ForbiddenException(
          "Insufficient permissions",
          "Role "
              + (actor != null ? actor.role() : "none")
              + " is not allowed to "
              + action.name().toLowerCase().replace('_', ' '));
    }
  }

  private CompliancePermissions() {}
}
