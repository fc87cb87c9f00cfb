package io.caseworks.backend.security;

import java.util.Optional;

/** Application role carried by an {@link Actor}. */
public enum Role {
  ADMIN(Roles.ADMIN),
  CASE_MANAGER(Roles.CASE_MANAGER),
  TEACHER(Roles.TEACHER);

  private final String claimValue;

  Role(String claimValue) {
    this.claimValue = claimValue;
  }

  public String claimValue() {
    return claimValue;
  }

  public static Optional<Role> fromClaim(String claimValue) {
    if (claimValue == null) {
      return Optional.empty();
    }
    for (Role role : values()) {
      if (role.claimValue.equalsIgnoreCase(claimValue)) {
        return Optional.of(role);
      }
    }
    return Optional.empty();
  }
}
