package io.caseworks.backend.security;

/**
 * Centralized role constants used across authentication, authorization, and access control.
 *
 * <p>Claim values come from the {@code role} claim of the access token. Spring authorities are the
 * {@code ROLE_} prefixed versions used by {@code @PreAuthorize}.
 */
public final class Roles {

  public static final String ROLE_CLAIM = "role";

  // "role" claim values
  public static final String ADMIN = "admin";
  public static final String CASE_MANAGER = "case_manager";
  public static final String TEACHER = "teacher";

  // Spring Security granted authorities
  public static final String AUTHORITY_ADMIN = "ROLE_ADMIN";
  public static final String AUTHORITY_CASE_MANAGER = "ROLE_CASE_MANAGER";
  public static final String AUTHORITY_TEACHER = "ROLE_TEACHER";

  private Roles() {}
}
