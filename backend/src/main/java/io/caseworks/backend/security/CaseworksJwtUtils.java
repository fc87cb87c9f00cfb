package io.caseworks.backend.security;

import java.util.UUID;
import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Extracts the user id ({@code sub}) and application role ({@code role}) from an access token.
 *
 * <p>Token format: {@code { "sub": "<user uuid>", "role": "case_manager" }}
 */
public final class CaseworksJwtUtils {

  /** Returns the user id from {@code sub}, or null when the subject is absent or not a UUID. */
  public static UUID extractUserId(Jwt jwt) {
    String subject = jwt.getSubject();
    if (subject == null) {
      return null;
    }
    try {
      return UUID.fromString(subject);
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  /** Returns the raw {@code role} claim value, or null. */
  public static String extractRole(Jwt jwt) {
    Object value = jwt.getClaim(Roles.ROLE_CLAIM);
    return value instanceof String str ? str : null;
  }

  private CaseworksJwtUtils() {}
}
