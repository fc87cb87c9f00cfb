package io.caseworks.backend.security;

import io.caseworks.backend.exception.MissingActorContextException;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

/**
 * Turns the authenticated bearer token of the current request into an {@link Actor}. Controllers
 * call {@link #requireActor()} once and hand the result to the service layer.
 */
@Component
public class ActorResolver {

  private static final Map<String, Role> AUTHORITY_ROLES =
      Map.of(
          Roles.AUTHORITY_ADMIN, Role.ADMIN,
          Roles.AUTHORITY_CASE_MANAGER, Role.CASE_MANAGER,
          Roles.AUTHORITY_TEACHER, Role.TEACHER);

  public Actor requireActor() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (!(authentication instanceof JwtAuthenticationToken token)) {
      throw new MissingActorContextException("Request is not authenticated with a bearer token");
    }

    UUID userId = CaseworksJwtUtils.extractUserId(token.getToken());
    if (userId == null) {
      throw new MissingActorContextException("Token subject is not a user id");
    }

    Role role =
        roleFromAuthorities(token)
            .or(() -> Role.fromClaim(CaseworksJwtUtils.extractRole(token.getToken())))
            .orElseThrow(
                () -> new MissingActorContextException("Token does not carry a known role"));
    return new Actor(userId, role);
  }

  private static Optional<Role> roleFromAuthorities(Authentication authentication) {
    return authentication.getAuthorities().stream()
        .map(GrantedAuthority::getAuthority)
        .map(AUTHORITY_ROLES::get)
        .filter(role -> role != null)
        .findFirst();
  }
}
