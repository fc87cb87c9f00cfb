package io.caseworks.backend.security;

import java.util.Objects;
import java.util.UUID;

/**
 * The authenticated user an operation runs on behalf of. Passed explicitly into every service
 * operation that reads or changes compliance data.
 */
public record Actor(UUID id, Role role) {

  public Actor {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(role, "role");
  }
}
