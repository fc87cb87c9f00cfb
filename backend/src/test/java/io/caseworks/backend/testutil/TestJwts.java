package io.caseworks.backend.testutil;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;

import java.util.List;
import java.util.UUID;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.web.servlet.MvcResult;

public final class TestJwts {

  private TestJwts() {}

  public static JwtRequestPostProcessor adminJwt(UUID userId) {
    return roleJwt(userId, "admin", "ROLE_ADMIN");
  }

  public static JwtRequestPostProcessor caseManagerJwt(UUID userId) {
    return roleJwt(userId, "case_manager", "ROLE_CASE_MANAGER");
  }

  public static JwtRequestPostProcessor teacherJwt(UUID userId) {
    return roleJwt(userId, "teacher", "ROLE_TEACHER");
  }

  public static String extractIdFromLocation(MvcResult result) {
    String location = result.getResponse().getHeader("Location");
    return location.substring(location.lastIndexOf('/') + 1);
  }

  private static JwtRequestPostProcessor roleJwt(UUID userId, String role, String authority) {
    return jwt()
        .jwt(j -> j.subject(userId.toString()).claim("role", role))
        .authorities(List.of(new SimpleGrantedAuthority(authority)));
  }
}
