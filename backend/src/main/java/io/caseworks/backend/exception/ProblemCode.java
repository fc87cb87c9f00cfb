package io.caseworks.backend.exception;

import java.net.URI;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

/**
 * Stable error categories exposed to API clients. Each problem body carries the category as its
 * {@code type} URI and as a {@code code} property, so clients can branch without parsing titles.
 */
public enum ProblemCode {
  NOT_FOUND("not-found", HttpStatus.NOT_FOUND),
  CONFLICT("conflict", HttpStatus.CONFLICT),
  INVALID_REQUEST("invalid-request", HttpStatus.BAD_REQUEST),
  UNKNOWN_REFERENCES("unknown-references", HttpStatus.BAD_REQUEST),
  FORBIDDEN("forbidden", HttpStatus.FORBIDDEN),
  UNAUTHENTICATED("unauthenticated", HttpStatus.UNAUTHORIZED);

  private static final String TYPE_PREFIX = "urn:caseworks:problem:";

  private final String slug;
  private final HttpStatus status;

  ProblemCode(String slug, HttpStatus status) {
    this.slug = slug;
    this.status = status;
  }

  public HttpStatus status() {
    return status;
  }

  public ProblemDetail problem(String title, String detail) {
    var problem = ProblemDetail.forStatusAndDetail(status, detail);
    problem.setType(URI.create(TYPE_PREFIX + slug));
    problem.setTitle(title);
    problem.setProperty("code", name());
    return problem;
  }
}
