package io.caseworks.backend.exception;

import org.springframework.web.ErrorResponseException;

public class ForbiddenException extends ErrorResponseException {

  public ForbiddenException(String title, String detail) {
    super(ProblemCode.FORBIDDEN.status(), ProblemCode.FORBIDDEN.problem(title, detail), null);
  }
}
