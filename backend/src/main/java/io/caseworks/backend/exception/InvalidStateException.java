package io.caseworks.backend.exception;

import org.springframework.web.ErrorResponseException;

/** Request is well-formed JSON but violates a domain rule; answered with 400. */
public class InvalidStateException extends ErrorResponseException {

  public InvalidStateException(String title, String detail) {
    super(
        ProblemCode.INVALID_REQUEST.status(),
        ProblemCode.INVALID_REQUEST.problem(title, detail),
        null);
  }
}
