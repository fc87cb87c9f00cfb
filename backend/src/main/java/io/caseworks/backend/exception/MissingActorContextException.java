package io.caseworks.backend.exception;

import org.springframework.web.ErrorResponseException;

/** No authenticated user could be derived from the request's token. */
public class MissingActorContextException extends ErrorResponseException {

  public MissingActorContextException(String detail) {
    super(
        ProblemCode.UNAUTHENTICATED.status(),
        ProblemCode.UNAUTHENTICATED.problem("Missing actor context", detail),
        null);
  }
}
