package io.caseworks.backend.exception;

import org.springframework.web.ErrorResponseException;

/**
 * The request clashes with current state: a duplicate attachment, a version race that outlived
 * its retries, or a lifecycle transition out of a terminal status.
 */
public class ResourceConflictException extends ErrorResponseException {

  public ResourceConflictException(String title, String detail) {
    super(ProblemCode.CONFLICT.status(), ProblemCode.CONFLICT.problem(title, detail), null);
  }
}
