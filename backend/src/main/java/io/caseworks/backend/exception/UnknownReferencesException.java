package io.caseworks.backend.exception;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a bulk request references catalog entries that do not exist. Results in HTTP 400 with
 * the offending ids in {@code missingIds}.
 */
public class UnknownReferencesException extends ErrorResponseException {

  public UnknownReferencesException(String referenceType, Collection<UUID> missingIds) {
    super(
        ProblemCode.UNKNOWN_REFERENCES.status(),
        createProblem(referenceType, List.copyOf(missingIds)),
        null);
  }

  private static ProblemDetail createProblem(String referenceType, List<UUID> missingIds) {
    var problem =
        ProblemCode.UNKNOWN_REFERENCES.problem(
            "Unknown " + referenceType, referenceType + "(s) not found: " + missingIds);
    problem.setProperty("missingIds", missingIds);
    return problem;
  }
}
