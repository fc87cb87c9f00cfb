package io.caseworks.backend.exception;

import org.springframework.web.ErrorResponseException;

/** A referenced rule pack, plan, schedule or task does not exist. */
public class ResourceNotFoundException extends ErrorResponseException {

  public ResourceNotFoundException(String resourceType, Object id) {
    this(resourceType + " not found", "No " + humanize(resourceType) + " found with id " + id);
  }

  private ResourceNotFoundException(String title, String detail) {
    super(ProblemCode.NOT_FOUND.status(), ProblemCode.NOT_FOUND.problem(title, detail), null);
  }

  /** For lookups keyed by something other than an id, such as a rule within a pack. */
  public static ResourceNotFoundException withDetail(String title, String detail) {
    return new ResourceNotFoundException(title, detail);
  }

  // "ReviewSchedule" -> "review schedule"
  private static String humanize(String resourceType) {
    return resourceType.replaceAll("([a-z])([A-Z])", "$1 $2").toLowerCase();
  }
}
