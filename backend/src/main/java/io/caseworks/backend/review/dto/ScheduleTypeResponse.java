package io.caseworks.backend.review.dto;

import io.caseworks.backend.review.ScheduleType;

public record ScheduleTypeResponse(String value, String label, String description) {

  public static ScheduleTypeResponse from(ScheduleType type) {
    return new ScheduleTypeResponse(type.name(), type.getLabel(), type.getDescription());
  }
}
