package io.caseworks.backend.compliancetask.dto;

import io.caseworks.backend.compliancetask.ComplianceTaskType;

public record TaskTypeResponse(String value, String label, String description) {

  public static TaskTypeResponse from(ComplianceTaskType type) {
    return new TaskTypeResponse(type.name(), type.getLabel(), type.getDescription());
  }
}
