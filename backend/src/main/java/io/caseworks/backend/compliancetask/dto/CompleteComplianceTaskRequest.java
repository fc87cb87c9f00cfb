package io.caseworks.backend.compliancetask.dto;

public record CompleteComplianceTaskRequest(String notes) {}
