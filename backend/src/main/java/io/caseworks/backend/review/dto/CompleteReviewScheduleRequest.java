package io.caseworks.backend.review.dto;

public record CompleteReviewScheduleRequest(String notes) {}
