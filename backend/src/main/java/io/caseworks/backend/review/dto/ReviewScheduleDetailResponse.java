package io.caseworks.backend.review.dto;

import io.caseworks.backend.compliancetask.dto.ComplianceTaskResponse;
import java.util.List;

/** A schedule with the compliance tasks that reference it, newest first. */
public record ReviewScheduleDetailResponse(
    ReviewScheduleResponse reviewSchedule, List<ComplianceTaskResponse> tasks) {}
