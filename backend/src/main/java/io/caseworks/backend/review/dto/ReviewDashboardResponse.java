package io.caseworks.backend.review.dto;

import java.util.List;

public record ReviewDashboardResponse(
    List<ReviewScheduleResponse> overdue, List<ReviewScheduleResponse> upcoming, Summary summary) {

  public record Summary(int overdueCount, int upcomingCount, int totalDueWithin30Days) {}
}
