package io.caseworks.backend.compliancetask.dto;

import java.util.List;

public record ComplianceTaskDashboardResponse(
    Summary summary, List<ComplianceTaskResponse> recentTasks) {

  public record Summary(long open, long inProgress, long overdue, long dueIn30Days) {}
}
