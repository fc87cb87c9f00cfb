package io.caseworks.backend.compliancetask;

import io.caseworks.backend.plan.PlanDirectory;
import io.caseworks.backend.plan.PlanInstance;
import io.caseworks.backend.review.ReviewSchedule;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Creates the "due soon" task for a review schedule that is already inside its lead window, i.e.
 * {@code dueDate - leadDays <= today}. Runs in the caller's transaction.
 */
@Component
public class LeadWindowTaskGenerator {

  private static final Logger log = LoggerFactory.getLogger(LeadWindowTaskGenerator.class);

  static final int DUE_SOON_PRIORITY = 2;

  private final ComplianceTaskRepository taskRepository;
  private final PlanDirectory planDirectory;

  public LeadWindowTaskGenerator(
      ComplianceTaskRepository taskRepository, PlanDirectory planDirectory) {
    this.taskRepository = taskRepository;
    this.planDirectory = planDirectory;
  }

  public static boolean isWithinLeadWindow(LocalDate dueDate, int leadDays, LocalDate today) {
    return !dueDate.minusDays(leadDays).isAfter(today);
  }

  /** Returns the created task, or empty when the schedule has not entered its lead window. */
  public Optional<ComplianceTask> maybeCreateLeadWindowTask(
      ReviewSchedule schedule, PlanInstance plan, UUID createdByUserId, LocalDate today) {
    if (!isWithinLeadWindow(schedule.getDueDate(), schedule.getLeadDays(), today)) {
      return Optional.empty();
    }

    var student = planDirectory.requireStudent(plan.getStudentId());
    var task =
        taskRepository.save(
            new ComplianceTask(
                ComplianceTaskType.REVIEW_DUE_SOON,
                schedule.getScheduleType().getLabel() + " due soon",
                "Review for "
                    + student.getFullName()
                    + " is due on "
                    + schedule.getDueDate(),
                schedule.getDueDate(),
                DUE_SOON_PRIORITY,
                schedule.getAssignedToUserId(),
                schedule.getId(),
                plan.getId(),
                plan.getStudentId(),
                createdByUserId));

    log.info(
        "Created due-soon task {} for review schedule {} (due {}, lead {} days)",
        task.getId(),
        schedule.getId(),
        schedule.getDueDate(),
        schedule.getLeadDays());
    return Optional.of(task);
  }
}
