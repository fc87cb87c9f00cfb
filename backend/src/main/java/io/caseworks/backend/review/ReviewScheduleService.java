package io.caseworks.backend.review;

import io.caseworks.backend.audit.AuditEventBuilder;
import io.caseworks.backend.audit.AuditService;
import io.caseworks.backend.audit.AuditSource;
import io.caseworks.backend.compliancetask.ComplianceTask;
import io.caseworks.backend.compliancetask.ComplianceTaskRepository;
import io.caseworks.backend.compliancetask.ComplianceTaskStatus;
import io.caseworks.backend.compliancetask.ComplianceTaskType;
import io.caseworks.backend.compliancetask.LeadWindowTaskGenerator;
import io.caseworks.backend.compliancetask.dto.ComplianceTaskResponse;
import io.caseworks.backend.config.CaseworksProperties;
import io.caseworks.backend.exception.InvalidStateException;
import io.caseworks.backend.exception.ResourceNotFoundException;
import io.caseworks.backend.plan.PlanDirectory;
import io.caseworks.backend.review.dto.CreateReviewScheduleRequest;
import io.caseworks.backend.review.dto.ReviewDashboardResponse;
import io.caseworks.backend.review.dto.ReviewScheduleDetailResponse;
import io.caseworks.backend.review.dto.ReviewScheduleResponse;
import io.caseworks.backend.review.dto.ScheduleTypeResponse;
import io.caseworks.backend.review.dto.UpdateReviewScheduleRequest;
import io.caseworks.backend.security.Actor;
import io.caseworks.backend.security.ComplianceAction;
import io.caseworks.backend.security.CompliancePermissions;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Review schedules of plans and the compliance tasks they drive. Completing or deleting a schedule
 * carries its tasks along in the same transaction.
 */
@Service
public class ReviewScheduleService {

  private static final Logger log = LoggerFactory.getLogger(ReviewScheduleService.class);

  static final int OVERDUE_TASK_PRIORITY = 3;
  static final int DASHBOARD_SUMMARY_DAYS = 30;

  private final ReviewScheduleRepository reviewScheduleRepository;
  private final ComplianceTaskRepository taskRepository;
  private final LeadWindowTaskGenerator leadWindowTaskGenerator;
  private final PlanDirectory planDirectory;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;
  private final CaseworksProperties properties;
  private final Clock clock;

  public ReviewScheduleService(
      ReviewScheduleRepository reviewScheduleRepository,
      ComplianceTaskRepository taskRepository,
      LeadWindowTaskGenerator leadWindowTaskGenerator,
      PlanDirectory planDirectory,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher,
      CaseworksProperties properties,
      Clock clock) {
    this.reviewScheduleRepository = reviewScheduleRepository;
    this.taskRepository = taskRepository;
    this.leadWindowTaskGenerator = leadWindowTaskGenerator;
    this.planDirectory = planDirectory;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Creates an OPEN schedule for the plan. When the due date is already inside the lead window a
   * due-soon task is created with it.
   */
  @Transactional
  public ReviewScheduleDetailResponse createSchedule(
      Actor actor, UUID planId, CreateReviewScheduleRequest request) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.MANAGE_REVIEW_SCHEDULES);
    int leadDays =
        request.leadDays() != null
            ? request.leadDays()
            : properties.reviewSchedules().defaultLeadDays();
    requireValidLeadDays(leadDays);
    var plan = planDirectory.requirePlan(planId);

    var schedule =
        reviewScheduleRepository.save(
            new ReviewSchedule(
                planId,
                request.scheduleType(),
                request.dueDate(),
                leadDays,
                request.notes(),
                request.assignedToUserId(),
                actor.id()));

    var generatedTask =
        leadWindowTaskGenerator.maybeCreateLeadWindowTask(
            schedule, plan, actor.id(), LocalDate.now(clock));

    log.info(
        "Created review schedule {} ({}) for plan {} due {}",
        schedule.getId(),
        schedule.getScheduleType(),
        planId,
        schedule.getDueDate());

    var details = new HashMap<String, Object>();
    details.put("plan_instance_id", planId.toString());
    details.put("schedule_type", schedule.getScheduleType().name());
    details.put("due_date", schedule.getDueDate().toString());
    details.put("lead_days", leadDays);
    generatedTask.ifPresent(task -> details.put("generated_task_id", task.getId().toString()));
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("review_schedule.created")
            .entityType("review_schedule")
            .entityId(schedule.getId())
            .actor(actor)
            .details(details)
            .build());

    return new ReviewScheduleDetailResponse(
        ReviewScheduleResponse.from(schedule),
        generatedTask.map(ComplianceTaskResponse::from).stream().toList());
  }

  @Transactional(readOnly = true)
  public List<ReviewScheduleResponse> listForPlan(
      Actor actor, UUID planId, ReviewScheduleStatus status, ScheduleType scheduleType) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.VIEW_REVIEW_SCHEDULES);
    planDirectory.requirePlan(planId);
    return reviewScheduleRepository.findForPlan(planId, status, scheduleType).stream()
        .map(ReviewScheduleResponse::from)
        .toList();
  }

  @Transactional(readOnly = true)
  public ReviewScheduleDetailResponse getSchedule(Actor actor, UUID id) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.VIEW_REVIEW_SCHEDULES);
    return toDetail(requireSchedule(id));
  }

  @Transactional
  public ReviewScheduleDetailResponse updateSchedule(
      Actor actor, UUID id, UpdateReviewScheduleRequest request) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.MANAGE_REVIEW_SCHEDULES);
    if (request.leadDays() != null) {
      requireValidLeadDays(request.leadDays());
    }
    var schedule = requireSchedule(id);
    var previousStatus = schedule.getStatus();

    schedule.updateDetails(
        request.dueDate() != null ? request.dueDate() : schedule.getDueDate(),
        request.leadDays() != null ? request.leadDays() : schedule.getLeadDays(),
        request.notes() != null ? request.notes() : schedule.getNotes(),
        request.clearAssignee()
            ? null
            : request.assignedToUserId() != null
                ? request.assignedToUserId()
                : schedule.getAssignedToUserId(),
        LocalDate.now(clock));
    schedule = reviewScheduleRepository.save(schedule);

    log.info("Updated review schedule {} (status {})", id, schedule.getStatus());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("review_schedule.updated")
            .entityType("review_schedule")
            .entityId(id)
            .actor(actor)
            .details(
                Map.of(
                    "due_date", schedule.getDueDate().toString(),
                    "lead_days", schedule.getLeadDays(),
                    "previous_status", previousStatus.name(),
                    "status", schedule.getStatus().name()))
            .build());

    return toDetail(schedule);
  }

  /**
   * Completes the schedule and every OPEN or IN_PROGRESS task referencing it, with one completion
   * timestamp and actor. Either all of it commits or none of it does.
   */
  @Transactional
  public ReviewScheduleDetailResponse completeSchedule(Actor actor, UUID id, String notes) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.MANAGE_REVIEW_SCHEDULES);
    var schedule = requireSchedule(id);

    Instant completedAt = clock.instant();
    schedule.complete(actor.id(), completedAt, notes);
    schedule = reviewScheduleRepository.saveAndFlush(schedule);

    var openTasks =
        taskRepository.findByReviewScheduleIdAndStatusIn(id, ComplianceTaskStatus.ACTIVE);
    for (ComplianceTask task : openTasks) {
      task.transitionTo(ComplianceTaskStatus.COMPLETE, actor.id(), completedAt);
    }
    taskRepository.saveAll(openTasks);

    log.info("Completed review schedule {} and {} open task(s)", id, openTasks.size());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("review_schedule.completed")
            .entityType("review_schedule")
            .entityId(id)
            .actor(actor)
            .details(
                Map.of(
                    "plan_instance_id", schedule.getPlanInstanceId().toString(),
                    "tasks_completed", openTasks.size()))
            .build());
    eventPublisher.publishEvent(
        new ReviewScheduleCompletedEvent(
            id, schedule.getPlanInstanceId(), actor.id(), openTasks.size(), completedAt));

    return toDetail(schedule);
  }

  /** Deletes every task referencing the schedule, then the schedule. */
  @Transactional
  public void deleteSchedule(Actor actor, UUID id) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.DELETE_REVIEW_SCHEDULE);
    var schedule = requireSchedule(id);

    int tasksDeleted = taskRepository.deleteByReviewScheduleId(id);
    reviewScheduleRepository.delete(schedule);

    log.info("Deleted review schedule {} and {} task(s)", id, tasksDeleted);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("review_schedule.deleted")
            .entityType("review_schedule")
            .entityId(id)
            .actor(actor)
            .details(
                Map.of(
                    "plan_instance_id", schedule.getPlanInstanceId().toString(),
                    "schedule_type", schedule.getScheduleType().name(),
                    "tasks_deleted", tasksDeleted))
            .build());
    eventPublisher.publishEvent(
        new ReviewScheduleDeletedEvent(
            id, schedule.getPlanInstanceId(), actor.id(), tasksDeleted, clock.instant()));
  }

  /**
   * Outstanding schedules due within {@code days}, split into overdue (past due or marked OVERDUE)
   * and upcoming.
   */
  @Transactional(readOnly = true)
  public ReviewDashboardResponse dashboard(Actor actor, int days) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.VIEW_REVIEW_SCHEDULES);
    if (days < 1 || days > 365) {
      throw new InvalidStateException("Invalid dashboard window", "days must be between 1 and 365");
    }
    LocalDate today = LocalDate.now(clock);
    var schedules =
        reviewScheduleRepository.findByStatusInAndDueDateLessThanEqualOrderByDueDateAsc(
            ReviewScheduleStatus.OUTSTANDING, today.plusDays(days));

    var overdue = new ArrayList<ReviewScheduleResponse>();
    var upcoming = new ArrayList<ReviewScheduleResponse>();
    int dueWithinSummaryWindow = 0;
    LocalDate summaryHorizon = today.plusDays(DASHBOARD_SUMMARY_DAYS);
    for (ReviewSchedule schedule : schedules) {
      if (schedule.isOverdue(today)) {
        overdue.add(ReviewScheduleResponse.from(schedule));
      } else {
        upcoming.add(ReviewScheduleResponse.from(schedule));
      }
      if (!schedule.getDueDate().isAfter(summaryHorizon)) {
        dueWithinSummaryWindow++;
      }
    }

    return new ReviewDashboardResponse(
        overdue,
        upcoming,
        new ReviewDashboardResponse.Summary(
            overdue.size(), upcoming.size(), dueWithinSummaryWindow));
  }

  public List<ScheduleTypeResponse> scheduleTypes() {
    return Arrays.stream(ScheduleType.values()).map(ScheduleTypeResponse::from).toList();
  }

  /** Ids of OPEN schedules whose due date is before {@code today}. */
  @Transactional(readOnly = true)
  public List<UUID> findSchedulesToMarkOverdue(LocalDate today) {
    return reviewScheduleRepository
        .findByStatusAndDueDateBefore(ReviewScheduleStatus.OPEN, today)
        .stream()
        .map(ReviewSchedule::getId)
        .toList();
  }

  /**
   * Moves one OPEN, past-due schedule to OVERDUE and opens a REVIEW_OVERDUE task for it unless an
   * active one exists. Returns false when the schedule no longer qualifies.
   */
  @Transactional
  public boolean markOverdue(UUID id, LocalDate today) {
    var schedule = reviewScheduleRepository.findById(id).orElse(null);
    if (schedule == null
        || schedule.getStatus() != ReviewScheduleStatus.OPEN
        || !schedule.getDueDate().isBefore(today)) {
      return false;
    }

    schedule.markOverdue();
    reviewScheduleRepository.save(schedule);

    UUID taskId = null;
    if (!taskRepository.existsByReviewScheduleIdAndTaskTypeAndStatusIn(
        id, ComplianceTaskType.REVIEW_OVERDUE, ComplianceTaskStatus.ACTIVE)) {
      var plan = planDirectory.requirePlan(schedule.getPlanInstanceId());
      var student = planDirectory.requireStudent(plan.getStudentId());
      var task =
          taskRepository.save(
              new ComplianceTask(
                  ComplianceTaskType.REVIEW_OVERDUE,
                  schedule.getScheduleType().getLabel() + " overdue",
                  "Review for "
                      + student.getFullName()
                      + " was due on "
                      + schedule.getDueDate(),
                  schedule.getDueDate(),
                  OVERDUE_TASK_PRIORITY,
                  schedule.getAssignedToUserId(),
                  schedule.getId(),
                  plan.getId(),
                  plan.getStudentId(),
                  null));
      taskId = task.getId();
    }

    log.info("Marked review schedule {} overdue (due {})", id, schedule.getDueDate());

    var details = new HashMap<String, Object>();
    details.put("due_date", schedule.getDueDate().toString());
    if (taskId != null) {
      details.put("generated_task_id", taskId.toString());
    }
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("review_schedule.overdue")
            .entityType("review_schedule")
            .entityId(id)
            .source(AuditSource.SCHEDULED)
            .details(details)
            .build());
    return true;
  }

  private ReviewScheduleDetailResponse toDetail(ReviewSchedule schedule) {
    var tasks =
        taskRepository.findByReviewScheduleIdOrderByCreatedAtDesc(schedule.getId()).stream()
            .map(ComplianceTaskResponse::from)
            .toList();
    return new ReviewScheduleDetailResponse(ReviewScheduleResponse.from(schedule), tasks);
  }

  private ReviewSchedule requireSchedule(UUID id) {
    return reviewScheduleRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("ReviewSchedule", id));
  }

  private static void requireValidLeadDays(int leadDays) {
    if (leadDays < ReviewSchedule.MIN_LEAD_DAYS || leadDays > ReviewSchedule.MAX_LEAD_DAYS) {
      throw new InvalidStateException(
          "Invalid lead days",
          "leadDays must be between "
              + ReviewSchedule.MIN_LEAD_DAYS
              + " and "
              + ReviewSchedule.MAX_LEAD_DAYS);
    }
  }
}
