package io.caseworks.backend.compliancetask;

import io.caseworks.backend.audit.AuditEventBuilder;
import io.caseworks.backend.audit.AuditService;
import io.caseworks.backend.compliancetask.dto.ComplianceTaskDashboardResponse;
import io.caseworks.backend.compliancetask.dto.ComplianceTaskResponse;
import io.caseworks.backend.compliancetask.dto.CreateComplianceTaskRequest;
import io.caseworks.backend.compliancetask.dto.TaskTypeResponse;
import io.caseworks.backend.compliancetask.dto.UpdateComplianceTaskRequest;
import io.caseworks.backend.exception.InvalidStateException;
import io.caseworks.backend.exception.ResourceConflictException;
import io.caseworks.backend.exception.ResourceNotFoundException;
import io.caseworks.backend.plan.PlanDirectory;
import io.caseworks.backend.review.ReviewScheduleRepository;
import io.caseworks.backend.security.Actor;
import io.caseworks.backend.security.ComplianceAction;
import io.caseworks.backend.security.CompliancePermissions;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ComplianceTaskService {

  private static final Logger log = LoggerFactory.getLogger(ComplianceTaskService.class);

  static final int DEFAULT_PRIORITY = 1;
  static final int DASHBOARD_DUE_DAYS = 30;

  private final ComplianceTaskRepository taskRepository;
  private final ReviewScheduleRepository reviewScheduleRepository;
  private final PlanDirectory planDirectory;
  private final AuditService auditService;
  private final Clock clock;

  public ComplianceTaskService(
      ComplianceTaskRepository taskRepository,
      ReviewScheduleRepository reviewScheduleRepository,
      PlanDirectory planDirectory,
      AuditService auditService,
      Clock clock) {
    this.taskRepository = taskRepository;
    this.reviewScheduleRepository = reviewScheduleRepository;
    this.planDirectory = planDirectory;
    this.auditService = auditService;
    this.clock = clock;
  }

  @Transactional
  public ComplianceTaskResponse createTask(Actor actor, CreateComplianceTaskRequest request) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.MANAGE_COMPLIANCE_TASKS);
    int priority = request.priority() != null ? request.priority() : DEFAULT_PRIORITY;
    requireValidPriority(priority);

    if (request.reviewScheduleId() != null) {
      var schedule =
          reviewScheduleRepository
              .findById(request.reviewScheduleId())
              .orElseThrow(
                  () -> new ResourceNotFoundException("ReviewSchedule", request.reviewScheduleId()));
      if (schedule.getStatus().isTerminal()) {
        throw new ResourceConflictException(
            "Review schedule already complete",
            "Review schedule " + schedule.getId() + " is complete and cannot take new tasks");
      }
    }
    UUID studentId = request.studentId();
    if (request.planInstanceId() != null) {
      var plan = planDirectory.requirePlan(request.planInstanceId());
      if (studentId == null) {
        studentId = plan.getStudentId();
      }
    }
    if (studentId != null) {
      planDirectory.requireStudent(studentId);
    }

    var task =
        taskRepository.save(
            new ComplianceTask(
                request.taskType(),
                request.title(),
                request.description(),
                request.dueDate(),
                priority,
                request.assignedToUserId(),
                request.reviewScheduleId(),
                request.planInstanceId(),
                studentId,
                actor.id()));

    log.info("Created compliance task {} ({})", task.getId(), task.getTaskType());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("compliance_task.created")
            .entityType("compliance_task")
            .entityId(task.getId())
            .actor(actor)
            .details(Map.of("task_type", task.getTaskType().name(), "title", task.getTitle()))
            .build());

    return ComplianceTaskResponse.from(task);
  }

  /**
   * Tasks matching every given filter, most urgent first. {@code overdue = true} keeps only
   * OPEN or IN_PROGRESS tasks past their due date.
   */
  @Transactional(readOnly = true)
  public List<ComplianceTaskResponse> listTasks(
      Actor actor,
      ComplianceTaskStatus status,
      ComplianceTaskType taskType,
      UUID assignedTo,
      UUID studentId,
      UUID planId,
      boolean overdue) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.VIEW_COMPLIANCE_TASKS);
    LocalDate today = LocalDate.now(clock);
    return taskRepository.findByFilters(status, taskType, assignedTo, studentId, planId).stream()
        .filter(task -> !overdue || task.isOverdue(today))
        .map(ComplianceTaskResponse::from)
        .toList();
  }

  /** Tasks assigned to the actor; OPEN and IN_PROGRESS unless a status is given. */
  @Transactional(readOnly = true)
  public List<ComplianceTaskResponse> myTasks(Actor actor, ComplianceTaskStatus status) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.VIEW_COMPLIANCE_TASKS);
    Set<ComplianceTaskStatus> statuses =
        status != null ? Set.of(status) : ComplianceTaskStatus.ACTIVE;
    return taskRepository.findAssignedTo(actor.id(), statuses).stream()
        .map(ComplianceTaskResponse::from)
        .toList();
  }

  @Transactional(readOnly = true)
  public ComplianceTaskDashboardResponse dashboard(Actor actor) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.VIEW_COMPLIANCE_TASKS);
    LocalDate today = LocalDate.now(clock);
    var active = ComplianceTaskStatus.ACTIVE;

    var summary =
        new ComplianceTaskDashboardResponse.Summary(
            taskRepository.countByStatus(ComplianceTaskStatus.OPEN),
            taskRepository.countByStatus(ComplianceTaskStatus.IN_PROGRESS),
            taskRepository.countOverdue(active, today),
            taskRepository.countDueBetween(active, today, today.plusDays(DASHBOARD_DUE_DAYS)));
    var recent =
        taskRepository.findMostPressing(active).stream()
            .map(ComplianceTaskResponse::from)
            .toList();
    return new ComplianceTaskDashboardResponse(summary, recent);
  }

  @Transactional(readOnly = true)
  public ComplianceTaskResponse getTask(Actor actor, UUID id) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.VIEW_COMPLIANCE_TASKS);
    return ComplianceTaskResponse.from(requireTask(id));
  }

  @Transactional
  public ComplianceTaskResponse updateTask(
      Actor actor, UUID id, UpdateComplianceTaskRequest request) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.MANAGE_COMPLIANCE_TASKS);
    if (request.priority() != null) {
      requireValidPriority(request.priority());
    }
    var task = requireTask(id);
    var previousStatus = task.getStatus();

    if (request.status() != null) {
      task.transitionTo(request.status(), actor.id(), clock.instant());
    }
    task.updateDetails(
        request.title() != null ? request.title() : task.getTitle(),
        request.description() != null ? request.description() : task.getDescription(),
        request.clearDueDate()
            ? null
            : request.dueDate() != null ? request.dueDate() : task.getDueDate(),
        request.priority() != null ? request.priority() : task.getPriority(),
        request.clearAssignee()
            ? null
            : request.assignedToUserId() != null
                ? request.assignedToUserId()
                : task.getAssignedToUserId());
    task = taskRepository.save(task);

    log.info("Updated compliance task {} (status {})", id, task.getStatus());

    var details = new HashMap<String, Object>();
    details.put("previous_status", previousStatus.name());
    details.put("status", task.getStatus().name());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("compliance_task.updated")
            .entityType("compliance_task")
            .entityId(id)
            .actor(actor)
            .details(details)
            .build());

    return ComplianceTaskResponse.from(task);
  }

  @Transactional
  public ComplianceTaskResponse completeTask(Actor actor, UUID id, String notes) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.MANAGE_COMPLIANCE_TASKS);
    var task = requireTask(id);

    task.complete(actor.id(), clock.instant(), notes);
    task = taskRepository.save(task);

    log.info("Completed compliance task {}", id);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("compliance_task.completed")
            .entityType("compliance_task")
            .entityId(id)
            .actor(actor)
            .details(Map.of("task_type", task.getTaskType().name()))
            .build());

    return ComplianceTaskResponse.from(task);
  }

  @Transactional
  public ComplianceTaskResponse dismissTask(Actor actor, UUID id, String reason) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.MANAGE_COMPLIANCE_TASKS);
    if (reason == null || reason.isBlank()) {
      throw new InvalidStateException("Dismissal reason required", "reason must not be blank");
    }
    var task = requireTask(id);

    task.dismiss(actor.id(), clock.instant(), reason.trim());
    task = taskRepository.save(task);

    log.info("Dismissed compliance task {}", id);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("compliance_task.dismissed")
            .entityType("compliance_task")
            .entityId(id)
            .actor(actor)
            .details(Map.of("reason", task.getDismissReason()))
            .build());

    return ComplianceTaskResponse.from(task);
  }

  public List<TaskTypeResponse> taskTypes() {
    return Arrays.stream(ComplianceTaskType.values()).map(TaskTypeResponse::from).toList();
  }

  private ComplianceTask requireTask(UUID id) {
    return taskRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("ComplianceTask", id));
  }

  private static void requireValidPriority(int priority) {
    if (priority < ComplianceTask.MIN_PRIORITY || priority > ComplianceTask.MAX_PRIORITY) {
      throw new InvalidStateException(
          "Invalid priority",
          "priority must be between "
              + ComplianceTask.MIN_PRIORITY
              + " and "
              + ComplianceTask.MAX_PRIORITY);
    }
  }
}
