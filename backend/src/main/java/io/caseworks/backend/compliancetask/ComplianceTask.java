package io.caseworks.backend.compliancetask;

import io.caseworks.backend.exception.ResourceConflictException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "compliance_tasks")
public class ComplianceTask {

  public static final int MIN_PRIORITY = 1;
  public static final int MAX_PRIORITY = 5;

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Enumerated(EnumType.STRING)
  @Column(name = "task_type", nullable = false, length = 30)
  private ComplianceTaskType taskType;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ComplianceTaskStatus status;

  @Column(name = "title", nullable = false, length = 300)
  private String title;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "due_date")
  private LocalDate dueDate;

  @Column(name = "priority", nullable = false)
  private int priority;

  @Column(name = "assigned_to_user_id")
  private UUID assignedToUserId;

  @Column(name = "review_schedule_id")
  private UUID reviewScheduleId;

  @Column(name = "plan_instance_id")
  private UUID planInstanceId;

  @Column(name = "student_id")
  private UUID studentId;

  @Column(name = "created_by_user_id")
  private UUID createdByUserId;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Column(name = "completed_by_user_id")
  private UUID completedByUserId;

  @Column(name = "dismissed_at")
  private Instant dismissedAt;

  @Column(name = "dismissed_by_user_id")
  private UUID dismissedByUserId;

  @Column(name = "dismiss_reason", columnDefinition = "TEXT")
  private String dismissReason;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ComplianceTask() {}

  public ComplianceTask(
      ComplianceTaskType taskType,
      String title,
      String description,
      LocalDate dueDate,
      int priority,
      UUID assignedToUserId,
      UUID reviewScheduleId,
      UUID planInstanceId,
      UUID studentId,
      UUID createdByUserId) {
    this.taskType = taskType;
    this.status = ComplianceTaskStatus.OPEN;
    this.title = title;
    this.description = description;
    this.dueDate = dueDate;
    this.priority = priority;
    this.assignedToUserId = assignedToUserId;
    this.reviewScheduleId = reviewScheduleId;
    this.planInstanceId = planInstanceId;
    this.studentId = studentId;
    this.createdByUserId = createdByUserId;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void updateDetails(
      String title, String description, LocalDate dueDate, int priority, UUID assignedToUserId) {
    this.title = title;
    this.description = description;
    this.dueDate = dueDate;
    this.priority = priority;
    this.assignedToUserId = assignedToUserId;
    this.updatedAt = Instant.now();
  }

  /**
   * Moves the task to {@code target}. Moving to COMPLETE stamps the completion; moving back to
   * OPEN or IN_PROGRESS leaves completion fields empty. Dismissal goes through {@link #dismiss}.
   */
  public void transitionTo(ComplianceTaskStatus target, UUID actorId, Instant at) {
    if (target == this.status) {
      return;
    }
    if (target == ComplianceTaskStatus.DISMISSED) {
      throw new ResourceConflictException(
          "Invalid task state", "Use dismiss to dismiss a compliance task");
    }
    requireTransition(target, "move");
    if (target == ComplianceTaskStatus.COMPLETE) {
      this.completedAt = at;
      this.completedByUserId = actorId;
    }
    this.status = target;
    this.updatedAt = Instant.now();
  }

  /** Completes the task; non-blank notes are appended to the description. */
  public void complete(UUID actorId, Instant at, String notes) {
    requireTransition(ComplianceTaskStatus.COMPLETE, "complete");
    this.status = ComplianceTaskStatus.COMPLETE;
    this.completedAt = at;
    this.completedByUserId = actorId;
    if (notes != null && !notes.isBlank()) {
      this.description = appendParagraph(this.description, "Completion notes: " + notes);
    }
    this.updatedAt = Instant.now();
  }

  public void dismiss(UUID actorId, Instant at, String reason) {
    requireTransition(ComplianceTaskStatus.DISMISSED, "dismiss");
    this.status = ComplianceTaskStatus.DISMISSED;
    this.dismissedAt = at;
    this.dismissedByUserId = actorId;
    this.dismissReason = reason;
    this.description = appendParagraph(this.description, "Dismissed: " + reason);
    this.updatedAt = Instant.now();
  }

  public boolean isOverdue(LocalDate today) {
    return status != null && !status.isTerminal() && dueDate != null && dueDate.isBefore(today);
  }

  private void requireTransition(ComplianceTaskStatus target, String action) {
    if (!this.status.canTransitionTo(target)) {
      throw new ResourceConflictException(
          "Invalid task state", "Cannot " + action + " compliance task in status " + this.status);
    }
  }

  static String appendParagraph(String existing, String paragraph) {
    return ((existing != null ? existing : "") + "\n\n" + paragraph).trim();
  }

  public UUID getId() {
    return id;
  }

  public ComplianceTaskType getTaskType() {
    return taskType;
  }

  public ComplianceTaskStatus getStatus() {
    return status;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public LocalDate getDueDate() {
    return dueDate;
  }

  public int getPriority() {
    return priority;
  }

  public UUID getAssignedToUserId() {
    return assignedToUserId;
  }

  public UUID getReviewScheduleId() {
    return reviewScheduleId;
  }

  public UUID getPlanInstanceId() {
    return planInstanceId;
  }

  public UUID getStudentId() {
    return studentId;
  }

  public UUID getCreatedByUserId() {
    return createdByUserId;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public UUID getCompletedByUserId() {
    return completedByUserId;
  }

  public Instant getDismissedAt() {
    return dismissedAt;
  }

  public UUID getDismissedByUserId() {
    return dismissedByUserId;
  }

  public String getDismissReason() {
    return dismissReason;
  }

  public int getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
