package io.caseworks.backend.review;

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

/** A compliance due date tracked for a plan, such as an annual IEP review. */
@Entity
@Table(name = "review_schedules")
public class ReviewSchedule {

  public static final int MIN_LEAD_DAYS = 1;
  public static final int MAX_LEAD_DAYS = 365;

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "plan_instance_id", nullable = false, updatable = false)
  private UUID planInstanceId;

  @Enumerated(EnumType.STRING)
  @Column(name = "schedule_type", nullable = false, length = 40)
  private ScheduleType scheduleType;

  @Column(name = "due_date", nullable = false)
  private LocalDate dueDate;

  @Column(name = "lead_days", nullable = false)
  private int leadDays;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ReviewScheduleStatus status;

  @Column(name = "notes", columnDefinition = "TEXT")
  private String notes;

  @Column(name = "assigned_to_user_id")
  private UUID assignedToUserId;

  @Column(name = "created_by_user_id", nullable = false, updatable = false)
  private UUID createdByUserId;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Column(name = "completed_by_user_id")
  private UUID completedByUserId;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ReviewSchedule() {}

  public ReviewSchedule(
      UUID planInstanceId,
      ScheduleType scheduleType,
      LocalDate dueDate,
      int leadDays,
      String notes,
      UUID assignedToUserId,
      UUID createdByUserId) {
    this.planInstanceId = planInstanceId;
    this.scheduleType = scheduleType;
    this.dueDate = dueDate;
    this.leadDays = leadDays;
    this.status = ReviewScheduleStatus.OPEN;
    this.notes = notes;
    this.assignedToUserId = assignedToUserId;
    this.createdByUserId = createdByUserId;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /**
   * Patches the editable fields. An OVERDUE schedule whose due date moves to {@code today} or later
   * becomes OPEN again.
   */
  public void updateDetails(
      LocalDate dueDate, int leadDays, String notes, UUID assignedToUserId, LocalDate today) {
    requireNotComplete("update");
    this.dueDate = dueDate;
    this.leadDays = leadDays;
    this.notes = notes;
    this.assignedToUserId = assignedToUserId;
    if (status == ReviewScheduleStatus.OVERDUE && !dueDate.isBefore(today)) {
      this.status = ReviewScheduleStatus.OPEN;
    }
    this.updatedAt = Instant.now();
  }

  /**
   * Marks the schedule COMPLETE. Non-blank notes are appended to the existing notes under a
   * "Completion notes:" heading.
   */
  public void complete(UUID actorId, Instant at, String completionNotes) {
    requireNotComplete("complete");
    this.status = ReviewScheduleStatus.COMPLETE;
    this.completedAt = at;
    this.completedByUserId = actorId;
    if (completionNotes != null && !completionNotes.isBlank()) {
      this.notes =
          ((this.notes != null ? this.notes : "") + "\n\nCompletion notes: " + completionNotes)
              .trim();
    }
    this.updatedAt = Instant.now();
  }

  public void markOverdue() {
    if (!status.canTransitionTo(ReviewScheduleStatus.OVERDUE)) {
      throw new ResourceConflictException(
          "Invalid review schedule state", "Cannot mark review schedule overdue in status " + status);
    }
    this.status = ReviewScheduleStatus.OVERDUE;
    this.updatedAt = Instant.now();
  }

  /** Overdue when marked so, or when still OPEN after its due date. */
  public boolean isOverdue(LocalDate today) {
    return status == ReviewScheduleStatus.OVERDUE
        || (status == ReviewScheduleStatus.OPEN && dueDate.isBefore(today));
  }

  private void requireNotComplete(String action) {
    if (status.isTerminal()) {
      throw new ResourceConflictException(
          "Review schedule already complete",
          "Cannot " + action + " review schedule " + id + " because it is already complete");
    }
  }

  public UUID getId() {
    return id;
  }

  public UUID getPlanInstanceId() {
    return planInstanceId;
  }

  public ScheduleType getScheduleType() {
    return scheduleType;
  }

  public LocalDate getDueDate() {
    return dueDate;
  }

  public int getLeadDays() {
    return leadDays;
  }

  public ReviewScheduleStatus getStatus() {
    return status;
  }

  public String getNotes() {
    return notes;
  }

  public UUID getAssignedToUserId() {
    return assignedToUserId;
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
