package io.caseworks.backend.compliancetask;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ComplianceTaskRepository extends JpaRepository<ComplianceTask, UUID> {

  @Query(
      """
      SELECT t FROM ComplianceTask t
      WHERE (:status IS NULL OR t.status = :status)
        AND (:taskType IS NULL OR t.taskType = :taskType)
        AND (:assignedTo IS NULL OR t.assignedToUserId = :assignedTo)
        AND (:studentId IS NULL OR t.studentId = :studentId)
        AND (:planId IS NULL OR t.planInstanceId = :planId)
      ORDER BY t.priority DESC, t.dueDate ASC NULLS LAST, t.createdAt ASC
      """)
  List<ComplianceTask> findByFilters(
      @Param("status") ComplianceTaskStatus status,
      @Param("taskType") ComplianceTaskType taskType,
      @Param("assignedTo") UUID assignedTo,
      @Param("studentId") UUID studentId,
      @Param("planId") UUID planId);

  @Query(
      """
      SELECT t FROM ComplianceTask t
      WHERE t.assignedToUserId = :userId AND t.status IN :statuses
      ORDER BY t.priority DESC, t.dueDate ASC NULLS LAST, t.createdAt ASC
      """)
  List<ComplianceTask> findAssignedTo(
      @Param("userId") UUID userId,
      @Param("statuses") Collection<ComplianceTaskStatus> statuses);

  List<ComplianceTask> findByReviewScheduleIdOrderByCreatedAtDesc(UUID reviewScheduleId);

  List<ComplianceTask> findByReviewScheduleIdAndStatusIn(
      UUID reviewScheduleId, Collection<ComplianceTaskStatus> statuses);

  boolean existsByReviewScheduleIdAndTaskTypeAndStatusIn(
      UUID reviewScheduleId,
      ComplianceTaskType taskType,
      Collection<ComplianceTaskStatus> statuses);

  long countByStatus(ComplianceTaskStatus status);

  @Query(
      """
      SELECT COUNT(t) FROM ComplianceTask t
      WHERE t.status IN :statuses AND t.dueDate >= :from AND t.dueDate <= :to
      """)
  long countDueBetween(
      @Param("statuses") Collection<ComplianceTaskStatus> statuses,
      @Param("from") LocalDate from,
      @Param("to") LocalDate to);

  @Query(
      "SELECT COUNT(t) FROM ComplianceTask t WHERE t.status IN :statuses AND t.dueDate < :today")
  long countOverdue(
      @Param("statuses") Collection<ComplianceTaskStatus> statuses,
      @Param("today") LocalDate today);

  @Query(
      """
      SELECT t FROM ComplianceTask t
      WHERE t.status IN :statuses
      ORDER BY t.priority DESC, t.dueDate ASC NULLS LAST, t.createdAt ASC
      LIMIT 10
      """)
  List<ComplianceTask> findMostPressing(
      @Param("statuses") Collection<ComplianceTaskStatus> statuses);

  @Modifying(flushAutomatically = true)
  @Query("DELETE FROM ComplianceTask t WHERE t.reviewScheduleId = :reviewScheduleId")
  int deleteByReviewScheduleId(@Param("reviewScheduleId") UUID reviewScheduleId);
}
