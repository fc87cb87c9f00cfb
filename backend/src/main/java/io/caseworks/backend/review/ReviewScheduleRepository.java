package io.caseworks.backend.review;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ReviewScheduleRepository extends JpaRepository<ReviewSchedule, UUID> {

  @Query(
      """
      SELECT s FROM ReviewSchedule s
      WHERE s.planInstanceId = :planId
        AND (:status IS NULL OR s.status = :status)
        AND (:scheduleType IS NULL OR s.scheduleType = :scheduleType)
      ORDER BY s.dueDate ASC
      """)
  List<ReviewSchedule> findForPlan(
      @Param("planId") UUID planId,
      @Param("status") ReviewScheduleStatus status,
      @Param("scheduleType") ScheduleType scheduleType);

  List<ReviewSchedule> findByStatusInAndDueDateLessThanEqualOrderByDueDateAsc(
      Collection<ReviewScheduleStatus> statuses, LocalDate dueOnOrBefore);

  List<ReviewSchedule> findByStatusAndDueDateBefore(
      ReviewScheduleStatus status, LocalDate dueBefore);
}
