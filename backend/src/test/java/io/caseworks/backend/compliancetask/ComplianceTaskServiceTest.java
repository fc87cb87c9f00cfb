package io.caseworks.backend.compliancetask;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.caseworks.backend.audit.AuditService;
import io.caseworks.backend.compliancetask.dto.CreateComplianceTaskRequest;
import io.caseworks.backend.exception.ResourceConflictException;
import io.caseworks.backend.exception.ResourceNotFoundException;
import io.caseworks.backend.plan.PlanDirectory;
import io.caseworks.backend.review.ReviewSchedule;
import io.caseworks.backend.review.ReviewScheduleRepository;
import io.caseworks.backend.review.ScheduleType;
import io.caseworks.backend.security.Actor;
import io.caseworks.backend.security.Role;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ComplianceTaskServiceTest {

  private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");
  private static final Actor CASE_MANAGER = new Actor(UUID.randomUUID(), Role.CASE_MANAGER);
  private static final UUID PLAN_ID = UUID.randomUUID();

  @Mock private ComplianceTaskRepository taskRepository;
  @Mock private ReviewScheduleRepository reviewScheduleRepository;
  @Mock private PlanDirectory planDirectory;
  @Mock private AuditService auditService;

  private ComplianceTaskService service;

  @BeforeEach
  void setUp() {
    service =
        new ComplianceTaskService(
            taskRepository,
            reviewScheduleRepository,
            planDirectory,
            auditService,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void createTask_rejectsCompletedReviewSchedule() {
    var schedule = schedule();
    schedule.complete(CASE_MANAGER.id(), NOW, "Held on time");
    UUID scheduleId = UUID.randomUUID();
    when(reviewScheduleRepository.findById(scheduleId)).thenReturn(Optional.of(schedule));

    assertThatThrownBy(() -> service.createTask(CASE_MANAGER, request(scheduleId)))
        .isInstanceOf(ResourceConflictException.class)
        .satisfies(
            ex ->
                assertThat(((ResourceConflictException) ex).getBody().getTitle())
                    .isEqualTo("Review schedule already complete"));
    verify(taskRepository, never()).save(any());
  }

  @Test
  void createTask_rejectsUnknownReviewSchedule() {
    UUID scheduleId = UUID.randomUUID();
    when(reviewScheduleRepository.findById(scheduleId)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.createTask(CASE_MANAGER, request(scheduleId)))
        .isInstanceOf(ResourceNotFoundException.class);
    verify(taskRepository, never()).save(any());
  }

  @Test
  void createTask_acceptsOpenReviewSchedule() {
    UUID scheduleId = UUID.randomUUID();
    when(reviewScheduleRepository.findById(scheduleId)).thenReturn(Optional.of(schedule()));
    when(taskRepository.save(any(ComplianceTask.class))).thenAnswer(inv -> inv.getArgument(0));

    var response = service.createTask(CASE_MANAGER, request(scheduleId));

    assertThat(response.status()).isEqualTo(ComplianceTaskStatus.OPEN);
    assertThat(response.reviewScheduleId()).isEqualTo(scheduleId);
  }

  private static ReviewSchedule schedule() {
    return new ReviewSchedule(
        PLAN_ID,
        ScheduleType.IEP_ANNUAL_REVIEW,
        LocalDate.of(2025, 4, 1),
        30,
        null,
        null,
        CASE_MANAGER.id());
  }

  private static CreateComplianceTaskRequest request(UUID scheduleId) {
    return new CreateComplianceTaskRequest(
        ComplianceTaskType.MEETING_REQUIRED,
        "Prepare review packet",
        null,
        null,
        null,
        null,
        scheduleId,
        null,
        null);
  }
}
