package io.caseworks.backend.review;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.caseworks.backend.audit.ActorType;
import io.caseworks.backend.audit.AuditEventRecord;
import io.caseworks.backend.audit.AuditService;
import io.caseworks.backend.audit.AuditSource;
import io.caseworks.backend.compliancetask.ComplianceTask;
import io.caseworks.backend.compliancetask.ComplianceTaskRepository;
import io.caseworks.backend.compliancetask.ComplianceTaskStatus;
import io.caseworks.backend.compliancetask.ComplianceTaskType;
import io.caseworks.backend.compliancetask.LeadWindowTaskGenerator;
import io.caseworks.backend.config.CaseworksProperties;
import io.caseworks.backend.exception.ForbiddenException;
import io.caseworks.backend.exception.InvalidStateException;
import io.caseworks.backend.exception.ResourceConflictException;
import io.caseworks.backend.plan.PlanDirectory;
import io.caseworks.backend.plan.PlanInstance;
import io.caseworks.backend.plan.Student;
import io.caseworks.backend.review.dto.CreateReviewScheduleRequest;
import io.caseworks.backend.security.Actor;
import io.caseworks.backend.security.Role;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class ReviewScheduleServiceTest {

  private static final Instant NOW = Instant.parse("2025-03-01T09:00:00Z");
  private static final LocalDate TODAY = LocalDate.of(2025, 3, 1);
  private static final UUID PLAN_ID = UUID.randomUUID();
  private static final UUID STUDENT_ID = UUID.randomUUID();
  private static final UUID SCHEDULE_ID = UUID.randomUUID();
  private static final Actor CASE_MANAGER = new Actor(UUID.randomUUID(), Role.CASE_MANAGER);
  private static final Actor TEACHER = new Actor(UUID.randomUUID(), Role.TEACHER);

  @Mock private ReviewScheduleRepository reviewScheduleRepository;
  @Mock private ComplianceTaskRepository taskRepository;
  @Mock private LeadWindowTaskGenerator leadWindowTaskGenerator;
  @Mock private PlanDirectory planDirectory;
  @Mock private AuditService auditService;
  @Mock private ApplicationEventPublisher eventPublisher;

  private ReviewScheduleService service;

  @BeforeEach
  void setUp() {
    var properties =
        new CaseworksProperties(
            new CaseworksProperties.RuleCatalog(false, "classpath:rule-catalog/catalog.json"),
            new CaseworksProperties.ReviewSchedules(30, false, "0 15 1 * * *"));
    service =
        new ReviewScheduleService(
            reviewScheduleRepository,
            taskRepository,
            leadWindowTaskGenerator,
            planDirectory,
            auditService,
            eventPublisher,
            properties,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void createSchedule_appliesDefaultLeadDays() {
    var plan = mock(PlanInstance.class);
    when(planDirectory.requirePlan(PLAN_ID)).thenReturn(plan);
    when(reviewScheduleRepository.save(any(ReviewSchedule.class)))
        .thenAnswer(inv -> inv.getArgument(0));
    when(leadWindowTaskGenerator.maybeCreateLeadWindowTask(
            any(ReviewSchedule.class), eq(plan), eq(CASE_MANAGER.id()), eq(TODAY)))
        .thenReturn(Optional.empty());

    var response =
        service.createSchedule(
            CASE_MANAGER,
            PLAN_ID,
            new CreateReviewScheduleRequest(
                ScheduleType.IEP_ANNUAL_REVIEW, TODAY.plusDays(90), null, null, null));

    assertThat(response.reviewSchedule().leadDays()).isEqualTo(30);
    assertThat(response.reviewSchedule().status()).isEqualTo(ReviewScheduleStatus.OPEN);
    assertThat(response.tasks()).isEmpty();
  }

  @Test
  void createSchedule_rejectsTeacher() {
    assertThatThrownBy(
            () ->
                service.createSchedule(
                    TEACHER,
                    PLAN_ID,
                    new CreateReviewScheduleRequest(
                        ScheduleType.IEP_ANNUAL_REVIEW, TODAY, 10, null, null)))
        .isInstanceOf(ForbiddenException.class);
    verify(reviewScheduleRepository, never()).save(any());
  }

  @Test
  void completeSchedule_completesActiveTasksWithSameTimestamp() {
    var schedule = schedule(TODAY.plusDays(5));
    var open = task();
    var inProgress = task();
    inProgress.transitionTo(ComplianceTaskStatus.IN_PROGRESS, CASE_MANAGER.id(), NOW);
    when(reviewScheduleRepository.findById(SCHEDULE_ID)).thenReturn(Optional.of(schedule));
    when(reviewScheduleRepository.saveAndFlush(schedule)).thenReturn(schedule);
    when(taskRepository.findByReviewScheduleIdAndStatusIn(
            SCHEDULE_ID, ComplianceTaskStatus.ACTIVE))
        .thenReturn(List.of(open, inProgress));
    when(taskRepository.findByReviewScheduleIdOrderByCreatedAtDesc(any()))
        .thenReturn(List.of(open, inProgress));

    var response = service.completeSchedule(CASE_MANAGER, SCHEDULE_ID, "Met with family");

    assertThat(schedule.getStatus()).isEqualTo(ReviewScheduleStatus.COMPLETE);
    assertThat(schedule.getCompletedAt()).isEqualTo(NOW);
    assertThat(schedule.getNotes()).isEqualTo("Completion notes: Met with family");
    assertThat(List.of(open, inProgress))
        .allSatisfy(
            task -> {
              assertThat(task.getStatus()).isEqualTo(ComplianceTaskStatus.COMPLETE);
              assertThat(task.getCompletedAt()).isEqualTo(NOW);
              assertThat(task.getCompletedByUserId()).isEqualTo(CASE_MANAGER.id());
            });
    assertThat(response.tasks()).hasSize(2);

    var eventCaptor = ArgumentCaptor.forClass(ReviewScheduleCompletedEvent.class);
    verify(eventPublisher).publishEvent(eventCaptor.capture());
    assertThat(eventCaptor.getValue().tasksCompleted()).isEqualTo(2);
  }

  @Test
  void completeSchedule_rejectsCompletedSchedule() {
    var schedule = schedule(TODAY);
    schedule.complete(CASE_MANAGER.id(), NOW, null);
    when(reviewScheduleRepository.findById(SCHEDULE_ID)).thenReturn(Optional.of(schedule));

    assertThatThrownBy(() -> service.completeSchedule(CASE_MANAGER, SCHEDULE_ID, null))
        .isInstanceOf(ResourceConflictException.class);
    verify(taskRepository, never()).saveAll(any());
  }

  @Test
  void deleteSchedule_requiresAdmin() {
    assertThatThrownBy(() -> service.deleteSchedule(CASE_MANAGER, SCHEDULE_ID))
        .isInstanceOf(ForbiddenException.class);
    verify(taskRepository, never()).deleteByReviewScheduleId(any());
  }

  @Test
  void deleteSchedule_removesTasksBeforeSchedule() {
    var admin = new Actor(UUID.randomUUID(), Role.ADMIN);
    var schedule = schedule(TODAY);
    when(reviewScheduleRepository.findById(SCHEDULE_ID)).thenReturn(Optional.of(schedule));
    when(taskRepository.deleteByReviewScheduleId(SCHEDULE_ID)).thenReturn(3);

    service.deleteSchedule(admin, SCHEDULE_ID);

    var order = inOrder(taskRepository, reviewScheduleRepository);
    order.verify(taskRepository).deleteByReviewScheduleId(SCHEDULE_ID);
    order.verify(reviewScheduleRepository).delete(schedule);
    var eventCaptor = ArgumentCaptor.forClass(ReviewScheduleDeletedEvent.class);
    verify(eventPublisher).publishEvent(eventCaptor.capture());
    assertThat(eventCaptor.getValue().tasksDeleted()).isEqualTo(3);
  }

  @Test
  void dashboard_rejectsWindowOutsideRange() {
    assertThatThrownBy(() -> service.dashboard(CASE_MANAGER, 0))
        .isInstanceOf(InvalidStateException.class);
    assertThatThrownBy(() -> service.dashboard(CASE_MANAGER, 366))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void dashboard_splitsOverdueAndUpcoming() {
    var pastDue = schedule(TODAY.minusDays(2));
    var dueSoon = schedule(TODAY.plusDays(10));
    var dueLater = schedule(TODAY.plusDays(45));
    when(reviewScheduleRepository.findByStatusInAndDueDateLessThanEqualOrderByDueDateAsc(
            ReviewScheduleStatus.OUTSTANDING, TODAY.plusDays(60)))
        .thenReturn(List.of(pastDue, dueSoon, dueLater));

    var dashboard = service.dashboard(TEACHER, 60);

    assertThat(dashboard.overdue()).hasSize(1);
    assertThat(dashboard.upcoming()).hasSize(2);
    assertThat(dashboard.summary().overdueCount()).isEqualTo(1);
    assertThat(dashboard.summary().upcomingCount()).isEqualTo(2);
    assertThat(dashboard.summary().totalDueWithin30Days()).isEqualTo(2);
  }

  @Test
  void markOverdue_createsOverdueTaskAsSystem() {
    var schedule = schedule(TODAY.minusDays(1));
    var plan = mock(PlanInstance.class);
    var student = mock(Student.class);
    when(plan.getId()).thenReturn(PLAN_ID);
    when(plan.getStudentId()).thenReturn(STUDENT_ID);
    when(student.getFullName()).thenReturn("Jamie Rivera");
    when(reviewScheduleRepository.findById(SCHEDULE_ID)).thenReturn(Optional.of(schedule));
    when(taskRepository.existsByReviewScheduleIdAndTaskTypeAndStatusIn(
            SCHEDULE_ID, ComplianceTaskType.REVIEW_OVERDUE, ComplianceTaskStatus.ACTIVE))
        .thenReturn(false);
    when(planDirectory.requirePlan(PLAN_ID)).thenReturn(plan);
    when(planDirectory.requireStudent(STUDENT_ID)).thenReturn(student);
    when(taskRepository.save(any(ComplianceTask.class))).thenAnswer(inv -> inv.getArgument(0));

    boolean marked = service.markOverdue(SCHEDULE_ID, TODAY);

    assertThat(marked).isTrue();
    assertThat(schedule.getStatus()).isEqualTo(ReviewScheduleStatus.OVERDUE);
    var taskCaptor = ArgumentCaptor.forClass(ComplianceTask.class);
    verify(taskRepository).save(taskCaptor.capture());
    assertThat(taskCaptor.getValue().getTaskType()).isEqualTo(ComplianceTaskType.REVIEW_OVERDUE);
    assertThat(taskCaptor.getValue().getPriority())
        .isEqualTo(ReviewScheduleService.OVERDUE_TASK_PRIORITY);
    assertThat(taskCaptor.getValue().getTitle()).isEqualTo("IEP Annual Review overdue");

    var auditCaptor = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(auditCaptor.capture());
    assertThat(auditCaptor.getValue().actorType()).isEqualTo(ActorType.SYSTEM);
    assertThat(auditCaptor.getValue().source()).isEqualTo(AuditSource.SCHEDULED);
    assertThat(auditCaptor.getValue().actorId()).isNull();
  }

  @Test
  void markOverdue_skipsTaskWhenActiveOneExists() {
    var schedule = schedule(TODAY.minusDays(1));
    when(reviewScheduleRepository.findById(SCHEDULE_ID)).thenReturn(Optional.of(schedule));
    when(taskRepository.existsByReviewScheduleIdAndTaskTypeAndStatusIn(
            SCHEDULE_ID, ComplianceTaskType.REVIEW_OVERDUE, ComplianceTaskStatus.ACTIVE))
        .thenReturn(true);

    assertThat(service.markOverdue(SCHEDULE_ID, TODAY)).isTrue();
    verify(taskRepository, never()).save(any());
  }

  @Test
  void markOverdue_ignoresScheduleNoLongerPastDue() {
    var schedule = schedule(TODAY);
    when(reviewScheduleRepository.findById(SCHEDULE_ID)).thenReturn(Optional.of(schedule));

    assertThat(service.markOverdue(SCHEDULE_ID, TODAY)).isFalse();
    assertThat(schedule.getStatus()).isEqualTo(ReviewScheduleStatus.OPEN);
    verify(auditService, never()).log(any());
  }

  private static ReviewSchedule schedule(LocalDate dueDate) {
    return new ReviewSchedule(
        PLAN_ID, ScheduleType.IEP_ANNUAL_REVIEW, dueDate, 30, null, null, CASE_MANAGER.id());
  }

  private static ComplianceTask task() {
    return new ComplianceTask(
        ComplianceTaskType.REVIEW_DUE_SOON,
        "IEP Annual Review due soon",
        null,
        TODAY.plusDays(5),
        2,
        null,
        SCHEDULE_ID,
        PLAN_ID,
        STUDENT_ID,
        CASE_MANAGER.id());
  }
}
