package io.caseworks.backend.compliancetask;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.caseworks.backend.plan.PlanDirectory;
import io.caseworks.backend.plan.PlanInstance;
import io.caseworks.backend.plan.Student;
import io.caseworks.backend.review.ReviewSchedule;
import io.caseworks.backend.review.ScheduleType;
import java.time.LocalDate;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LeadWindowTaskGeneratorTest {

  private static final LocalDate TODAY = LocalDate.of(2025, 3, 1);
  private static final UUID PLAN_ID = UUID.randomUUID();
  private static final UUID STUDENT_ID = UUID.randomUUID();
  private static final UUID ACTOR_ID = UUID.randomUUID();
  private static final UUID ASSIGNEE_ID = UUID.randomUUID();

  @Mock private ComplianceTaskRepository taskRepository;
  @Mock private PlanDirectory planDirectory;

  private LeadWindowTaskGenerator generator;

  @BeforeEach
  void setUp() {
    generator = new LeadWindowTaskGenerator(taskRepository, planDirectory);
  }

  @Test
  void isWithinLeadWindow_includesFirstDayOfWindow() {
    assertThat(LeadWindowTaskGenerator.isWithinLeadWindow(TODAY.plusDays(30), 30, TODAY)).isTrue();
    assertThat(LeadWindowTaskGenerator.isWithinLeadWindow(TODAY.plusDays(31), 30, TODAY)).isFalse();
  }

  @Test
  void isWithinLeadWindow_pastDueDatesAreInside() {
    assertThat(LeadWindowTaskGenerator.isWithinLeadWindow(TODAY.minusDays(3), 1, TODAY)).isTrue();
  }

  @Test
  void createsDueSoonTaskWhenInsideWindow() {
    var schedule = schedule(TODAY.plusDays(10), 30);
    var plan = plan();
    var student = mock(Student.class);
    when(student.getFullName()).thenReturn("Jamie Rivera");
    when(planDirectory.requireStudent(STUDENT_ID)).thenReturn(student);
    when(taskRepository.save(any(ComplianceTask.class))).thenAnswer(inv -> inv.getArgument(0));

    var task = generator.maybeCreateLeadWindowTask(schedule, plan, ACTOR_ID, TODAY);

    assertThat(task).isPresent();
    assertThat(task.get().getTaskType()).isEqualTo(ComplianceTaskType.REVIEW_DUE_SOON);
    assertThat(task.get().getStatus()).isEqualTo(ComplianceTaskStatus.OPEN);
    assertThat(task.get().getTitle()).isEqualTo("IEP Annual Review due soon");
    assertThat(task.get().getDescription())
        .isEqualTo("Review for Jamie Rivera is due on " + TODAY.plusDays(10));
    assertThat(task.get().getDueDate()).isEqualTo(TODAY.plusDays(10));
    assertThat(task.get().getPriority()).isEqualTo(LeadWindowTaskGenerator.DUE_SOON_PRIORITY);
    assertThat(task.get().getAssignedToUserId()).isEqualTo(ASSIGNEE_ID);
    assertThat(task.get().getPlanInstanceId()).isEqualTo(PLAN_ID);
    assertThat(task.get().getStudentId()).isEqualTo(STUDENT_ID);
    assertThat(task.get().getCreatedByUserId()).isEqualTo(ACTOR_ID);
  }

  @Test
  void createsNothingBeforeWindowOpens() {
    var schedule = schedule(TODAY.plusDays(10), 5);

    var task = generator.maybeCreateLeadWindowTask(schedule, mock(PlanInstance.class), ACTOR_ID, TODAY);

    assertThat(task).isEmpty();
    verify(taskRepository, never()).save(any());
  }

  private static ReviewSchedule schedule(LocalDate dueDate, int leadDays) {
    return new ReviewSchedule(
        PLAN_ID, ScheduleType.IEP_ANNUAL_REVIEW, dueDate, leadDays, null, ASSIGNEE_ID, ACTOR_ID);
  }

  private static PlanInstance plan() {
    var plan = mock(PlanInstance.class);
    when(plan.getId()).thenReturn(PLAN_ID);
    when(plan.getStudentId()).thenReturn(STUDENT_ID);
    return plan;
  }
}
