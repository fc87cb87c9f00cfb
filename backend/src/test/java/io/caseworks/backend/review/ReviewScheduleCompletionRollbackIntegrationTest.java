package io.caseworks.backend.review;

import static io.caseworks.backend.testutil.TestJwts.caseManagerJwt;
import static io.caseworks.backend.testutil.TestJwts.extractIdFromLocation;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.caseworks.backend.TestcontainersConfiguration;
import io.caseworks.backend.compliancetask.ComplianceTaskRepository;
import io.caseworks.backend.exception.ResourceConflictException;
import io.caseworks.backend.testutil.TestPlanFactory;
import java.time.LocalDate;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoSpyBean;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Testcontainers;

/** A failure while completing tasks must leave the schedule and its tasks untouched. */
@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class ReviewScheduleCompletionRollbackIntegrationTest {

  private static final UUID CASE_MANAGER_ID = UUID.randomUUID();

  @Autowired private MockMvc mockMvc;
  @Autowired private JdbcTemplate jdbcTemplate;
  @MockitoSpyBean private ComplianceTaskRepository taskRepository;

  @Test
  void shouldRollBackScheduleWhenTaskCompletionFails() throws Exception {
    UUID planId = TestPlanFactory.createIepPlan(jdbcTemplate, "Casey", "Morgan");
    var result =
        mockMvc
            .perform(
                post("/api/plans/" + planId + "/review-schedules")
                    .with(caseManagerJwt(CASE_MANAGER_ID))
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"scheduleType": "IEP_ANNUAL_REVIEW", "dueDate": "%s", "leadDays": 30}
                        """
                            .formatted(LocalDate.now().plusDays(5))))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.tasks[0].status").value("OPEN"))
            .andReturn();
    UUID scheduleId = UUID.fromString(extractIdFromLocation(result));

    doThrow(new ResourceConflictException("Simulated failure", "task store unavailable"))
        .when(taskRepository)
        .findByReviewScheduleIdAndStatusIn(eq(scheduleId), any());

    mockMvc
        .perform(
            post("/api/review-schedules/" + scheduleId + "/complete")
                .with(caseManagerJwt(CASE_MANAGER_ID)))
        .andExpect(status().isConflict());

    mockMvc
        .perform(
            get("/api/review-schedules/" + scheduleId).with(caseManagerJwt(CASE_MANAGER_ID)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.reviewSchedule.status").value("OPEN"))
        .andExpect(jsonPath("$.reviewSchedule.completedAt").doesNotExist())
        .andExpect(jsonPath("$.tasks[0].status").value("OPEN"));
  }
}
