package io.caseworks.backend.rulepack;

import static io.caseworks.backend.testutil.TestJwts.adminJwt;
import static io.caseworks.backend.testutil.TestJwts.caseManagerJwt;
import static io.caseworks.backend.testutil.TestJwts.extractIdFromLocation;
import static io.caseworks.backend.testutil.TestJwts.teacherJwt;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.caseworks.backend.TestcontainersConfiguration;
import io.caseworks.backend.audit.AuditEventRepository;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class RulePackIntegrationTest {

  private static final UUID ADMIN_ID = UUID.randomUUID();
  private static final UUID CASE_MANAGER_ID = UUID.randomUUID();

  @Autowired private MockMvc mockMvc;
  @Autowired private JdbcTemplate jdbcTemplate;
  @Autowired private AuditEventRepository auditEventRepository;

  private UUID preMeetingDocsDaysId;
  private UUID conferenceNotesRequiredId;
  private UUID defaultDeliveryMethodId;

  @BeforeAll
  void setup() {
    preMeetingDocsDaysId = ruleDefinitionId("PRE_MEETING_DOCS_DAYS");
    conferenceNotesRequiredId = ruleDefinitionId("CONFERENCE_NOTES_REQUIRED");
    defaultDeliveryMethodId = ruleDefinitionId("DEFAULT_DELIVERY_METHOD");
  }

  @Test
  void shouldListSeededRuleDefinitions() throws Exception {
    mockMvc
        .perform(get("/api/rule-packs/definitions").with(caseManagerJwt(CASE_MANAGER_ID)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(10)));
  }

  @Test
  void shouldAssignIncreasingVersionsPerScopeAndPlanType() throws Exception {
    String scopeId = "VER-" + UUID.randomUUID().toString().substring(0, 8);

    for (int expected = 1; expected <= 3; expected++) {
      mockMvc
          .perform(
              post("/api/rule-packs")
                  .with(adminJwt(ADMIN_ID))
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(packJson("DISTRICT", scopeId, "IEP", "Pack " + expected)))
          .andExpect(status().isCreated())
          .andExpect(jsonPath("$.version").value(expected))
          .andExpect(jsonPath("$.isActive").value(true));
    }

    // A different plan type starts its own sequence
    mockMvc
        .perform(
            post("/api/rule-packs")
                .with(adminJwt(ADMIN_ID))
                .contentType(MediaType.APPLICATION_JSON)
                .content(packJson("DISTRICT", scopeId, "BIP", "BIP pack")))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.version").value(1));

    mockMvc
        .perform(
            get("/api/rule-packs")
                .param("scopeId", scopeId)
                .param("planType", "IEP")
                .with(caseManagerJwt(CASE_MANAGER_ID)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(3)))
        .andExpect(jsonPath("$[0].version").value(3));
  }

  @Test
  void shouldRejectPackCreationByCaseManager() throws Exception {
    mockMvc
        .perform(
            post("/api/rule-packs")
                .with(caseManagerJwt(CASE_MANAGER_ID))
                .contentType(MediaType.APPLICATION_JSON)
                .content(packJson("DISTRICT", "NOPE", "IEP", "Not allowed")))
        .andExpect(status().isForbidden());
  }

  @Test
  void shouldRejectPackListingByTeacher() throws Exception {
    mockMvc
        .perform(get("/api/rule-packs").with(teacherJwt(UUID.randomUUID())))
        .andExpect(status().isForbidden());
  }

  @Test
  void shouldRejectInvertedEffectiveWindow() throws Exception {
    mockMvc
        .perform(
            post("/api/rule-packs")
                .with(adminJwt(ADMIN_ID))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {
                      "scopeType": "STATE",
                      "scopeId": "ZZ",
                      "planType": "IEP",
                      "name": "Backwards",
                      "effectiveFrom": "2025-01-01T00:00:00Z",
                      "effectiveTo": "2024-01-01T00:00:00Z"
                    }
                    """))
        .andExpect(status().isBadRequest());
  }

  @Test
  void shouldAttachRuleWithNormalizedConfig() throws Exception {
    String packId = createPack("ATT-" + UUID.randomUUID().toString().substring(0, 8));

    var result =
        mockMvc
            .perform(
                post("/api/rule-packs/" + packId + "/rules")
                    .with(adminJwt(ADMIN_ID))
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"ruleDefinitionId": "%s", "config": {"days": 7}, "sortOrder": 1}
                        """
                            .formatted(preMeetingDocsDaysId)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.ruleKey").value("PRE_MEETING_DOCS_DAYS"))
            .andExpect(jsonPath("$.isEnabled").value(true))
            .andExpect(jsonPath("$.config.kind").value("PRE_MEETING_DOCS_DAYS"))
            .andExpect(jsonPath("$.config.days").value(7))
            .andExpect(jsonPath("$.effectiveConfig.days").value(7))
            .andReturn();
    String ruleId = extractIdFromLocation(result);

    // Clearing the override falls back to the definition default
    mockMvc
        .perform(
            patch("/api/rule-packs/" + packId + "/rules/" + ruleId)
                .with(adminJwt(ADMIN_ID))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"clearConfig": true}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.config").doesNotExist())
        .andExpect(jsonPath("$.effectiveConfig.days").value(5));
  }

  @Test
  void shouldRejectSecondAttachOfSameRule() throws Exception {
    String packId = createPack("DUP-" + UUID.randomUUID().toString().substring(0, 8));
    String body =
        """
        {"ruleDefinitionId": "%s"}
        """
            .formatted(conferenceNotesRequiredId);

    mockMvc
        .perform(
            post("/api/rule-packs/" + packId + "/rules")
                .with(adminJwt(ADMIN_ID))
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
        .andExpect(status().isCreated());
    mockMvc
        .perform(
            post("/api/rule-packs/" + packId + "/rules")
                .with(adminJwt(ADMIN_ID))
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
        .andExpect(status().isConflict());
  }

  @Test
  void shouldRejectConfigOfAnotherKind() throws Exception {
    String packId = createPack("KND-" + UUID.randomUUID().toString().substring(0, 8));

    mockMvc
        .perform(
            post("/api/rule-packs/" + packId + "/rules")
                .with(adminJwt(ADMIN_ID))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"ruleDefinitionId": "%s", "config": {"kind": "POST_MEETING_DOCS_DAYS", "days": 3}}
                    """
                        .formatted(preMeetingDocsDaysId)))
        .andExpect(status().isBadRequest());
  }

  @Test
  void shouldReplaceRulesAndReportUnknownDefinitions() throws Exception {
    String packId = createPack("RPL-" + UUID.randomUUID().toString().substring(0, 8));
    UUID unknownId = UUID.randomUUID();

    mockMvc
        .perform(
            put("/api/rule-packs/" + packId + "/rules")
                .with(adminJwt(ADMIN_ID))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"rules": [
                      {"ruleDefinitionId": "%s", "sortOrder": 2},
                      {"ruleDefinitionId": "%s", "config": {"method": "US_MAIL"}, "sortOrder": 1}
                    ]}
                    """
                        .formatted(conferenceNotesRequiredId, defaultDeliveryMethodId)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.rules", hasSize(2)))
        .andExpect(jsonPath("$.rules[0].ruleKey").value("DEFAULT_DELIVERY_METHOD"))
        .andExpect(jsonPath("$.rules[0].config.method").value("US_MAIL"));

    mockMvc
        .perform(
            put("/api/rule-packs/" + packId + "/rules")
                .with(adminJwt(ADMIN_ID))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"rules": [{"ruleDefinitionId": "%s"}, {"ruleDefinitionId": "%s"}]}
                    """
                        .formatted(preMeetingDocsDaysId, unknownId)))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.missingIds[0]").value(unknownId.toString()));

    // The failed replacement left the previous rules in place
    mockMvc
        .perform(get("/api/rule-packs/" + packId).with(adminJwt(ADMIN_ID)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.rules", hasSize(2)));
  }

  @Test
  void shouldNotReuseVersionOfDeletedNewestPack() throws Exception {
    String scopeId = "HWM-" + UUID.randomUUID().toString().substring(0, 8);
    createPack(scopeId);
    String second = createPack(scopeId);

    mockMvc
        .perform(delete("/api/rule-packs/" + second).with(adminJwt(ADMIN_ID)))
        .andExpect(status().isNoContent());

    mockMvc
        .perform(
            post("/api/rule-packs")
                .with(adminJwt(ADMIN_ID))
                .contentType(MediaType.APPLICATION_JSON)
                .content(packJson("DISTRICT", scopeId, "IEP", "After delete")))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.version").value(3));
  }

  @Test
  void shouldAllocatePastVersionsWrittenDirectly() throws Exception {
    String scopeId = "SQL-" + UUID.randomUUID().toString().substring(0, 8);
    createPack(scopeId);
    jdbcTemplate.update(
        """
        INSERT INTO rule_packs (id, scope_type, scope_id, plan_type, version, name, is_active,
            effective_from, created_at, updated_at)
        VALUES (?, 'DISTRICT', ?, 'IEP', 4, 'Imported pack', TRUE, now(), now(), now())
        """,
        UUID.randomUUID(),
        scopeId);

    mockMvc
        .perform(
            post("/api/rule-packs")
                .with(adminJwt(ADMIN_ID))
                .contentType(MediaType.APPLICATION_JSON)
                .content(packJson("DISTRICT", scopeId, "IEP", "After import")))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.version").value(5));
  }

  @Test
  void shouldDeletePackWithRulesAndAudit() throws Exception {
    String packId = createPack("DEL-" + UUID.randomUUID().toString().substring(0, 8));
    mockMvc
        .perform(
            post("/api/rule-packs/" + packId + "/rules")
                .with(adminJwt(ADMIN_ID))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"ruleDefinitionId": "%s"}
                    """
                        .formatted(preMeetingDocsDaysId)))
        .andExpect(status().isCreated());

    mockMvc
        .perform(delete("/api/rule-packs/" + packId).with(adminJwt(ADMIN_ID)))
        .andExpect(status().isNoContent());
    mockMvc
        .perform(get("/api/rule-packs/" + packId).with(adminJwt(ADMIN_ID)))
        .andExpect(status().isNotFound());

    Integer remainingRules =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM rule_pack_rules WHERE rule_pack_id = ?",
            Integer.class,
            UUID.fromString(packId));
    assertThat(remainingRules).isZero();

    var events =
        auditEventRepository.findByEntityTypeAndEntityIdOrderByOccurredAtAsc(
            "rule_pack", UUID.fromString(packId));
    assertThat(events)
        .extracting(event -> event.getEventType())
        .contains("rule_pack.created", "rule_pack.rule_attached", "rule_pack.deleted");
  }

  private String createPack(String scopeId) throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/rule-packs")
                    .with(adminJwt(ADMIN_ID))
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(packJson("DISTRICT", scopeId, "IEP", "Test pack")))
            .andExpect(status().isCreated())
            .andReturn();
    return extractIdFromLocation(result);
  }

  private static String packJson(String scopeType, String scopeId, String planType, String name) {
    return """
        {
          "scopeType": "%s",
          "scopeId": "%s",
          "planType": "%s",
          "name": "%s",
          "effectiveFrom": "2024-07-01T00:00:00Z"
        }
        """
        .formatted(scopeType, scopeId, planType, name);
  }

  private UUID ruleDefinitionId(String key) {
    return jdbcTemplate.queryForObject(
        "SELECT id FROM rule_definitions WHERE key = ?", UUID.class, key);
  }
}
