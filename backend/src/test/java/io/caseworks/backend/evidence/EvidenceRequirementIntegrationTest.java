package io.caseworks.backend.evidence;

import static io.caseworks.backend.testutil.TestJwts.adminJwt;
import static io.caseworks.backend.testutil.TestJwts.caseManagerJwt;
import static io.caseworks.backend.testutil.TestJwts.extractIdFromLocation;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.caseworks.backend.TestcontainersConfiguration;
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
class EvidenceRequirementIntegrationTest {

  private static final UUID ADMIN_ID = UUID.randomUUID();

  @Autowired private MockMvc mockMvc;
  @Autowired private JdbcTemplate jdbcTemplate;

  private UUID conferenceNotesId;
  private UUID consentFormId;
  private UUID meetingNoticeId;

  @BeforeAll
  void setup() {
    conferenceNotesId = evidenceTypeId("CONFERENCE_NOTES");
    consentFormId = evidenceTypeId("CONSENT_FORM");
    meetingNoticeId = evidenceTypeId("MEETING_NOTICE");
  }

  @Test
  void shouldListEvidenceTypesForPlanType() throws Exception {
    // BIP types plus the ones that apply to every plan
    mockMvc
        .perform(
            get("/api/rule-packs/evidence-types")
                .param("planType", "BIP")
                .with(caseManagerJwt(UUID.randomUUID())))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[?(@.key == 'FBA_REPORT')]", hasSize(1)))
        .andExpect(jsonPath("$[?(@.key == 'CONSENT_FORM')]").isEmpty());
  }

  @Test
  void shouldAttachListAndDetachEvidence() throws Exception {
    String packId = createPack();
    String ruleId = attachRule(packId, "CONFERENCE_NOTES_REQUIRED");

    var result =
        mockMvc
            .perform(
                post("/api/rule-packs/" + packId + "/rules/" + ruleId + "/evidence")
                    .with(adminJwt(ADMIN_ID))
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"evidenceTypeId": "%s"}
                        """
                            .formatted(conferenceNotesId)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.evidenceTypeKey").value("CONFERENCE_NOTES"))
            .andExpect(jsonPath("$.isRequired").value(true))
            .andReturn();
    String evidenceId = extractIdFromLocation(result);

    mockMvc
        .perform(
            post("/api/rule-packs/" + packId + "/rules/" + ruleId + "/evidence")
                .with(adminJwt(ADMIN_ID))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"evidenceTypeId": "%s"}
                    """
                        .formatted(conferenceNotesId)))
        .andExpect(status().isConflict());

    mockMvc
        .perform(
            get("/api/rule-packs/" + packId + "/evidence-requirements")
                .with(caseManagerJwt(UUID.randomUUID())))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(1)))
        .andExpect(jsonPath("$[0].ruleKey").value("CONFERENCE_NOTES_REQUIRED"))
        .andExpect(jsonPath("$[0].evidenceTypeName").value("Conference Notes"));

    mockMvc
        .perform(
            delete("/api/rule-packs/" + packId + "/rules/" + ruleId + "/evidence/" + evidenceId)
                .with(adminJwt(ADMIN_ID)))
        .andExpect(status().isNoContent());
    mockMvc
        .perform(
            delete("/api/rule-packs/" + packId + "/rules/" + ruleId + "/evidence/" + evidenceId)
                .with(adminJwt(ADMIN_ID)))
        .andExpect(status().isNotFound());
  }

  @Test
  void shouldReplaceEvidenceAndHideDisabledRules() throws Exception {
    String packId = createPack();
    String ruleId = attachRule(packId, "INITIAL_IEP_CONSENT_GATE");

    mockMvc
        .perform(
            put("/api/rule-packs/" + packId + "/rules/" + ruleId + "/evidence")
                .with(adminJwt(ADMIN_ID))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"evidence": [
                      {"evidenceTypeId": "%s", "isRequired": true},
                      {"evidenceTypeId": "%s", "isRequired": false}
                    ]}
                    """
                        .formatted(consentFormId, meetingNoticeId)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.evidenceRequirements", hasSize(2)));

    mockMvc
        .perform(
            get("/api/rule-packs/" + packId + "/evidence-requirements")
                .with(adminJwt(ADMIN_ID)))
        .andExpect(jsonPath("$", hasSize(2)));

    mockMvc
        .perform(
            patch("/api/rule-packs/" + packId + "/rules/" + ruleId)
                .with(adminJwt(ADMIN_ID))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"isEnabled": false}
                    """))
        .andExpect(status().isOk());

    mockMvc
        .perform(
            get("/api/rule-packs/" + packId + "/evidence-requirements")
                .with(adminJwt(ADMIN_ID)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(0)));
  }

  @Test
  void shouldRejectUnknownEvidenceTypeInReplacement() throws Exception {
    String packId = createPack();
    String ruleId = attachRule(packId, "CONFERENCE_NOTES_REQUIRED");
    UUID unknownId = UUID.randomUUID();

    mockMvc
        .perform(
            put("/api/rule-packs/" + packId + "/rules/" + ruleId + "/evidence")
                .with(adminJwt(ADMIN_ID))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"evidence": [{"evidenceTypeId": "%s"}]}
                    """
                        .formatted(unknownId)))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.missingIds[0]").value(unknownId.toString()));
  }

  private String createPack() throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/rule-packs")
                    .with(adminJwt(ADMIN_ID))
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {
                          "scopeType": "SCHOOL",
                          "scopeId": "EVD-%s",
                          "planType": "IEP",
                          "name": "Evidence pack",
                          "effectiveFrom": "2024-07-01T00:00:00Z"
                        }
                        """
                            .formatted(UUID.randomUUID().toString().substring(0, 8))))
            .andExpect(status().isCreated())
            .andReturn();
    return extractIdFromLocation(result);
  }

  private String attachRule(String packId, String ruleKey) throws Exception {
    UUID definitionId =
        jdbcTemplate.queryForObject(
            "SELECT id FROM rule_definitions WHERE key = ?", UUID.class, ruleKey);
    var result =
        mockMvc
            .perform(
                post("/api/rule-packs/" + packId + "/rules")
                    .with(adminJwt(ADMIN_ID))
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"ruleDefinitionId": "%s"}
                        """
                            .formatted(definitionId)))
            .andExpect(status().isCreated())
            .andReturn();
    return extractIdFromLocation(result);
  }

  private UUID evidenceTypeId(String key) {
    return jdbcTemplate.queryForObject(
        "SELECT id FROM evidence_types WHERE key = ?", UUID.class, key);
  }
}
