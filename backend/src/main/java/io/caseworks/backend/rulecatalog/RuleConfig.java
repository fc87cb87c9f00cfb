package io.caseworks.backend.rulecatalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.Set;

/**
 * Typed configuration of a rule, one variant per rule definition key. The JSON form carries the key
 * in {@code kind}, e.g. {@code {"kind": "PRE_MEETING_DOCS_DAYS", "days": 5}}.
 *
 * <p>Variants check their own ranges on construction, so a config that deserializes is valid.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
  @JsonSubTypes.Type(value = RuleConfig.PreMeetingDocsDays.class, name = "PRE_MEETING_DOCS_DAYS"),
  @JsonSubTypes.Type(value = RuleConfig.PostMeetingDocsDays.class, name = "POST_MEETING_DOCS_DAYS"),
  @JsonSubTypes.Type(
      value = RuleConfig.UsMailPreMeetingDays.class,
      name = "US_MAIL_PRE_MEETING_DAYS"),
  @JsonSubTypes.Type(
      value = RuleConfig.UsMailPostMeetingDays.class,
      name = "US_MAIL_POST_MEETING_DAYS"),
  @JsonSubTypes.Type(
      value = RuleConfig.ContinuedMeetingNoticeDays.class,
      name = "CONTINUED_MEETING_NOTICE_DAYS"),
  @JsonSubTypes.Type(
      value = RuleConfig.DefaultDeliveryMethod.class,
      name = "DEFAULT_DELIVERY_METHOD"),
  @JsonSubTypes.Type(
      value = RuleConfig.ConferenceNotesRequired.class,
      name = "CONFERENCE_NOTES_REQUIRED"),
  @JsonSubTypes.Type(
      value = RuleConfig.ContinuedMeetingMutualAgreement.class,
      name = "CONTINUED_MEETING_MUTUAL_AGREEMENT"),
  @JsonSubTypes.Type(
      value = RuleConfig.InitialIepConsentGate.class,
      name = "INITIAL_IEP_CONSENT_GATE"),
  @JsonSubTypes.Type(value = RuleConfig.AudioRecordingRule.class, name = "AUDIO_RECORDING_RULE")
})
@JsonIgnoreProperties(ignoreUnknown = false)
public sealed interface RuleConfig {

  int MAX_DAYS = 365;

  /** Rule definition keys that have a config variant. */
  Set<String> KNOWN_KINDS =
      Set.of(
          "PRE_MEETING_DOCS_DAYS",
          "POST_MEETING_DOCS_DAYS",
          "US_MAIL_PRE_MEETING_DAYS",
          "US_MAIL_POST_MEETING_DAYS",
          "CONTINUED_MEETING_NOTICE_DAYS",
          "DEFAULT_DELIVERY_METHOD",
          "CONFERENCE_NOTES_REQUIRED",
          "CONTINUED_MEETING_MUTUAL_AGREEMENT",
          "INITIAL_IEP_CONSENT_GATE",
          "AUDIO_RECORDING_RULE");

  enum DeliveryMethod {
    SEND_HOME,
    US_MAIL,
    PICK_UP
  }

  record PreMeetingDocsDays(Integer days) implements RuleConfig {
    public PreMeetingDocsDays {
      RuleConfig.requireDays(days);
    }
  }

  record PostMeetingDocsDays(Integer days) implements RuleConfig {
    public PostMeetingDocsDays {
      RuleConfig.requireDays(days);
    }
  }

  record UsMailPreMeetingDays(Integer days) implements RuleConfig {
    public UsMailPreMeetingDays {
      RuleConfig.requireDays(days);
    }
  }

  record UsMailPostMeetingDays(Integer days) implements RuleConfig {
    public UsMailPostMeetingDays {
      RuleConfig.requireDays(days);
    }
  }

  record ContinuedMeetingNoticeDays(Integer days) implements RuleConfig {
    public ContinuedMeetingNoticeDays {
      RuleConfig.requireDays(days);
    }
  }

  record DefaultDeliveryMethod(DeliveryMethod method) implements RuleConfig {
    public DefaultDeliveryMethod {
      if (method == null) {
        throw new IllegalArgumentException("method is required");
      }
    }
  }

  record ConferenceNotesRequired(Boolean required) implements RuleConfig {
    public ConferenceNotesRequired {
      RuleConfig.requireFlag("required", required);
    }
  }

  record ContinuedMeetingMutualAgreement(Boolean required) implements RuleConfig {
    public ContinuedMeetingMutualAgreement {
      RuleConfig.requireFlag("required", required);
    }
  }

  record InitialIepConsentGate(Boolean enabled) implements RuleConfig {
    public InitialIepConsentGate {
      RuleConfig.requireFlag("enabled", enabled);
    }
  }

  record AudioRecordingRule(Boolean staffMustRecordIfParentRecords, Boolean markAsNotOfficialRecord)
      implements RuleConfig {
    public AudioRecordingRule {
      RuleConfig.requireFlag("staffMustRecordIfParentRecords", staffMustRecordIfParentRecords);
      RuleConfig.requireFlag("markAsNotOfficialRecord", markAsNotOfficialRecord);
    }
  }

  private static void requireDays(Integer days) {
    if (days == null) {
      throw new IllegalArgumentException("days is required");
    }
    if (days < 0 || days > MAX_DAYS) {
      throw new IllegalArgumentException("days must be between 0 and " + MAX_DAYS);
    }
  }

  private static void requireFlag(String name, Boolean value) {
    if (value == null) {
      throw new IllegalArgumentException(name + " is required");
    }
  }
}
