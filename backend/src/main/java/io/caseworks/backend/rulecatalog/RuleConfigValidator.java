package io.caseworks.backend.rulecatalog;

import io.caseworks.backend.exception.InvalidStateException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;

/**
 * Checks a rule config against the {@link RuleConfig} variant of its rule definition and returns
 * the normalized JSON form that is stored. A missing {@code kind} is filled in from the definition
 * key.
 */
@Component
public class RuleConfigValidator {

  private static final String KIND = "kind";
  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public RuleConfigValidator(ObjectMapper objectMapper) {
    // Unknown config fields are errors even where the shared mapper ignores them.
    this.objectMapper =
        objectMapper.rebuild().enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES).build();
  }

  /**
   * Parses {@code rawConfig} as the config of rule {@code ruleKey}.
   *
   * @return the typed config, or null when {@code rawConfig} is null (definition default applies)
   * @throws InvalidStateException when the kind does not match or a field is missing or out of
   *     range
   */
  public RuleConfig parse(String ruleKey, Map<String, Object> rawConfig) {
    if (rawConfig == null) {
      return null;
    }
    if (!RuleConfig.KNOWN_KINDS.contains(ruleKey)) {
      throw new InvalidStateException(
          "Unsupported rule", "Rule " + ruleKey + " does not accept configuration");
    }

    var candidate = new LinkedHashMap<>(rawConfig);
    Object kind = candidate.putIfAbsent(KIND, ruleKey);
    if (kind != null && !ruleKey.equals(kind)) {
      throw new InvalidStateException(
          "Invalid rule config", "Config kind " + kind + " does not match rule " + ruleKey);
    }

    try {
      return objectMapper.convertValue(candidate, RuleConfig.class);
    } catch (IllegalArgumentException | JacksonException e) {
      throw new InvalidStateException(
          "Invalid rule config", "Config for rule " + ruleKey + " is invalid: " + rootMessage(e));
    }
  }

  /** Validates and returns the JSON form to persist, or null when {@code rawConfig} is null. */
  public Map<String, Object> normalize(String ruleKey, Map<String, Object> rawConfig) {
    RuleConfig config = parse(ruleKey, rawConfig);
    if (config == null) {
      return null;
    }
    var normalized = new LinkedHashMap<String, Object>();
    normalized.put(KIND, ruleKey);
    normalized.putAll(objectMapper.convertValue(config, MAP_TYPE));
    normalized.put(KIND, ruleKey);
    return normalized;
  }

  private static String rootMessage(Throwable e) {
    Throwable current = e;
    while (current.getCause() != null && current.getCause() != current) {
      current = current.getCause();
    }
    return current.getMessage();
  }
}
