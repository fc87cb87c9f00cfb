package io.caseworks.backend.rulecatalog;

import java.util.List;
import java.util.Map;

/** JSON shape of {@code rule-catalog/catalog.json}. */
public record RuleCatalogDefinition(
    String catalogId,
    int version,
    List<RuleDefinitionEntry> ruleDefinitions,
    List<EvidenceTypeEntry> evidenceTypes,
    List<JurisdictionEntry> jurisdictions) {

  public record RuleDefinitionEntry(
      String key, String name, String description, Map<String, Object> defaultConfig) {}

  public record EvidenceTypeEntry(String key, String name, PlanType planType) {}

  public record JurisdictionEntry(
      String stateCode, String stateName, String districtCode, String districtName) {}
}
