package io.caseworks.backend.rulepack;

import io.caseworks.backend.rulecatalog.EvidenceType;
import io.caseworks.backend.rulecatalog.EvidenceTypeRepository;
import io.caseworks.backend.rulecatalog.RuleDefinition;
import io.caseworks.backend.rulecatalog.RuleDefinitionRepository;
import io.caseworks.backend.rulepack.dto.EvidenceRequirementResponse;
import io.caseworks.backend.rulepack.dto.RulePackResponse;
import io.caseworks.backend.rulepack.dto.RuleResponse;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Loads the rules, evidence requirements, and catalog entries of a set of packs in batch and
 * assembles the API view.
 */
@Component
public class RulePackResponseAssembler {

  private final RulePackRuleRepository ruleRepository;
  private final RulePackEvidenceRequirementRepository evidenceRequirementRepository;
  private final RuleDefinitionRepository ruleDefinitionRepository;
  private final EvidenceTypeRepository evidenceTypeRepository;

  public RulePackResponseAssembler(
      RulePackRuleRepository ruleRepository,
      RulePackEvidenceRequirementRepository evidenceRequirementRepository,
      RuleDefinitionRepository ruleDefinitionRepository,
      EvidenceTypeRepository evidenceTypeRepository) {
    this.ruleRepository = ruleRepository;
    this.evidenceRequirementRepository = evidenceRequirementRepository;
    this.ruleDefinitionRepository = ruleDefinitionRepository;
    this.evidenceTypeRepository = evidenceTypeRepository;
  }

  public RulePackResponse toResponse(RulePack pack, boolean enabledRulesOnly) {
    return toResponses(List.of(pack), enabledRulesOnly).get(0);
  }

  public List<RulePackResponse> toResponses(List<RulePack> packs, boolean enabledRulesOnly) {
    if (packs.isEmpty()) {
      return List.of();
    }

    var packIds = packs.stream().map(RulePack::getId).toList();
    var rules =
        ruleRepository.findByRulePackIdIn(packIds).stream()
            .filter(rule -> !enabledRulesOnly || rule.isEnabled())
            .toList();

    var ruleIds = rules.stream().map(RulePackRule::getId).toList();
    var evidenceByRule =
        ruleIds.isEmpty()
            ? Map.<UUID, List<RulePackEvidenceRequirement>>of()
            : evidenceRequirementRepository.findByRulePackRuleIdIn(ruleIds).stream()
                .collect(Collectors.groupingBy(RulePackEvidenceRequirement::getRulePackRuleId));

    var definitions =
        ruleDefinitionRepository
            .findAllById(rules.stream().map(RulePackRule::getRuleDefinitionId).distinct().toList())
            .stream()
            .collect(Collectors.toMap(RuleDefinition::getId, Function.identity()));

    var evidenceTypeIds =
        evidenceByRule.values().stream()
            .flatMap(List::stream)
            .map(RulePackEvidenceRequirement::getEvidenceTypeId)
            .distinct()
            .toList();
    var evidenceTypes =
        evidenceTypeRepository.findAllById(evidenceTypeIds).stream()
            .collect(Collectors.toMap(EvidenceType::getId, Function.identity()));

    var rulesByPack =
        rules.stream()
            .map(
                rule ->
                    Map.entry(
                        rule.getRulePackId(),
                        toRuleResponse(
                            rule,
                            definitions.get(rule.getRuleDefinitionId()),
                            evidenceByRule.getOrDefault(rule.getId(), List.of()),
                            evidenceTypes)))
            .collect(
                Collectors.groupingBy(
                    Map.Entry::getKey,
                    Collectors.mapping(Map.Entry::getValue, Collectors.toList())));

    return packs.stream()
        .map(pack -> RulePackResponse.from(pack, rulesByPack.getOrDefault(pack.getId(), List.of())))
        .toList();
  }

  public RuleResponse toRuleResponse(RulePackRule rule) {
    var definition = ruleDefinitionRepository.findById(rule.getRuleDefinitionId()).orElse(null);
    var evidence = evidenceRequirementRepository.findByRulePackRuleIdIn(List.of(rule.getId()));
    var evidenceTypes =
        evidenceTypeRepository
            .findAllById(evidence.stream().map(RulePackEvidenceRequirement::getEvidenceTypeId).toList())
            .stream()
            .collect(Collectors.toMap(EvidenceType::getId, Function.identity()));
    return toRuleResponse(rule, definition, evidence, evidenceTypes);
  }

  private static RuleResponse toRuleResponse(
      RulePackRule rule,
      RuleDefinition definition,
      List<RulePackEvidenceRequirement> evidence,
      Map<UUID, EvidenceType> evidenceTypes) {
    var evidenceResponses =
        evidence.stream()
            .map(
                requirement -> {
                  var type = evidenceTypes.get(requirement.getEvidenceTypeId());
                  return new EvidenceRequirementResponse(
                      requirement.getId(),
                      requirement.getEvidenceTypeId(),
                      type != null ? type.getKey() : null,
                      type != null ? type.getName() : null,
                      requirement.isRequired());
                })
            .toList();

    Map<String, Object> defaultConfig = definition != null ? definition.getDefaultConfig() : null;
    return new RuleResponse(
        rule.getId(),
        rule.getRuleDefinitionId(),
        definition != null ? definition.getKey() : null,
        definition != null ? definition.getName() : null,
        rule.isEnabled(),
        rule.getConfig(),
        rule.getConfig() != null ? rule.getConfig() : defaultConfig,
        rule.getSortOrder(),
        evidenceResponses);
  }
}
