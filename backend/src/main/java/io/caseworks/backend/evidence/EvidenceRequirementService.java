package io.caseworks.backend.evidence;

import io.caseworks.backend.audit.AuditEventBuilder;
import io.caseworks.backend.audit.AuditService;
import io.caseworks.backend.exception.InvalidStateException;
import io.caseworks.backend.exception.ResourceConflictException;
import io.caseworks.backend.exception.ResourceNotFoundException;
import io.caseworks.backend.exception.UnknownReferencesException;
import io.caseworks.backend.rulecatalog.EvidenceType;
import io.caseworks.backend.rulecatalog.EvidenceTypeRepository;
import io.caseworks.backend.rulecatalog.RuleDefinition;
import io.caseworks.backend.rulecatalog.RuleDefinitionRepository;
import io.caseworks.backend.rulepack.RulePackEvidenceRequirement;
import io.caseworks.backend.rulepack.RulePackEvidenceRequirementRepository;
import io.caseworks.backend.rulepack.RulePackRepository;
import io.caseworks.backend.rulepack.RulePackResponseAssembler;
import io.caseworks.backend.rulepack.RulePackRule;
import io.caseworks.backend.rulepack.RulePackRuleRepository;
import io.caseworks.backend.rulepack.dto.EvidenceRequirementResponse;
import io.caseworks.backend.rulepack.dto.RuleResponse;
import io.caseworks.backend.security.Actor;
import io.caseworks.backend.security.ComplianceAction;
import io.caseworks.backend.security.CompliancePermissions;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Evidence types that the rules of a pack require, and the per-pack checklist built from them. */
@Service
public class EvidenceRequirementService {

  private static final Logger log = LoggerFactory.getLogger(EvidenceRequirementService.class);

  private final RulePackRepository rulePackRepository;
  private final RulePackRuleRepository ruleRepository;
  private final RulePackEvidenceRequirementRepository evidenceRequirementRepository;
  private final RuleDefinitionRepository ruleDefinitionRepository;
  private final EvidenceTypeRepository evidenceTypeRepository;
  private final RulePackResponseAssembler responseAssembler;
  private final AuditService auditService;

  public EvidenceRequirementService(
      RulePackRepository rulePackRepository,
      RulePackRuleRepository ruleRepository,
      RulePackEvidenceRequirementRepository evidenceRequirementRepository,
      RuleDefinitionRepository ruleDefinitionRepository,
      EvidenceTypeRepository evidenceTypeRepository,
      RulePackResponseAssembler responseAssembler,
      AuditService auditService) {
    this.rulePackRepository = rulePackRepository;
    this.ruleRepository = ruleRepository;
    this.evidenceRequirementRepository = evidenceRequirementRepository;
    this.ruleDefinitionRepository = ruleDefinitionRepository;
    this.evidenceTypeRepository = evidenceTypeRepository;
    this.responseAssembler = responseAssembler;
    this.auditService = auditService;
  }

  @Transactional
  public EvidenceRequirementResponse attachEvidence(
      Actor actor, UUID packId, UUID ruleId, AttachEvidenceRequest request) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.MANAGE_RULE_PACKS);
    var rule = requireRule(packId, ruleId);
    var evidenceType =
        evidenceTypeRepository
            .findById(request.evidenceTypeId())
            .orElseThrow(
                () -> new ResourceNotFoundException("EvidenceType", request.evidenceTypeId()));

    if (evidenceRequirementRepository.existsByRulePackRuleIdAndEvidenceTypeId(
        rule.getId(), evidenceType.getId())) {
      throw alreadyAttached(evidenceType, ruleId);
    }

    RulePackEvidenceRequirement requirement;
    try {
      requirement =
          evidenceRequirementRepository.saveAndFlush(
              new RulePackEvidenceRequirement(
                  rule.getId(),
                  evidenceType.getId(),
                  request.isRequired() == null || request.isRequired()));
    } catch (DataIntegrityViolationException ex) {
      throw alreadyAttached(evidenceType, ruleId);
    }

    log.info("Attached evidence type {} to rule {} of pack {}", evidenceType.getKey(), ruleId, packId);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("rule_pack.evidence_attached")
            .entityType("rule_pack")
            .entityId(packId)
            .actor(actor)
            .details(
                Map.of(
                    "rule_id", ruleId.toString(),
                    "evidence_type", evidenceType.getKey(),
                    "required", requirement.isRequired()))
            .build());

    return new EvidenceRequirementResponse(
        requirement.getId(),
        evidenceType.getId(),
        evidenceType.getKey(),
        evidenceType.getName(),
        requirement.isRequired());
  }

  /** Replaces all evidence requirements of one rule with the given set. */
  @Transactional
  public RuleResponse replaceEvidence(
      Actor actor, UUID packId, UUID ruleId, ReplaceEvidenceRequest request) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.MANAGE_RULE_PACKS);
    var rule = requireRule(packId, ruleId);

    var requestedIds = new LinkedHashSet<UUID>();
    for (AttachEvidenceRequest entry : request.evidence()) {
      if (!requestedIds.add(entry.evidenceTypeId())) {
        throw new InvalidStateException(
            "Duplicate evidence type",
            "Evidence type " + entry.evidenceTypeId() + " appears twice");
      }
    }
    var known =
        evidenceTypeRepository.findAllById(requestedIds).stream()
            .map(EvidenceType::getId)
            .collect(Collectors.toSet());
    var missing = new HashSet<>(requestedIds);
    missing.removeAll(known);
    if (!missing.isEmpty()) {
      throw new UnknownReferencesException("evidence type", missing);
    }

    int removed = evidenceRequirementRepository.deleteByRulePackRuleId(rule.getId());
    evidenceRequirementRepository.saveAll(
        request.evidence().stream()
            .map(
                entry ->
                    new RulePackEvidenceRequirement(
                        rule.getId(),
                        entry.evidenceTypeId(),
                        entry.isRequired() == null || entry.isRequired()))
            .toList());

    log.info(
        "Replaced evidence of rule {} in pack {}: {} removed, {} added",
        ruleId,
        packId,
        removed,
        request.evidence().size());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("rule_pack.evidence_replaced")
            .entityType("rule_pack")
            .entityId(packId)
            .actor(actor)
            .details(
                Map.of(
                    "rule_id", ruleId.toString(),
                    "removed", removed,
                    "added", request.evidence().size()))
            .build());

    return responseAssembler.toRuleResponse(rule);
  }

  @Transactional
  public void detachEvidence(Actor actor, UUID packId, UUID ruleId, UUID evidenceId) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.MANAGE_RULE_PACKS);
    var rule = requireRule(packId, ruleId);
    var requirement =
        evidenceRequirementRepository
            .findByIdAndRulePackRuleId(evidenceId, rule.getId())
            .orElseThrow(
                () ->
                    ResourceNotFoundException.withDetail(
                        "Evidence requirement not found",
                        "No evidence requirement " + evidenceId + " on rule " + ruleId));

    evidenceRequirementRepository.delete(requirement);

    log.info("Detached evidence requirement {} from rule {} of pack {}", evidenceId, ruleId, packId);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("rule_pack.evidence_detached")
            .entityType("rule_pack")
            .entityId(packId)
            .actor(actor)
            .details(Map.of("rule_id", ruleId.toString(), "evidence_id", evidenceId.toString()))
            .build());
  }

  /**
   * Evidence requirements of the pack's enabled rules, in rule sort order. Requirements of
   * disabled rules are left out.
   */
  @Transactional(readOnly = true)
  public List<PackEvidenceRequirement> listRequirements(Actor actor, UUID packId) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.VIEW_RULE_PACKS);
    if (!rulePackRepository.existsById(packId)) {
      throw new ResourceNotFoundException("RulePack", packId);
    }

    var rules =
        ruleRepository.findByRulePackIdOrderBySortOrder(packId).stream()
            .filter(RulePackRule::isEnabled)
            .toList();
    if (rules.isEmpty()) {
      return List.of();
    }

    var evidenceByRule =
        evidenceRequirementRepository
            .findByRulePackRuleIdIn(rules.stream().map(RulePackRule::getId).toList())
            .stream()
            .collect(Collectors.groupingBy(RulePackEvidenceRequirement::getRulePackRuleId));
    Map<UUID, RuleDefinition> definitions =
        ruleDefinitionRepository
            .findAllById(rules.stream().map(RulePackRule::getRuleDefinitionId).toList())
            .stream()
            .collect(Collectors.toMap(RuleDefinition::getId, Function.identity()));
    Map<UUID, EvidenceType> evidenceTypes =
        evidenceTypeRepository
            .findAllById(
                evidenceByRule.values().stream()
                    .flatMap(List::stream)
                    .map(RulePackEvidenceRequirement::getEvidenceTypeId)
                    .distinct()
                    .toList())
            .stream()
            .collect(Collectors.toMap(EvidenceType::getId, Function.identity()));

    var result = new ArrayList<PackEvidenceRequirement>();
    for (RulePackRule rule : rules) {
      var definition = definitions.get(rule.getRuleDefinitionId());
      for (RulePackEvidenceRequirement requirement :
          evidenceByRule.getOrDefault(rule.getId(), List.of())) {
        var type = evidenceTypes.get(requirement.getEvidenceTypeId());
        result.add(
            new PackEvidenceRequirement(
                definition != null ? definition.getKey() : null,
                type != null ? type.getKey() : null,
                type != null ? type.getName() : null,
                requirement.isRequired()));
      }
    }
    return result;
  }

  private RulePackRule requireRule(UUID packId, UUID ruleId) {
    if (!rulePackRepository.existsById(packId)) {
      throw new ResourceNotFoundException("RulePack", packId);
    }
    return ruleRepository
        .findByIdAndRulePackId(ruleId, packId)
        .orElseThrow(
            () ->
                ResourceNotFoundException.withDetail(
                    "Rule not found", "No rule " + ruleId + " in rule pack " + packId));
  }

  private static ResourceConflictException alreadyAttached(EvidenceType evidenceType, UUID ruleId) {
    return new ResourceConflictException(
        "Evidence already attached",
        "Evidence type " + evidenceType.getKey() + " is already attached to rule " + ruleId);
  }
}
