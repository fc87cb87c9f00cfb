package io.caseworks.backend.rulepack;

import io.caseworks.backend.audit.AuditEventBuilder;
import io.caseworks.backend.audit.AuditService;
import io.caseworks.backend.exception.InvalidStateException;
import io.caseworks.backend.exception.ResourceConflictException;
import io.caseworks.backend.exception.ResourceNotFoundException;
import io.caseworks.backend.exception.UnknownReferencesException;
import io.caseworks.backend.rulecatalog.PlanType;
import io.caseworks.backend.rulecatalog.RuleConfigValidator;
import io.caseworks.backend.rulecatalog.RuleDefinition;
import io.caseworks.backend.rulecatalog.RuleDefinitionRepository;
import io.caseworks.backend.rulepack.dto.AttachRuleRequest;
import io.caseworks.backend.rulepack.dto.CreateRulePackRequest;
import io.caseworks.backend.rulepack.dto.ReplaceRulesRequest;
import io.caseworks.backend.rulepack.dto.RulePackResponse;
import io.caseworks.backend.rulepack.dto.RuleResponse;
import io.caseworks.backend.rulepack.dto.UpdateRulePackRequest;
import io.caseworks.backend.rulepack.dto.UpdateRuleRequest;
import io.caseworks.backend.security.Actor;
import io.caseworks.backend.security.ComplianceAction;
import io.caseworks.backend.security.CompliancePermissions;
import java.time.Instant;
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
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Rule pack store: versioned packs, the rules attached to them, and aggregate deletes.
 *
 * <p>Versions come from {@link RulePackVersionAllocator}, a per (scope type, scope id, plan type)
 * high-water mark, so a deleted version is never issued again. The unique constraint on that tuple
 * still rejects a version claimed by a write that bypassed the allocator; creation then retries in a
 * fresh transaction and gives up with a conflict after the configured attempts.
 */
@Service
public class RulePackService {

  private static final Logger log = LoggerFactory.getLogger(RulePackService.class);

  private final RulePackRepository rulePackRepository;
  private final RulePackRuleRepository ruleRepository;
  private final RulePackEvidenceRequirementRepository evidenceRequirementRepository;
  private final RuleDefinitionRepository ruleDefinitionRepository;
  private final RuleConfigValidator ruleConfigValidator;
  private final RulePackResponseAssembler responseAssembler;
  private final AuditService auditService;
  private final TransactionTemplate transactionTemplate;
  private final RetryTemplate retryTemplate;
  private final RulePackVersionAllocator versionAllocator;

  public RulePackService(
      RulePackRepository rulePackRepository,
      RulePackRuleRepository ruleRepository,
      RulePackEvidenceRequirementRepository evidenceRequirementRepository,
      RuleDefinitionRepository ruleDefinitionRepository,
      RuleConfigValidator ruleConfigValidator,
      RulePackResponseAssembler responseAssembler,
      AuditService auditService,
      TransactionTemplate transactionTemplate,
      RetryTemplate retryTemplate,
      RulePackVersionAllocator versionAllocator) {
    this.rulePackRepository = rulePackRepository;
    this.ruleRepository = ruleRepository;
    this.evidenceRequirementRepository = evidenceRequirementRepository;
    this.ruleDefinitionRepository = ruleDefinitionRepository;
    this.ruleConfigValidator = ruleConfigValidator;
    this.responseAssembler = responseAssembler;
    this.auditService = auditService;
    this.transactionTemplate = transactionTemplate;
    this.retryTemplate = retryTemplate;
    this.versionAllocator = versionAllocator;
  }

  @Transactional(readOnly = true)
  public List<RulePackResponse> listPacks(
      Actor actor, ScopeType scopeType, String scopeId, PlanType planType, Boolean active) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.VIEW_RULE_PACKS);
    var packs = rulePackRepository.findByFilters(scopeType, scopeId, planType, active);
    return responseAssembler.toResponses(packs, false);
  }

  @Transactional(readOnly = true)
  public RulePackResponse getPack(Actor actor, UUID id) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.VIEW_RULE_PACKS);
    return responseAssembler.toResponse(requirePack(id), false);
  }

  /**
   * Creates the next version of the pack for the request's (scope, plan type). Not transactional
   * itself: every attempt runs in its own transaction so a version collision can be retried.
   */
  public RulePackResponse createPack(Actor actor, CreateRulePackRequest request) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.MANAGE_RULE_PACKS);
    requireValidWindow(request.effectiveFrom(), request.effectiveTo());

    try {
      return retryTemplate.execute(
          context -> {
            if (context.getRetryCount() > 0) {
              log.warn(
                  "Rule pack version conflict for {}/{}/{}, retry {}",
                  request.scopeType(),
                  request.scopeId(),
                  request.planType(),
                  context.getRetryCount());
            }
            return transactionTemplate.execute(tx -> insertNextVersion(actor, request));
          });
    } catch (RulePackVersionCollisionException ex) {
      throw new ResourceConflictException(
          "Rule pack version conflict",
          "Another rule pack version was created concurrently for "
              + request.scopeType()
              + "/"
              + request.scopeId()
              + "/"
              + request.planType()
              + ". Please retry.");
    }
  }

  private RulePackResponse insertNextVersion(Actor actor, CreateRulePackRequest request) {
    int nextVersion =
        versionAllocator.nextVersion(request.scopeType(), request.scopeId(), request.planType());

    RulePack pack;
    try {
      pack =
          rulePackRepository.saveAndFlush(
              new RulePack(
                  request.scopeType(),
                  request.scopeId(),
                  request.planType(),
                  nextVersion,
                  request.name(),
                  request.isActive() == null || request.isActive(),
                  request.effectiveFrom(),
                  request.effectiveTo()));
    } catch (DataIntegrityViolationException ex) {
      if (RulePackVersionCollisionException.isVersionCollision(ex)) {
        throw new RulePackVersionCollisionException(ex);
      }
      throw ex;
    }

    log.info(
        "Created rule pack {} v{} for {}/{} ({})",
        pack.getId(),
        pack.getVersion(),
        pack.getScopeType(),
        pack.getScopeId(),
        pack.getPlanType());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("rule_pack.created")
            .entityType("rule_pack")
            .entityId(pack.getId())
            .actor(actor)
            .details(
                Map.of(
                    "scope_type", pack.getScopeType().name(),
                    "scope_id", pack.getScopeId(),
                    "plan_type", pack.getPlanType().name(),
                    "version", pack.getVersion()))
            .build());

    return responseAssembler.toResponse(pack, false);
  }

  @Transactional
  public RulePackResponse updatePack(Actor actor, UUID id, UpdateRulePackRequest request) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.MANAGE_RULE_PACKS);
    var pack = requirePack(id);

    Instant effectiveFrom =
        request.effectiveFrom() != null ? request.effectiveFrom() : pack.getEffectiveFrom();
    Instant effectiveTo =
        request.clearEffectiveTo()
            ? null
            : request.effectiveTo() != null ? request.effectiveTo() : pack.getEffectiveTo();
    requireValidWindow(effectiveFrom, effectiveTo);

    pack.updateDetails(
        request.name() != null ? request.name() : pack.getName(),
        request.isActive() != null ? request.isActive() : pack.isActive(),
        effectiveFrom,
        effectiveTo);
    pack = rulePackRepository.save(pack);

    log.info("Updated rule pack {} (active={})", id, pack.isActive());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("rule_pack.updated")
            .entityType("rule_pack")
            .entityId(id)
            .actor(actor)
            .details(Map.of("name", pack.getName(), "active", pack.isActive()))
            .build());

    return responseAssembler.toResponse(pack, false);
  }

  /** Deletes the pack's evidence requirements, then its rules, then the pack. */
  @Transactional
  public void deletePack(Actor actor, UUID id) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.MANAGE_RULE_PACKS);
    var pack = requirePack(id);

    int evidenceDeleted = evidenceRequirementRepository.deleteByRulePackId(id);
    int rulesDeleted = ruleRepository.deleteByRulePackId(id);
    rulePackRepository.delete(pack);

    log.info(
        "Deleted rule pack {} v{} with {} rules and {} evidence requirements",
        id,
        pack.getVersion(),
        rulesDeleted,
        evidenceDeleted);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("rule_pack.deleted")
            .entityType("rule_pack")
            .entityId(id)
            .actor(actor)
            .details(
                Map.of(
                    "scope_type", pack.getScopeType().name(),
                    "scope_id", pack.getScopeId(),
                    "version", pack.getVersion(),
                    "rules_deleted", rulesDeleted))
            .build());
  }

  @Transactional
  public RuleResponse attachRule(Actor actor, UUID packId, AttachRuleRequest request) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.MANAGE_RULE_PACKS);
    requirePack(packId);
    var definition =
        ruleDefinitionRepository
            .findById(request.ruleDefinitionId())
            .orElseThrow(
                () -> new ResourceNotFoundException("RuleDefinition", request.ruleDefinitionId()));

    if (ruleRepository.existsByRulePackIdAndRuleDefinitionId(packId, definition.getId())) {
      throw new ResourceConflictException(
          "Rule already attached",
          "Rule " + definition.getKey() + " is already part of rule pack " + packId);
    }

    var config = ruleConfigValidator.normalize(definition.getKey(), request.config());
    RulePackRule rule;
    try {
      rule =
          ruleRepository.saveAndFlush(
              new RulePackRule(
                  packId,
                  definition.getId(),
                  request.isEnabled() == null || request.isEnabled(),
                  config,
                  request.sortOrder() != null ? request.sortOrder() : 0));
    } catch (RulePackVersionCollisionException ex) {
      throw new ResourceConflictException(
          "Rule already attached",
          "Rule " + definition.getKey() + " is already part of rule pack " + packId);
    }

    log.info("Attached rule {} to rule pack {}", definition.getKey(), packId);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("rule_pack.rule_attached")
            .entityType("rule_pack")
            .entityId(packId)
            .actor(actor)
            .details(Map.of("rule_key", definition.getKey(), "rule_id", rule.getId().toString()))
            .build());

    return responseAssembler.toRuleResponse(rule);
  }

  @Transactional
  public RuleResponse updateRule(
      Actor actor, UUID packId, UUID ruleId, UpdateRuleRequest request) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.MANAGE_RULE_PACKS);
    var rule = requireRule(packId, ruleId);

    Map<String, Object> config = rule.getConfig();
    if (request.clearConfig()) {
      config = null;
    } else if (request.config() != null) {
      var definition =
          ruleDefinitionRepository
              .findById(rule.getRuleDefinitionId())
              .orElseThrow(
                  () -> new ResourceNotFoundException("RuleDefinition", rule.getRuleDefinitionId()));
      config = ruleConfigValidator.normalize(definition.getKey(), request.config());
    }

    rule.update(
        request.isEnabled() != null ? request.isEnabled() : rule.isEnabled(),
        config,
        request.sortOrder() != null ? request.sortOrder() : rule.getSortOrder());
    ruleRepository.save(rule);

    log.info("Updated rule {} in rule pack {}", ruleId, packId);

    return responseAssembler.toRuleResponse(rule);
  }

  @Transactional
  public void detachRule(Actor actor, UUID packId, UUID ruleId) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.MANAGE_RULE_PACKS);
    var rule = requireRule(packId, ruleId);

    evidenceRequirementRepository.deleteByRulePackRuleId(ruleId);
    ruleRepository.delete(rule);

    log.info("Detached rule {} from rule pack {}", ruleId, packId);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("rule_pack.rule_detached")
            .entityType("rule_pack")
            .entityId(packId)
            .actor(actor)
            .details(Map.of("rule_id", ruleId.toString()))
            .build());
  }

  /**
   * Replaces every rule of the pack with the given set. Existing rules and their evidence
   * requirements are removed first.
   */
  @Transactional
  public RulePackResponse replaceRules(Actor actor, UUID packId, ReplaceRulesRequest request) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.MANAGE_RULE_PACKS);
    var pack = requirePack(packId);

    var requestedIds = new LinkedHashSet<UUID>();
    for (AttachRuleRequest entry : request.rules()) {
      if (!requestedIds.add(entry.ruleDefinitionId())) {
        throw new InvalidStateException(
            "Duplicate rule", "Rule definition " + entry.ruleDefinitionId() + " appears twice");
      }
    }

    Map<UUID, RuleDefinition> definitions =
        ruleDefinitionRepository.findAllById(requestedIds).stream()
            .collect(Collectors.toMap(RuleDefinition::getId, Function.identity()));
    var missing = new HashSet<>(requestedIds);
    missing.removeAll(definitions.keySet());
    if (!missing.isEmpty()) {
      throw new UnknownReferencesException("rule definition", missing);
    }

    var newRules =
        request.rules().stream()
            .map(
                entry ->
                    new RulePackRule(
                        packId,
                        entry.ruleDefinitionId(),
                        entry.isEnabled() == null || entry.isEnabled(),
                        ruleConfigValidator.normalize(
                            definitions.get(entry.ruleDefinitionId()).getKey(), entry.config()),
                        entry.sortOrder() != null ? entry.sortOrder() : 0))
            .toList();

    evidenceRequirementRepository.deleteByRulePackId(packId);
    int removed = ruleRepository.deleteByRulePackId(packId);
    ruleRepository.saveAll(newRules);

    log.info(
        "Replaced rules of rule pack {}: {} removed, {} added", packId, removed, newRules.size());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("rule_pack.rules_replaced")
            .entityType("rule_pack")
            .entityId(packId)
            .actor(actor)
            .details(Map.of("removed", removed, "added", newRules.size()))
            .build());

    return responseAssembler.toResponse(pack, false);
  }

  RulePack requirePack(UUID id) {
    return rulePackRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("RulePack", id));
  }

  RulePackRule requireRule(UUID packId, UUID ruleId) {
    requirePack(packId);
    return ruleRepository
        .findByIdAndRulePackId(ruleId, packId)
        .orElseThrow(
            () ->
                ResourceNotFoundException.withDetail(
                    "Rule not found", "No rule " + ruleId + " in rule pack " + packId));
  }

  private static void requireValidWindow(Instant effectiveFrom, Instant effectiveTo) {
    if (effectiveFrom != null && effectiveTo != null && effectiveTo.isBefore(effectiveFrom)) {
      throw new InvalidStateException(
          "Invalid effective window", "effectiveTo must not be before effectiveFrom");
    }
  }
}
