package io.caseworks.backend.rulecatalog;

import io.caseworks.backend.security.Actor;
import io.caseworks.backend.security.ComplianceAction;
import io.caseworks.backend.security.CompliancePermissions;
import java.util.EnumSet;
import java.util.List;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class RuleCatalogService {

  private final RuleDefinitionRepository ruleDefinitionRepository;
  private final EvidenceTypeRepository evidenceTypeRepository;

  public RuleCatalogService(
      RuleDefinitionRepository ruleDefinitionRepository,
      EvidenceTypeRepository evidenceTypeRepository) {
    this.ruleDefinitionRepository = ruleDefinitionRepository;
    this.evidenceTypeRepository = evidenceTypeRepository;
  }

  @Transactional(readOnly = true)
  public List<RuleDefinition> listRuleDefinitions(Actor actor) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.VIEW_RULE_PACKS);
    return ruleDefinitionRepository.findAllByOrderByKeyAsc();
  }

  /**
   * Lists evidence types ordered by key. With a plan type, returns the types for that plan type
   * plus those that apply to every plan.
   */
  @Transactional(readOnly = true)
  public List<EvidenceType> listEvidenceTypes(Actor actor, PlanType planType) {
    CompliancePermissions.requirePermitted(actor, ComplianceAction.VIEW_RULE_PACKS);
    if (planType == null) {
      return evidenceTypeRepository.findAllByOrderByKeyAsc();
    }
    return evidenceTypeRepository.findByPlanTypeInOrderByKeyAsc(
        EnumSet.of(planType, PlanType.ALL));
  }
}
