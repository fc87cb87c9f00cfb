package io.caseworks.backend.rulepack;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RulePackEvidenceRequirementRepository
    extends JpaRepository<RulePackEvidenceRequirement, UUID> {

  @Query(
      "SELECT e FROM RulePackEvidenceRequirement e WHERE e.rulePackRuleId IN :ruleIds"
          + " ORDER BY e.createdAt")
  List<RulePackEvidenceRequirement> findByRulePackRuleIdIn(
      @Param("ruleIds") Collection<UUID> ruleIds);

  Optional<RulePackEvidenceRequirement> findByIdAndRulePackRuleId(UUID id, UUID rulePackRuleId);

  boolean existsByRulePackRuleIdAndEvidenceTypeId(UUID rulePackRuleId, UUID evidenceTypeId);

  @Modifying(flushAutomatically = true)
  @Query("DELETE FROM RulePackEvidenceRequirement e WHERE e.rulePackRuleId = :ruleId")
  int deleteByRulePackRuleId(@Param("ruleId") UUID ruleId);

  @Modifying(flushAutomatically = true)
  @Query(
      """
      DELETE FROM RulePackEvidenceRequirement e
      WHERE e.rulePackRuleId IN (SELECT r.id FROM RulePackRule r WHERE r.rulePackId = :rulePackId)
      """)
  int deleteByRulePackId(@Param("rulePackId") UUID rulePackId);
}
