package io.caseworks.backend.rulepack;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RulePackRuleRepository extends JpaRepository<RulePackRule, UUID> {

  @Query(
      "SELECT r FROM RulePackRule r WHERE r.rulePackId = :rulePackId"
          + " ORDER BY r.sortOrder, r.createdAt")
  List<RulePackRule> findByRulePackIdOrderBySortOrder(@Param("rulePackId") UUID rulePackId);

  @Query(
      "SELECT r FROM RulePackRule r WHERE r.rulePackId IN :rulePackIds"
          + " ORDER BY r.sortOrder, r.createdAt")
  List<RulePackRule> findByRulePackIdIn(@Param("rulePackIds") Collection<UUID> rulePackIds);

  Optional<RulePackRule> findByIdAndRulePackId(UUID id, UUID rulePackId);

  boolean existsByRulePackIdAndRuleDefinitionId(UUID rulePackId, UUID ruleDefinitionId);

  @Modifying(flushAutomatically = true)
  @Query("DELETE FROM RulePackRule r WHERE r.rulePackId = :rulePackId")
  int deleteByRulePackId(@Param("rulePackId") UUID rulePackId);
}
