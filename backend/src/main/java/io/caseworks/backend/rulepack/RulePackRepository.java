package io.caseworks.backend.rulepack;

import io.caseworks.backend.rulecatalog.PlanType;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RulePackRepository extends JpaRepository<RulePack, UUID> {

  @Query(
      """
      SELECT p FROM RulePack p
      WHERE (:scopeType IS NULL OR p.scopeType = :scopeType)
        AND (:scopeId IS NULL OR p.scopeId = :scopeId)
        AND (:planType IS NULL OR p.planType = :planType)
        AND (:active IS NULL OR p.active = :active)
      ORDER BY p.scopeType, p.scopeId, p.version DESC
      """)
  List<RulePack> findByFilters(
      @Param("scopeType") ScopeType scopeType,
      @Param("scopeId") String scopeId,
      @Param("planType") PlanType planType,
      @Param("active") Boolean active);

  /**
   * Active packs at one scope whose plan type is among {@code planTypes}, highest version first.
   * The effective window is checked by the caller.
   */
  @Query(
      """
      SELECT p FROM RulePack p
      WHERE p.scopeType = :scopeType AND p.scopeId = :scopeId
        AND p.planType IN :planTypes
        AND p.active = true
      ORDER BY p.version DESC
      """)
  List<RulePack> findActiveAtScope(
      @Param("scopeType") ScopeType scopeType,
      @Param("scopeId") String scopeId,
      @Param("planTypes") Collection<PlanType> planTypes);
}
