package io.caseworks.backend.rulepack;

import io.caseworks.backend.rulecatalog.PlanType;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues rule pack versions per (scope type, scope id, plan type) from a counter table.
 *
 * <ul>
 *   <li>The counter row is created lazily, seeded from the highest version already stored
 *   <li>Versions are never reused, even after the newest pack is deleted
 *   <li>A rolled back create also rolls back its counter increment
 * </ul>
 */
@Component
public class RulePackVersionAllocator {

  @PersistenceContext private EntityManager entityManager;

  /**
   * Claims the next version. Concurrent callers for the same key serialize on the counter row lock
   * taken by the upsert. Rows written to {@code rule_packs} without going through this allocator
   * are accounted for by never issuing a version at or below their current maximum.
   */
  @Transactional
  public int nextVersion(ScopeType scopeType, String scopeId, PlanType planType) {
    var result =
        entityManager
            .createNativeQuery(
                "INSERT INTO rule_pack_version_counters"
                    + " (scope_type, scope_id, plan_type, last_version)"
                    + " VALUES (:scopeType, :scopeId, :planType,"
                    + " (SELECT COALESCE(MAX(version), 0) + 1 FROM rule_packs"
                    + " WHERE scope_type = :scopeType AND scope_id = :scopeId"
                    + " AND plan_type = :planType))"
                    + " ON CONFLICT (scope_type, scope_id, plan_type)"
                    + " DO UPDATE SET last_version = GREATEST("
                    + "rule_pack_version_counters.last_version, EXCLUDED.last_version - 1) + 1"
                    + " RETURNING last_version")
            .setParameter("scopeType", scopeType.name())
            .setParameter("scopeId", scopeId)
            .setParameter("planType", planType.name())
            .getSingleResult();
    return ((Number) result).intValue();
  }
}
