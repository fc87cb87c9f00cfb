package io.caseworks.backend.rulepack;

import io.caseworks.backend.rulecatalog.PlanType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * A versioned bundle of compliance rules for one (scope, plan type). New versions are new rows;
 * {@code version} is assigned by {@link RulePackService} and never changes afterwards.
 */
@Entity
@Table(name = "rule_packs")
public class RulePack {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Enumerated(EnumType.STRING)
  @Column(name = "scope_type", nullable = false, length = 20)
  private ScopeType scopeType;

  @Column(name = "scope_id", nullable = false, length = 100)
  private String scopeId;

  @Enumerated(EnumType.STRING)
  @Column(name = "plan_type", nullable = false, length = 20)
  private PlanType planType;

  @Column(name = "version", nullable = false, updatable = false)
  private int version;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Column(name = "is_active", nullable = false)
  private boolean active;

  @Column(name = "effective_from", nullable = false)
  private Instant effectiveFrom;

  @Column(name = "effective_to")
  private Instant effectiveTo;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected RulePack() {}

  public RulePack(
      ScopeType scopeType,
      String scopeId,
      PlanType planType,
      int version,
      String name,
      boolean active,
      Instant effectiveFrom,
      Instant effectiveTo) {
    this.scopeType = scopeType;
    this.scopeId = scopeId;
    this.planType = planType;
    this.version = version;
    this.name = name;
    this.active = active;
    this.effectiveFrom = effectiveFrom;
    this.effectiveTo = effectiveTo;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Patches the non-version fields in place. */
  public void updateDetails(
      String name, boolean active, Instant effectiveFrom, Instant effectiveTo) {
    this.name = name;
    this.active = active;
    this.effectiveFrom = effectiveFrom;
    this.effectiveTo = effectiveTo;
    this.updatedAt = Instant.now();
  }

  /** True when {@code asOf} lies inside [effectiveFrom, effectiveTo]; a null end is open. */
  public boolean isEffectiveAt(Instant asOf) {
    return !effectiveFrom.isAfter(asOf) && (effectiveTo == null || !effectiveTo.isBefore(asOf));
  }

  public UUID getId() {
    return id;
  }

  public ScopeType getScopeType() {
    return scopeType;
  }

  public String getScopeId() {
    return scopeId;
  }

  public PlanType getPlanType() {
    return planType;
  }

  public int getVersion() {
    return version;
  }

  public String getName() {
    return name;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getEffectiveFrom() {
    return effectiveFrom;
  }

  public Instant getEffectiveTo() {
    return effectiveTo;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
