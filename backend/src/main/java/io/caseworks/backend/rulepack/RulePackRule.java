package io.caseworks.backend.rulepack;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A rule definition attached to a rule pack. A null {@code config} means the definition's default
 * applies.
 */
@Entity
@Table(name = "rule_pack_rules")
public class RulePackRule {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "rule_pack_id", nullable = false)
  private UUID rulePackId;

  @Column(name = "rule_definition_id", nullable = false)
  private UUID ruleDefinitionId;

  @Column(name = "is_enabled", nullable = false)
  private boolean enabled;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "config", columnDefinition = "jsonb")
  private Map<String, Object> config;

  @Column(name = "sort_order", nullable = false)
  private int sortOrder;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected RulePackRule() {}

  public RulePackRule(
      UUID rulePackId,
      UUID ruleDefinitionId,
      boolean enabled,
      Map<String, Object> config,
      int sortOrder) {
    this.rulePackId = rulePackId;
    this.ruleDefinitionId = ruleDefinitionId;
    this.enabled = enabled;
    this.config = config;
    this.sortOrder = sortOrder;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void update(boolean enabled, Map<String, Object> config, int sortOrder) {
    this.enabled = enabled;
    this.config = config;
    this.sortOrder = sortOrder;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getRulePackId() {
    return rulePackId;
  }

  public UUID getRuleDefinitionId() {
    return ruleDefinitionId;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public Map<String, Object> getConfig() {
    return config;
  }

  public int getSortOrder() {
    return sortOrder;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
