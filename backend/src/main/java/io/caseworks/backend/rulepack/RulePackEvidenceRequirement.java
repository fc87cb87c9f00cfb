package io.caseworks.backend.rulepack;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** Declares that a rule in a pack needs (or optionally accepts) an artifact of an evidence type. */
@Entity
@Table(name = "rule_pack_evidence_requirements")
public class RulePackEvidenceRequirement {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "rule_pack_rule_id", nullable = false)
  private UUID rulePackRuleId;

  @Column(name = "evidence_type_id", nullable = false)
  private UUID evidenceTypeId;

  @Column(name = "is_required", nullable = false)
  private boolean required;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected RulePackEvidenceRequirement() {}

  public RulePackEvidenceRequirement(UUID rulePackRuleId, UUID evidenceTypeId, boolean required) {
    this.rulePackRuleId = rulePackRuleId;
    this.evidenceTypeId = evidenceTypeId;
    this.required = required;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getRulePackRuleId() {
    return rulePackRuleId;
  }

  public UUID getEvidenceTypeId() {
    return evidenceTypeId;
  }

  public boolean isRequired() {
    return required;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
