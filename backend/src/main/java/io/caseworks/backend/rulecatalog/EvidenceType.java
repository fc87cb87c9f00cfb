package io.caseworks.backend.rulecatalog;

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

/** A kind of artifact (notes, consent form, notice) that a rule can require. */
@Entity
@Table(name = "evidence_types")
public class EvidenceType {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "key", nullable = false, length = 100, unique = true)
  private String key;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Enumerated(EnumType.STRING)
  @Column(name = "plan_type", nullable = false, length = 20)
  private PlanType planType;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected EvidenceType() {}

  public EvidenceType(String key, String name, PlanType planType) {
    this.key = key;
    this.name = name;
    this.planType = planType != null ? planType : PlanType.ALL;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getKey() {
    return key;
  }

  public String getName() {
    return name;
  }

  public PlanType getPlanType() {
    return planType;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
