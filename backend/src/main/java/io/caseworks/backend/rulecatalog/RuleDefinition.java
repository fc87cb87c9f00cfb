package io.caseworks.backend.rulecatalog;

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
 * A reusable compliance rule type. {@code defaultConfig} has the shape of the {@link RuleConfig}
 * variant named by {@code key}.
 */
@Entity
@Table(name = "rule_definitions")
public class RuleDefinition {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "key", nullable = false, length = 100, unique = true)
  private String key;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "default_config", nullable = false, columnDefinition = "jsonb")
  private Map<String, Object> defaultConfig;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected RuleDefinition() {}

  public RuleDefinition(
      String key, String name, String description, Map<String, Object> defaultConfig) {
    this.key = key;
    this.name = name;
    this.description = description;
    this.defaultConfig = defaultConfig;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
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

  public String getDescription() {
    return description;
  }

  public Map<String, Object> getDefaultConfig() {
    return defaultConfig;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
