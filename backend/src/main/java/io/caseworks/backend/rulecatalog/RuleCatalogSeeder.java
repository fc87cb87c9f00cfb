package io.caseworks.backend.rulecatalog;

import io.caseworks.backend.config.CaseworksProperties;
import io.caseworks.backend.rulecatalog.RuleCatalogDefinition.EvidenceTypeEntry;
import io.caseworks.backend.rulecatalog.RuleCatalogDefinition.JurisdictionEntry;
import io.caseworks.backend.rulecatalog.RuleCatalogDefinition.RuleDefinitionEntry;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Seeds rule definitions, evidence types, and jurisdictions from the classpath catalog file on
 * startup. Idempotent: entries whose key already exists are left untouched, so administrator edits
 * survive restarts.
 */
@Service
public class RuleCatalogSeeder {

  private static final Logger log = LoggerFactory.getLogger(RuleCatalogSeeder.class);

  private final ResourcePatternResolver resourceResolver;
  private final ObjectMapper objectMapper;
  private final RuleDefinitionRepository ruleDefinitionRepository;
  private final EvidenceTypeRepository evidenceTypeRepository;
  private final JurisdictionRepository jurisdictionRepository;
  private final RuleConfigValidator ruleConfigValidator;
  private final TransactionTemplate transactionTemplate;
  private final CaseworksProperties properties;

  public RuleCatalogSeeder(
      ResourcePatternResolver resourceResolver,
      ObjectMapper objectMapper,
      RuleDefinitionRepository ruleDefinitionRepository,
      EvidenceTypeRepository evidenceTypeRepository,
      JurisdictionRepository jurisdictionRepository,
      RuleConfigValidator ruleConfigValidator,
      TransactionTemplate transactionTemplate,
      CaseworksProperties properties) {
    this.resourceResolver = resourceResolver;
    this.objectMapper = objectMapper;
    this.ruleDefinitionRepository = ruleDefinitionRepository;
    this.evidenceTypeRepository = evidenceTypeRepository;
    this.jurisdictionRepository = jurisdictionRepository;
    this.ruleConfigValidator = ruleConfigValidator;
    this.transactionTemplate = transactionTemplate;
    this.properties = properties;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void seedOnStartup() {
    if (!properties.ruleCatalog().seedOnStartup()) {
      log.info("Rule catalog seeding disabled");
      return;
    }
    seed();
  }

  /** Applies the catalog file. Returns the number of rows inserted. */
  public int seed() {
    String location = properties.ruleCatalog().location();
    RuleCatalogDefinition catalog = loadCatalog(location);
    if (catalog == null) {
      log.info("No rule catalog found at {}", location);
      return 0;
    }

    Integer inserted = transactionTemplate.execute(tx -> applyCatalog(catalog));
    int count = inserted != null ? inserted : 0;
    log.info(
        "Applied rule catalog {} v{}: {} new entries", catalog.catalogId(), catalog.version(), count);
    return count;
  }

  private RuleCatalogDefinition loadCatalog(String location) {
    Resource resource = resourceResolver.getResource(location);
    if (!resource.exists()) {
      return null;
    }
    try (InputStream in = resource.getInputStream()) {
      return objectMapper.readValue(in, RuleCatalogDefinition.class);
    } catch (IOException | JacksonException e) {
      throw new IllegalStateException("Failed to read rule catalog: " + location, e);
    }
  }

  private int applyCatalog(RuleCatalogDefinition catalog) {
    int inserted = 0;
    for (RuleDefinitionEntry entry : nullSafe(catalog.ruleDefinitions())) {
      if (ruleDefinitionRepository.existsByKey(entry.key())) {
        continue;
      }
      var defaultConfig = ruleConfigValidator.normalize(entry.key(), entry.defaultConfig());
      ruleDefinitionRepository.save(
          new RuleDefinition(entry.key(), entry.name(), entry.description(), defaultConfig));
      inserted++;
    }

    for (EvidenceTypeEntry entry : nullSafe(catalog.evidenceTypes())) {
      if (evidenceTypeRepository.existsByKey(entry.key())) {
        continue;
      }
      evidenceTypeRepository.save(new EvidenceType(entry.key(), entry.name(), entry.planType()));
      inserted++;
    }

    for (JurisdictionEntry entry : nullSafe(catalog.jurisdictions())) {
      if (jurisdictionRepository.existsByStateCodeAndDistrictCode(
          entry.stateCode(), entry.districtCode())) {
        continue;
      }
      jurisdictionRepository.save(
          new Jurisdiction(
              entry.stateCode(), entry.stateName(), entry.districtCode(), entry.districtName()));
      inserted++;
    }
    return inserted;
  }

  private static <T> List<T> nullSafe(List<T> list) {
    return list != null ? list : List.of();
  }
}
