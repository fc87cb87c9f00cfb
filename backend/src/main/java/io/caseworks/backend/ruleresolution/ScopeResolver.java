package io.caseworks.backend.ruleresolution;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.caseworks.backend.rulecatalog.Jurisdiction;
import io.caseworks.backend.rulecatalog.JurisdictionRepository;
import io.caseworks.backend.rulecatalog.PlanType;
import io.caseworks.backend.rulepack.RulePack;
import io.caseworks.backend.rulepack.RulePackRepository;
import io.caseworks.backend.rulepack.ScopeType;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Finds the rule pack that governs a (scope, plan type) at an instant by walking from the most
 * specific scope to the state: SCHOOL, then DISTRICT, then STATE. The first scope with an active,
 * effective pack for the plan type (or for {@link PlanType#ALL}) wins; within a scope the highest
 * version wins.
 */
@Service
public class ScopeResolver {

  private static final Logger log = LoggerFactory.getLogger(ScopeResolver.class);

  private final RulePackRepository rulePackRepository;
  private final JurisdictionRepository jurisdictionRepository;
  private final Cache<String, Optional<String>> districtStateCache =
      Caffeine.newBuilder().maximumSize(10_000).expireAfterWrite(Duration.ofHours(1)).build();

  public ScopeResolver(
      RulePackRepository rulePackRepository, JurisdictionRepository jurisdictionRepository) {
    this.rulePackRepository = rulePackRepository;
    this.jurisdictionRepository = jurisdictionRepository;
  }

  @Transactional(readOnly = true)
  public Optional<RuleResolution> resolveActivePack(
      ScopeType scopeType,
      String scopeId,
      PlanType planType,
      Instant asOf,
      ResolutionHints hints) {
    var chain = candidateChain(scopeType, scopeId, hints != null ? hints : ResolutionHints.none());
    var planTypes = planType == PlanType.ALL ? Set.of(PlanType.ALL) : Set.of(planType, PlanType.ALL);

    for (ScopeCandidate candidate : chain) {
      var packs =
          rulePackRepository.findActiveAtScope(
              candidate.scopeType(), candidate.scopeId(), planTypes);
      var selected = selectPack(packs, planType, asOf);
      if (selected.isPresent()) {
        log.debug(
            "Resolved {} {} for {}/{} at {}",
            selected.get().getId(),
            candidate,
            scopeType,
            scopeId,
            asOf);
        return Optional.of(new RuleResolution(selected.get(), candidate, chain));
      }
    }

    log.debug("No active rule pack for {}/{} ({}) searched {}", scopeType, scopeId, planType, chain);
    return Optional.empty();
  }

  /** Scopes to search, most specific first, without duplicates. */
  List<ScopeCandidate> candidateChain(
      ScopeType scopeType, String scopeId, ResolutionHints hints) {
    var chain = new LinkedHashSet<ScopeCandidate>();
    var districts = new ArrayList<String>();

    if (scopeType == ScopeType.SCHOOL) {
      chain.add(new ScopeCandidate(ScopeType.SCHOOL, scopeId));
    }
    if (scopeType == ScopeType.SCHOOL || scopeType == ScopeType.DISTRICT) {
      chain.add(new ScopeCandidate(ScopeType.DISTRICT, scopeId));
      districts.add(scopeId);
    }
    if (scopeType == ScopeType.SCHOOL) {
      String owningDistrict = hints.hasDistrict() ? hints.districtId() : districtPrefix(scopeId);
      if (owningDistrict != null && !owningDistrict.equals(scopeId)) {
        chain.add(new ScopeCandidate(ScopeType.DISTRICT, owningDistrict));
        districts.add(owningDistrict);
      }
    }

    String stateCode;
    if (scopeType == ScopeType.STATE) {
      stateCode = scopeId.toUpperCase(Locale.ROOT);
    } else if (hints.hasState()) {
      stateCode = hints.stateCode().toUpperCase(Locale.ROOT);
    } else {
      stateCode =
          districts.stream()
              .map(this::stateOfDistrict)
              .flatMap(Optional::stream)
              .findFirst()
              .orElseGet(() -> statePrefix(scopeId));
    }
    if (stateCode != null) {
      chain.add(new ScopeCandidate(ScopeType.STATE, stateCode));
    }
    return List.copyOf(chain);
  }

  /**
   * Picks the pack that applies at {@code asOf}: active, inside its effective window, and of the
   * queried plan type or {@code ALL}. Highest version wins; on equal versions the exact plan type
   * is preferred over {@code ALL}.
   */
  static Optional<RulePack> selectPack(List<RulePack> packs, PlanType planType, Instant asOf) {
    return packs.stream()
        .filter(RulePack::isActive)
        .filter(pack -> pack.getPlanType().appliesTo(planType))
        .filter(pack -> pack.isEffectiveAt(asOf))
        .max(
            Comparator.comparingInt(RulePack::getVersion)
                .thenComparing(pack -> pack.getPlanType() == planType));
  }

  /** The owning state of a district when exactly one known jurisdiction has that code. */
  private Optional<String> stateOfDistrict(String districtCode) {
    return districtStateCache.get(
        districtCode.toUpperCase(Locale.ROOT), key -> lookupStateOfDistrict(districtCode));
  }

  private Optional<String> lookupStateOfDistrict(String districtCode) {
    List<Jurisdiction> matches = jurisdictionRepository.findByDistrictCodeIgnoreCase(districtCode);
    if (matches.size() != 1) {
      return Optional.empty();
    }
    return Optional.of(matches.get(0).getStateCode().toUpperCase(Locale.ROOT));
  }

  /** School ids are issued as {@code <DISTRICT>-<number>}. */
  static String districtPrefix(String schoolId) {
    int dash = schoolId.indexOf('-');
    return dash > 0 ? schoolId.substring(0, dash) : null;
  }

  static String statePrefix(String scopeId) {
    return scopeId.length() >= 2 ? scopeId.substring(0, 2).toUpperCase(Locale.ROOT) : null;
  }
}
