package io.caseworks.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Application settings bound from the {@code caseworks} prefix.
 *
 * @param ruleCatalog where the rule catalog is loaded from and whether it is seeded on startup
 * @param reviewSchedules review schedule defaults and overdue sweep settings
 */
@ConfigurationProperties(prefix = "caseworks")
public record CaseworksProperties(
    @DefaultValue RuleCatalog ruleCatalog, @DefaultValue ReviewSchedules reviewSchedules) {

  public record RuleCatalog(
      @DefaultValue("true") boolean seedOnStartup,
      @DefaultValue("classpath:rule-catalog/catalog.json") String location) {}

  /**
   * @param defaultLeadDays lead window applied when a schedule is created without one
   * @param sweepEnabled whether the daily overdue sweep runs
   * @param sweepCron cron expression for the overdue sweep
   */
  public record ReviewSchedules(
      @DefaultValue("30") int defaultLeadDays,
      @DefaultValue("true") boolean sweepEnabled,
      @DefaultValue("0 15 1 * * *") String sweepCron) {}
}
