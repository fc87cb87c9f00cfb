package io.caseworks.backend.plan;

import io.caseworks.backend.rulecatalog.PlanType;
import java.util.Locale;
import java.util.Map;

/** Maps the plan type codes stored on plans to the plan types rule packs are keyed by. */
public final class PlanTypeCodes {

  private static final Map<String, PlanType> CODES =
      Map.of(
          "IEP", PlanType.IEP,
          "FIVE_OH_FOUR", PlanType.PLAN504,
          "PLAN504", PlanType.PLAN504,
          "BEHAVIOR_PLAN", PlanType.BIP,
          "BIP", PlanType.BIP);

  public static PlanType toRulePlanType(String code) {
    if (code == null) {
      return null;
    }
    return CODES.get(code.trim().toUpperCase(Locale.ROOT));
  }

  private PlanTypeCodes() {}
}
