package io.caseworks.backend.rulecatalog;

/** Plan kinds a rule pack or evidence type applies to. {@link #ALL} is the wildcard. */
public enum PlanType {
  IEP,
  PLAN504,
  BIP,
  ALL;

  /**
   * Returns true when something scoped to this plan type applies to a plan of the queried type.
   * {@code ALL} applies to every query; a concrete type only to itself.
   */
  public boolean appliesTo(PlanType query) {
    return this == ALL || this == query;
  }
}
