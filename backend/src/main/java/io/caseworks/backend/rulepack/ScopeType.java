package io.caseworks.backend.rulepack;

/** Organizational level a rule pack is defined at, from most to least specific. */
public enum ScopeType {
  SCHOOL,
  DISTRICT,
  STATE
}
