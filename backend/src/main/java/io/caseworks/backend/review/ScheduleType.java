package io.caseworks.backend.review;

public enum ScheduleType {
  IEP_ANNUAL_REVIEW("IEP Annual Review", "Annual review of IEP goals and services"),
  IEP_REEVALUATION("IEP Reevaluation", "Three-year comprehensive reevaluation"),
  PLAN_AMENDMENT_REVIEW("Plan Amendment Review", "Review of plan amendments"),
  SECTION504_PERIODIC_REVIEW(
      "Section 504 Periodic Review", "Periodic review of 504 accommodations"),
  BIP_REVIEW("BIP Review", "Behavior Intervention Plan review");

  private final String label;
  private final String description;

  ScheduleType(String label, String description) {
    this.label = label;
    this.description = description;
  }

  public String getLabel() {
    return label;
  }

  public String getDescription() {
    return description;
  }
}
