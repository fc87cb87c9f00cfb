package io.caseworks.backend.compliancetask;

public enum ComplianceTaskType {
  REVIEW_DUE_SOON("Review Due Soon", "A plan review is due within the lead window"),
  REVIEW_OVERDUE("Review Overdue", "A plan review is past its due date"),
  DOCUMENT_REQUIRED("Document Required", "A required document needs to be uploaded or completed"),
  SIGNATURE_NEEDED("Signature Needed", "A signature is required on a document or plan"),
  MEETING_REQUIRED("Meeting Required", "A meeting needs to be scheduled or held");

  private final String label;
  private final String description;

  ComplianceTaskType(String label, String description) {
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
