package io.caseworks.backend.plan;

import io.caseworks.backend.rulecatalog.PlanType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

/**
 * A student's plan as recorded by the case-management side of the application. Mapped read-only:
 * this back end never writes plan rows.
 */
@Entity
@Immutable
@Table(name = "plan_instances")
public class PlanInstance {

  @Id private UUID id;

  @Column(name = "student_id", nullable = false)
  private UUID studentId;

  @Column(name = "plan_type", nullable = false, length = 20)
  private String planTypeCode;

  @Column(name = "state_code", nullable = false, length = 2)
  private String stateCode;

  @Column(name = "district_id", length = 100)
  private String districtId;

  @Column(name = "school_id", length = 100)
  private String schoolId;

  protected PlanInstance() {}

  public UUID getId() {
    return id;
  }

  public UUID getStudentId() {
    return studentId;
  }

  public String getPlanTypeCode() {
    return planTypeCode;
  }

  public String getStateCode() {
    return stateCode;
  }

  public String getDistrictId() {
    return districtId;
  }

  public String getSchoolId() {
    return schoolId;
  }

  /** The rule pack plan type for this plan, or null when its type code is not recognized. */
  public PlanType rulePlanType() {
    return PlanTypeCodes.toRulePlanType(planTypeCode);
  }
}
