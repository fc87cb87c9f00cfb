package io.caseworks.backend.rulecatalog;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;

/** A school district and the state it belongs to. */
@Entity
@Table(name = "jurisdictions")
public class Jurisdiction {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "state_code", nullable = false, length = 2)
  private String stateCode;

  @Column(name = "state_name", nullable = false, length = 100)
  private String stateName;

  @Column(name = "district_code", nullable = false, length = 50)
  private String districtCode;

  @Column(name = "district_name", nullable = false, length = 200)
  private String districtName;

  protected Jurisdiction() {}

  public Jurisdiction(
      String stateCode, String stateName, String districtCode, String districtName) {
    this.stateCode = stateCode;
    this.stateName = stateName;
    this.districtCode = districtCode;
    this.districtName = districtName;
  }

  public UUID getId() {
    return id;
  }

  public String getStateCode() {
    return stateCode;
  }

  public String getStateName() {
    return stateName;
  }

  public String getDistrictCode() {
    return districtCode;
  }

  public String getDistrictName() {
    return districtName;
  }
}
