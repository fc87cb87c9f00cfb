package io.caseworks.backend.ruleresolution;

/**
 * Optional knowledge about where a scope sits in the hierarchy. When present, {@code districtId}
 * replaces the district derived from a school id and {@code stateCode} replaces the state derived
 * from the district.
 */
public record ResolutionHints(String districtId, String stateCode) {

  public static ResolutionHints none() {
    return new ResolutionHints(null, null);
  }

  public boolean hasDistrict() {
    return districtId != null && !districtId.isBlank();
  }

  public boolean hasState() {
    return stateCode != null && !stateCode.isBlank();
  }
}
