package io.caseworks.backend.rulecatalog;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface JurisdictionRepository extends JpaRepository<Jurisdiction, UUID> {

  List<Jurisdiction> findByDistrictCodeIgnoreCase(String districtCode);

  boolean existsByStateCodeAndDistrictCode(String stateCode, String districtCode);
}
