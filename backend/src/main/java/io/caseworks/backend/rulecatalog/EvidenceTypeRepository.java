package io.caseworks.backend.rulecatalog;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EvidenceTypeRepository extends JpaRepository<EvidenceType, UUID> {

  List<EvidenceType> findAllByOrderByKeyAsc();

  List<EvidenceType> findByPlanTypeInOrderByKeyAsc(Collection<PlanType> planTypes);

  boolean existsByKey(String key);
}
