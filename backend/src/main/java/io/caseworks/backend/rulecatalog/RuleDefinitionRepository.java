package io.caseworks.backend.rulecatalog;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RuleDefinitionRepository extends JpaRepository<RuleDefinition, UUID> {

  List<RuleDefinition> findAllByOrderByKeyAsc();

  Optional<RuleDefinition> findByKey(String key);

  boolean existsByKey(String key);
}
