package io.caseworks.backend.plan;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PlanInstanceRepository extends JpaRepository<PlanInstance, UUID> {}
