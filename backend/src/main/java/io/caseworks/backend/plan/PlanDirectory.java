package io.caseworks.backend.plan;

import io.caseworks.backend.exception.ResourceNotFoundException;
import java.util.UUID;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** Lookups into the plans and students owned by the rest of the application. */
@Component
public class PlanDirectory {

  private final PlanInstanceRepository planInstanceRepository;
  private final StudentRepository studentRepository;

  public PlanDirectory(
      PlanInstanceRepository planInstanceRepository, StudentRepository studentRepository) {
    this.planInstanceRepository = planInstanceRepository;
    this.studentRepository = studentRepository;
  }

  @Transactional(readOnly = true)
  public PlanInstance requirePlan(UUID planId) {
    return planInstanceRepository
        .findById(planId)
        .orElseThrow(() -> new ResourceNotFoundException("Plan", planId));
  }

  @Transactional(readOnly = true)
  public Student requireStudent(UUID studentId) {
    return studentRepository
        .findById(studentId)
        .orElseThrow(() -> new ResourceNotFoundException("Student", studentId));
  }
}
