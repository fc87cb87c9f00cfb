package io.caseworks.backend.compliancetask;

import io.caseworks.backend.compliancetask.dto.CompleteComplianceTaskRequest;
import io.caseworks.backend.compliancetask.dto.ComplianceTaskDashboardResponse;
import io.caseworks.backend.compliancetask.dto.ComplianceTaskResponse;
import io.caseworks.backend.compliancetask.dto.CreateComplianceTaskRequest;
import io.caseworks.backend.compliancetask.dto.DismissComplianceTaskRequest;
import io.caseworks.backend.compliancetask.dto.TaskTypeResponse;
import io.caseworks.backend.compliancetask.dto.UpdateComplianceTaskRequest;
import io.caseworks.backend.security.ActorResolver;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/compliance-tasks")
public class ComplianceTaskController {

  private final ComplianceTaskService complianceTaskService;
  private final ActorResolver actorResolver;

  public ComplianceTaskController(
      ComplianceTaskService complianceTaskService, ActorResolver actorResolver) {
    this.complianceTaskService = complianceTaskService;
    this.actorResolver = actorResolver;
  }

  @PostMapping
  @PreAuthorize("hasAnyRole('ADMIN', 'CASE_MANAGER')")
  public ResponseEntity<ComplianceTaskResponse> createTask(
      @Valid @RequestBody CreateComplianceTaskRequest request) {
    var response = complianceTaskService.createTask(actorResolver.requireActor(), request);
    return ResponseEntity.created(URI.create("/api/compliance-tasks/" + response.id()))
        .body(response);
  }

  @GetMapping
  @PreAuthorize("hasAnyRole('ADMIN', 'CASE_MANAGER', 'TEACHER')")
  public ResponseEntity<List<ComplianceTaskResponse>> listTasks(
      @RequestParam(required = false) ComplianceTaskStatus status,
      @RequestParam(name = "type", required = false) ComplianceTaskType taskType,
      @RequestParam(required = false) UUID assignedTo,
      @RequestParam(required = false) UUID studentId,
      @RequestParam(required = false) UUID planId,
      @RequestParam(defaultValue = "false") boolean overdue) {
    return ResponseEntity.ok(
        complianceTaskService.listTasks(
            actorResolver.requireActor(),
            status,
            taskType,
            assignedTo,
            studentId,
            planId,
            overdue));
  }

  @GetMapping("/my-tasks")
  @PreAuthorize("isAuthenticated()")
  public ResponseEntity<List<ComplianceTaskResponse>> myTasks(
      @RequestParam(required = false) ComplianceTaskStatus status) {
    return ResponseEntity.ok(complianceTaskService.myTasks(actorResolver.requireActor(), status));
  }

  @GetMapping("/dashboard")
  @PreAuthorize("hasAnyRole('ADMIN', 'CASE_MANAGER', 'TEACHER')")
  public ResponseEntity<ComplianceTaskDashboardResponse> dashboard() {
    return ResponseEntity.ok(complianceTaskService.dashboard(actorResolver.requireActor()));
  }

  @GetMapping("/task-types")
  @PreAuthorize("isAuthenticated()")
  public ResponseEntity<List<TaskTypeResponse>> taskTypes() {
    return ResponseEntity.ok(complianceTaskService.taskTypes());
  }

  @GetMapping("/{id}")
  @PreAuthorize("hasAnyRole('ADMIN', 'CASE_MANAGER', 'TEACHER')")
  public ResponseEntity<ComplianceTaskResponse> getTask(@PathVariable UUID id) {
    return ResponseEntity.ok(complianceTaskService.getTask(actorResolver.requireActor(), id));
  }

  @PatchMapping("/{id}")
  @PreAuthorize("hasAnyRole('ADMIN', 'CASE_MANAGER')")
  public ResponseEntity<ComplianceTaskResponse> updateTask(
      @PathVariable UUID id, @Valid @RequestBody UpdateComplianceTaskRequest request) {
    return ResponseEntity.ok(
        complianceTaskService.updateTask(actorResolver.requireActor(), id, request));
  }

  @PostMapping("/{id}/complete")
  @PreAuthorize("hasAnyRole('ADMIN', 'CASE_MANAGER')")
  public ResponseEntity<ComplianceTaskResponse> completeTask(
      @PathVariable UUID id, @RequestBody(required = false) CompleteComplianceTaskRequest request) {
    return ResponseEntity.ok(
        complianceTaskService.completeTask(
            actorResolver.requireActor(), id, request != null ? request.notes() : null));
  }

  @PostMapping("/{id}/dismiss")
  @PreAuthorize("hasAnyRole('ADMIN', 'CASE_MANAGER')")
  public ResponseEntity<ComplianceTaskResponse> dismissTask(
      @PathVariable UUID id, @Valid @RequestBody DismissComplianceTaskRequest request) {
    return ResponseEntity.ok(
        complianceTaskService.dismissTask(actorResolver.requireActor(), id, request.reason()));
  }
}
