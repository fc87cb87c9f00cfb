package io.caseworks.backend.review;

import io.caseworks.backend.review.dto.CompleteReviewScheduleRequest;
import io.caseworks.backend.review.dto.CreateReviewScheduleRequest;
import io.caseworks.backend.review.dto.ReviewDashboardResponse;
import io.caseworks.backend.review.dto.ReviewScheduleDetailResponse;
import io.caseworks.backend.review.dto.ReviewScheduleResponse;
import io.caseworks.backend.review.dto.ScheduleTypeResponse;
import io.caseworks.backend.review.dto.UpdateReviewScheduleRequest;
import io.caseworks.backend.security.ActorResolver;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ReviewScheduleController {

  private final ReviewScheduleService reviewScheduleService;
  private final ActorResolver actorResolver;

  public ReviewScheduleController(
      ReviewScheduleService reviewScheduleService, ActorResolver actorResolver) {
    this.reviewScheduleService = reviewScheduleService;
    this.actorResolver = actorResolver;
  }

  @PostMapping("/api/plans/{planId}/review-schedules")
  @PreAuthorize("hasAnyRole('ADMIN', 'CASE_MANAGER')")
  public ResponseEntity<ReviewScheduleDetailResponse> createSchedule(
      @PathVariable UUID planId, @Valid @RequestBody CreateReviewScheduleRequest request) {
    var response =
        reviewScheduleService.createSchedule(actorResolver.requireActor(), planId, request);
    return ResponseEntity.created(
            URI.create("/api/review-schedules/" + response.reviewSchedule().id()))
        .body(response);
  }

  @GetMapping("/api/plans/{planId}/review-schedules")
  @PreAuthorize("hasAnyRole('ADMIN', 'CASE_MANAGER', 'TEACHER')")
  public ResponseEntity<List<ReviewScheduleResponse>> listForPlan(
      @PathVariable UUID planId,
      @RequestParam(required = false) ReviewScheduleStatus status,
      @RequestParam(name = "type", required = false) ScheduleType scheduleType) {
    return ResponseEntity.ok(
        reviewScheduleService.listForPlan(
            actorResolver.requireActor(), planId, status, scheduleType));
  }

  @GetMapping("/api/review-schedules/dashboard")
  @PreAuthorize("hasAnyRole('ADMIN', 'CASE_MANAGER', 'TEACHER')")
  public ResponseEntity<ReviewDashboardResponse> dashboard(
      @RequestParam(defaultValue = "30") int days) {
    return ResponseEntity.ok(reviewScheduleService.dashboard(actorResolver.requireActor(), days));
  }

  @GetMapping("/api/review-schedules/schedule-types")
  @PreAuthorize("isAuthenticated()")
  public ResponseEntity<List<ScheduleTypeResponse>> scheduleTypes() {
    return ResponseEntity.ok(reviewScheduleService.scheduleTypes());
  }

  @GetMapping("/api/review-schedules/{id}")
  @PreAuthorize("hasAnyRole('ADMIN', 'CASE_MANAGER', 'TEACHER')")
  public ResponseEntity<ReviewScheduleDetailResponse> getSchedule(@PathVariable UUID id) {
    return ResponseEntity.ok(reviewScheduleService.getSchedule(actorResolver.requireActor(), id));
  }

  @PatchMapping("/api/review-schedules/{id}")
  @PreAuthorize("hasAnyRole('ADMIN', 'CASE_MANAGER')")
  public ResponseEntity<ReviewScheduleDetailResponse> updateSchedule(
      @PathVariable UUID id, @Valid @RequestBody UpdateReviewScheduleRequest request) {
    return ResponseEntity.ok(
        reviewScheduleService.updateSchedule(actorResolver.requireActor(), id, request));
  }

  @PostMapping("/api/review-schedules/{id}/complete")
  @PreAuthorize("hasAnyRole('ADMIN', 'CASE_MANAGER')")
  public ResponseEntity<ReviewScheduleDetailResponse> completeSchedule(
      @PathVariable UUID id, @RequestBody(required = false) CompleteReviewScheduleRequest request) {
    return ResponseEntity.ok(
        reviewScheduleService.completeSchedule(
            actorResolver.requireActor(), id, request != null ? request.notes() : null));
  }

  @DeleteMapping("/api/review-schedules/{id}")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<Void> deleteSchedule(@PathVariable UUID id) {
    reviewScheduleService.deleteSchedule(actorResolver.requireActor(), id);
    return ResponseEntity.noContent().build();
  }
}
