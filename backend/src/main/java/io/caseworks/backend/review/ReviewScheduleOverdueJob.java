package io.caseworks.backend.review;

import io.caseworks.backend.config.CaseworksProperties;
import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Daily job that persists OPEN to OVERDUE for review schedules past their due date. Each schedule
 * is handled in its own transaction; a failing schedule is logged and skipped.
 */
@Component
public class ReviewScheduleOverdueJob {

  private static final Logger log = LoggerFactory.getLogger(ReviewScheduleOverdueJob.class);

  private final ReviewScheduleService reviewScheduleService;
  private final CaseworksProperties properties;
  private final Clock clock;

  public ReviewScheduleOverdueJob(
      ReviewScheduleService reviewScheduleService, CaseworksProperties properties, Clock clock) {
    this.reviewScheduleService = reviewScheduleService;
    this.properties = properties;
    this.clock = clock;
  }

  @Scheduled(cron = "${caseworks.review-schedules.sweep-cron:0 15 1 * * *}")
  public void scheduledSweep() {
    if (!properties.reviewSchedules().sweepEnabled()) {
      log.debug("Overdue review sweep disabled");
      return;
    }
    sweep();
  }

  /** Returns the number of schedules marked overdue. */
  public int sweep() {
    log.info("Overdue review sweep started");
    LocalDate today = LocalDate.now(clock);
    var candidates = reviewScheduleService.findSchedulesToMarkOverdue(today);
    int marked = 0;

    for (UUID scheduleId : candidates) {
      try {
        if (reviewScheduleService.markOverdue(scheduleId, today)) {
          marked++;
        }
      } catch (Exception e) {
        log.error("Overdue review sweep: failed to process review schedule {}", scheduleId, e);
      }
    }

    log.info(
        "Overdue review sweep completed: {} candidates, {} marked overdue",
        candidates.size(),
        marked);
    return marked;
  }
}
