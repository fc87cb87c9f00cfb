package io.caseworks.backend.review;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/** Reports schedule completions and deletions once their transaction has committed. */
@Component
public class ReviewScheduleEventListener {

  private static final Logger log = LoggerFactory.getLogger(ReviewScheduleEventListener.class);

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onCompleted(ReviewScheduleCompletedEvent event) {
    log.info(
        "Review schedule {} for plan {} completed by {}; {} open task(s) closed",
        event.reviewScheduleId(),
        event.planInstanceId(),
        event.completedByUserId(),
        event.tasksCompleted());
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onDeleted(ReviewScheduleDeletedEvent event) {
    log.info(
        "Review schedule {} for plan {} deleted by {}; {} task(s) removed",
        event.reviewScheduleId(),
        event.planInstanceId(),
        event.deletedByUserId(),
        event.tasksDeleted());
  }
}
