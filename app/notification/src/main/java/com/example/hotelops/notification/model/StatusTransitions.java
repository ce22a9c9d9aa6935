/*
 * Where: Notification domain model
 * What: Single entry point for validating batch and queue item transitions
 * Why: Services call this before issuing a conditional UPDATE so an illegal
 *      transition fails fast instead of silently updating zero rows
 */
package com.example.hotelops.notification.model;

public final class StatusTransitions {

  private StatusTransitions() {}

  public static void requireBatchTransition(BatchStatus from, BatchStatus to) {
    if (!from.canTransitionTo(to)) {
      throw new InvalidStatusTransitionException("batch", from.name(), to.name());
    }
  }

  public static void requireItemTransition(QueueItemStatus from, QueueItemStatus to) {
    if (!from.canTransitionTo(to)) {
      throw new InvalidStatusTransitionException("queue item", from.name(), to.name());
    }
  }

  /** Outcome of a failed delivery attempt: retry while attempts remain, otherwise terminal. */
  public static QueueItemStatus afterFailedAttempt(int attempts, int maxAttempts) {
    return attempts < maxAttempts ? QueueItemStatus.PENDING : QueueItemStatus.FAILED;
  }
}
