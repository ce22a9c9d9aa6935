/*
 * Where: Notification domain model
 * What: Delivery states of a single queue item
 * Why: Keeps the allowed transitions next to the states the DB stores
 */
package com.example.hotelops.notification.model;

public enum QueueItemStatus {
  PENDING,
  PROCESSING,
  SENT,
  FAILED;

  public boolean canTransitionTo(QueueItemStatus next) {
    return switch (this) {
      case PENDING -> next == PROCESSING;
      // PROCESSING -> PROCESSING is a lease-expired reclaim by another pass
      case PROCESSING -> next == SENT || next == PENDING || next == FAILED || next == PROCESSING;
      case SENT, FAILED -> false;
    };
  }

  public boolean isTerminal() {
    return this == SENT || this == FAILED;
  }
}
