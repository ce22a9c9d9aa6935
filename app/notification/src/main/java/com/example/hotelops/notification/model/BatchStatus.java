/*
 * Where: Notification domain model
 * What: Lifecycle states of a notification batch
 * Why: Keeps the allowed transitions next to the states the DB stores
 */
package com.example.hotelops.notification.model;

import java.util.Locale;

public enum BatchStatus {
  PENDING,
  PROCESSING,
  COMPLETED;

  public boolean canTransitionTo(BatchStatus next) {
    return switch (this) {
      case PENDING -> next == PROCESSING;
      case PROCESSING -> next == COMPLETED;
      case COMPLETED -> false;
    };
  }

  public boolean isTerminal() {
    return this == COMPLETED;
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
