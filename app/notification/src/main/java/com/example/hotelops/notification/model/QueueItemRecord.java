/*
 * Where: Notification domain model
 * What: Snapshot of a notification_queue row
 * Why: The processor works on claimed snapshots and writes back by item id
 */
package com.example.hotelops.notification.model;

import java.time.Instant;
import java.util.UUID;

public record QueueItemRecord(
    UUID itemId,
    UUID batchId,
    String userId,
    String notificationType,
    String notificationDataJson,
    QueueItemStatus status,
    int attempts,
    int maxAttempts,
    String errorMessage,
    String lockedBy,
    Instant leaseUntil,
    Instant createdAt,
    Instant processedAt) {

  public static QueueItemRecord newPending(
      UUID itemId,
      UUID batchId,
      String userId,
      String notificationType,
      String notificationDataJson,
      int maxAttempts,
      Instant createdAt) {
    return new QueueItemRecord(
        itemId,
        batchId,
        userId,
        notificationType,
        notificationDataJson,
        QueueItemStatus.PENDING,
        0,
        maxAttempts,
        null,
        null,
        null,
        createdAt,
        null);
  }
}
