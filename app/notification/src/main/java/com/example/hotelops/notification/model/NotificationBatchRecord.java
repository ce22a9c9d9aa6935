/*
 * Where: Notification domain model
 * What: Snapshot of a notification_batches row
 * Why: Shared by the creator, the processor and the status API
 */
package com.example.hotelops.notification.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationBatchRecord(
    UUID batchId,
    String jobType,
    int totalCount,
    int processedCount,
    int failedCount,
    BatchStatus status,
    String metadataJson,
    String createdBy,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt) {

  public static NotificationBatchRecord newPending(
      UUID batchId,
      String jobType,
      int totalCount,
      String metadataJson,
      String createdBy,
      Instant createdAt) {
    return new NotificationBatchRecord(
        batchId,
        jobType,
        totalCount,
        0,
        0,
        BatchStatus.PENDING,
        metadataJson,
        createdBy,
        createdAt,
        null,
        null);
  }

  public int settledCount() {
    return processedCount + failedCount;
  }
}
