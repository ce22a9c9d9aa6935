/*
 * Where: Notification application configuration binding
 * What: Holds fan-out, claim and retry settings for bulk batches
 * Why: Keeps chunk size, pass size and attempt limits tunable per environment
 */
package com.example.hotelops.notification.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.bulk")
public record BulkNotificationProperties(
    int defaultBatchSize,
    int maxBatchSize,
    int chunkSize,
    int maxAttempts,
    String defaultJobType,
    String defaultTitle,
    String defaultMessage,
    int errorMessageMaxLength,
    Duration lease,
    int listLimitMax) {

  public BulkNotificationProperties {
    defaultBatchSize = defaultBatchSize <= 0 ? 50 : defaultBatchSize;
    maxBatchSize = maxBatchSize <= 0 ? 500 : Math.max(maxBatchSize, defaultBatchSize);
    chunkSize = chunkSize <= 0 ? 100 : chunkSize;
    maxAttempts = maxAttempts <= 0 ? 3 : maxAttempts;
    defaultJobType =
        defaultJobType == null || defaultJobType.isBlank() ? "training_assigned" : defaultJobType;
    defaultTitle =
        defaultTitle == null || defaultTitle.isBlank() ? "New Training Assigned" : defaultTitle;
    defaultMessage =
        defaultMessage == null || defaultMessage.isBlank()
            ? "You have been assigned a new training module"
            : defaultMessage;
    errorMessageMaxLength = errorMessageMaxLength <= 0 ? 1000 : errorMessageMaxLength;
    lease = lease == null || lease.isNegative() || lease.isZero() ? Duration.ofSeconds(60) : lease;
    listLimitMax = listLimitMax <= 0 ? 100 : listLimitMax;
  }

  /** Resolves a caller-supplied pass size: default when absent, capped at the maximum. */
  public int resolveBatchSize(Integer requested) {
    if (requested == null) {
      return defaultBatchSize;
    }
    return Math.min(requested, maxBatchSize);
  }
}
