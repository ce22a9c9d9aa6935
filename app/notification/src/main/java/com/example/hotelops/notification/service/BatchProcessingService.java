/*
 * Where: Notification service layer
 * What: Runs one processing pass over a bounded slice of pending queue items
 * Why: Each pass claims, delivers and settles items, keeps the batch aggregate in step
 *      (system-wide passes start and complete every batch they drain), and reports what
 *      is left so the caller can decide whether to run another pass
 */
package com.example.hotelops.notification.service;

import com.example.hotelops.notification.config.BulkNotificationProperties;
import com.example.hotelops.notification.model.ProcessResult;
import com.example.hotelops.notification.model.QueueItemRecord;
import com.example.hotelops.notification.model.QueueItemStatus;
import com.example.hotelops.notification.model.StatusTransitions;
import com.example.hotelops.notification.repository.NotificationBatchRepository;
import com.example.hotelops.notification.repository.NotificationQueueRepository;
import com.google.common.annotations.VisibleForTesting;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class BatchProcessingService {

  private static final Logger logger = LoggerFactory.getLogger(BatchProcessingService.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";
  private static final String MDC_BATCH_ID = "batch_id";

  static final String LEASE_EXPIRED_ERROR = "delivery lease expired after final attempt";

  private final NotificationQueueRepository queueRepository;
  private final NotificationBatchRepository batchRepository;
  private final NotificationSender sender;
  private final BulkNotificationProperties properties;
  private final BulkNotificationMetrics metrics;
  private final Clock clock;

  enum Outcome {
    SENT,
    RETRIED,
    FAILED,
    LOCK_LOST
  }

  /**
   * Processes up to {@code batchSize} pending items, oldest first.
   *
   * @param batchId restricts the pass to one batch; {@code null} drains the whole queue
   * @param batchSize upper bound of items claimed by this pass
   * @return items sent, items failed terminally, and pending items left after the pass
   */
  public ProcessResult process(@Nullable UUID batchId, int batchSize) {
    if (batchSize <= 0) {
      throw new InvalidBatchRequestException("batchSize must be positive");
    }
    if (batchId != null) {
      MDC.put(MDC_BATCH_ID, batchId.toString());
    }
    try {
      return runPass(batchId, batchSize);
    } finally {
      MDC.remove(MDC_BATCH_ID);
    }
  }

  private ProcessResult runPass(@Nullable UUID batchId, int batchSize) {
    final Instant now = Instant.now(clock);
    if (batchId != null) {
      startBatch(batchId, now);
    }

    final List<QueueItemRecord> expired = expireExhaustedClaims(batchId, now);
    int failed = expired.size();

    final String lockedBy = resolveLockedBy();
    final List<QueueItemRecord> claimed =
        queueRepository.claimPending(
            batchId, batchSize, now, now.plus(properties.lease()), lockedBy);
    if (batchId == null) {
      // a system-wide pass may be the first to touch a batch whose creator pass never ran
      touchedBatchIds(claimed).forEach(id -> startBatch(id, now));
    }

    int processed = 0;
    for (QueueItemRecord item : claimed) {
      final Outcome outcome = deliver(item, lockedBy);
      if (outcome == Outcome.SENT) {
        processed++;
      } else if (outcome == Outcome.FAILED) {
        failed++;
      }
    }

    final int remaining = queueRepository.countPending(batchId);
    metrics.updateBacklogCurrent(remaining);
    if (batchId == null) {
      completeDrainedBatches();
    } else if (remaining == 0) {
      completeIfDrained(batchId);
    }
    logger.info(
        "notification pass finished batchId={} claimed={} processed={} failed={} remaining={}",
        batchId,
        claimed.size(),
        processed,
        failed,
        remaining);
    return new ProcessResult(processed, remaining, failed);
  }

  @VisibleForTesting
  Outcome deliver(QueueItemRecord item, String lockedBy) {
    try {
      sender.send(item);
    } catch (RuntimeException ex) {
      return handleFailure(item, ex, lockedBy);
    }
    StatusTransitions.requireItemTransition(item.status(), QueueItemStatus.SENT);
    // a store error here aborts the pass; the lease expires and the item is claimed again
    final int updated = queueRepository.markSent(item.itemId(), Instant.now(clock), lockedBy);
    if (updated == 0) {
      // the inbox row exists already; a later reclaim may deliver it a second time
      logger.warn(
          "notification sent but lock was lost itemId={} attempts={}",
          item.itemId(),
          item.attempts());
      metrics.recordDeliveryResult(BulkNotificationMetrics.RESULT_LOCK_LOST);
      return Outcome.LOCK_LOST;
    }
    if (item.batchId() != null) {
      batchRepository.incrementProcessed(item.batchId());
    }
    metrics.recordDeliveryResult(BulkNotificationMetrics.RESULT_SENT);
    return Outcome.SENT;
  }

  @VisibleForTesting
  Outcome handleFailure(QueueItemRecord item, RuntimeException ex, String lockedBy) {
    final String errorMessage = truncateError(ex.getMessage());
    final QueueItemStatus next =
        StatusTransitions.afterFailedAttempt(item.attempts(), item.maxAttempts());
    StatusTransitions.requireItemTransition(item.status(), next);

    if (next == QueueItemStatus.PENDING) {
      final int updated = queueRepository.markRetry(item.itemId(), errorMessage, lockedBy);
      if (updated == 0) {
        logger.warn(
            "notification retry skipped because lock was lost itemId={} attempts={}",
            item.itemId(),
            item.attempts());
        metrics.recordDeliveryResult(BulkNotificationMetrics.RESULT_LOCK_LOST);
        return Outcome.LOCK_LOST;
      }
      logger.warn(
          "notification retry scheduled itemId={} attempts={} maxAttempts={}",
          item.itemId(),
          item.attempts(),
          item.maxAttempts(),
          ex);
      metrics.recordDeliveryResult(BulkNotificationMetrics.RESULT_RETRY);
      return Outcome.RETRIED;
    }

    final int updated =
        queueRepository.markFailed(item.itemId(), errorMessage, Instant.now(clock), lockedBy);
    if (updated == 0) {
      logger.warn(
          "notification failure skipped because lock was lost itemId={} attempts={}",
          item.itemId(),
          item.attempts());
      metrics.recordDeliveryResult(BulkNotificationMetrics.RESULT_LOCK_LOST);
      return Outcome.LOCK_LOST;
    }
    if (item.batchId() != null) {
      batchRepository.incrementFailed(item.batchId());
    }
    logger.warn(
        "notification failed permanently itemId={} batchId={} attempts={}",
        item.itemId(),
        item.batchId(),
        item.attempts(),
        ex);
    metrics.recordDeliveryResult(BulkNotificationMetrics.RESULT_FAILED);
    return Outcome.FAILED;
  }

  private List<QueueItemRecord> expireExhaustedClaims(@Nullable UUID batchId, Instant now) {
    final List<QueueItemRecord> expired =
        queueRepository.failExpiredExhausted(batchId, now, LEASE_EXPIRED_ERROR);
    for (QueueItemRecord item : expired) {
      if (item.batchId() != null) {
        batchRepository.incrementFailed(item.batchId());
      }
      logger.warn(
          "notification failed after lease expiry itemId={} batchId={} attempts={}",
          item.itemId(),
          item.batchId(),
          item.attempts());
      metrics.recordDeliveryResult(BulkNotificationMetrics.RESULT_FAILED);
    }
    return expired;
  }

  private void startBatch(UUID batchId, Instant now) {
    if (batchRepository.markProcessingIfPending(batchId, now) > 0) {
      logger.info("notification batch started batchId={}", batchId);
    }
  }

  private void completeDrainedBatches() {
    for (UUID completed : batchRepository.completeDrainedBatches(Instant.now(clock))) {
      logger.info("notification batch completed batchId={}", completed);
    }
  }

  private static Set<UUID> touchedBatchIds(List<QueueItemRecord> items) {
    final Set<UUID> batchIds = new LinkedHashSet<>();
    for (QueueItemRecord item : items) {
      if (item.batchId() != null) {
        batchIds.add(item.batchId());
      }
    }
    return batchIds;
  }

  private void completeIfDrained(UUID batchId) {
    if (batchRepository.markCompletedIfDrained(batchId, Instant.now(clock)) > 0) {
      logger.info("notification batch completed batchId={}", batchId);
    }
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    return message.length() <= maxLength ? message : message.substring(0, maxLength);
  }

  // hostname alone is shared by the creator's pass and the scheduled pass on the same node
  @VisibleForTesting
  String resolveLockedBy() {
    return resolveHostname() + "/" + UUID.randomUUID();
  }

  private String resolveHostname() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }
}
