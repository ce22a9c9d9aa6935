/*
 * Where: Notification service layer
 * What: Creates a batch, fans recipients out into queue items and runs the first pass
 * Why: Fan-out is chunked so one bad chunk loses only its own recipients, and the
 *      batch total is reconciled to what was actually queued
 */
package com.example.hotelops.notification.service;

import com.example.hotelops.notification.config.BulkNotificationProperties;
import com.example.hotelops.notification.model.NotificationBatchRecord;
import com.example.hotelops.notification.model.ProcessResult;
import com.example.hotelops.notification.model.QueueItemRecord;
import com.example.hotelops.notification.repository.NotificationBatchRepository;
import com.example.hotelops.notification.repository.NotificationQueueRepository;
import com.google.common.collect.Lists;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class BatchCreationService {

  private static final Logger logger = LoggerFactory.getLogger(BatchCreationService.class);

  private final NotificationBatchRepository batchRepository;
  private final NotificationQueueRepository queueRepository;
  private final BatchProcessingService processingService;
  private final NotificationPayloads payloads;
  private final BulkNotificationProperties properties;
  private final BulkNotificationMetrics metrics;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  public BatchCreationResult create(CreateBatchCommand command) {
    final List<String> recipients = distinctRecipients(command.userIds());
    final int passSize = resolvePassSize(command.batchSize());
    final String notificationType =
        command.notificationType() == null || command.notificationType().isBlank()
            ? properties.defaultJobType()
            : command.notificationType();
    final String payloadJson = payloads.toJson(command.notificationData());

    final Instant now = Instant.now(clock);
    final UUID batchId = UUID.randomUUID();
    batchRepository.insert(
        NotificationBatchRecord.newPending(
            batchId,
            notificationType,
            recipients.size(),
            payloadJson,
            command.createdBy(),
            now));
    metrics.recordBatchCreated();
    logger.info(
        "notification batch created batchId={} type={} recipients={} createdBy={}",
        batchId,
        notificationType,
        recipients.size(),
        command.createdBy());

    final int queued = enqueue(batchId, recipients, notificationType, payloadJson, now);
    reconcile(batchId, recipients.size(), queued);

    final int processed = runImmediatePass(batchId, passSize);
    return new BatchCreationResult(batchId, queued, processed);
  }

  private int enqueue(
      UUID batchId, List<String> recipients, String notificationType, String payloadJson,
      Instant now) {
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    int queued = 0;
    int chunkIndex = 0;
    for (List<String> chunk : Lists.partition(recipients, properties.chunkSize())) {
      final List<QueueItemRecord> items = new ArrayList<>(chunk.size());
      for (String userId : chunk) {
        items.add(
            QueueItemRecord.newPending(
                UUID.randomUUID(),
                batchId,
                userId,
                notificationType,
                payloadJson,
                properties.maxAttempts(),
                now));
      }
      try {
        final Integer inserted =
            transactionTemplate.execute(status -> queueRepository.insertChunk(items));
        queued += inserted == null ? 0 : inserted;
      } catch (DataAccessException ex) {
        metrics.recordChunkFailure();
        logger.warn(
            "notification queue chunk insert failed batchId={} chunk={} size={}",
            batchId,
            chunkIndex,
            items.size(),
            ex);
      }
      chunkIndex++;
    }
    return queued;
  }

  private void reconcile(UUID batchId, int requested, int queued) {
    if (queued == requested) {
      return;
    }
    if (queued == 0) {
      batchRepository.deleteIfEmpty(batchId);
      logger.error("notification batch rolled back, no queue rows written batchId={}", batchId);
      throw new BatchStoreException("failed to queue any notification for batch " + batchId);
    }
    batchRepository.reconcileTotalCount(batchId, queued);
    logger.warn(
        "notification batch total reconciled batchId={} requested={} queued={}",
        batchId,
        requested,
        queued);
  }

  private int runImmediatePass(UUID batchId, int passSize) {
    try {
      final ProcessResult result = processingService.process(batchId, passSize);
      return result.processed();
    } catch (DataAccessException ex) {
      // rows are queued; the scheduled worker picks them up
      logger.warn("immediate notification pass failed batchId={}", batchId, ex);
      return 0;
    }
  }

  private List<String> distinctRecipients(List<String> userIds) {
    if (userIds == null || userIds.isEmpty()) {
      throw new InvalidBatchRequestException("userIds required");
    }
    final Set<String> distinct = new LinkedHashSet<>();
    for (String userId : userIds) {
      if (userId == null || userId.isBlank()) {
        throw new InvalidBatchRequestException("userIds must not contain blank values");
      }
      distinct.add(userId);
    }
    return List.copyOf(distinct);
  }

  private int resolvePassSize(Integer requested) {
    if (requested != null && requested <= 0) {
      throw new InvalidBatchRequestException("batchSize must be positive");
    }
    return properties.resolveBatchSize(requested);
  }
}
