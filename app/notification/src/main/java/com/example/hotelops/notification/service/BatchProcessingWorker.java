/*
 * Where: Notification background worker
 * What: Drains the whole queue on a fixed delay
 * Why: Batches larger than the immediate pass, and retried items, need later passes
 */
package com.example.hotelops.notification.service;

import com.example.hotelops.notification.config.NotificationWorkerProperties;
import com.example.hotelops.notification.model.ProcessResult;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "notification.worker.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class BatchProcessingWorker {

  private static final Logger logger = LoggerFactory.getLogger(BatchProcessingWorker.class);

  private final BatchProcessingService processingService;
  private final NotificationWorkerProperties properties;

  @Scheduled(fixedDelayString = "${notification.worker.poll-interval}")
  public void run() {
    try {
      final ProcessResult result = processingService.process(null, properties.batchSize());
      if (result.processed() > 0 || result.failed() > 0) {
        logger.info(
            "scheduled notification pass processed={} failed={} remaining={}",
            result.processed(),
            result.failed(),
            result.remaining());
      }
    } catch (DataAccessException ex) {
      logger.error("scheduled notification pass failed", ex);
    }
  }
}
