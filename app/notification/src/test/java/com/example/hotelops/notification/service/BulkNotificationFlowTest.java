/*
 * Where: Notification end-to-end tests
 * What: Drives create, process and status against Postgres with injected delivery failures
 * Why: Batch counters, item attempts and completion must agree once real SQL is involved
 */
package com.example.hotelops.notification.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.hotelops.notification.AbstractPostgresContainerTest;
import com.example.hotelops.notification.config.NotificationWorkerProperties;
import com.example.hotelops.notification.model.BatchStatus;
import com.example.hotelops.notification.model.NotificationBatchRecord;
import com.example.hotelops.notification.model.ProcessResult;
import com.example.hotelops.notification.model.QueueItemRecord;
import com.example.hotelops.notification.model.QueueItemStatus;
import com.example.hotelops.notification.repository.NotificationBatchRepository;
import com.example.hotelops.notification.repository.NotificationQueueRepository;
import com.example.hotelops.notification.repository.NotificationRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest(
    properties = {
      "notification.bulk.failure-injection.enabled=true",
      "notification.bulk.failure-injection.user-id-prefix=fail-"
    })
@ActiveProfiles("test")
class BulkNotificationFlowTest extends AbstractPostgresContainerTest {

  @Autowired private BatchCreationService creationService;
  @Autowired private BatchProcessingService processingService;
  @Autowired private BatchStatusService statusService;
  @Autowired private NotificationBatchRepository batchRepository;
  @Autowired private NotificationQueueRepository queueRepository;
  @Autowired private NotificationRepository notificationRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM notification_queue", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM notification_batches", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM notifications", new MapSqlParameterSource());
  }

  @Test
  void succeedingBatchCompletesInTheImmediatePass() {
    final BatchCreationResult result =
        creationService.create(
            new CreateBatchCommand(
                List.of("u1", "u2", "u3", "u4", "u5"), null, null, 50, "admin-1"));

    assertThat(result.totalQueued()).isEqualTo(5);
    assertThat(result.processed()).isEqualTo(5);

    final BatchStatusView view = statusService.getStatus(result.batchId());
    assertThat(view.batch().status()).isEqualTo(BatchStatus.COMPLETED);
    assertThat(view.batch().totalCount()).isEqualTo(5);
    assertThat(view.batch().processedCount()).isEqualTo(5);
    assertThat(view.batch().completedAt()).isNotNull();
    assertThat(view.pendingCount()).isZero();
    assertThat(queueRepository.findByBatchId(result.batchId()))
        .allSatisfy(
            item -> {
              assertThat(item.status()).isEqualTo(QueueItemStatus.SENT);
              assertThat(item.attempts()).isEqualTo(1);
            });
    assertThat(notificationRepository.findByUserId("u3"))
        .singleElement()
        .satisfies(
            notification -> {
              assertThat(notification.title()).isEqualTo("New Training Assigned");
              assertThat(notification.type()).isEqualTo("training_assigned");
            });
  }

  @Test
  void smallPassSizeLeavesTheRestPending() {
    final BatchCreationResult result =
        creationService.create(
            new CreateBatchCommand(List.of("u1", "u2", "u3", "u4", "u5"), null, null, 2, null));

    assertThat(result.processed()).isEqualTo(2);
    final BatchStatusView afterCreate = statusService.getStatus(result.batchId());
    assertThat(afterCreate.batch().status()).isEqualTo(BatchStatus.PROCESSING);
    assertThat(afterCreate.pendingCount()).isEqualTo(3);

    final ProcessResult second = processingService.process(result.batchId(), 2);
    assertThat(second).isEqualTo(new ProcessResult(2, 1, 0));

    final ProcessResult third = processingService.process(result.batchId(), 2);
    assertThat(third).isEqualTo(new ProcessResult(1, 0, 0));
    assertThat(statusService.getStatus(result.batchId()).batch().status())
        .isEqualTo(BatchStatus.COMPLETED);
  }

  @Test
  void scheduledDrainCompletesBatchLeftOpenByTheCreatorPass() {
    final BatchCreationResult result =
        creationService.create(
            new CreateBatchCommand(List.of("u1", "u2", "u3", "u4", "u5"), null, null, 2, null));
    assertThat(statusService.getStatus(result.batchId()).batch().status())
        .isEqualTo(BatchStatus.PROCESSING);
    final BatchProcessingWorker worker =
        new BatchProcessingWorker(
            processingService, new NotificationWorkerProperties(true, Duration.ofSeconds(5), 50));

    worker.run();

    final BatchStatusView view = statusService.getStatus(result.batchId());
    assertThat(view.batch().status()).isEqualTo(BatchStatus.COMPLETED);
    assertThat(view.batch().processedCount()).isEqualTo(5);
    assertThat(view.batch().completedAt()).isNotNull();
    assertThat(view.pendingCount()).isZero();
  }

  @Test
  void systemWidePassesCarryPendingBatchThroughToCompleted() {
    final Instant createdAt = Instant.now();
    final UUID batchId = UUID.randomUUID();
    batchRepository.insert(
        NotificationBatchRecord.newPending(
            batchId, "training_assigned", 3, "{}", "admin-1", createdAt));
    queueRepository.insertChunk(
        List.of(
            pendingItem(batchId, "u1", createdAt),
            pendingItem(batchId, "u2", createdAt.plusMillis(1)),
            pendingItem(batchId, "u3", createdAt.plusMillis(2))));
    assertThat(statusService.getStatus(batchId).batch().status()).isEqualTo(BatchStatus.PENDING);

    assertThat(processingService.process(null, 2)).isEqualTo(new ProcessResult(2, 1, 0));
    final NotificationBatchRecord started = statusService.getStatus(batchId).batch();
    assertThat(started.status()).isEqualTo(BatchStatus.PROCESSING);
    assertThat(started.startedAt()).isNotNull();
    assertThat(started.completedAt()).isNull();

    assertThat(processingService.process(null, 2)).isEqualTo(new ProcessResult(1, 0, 0));
    final BatchStatusView finished = statusService.getStatus(batchId);
    assertThat(finished.batch().status()).isEqualTo(BatchStatus.COMPLETED);
    assertThat(finished.batch().processedCount()).isEqualTo(3);
    assertThat(finished.batch().completedAt()).isNotNull();
    assertThat(finished.pendingCount()).isZero();
  }

  @Test
  void alwaysFailingRecipientIsFailedAfterMaxAttempts() {
    final BatchCreationResult result =
        creationService.create(
            new CreateBatchCommand(List.of("fail-1"), null, null, null, null));
    assertThat(result.processed()).isZero();

    final QueueItemRecord afterFirst = queueRepository.findByBatchId(result.batchId()).get(0);
    assertThat(afterFirst.status()).isEqualTo(QueueItemStatus.PENDING);
    assertThat(afterFirst.attempts()).isEqualTo(1);
    assertThat(afterFirst.errorMessage()).contains("fail-1");

    assertThat(processingService.process(result.batchId(), 50))
        .isEqualTo(new ProcessResult(0, 1, 0));
    assertThat(processingService.process(result.batchId(), 50))
        .isEqualTo(new ProcessResult(0, 0, 1));

    final QueueItemRecord item = queueRepository.findByBatchId(result.batchId()).get(0);
    assertThat(item.status()).isEqualTo(QueueItemStatus.FAILED);
    assertThat(item.attempts()).isEqualTo(3);
    final NotificationBatchRecord batch = statusService.getStatus(result.batchId()).batch();
    assertThat(batch.failedCount()).isEqualTo(1);
    assertThat(batch.status()).isEqualTo(BatchStatus.COMPLETED);
    assertThat(notificationRepository.findByUserId("fail-1")).isEmpty();

    // exhausted items are never claimed again
    assertThat(processingService.process(result.batchId(), 50)).isEqualTo(ProcessResult.empty());
    assertThat(queueRepository.findByBatchId(result.batchId()).get(0).attempts()).isEqualTo(3);
  }

  @Test
  void mixedBatchSettlesEveryRecipientWithinTotal() {
    final BatchCreationResult result =
        creationService.create(
            new CreateBatchCommand(List.of("u1", "fail-2", "u3"), null, null, null, null));

    for (int pass = 0; pass < 3; pass++) {
      processingService.process(result.batchId(), 50);
      final NotificationBatchRecord batch = statusService.getStatus(result.batchId()).batch();
      assertThat(batch.settledCount()).isLessThanOrEqualTo(batch.totalCount());
    }

    final NotificationBatchRecord batch = statusService.getStatus(result.batchId()).batch();
    assertThat(batch.processedCount()).isEqualTo(2);
    assertThat(batch.failedCount()).isEqualTo(1);
    assertThat(batch.settledCount()).isEqualTo(batch.totalCount());
    assertThat(batch.status()).isEqualTo(BatchStatus.COMPLETED);
    assertThat(queueRepository.findByBatchId(result.batchId()))
        .allSatisfy(item -> assertThat(item.attempts()).isLessThanOrEqualTo(item.maxAttempts()));
  }

  @Test
  void getStatusIsIdempotent() {
    final BatchCreationResult result =
        creationService.create(new CreateBatchCommand(List.of("u1", "u2"), null, null, 1, null));

    final BatchStatusView first = statusService.getStatus(result.batchId());
    final BatchStatusView second = statusService.getStatus(result.batchId());

    assertThat(second).isEqualTo(first);
    assertThat(first.pendingCount()).isEqualTo(1);
  }

  @Test
  void processingUnknownBatchReturnsZeros() {
    final ProcessResult result = processingService.process(UUID.randomUUID(), 50);

    assertThat(result).isEqualTo(ProcessResult.empty());
  }

  private static QueueItemRecord pendingItem(UUID batchId, String userId, Instant createdAt) {
    return QueueItemRecord.newPending(
        UUID.randomUUID(), batchId, userId, "training_assigned", "{}", 3, createdAt);
  }
}
