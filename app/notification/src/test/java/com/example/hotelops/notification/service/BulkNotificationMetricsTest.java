package com.example.hotelops.notification.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

class BulkNotificationMetricsTest {

  @Test
  void recordsBatchDeliveryChunkAndBacklogMetrics() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final BulkNotificationMetrics metrics = new BulkNotificationMetrics(registry);

    metrics.recordBatchCreated();
    metrics.recordDeliveryResult(BulkNotificationMetrics.RESULT_SENT);
    metrics.recordDeliveryResult(BulkNotificationMetrics.RESULT_SENT);
    metrics.recordDeliveryResult(BulkNotificationMetrics.RESULT_FAILED);
    metrics.recordChunkFailure();
    metrics.updateBacklogCurrent(7);

    assertThat(registry.get("notification.bulk.batches.created").counter().count())
        .isEqualTo(1.0d);
    assertThat(
            registry
                .get("notification.bulk.delivery.total")
                .tag("result", "sent")
                .counter()
                .count())
        .isEqualTo(2.0d);
    assertThat(
            registry
                .get("notification.bulk.delivery.total")
                .tag("result", "failed")
                .counter()
                .count())
        .isEqualTo(1.0d);
    assertThat(registry.get("notification.bulk.queue.chunk.failures").counter().count())
        .isEqualTo(1.0d);
    assertThat(registry.get("notification.bulk.backlog.current").gauge().value())
        .isEqualTo(7.0d);
  }

  @Test
  void backlogNeverGoesNegative() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final BulkNotificationMetrics metrics = new BulkNotificationMetrics(registry);

    metrics.updateBacklogCurrent(-3);

    assertThat(registry.get("notification.bulk.backlog.current").gauge().value()).isZero();
  }
}
