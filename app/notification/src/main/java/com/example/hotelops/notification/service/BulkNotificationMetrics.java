/*
 * Where: Notification service layer
 * What: Records batch creation, delivery outcomes, chunk failures and backlog
 * Why: Failure rates and queue depth are watched from Prometheus, not from this service
 */
package com.example.hotelops.notification.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class BulkNotificationMetrics {

  public static final String RESULT_SENT = "sent";
  public static final String RESULT_RETRY = "retry";
  public static final String RESULT_FAILED = "failed";
  public static final String RESULT_LOCK_LOST = "lock_lost";

  private static final String METRIC_BATCHES_CREATED = "notification.bulk.batches.created";
  private static final String METRIC_DELIVERY_TOTAL = "notification.bulk.delivery.total";
  private static final String METRIC_CHUNK_FAILURES = "notification.bulk.queue.chunk.failures";
  private static final String METRIC_BACKLOG_CURRENT = "notification.bulk.backlog.current";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger backlogCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
  private final Counter batchesCreated;
  private final Counter chunkFailures;

  public BulkNotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_BACKLOG_CURRENT, backlogCurrent, AtomicInteger::get)
        .description("Pending queue items left after the most recent pass")
        .register(meterRegistry);
    this.batchesCreated =
        Counter.builder(METRIC_BATCHES_CREATED)
            .description("Total number of notification batches created")
            .register(meterRegistry);
    this.chunkFailures =
        Counter.builder(METRIC_CHUNK_FAILURES)
            .description("Queue insert chunks that failed during batch fan-out")
            .register(meterRegistry);
  }

  public void recordBatchCreated() {
    batchesCreated.increment();
  }

  public void recordChunkFailure() {
    chunkFailures.increment();
  }

  public void recordDeliveryResult(String result) {
    deliveryCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_DELIVERY_TOTAL)
                    .description("Bulk notification delivery outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void updateBacklogCurrent(int backlogCount) {
    backlogCurrent.set(Math.max(backlogCount, 0));
  }
}
