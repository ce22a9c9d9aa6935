/*
 * Where: Notification service layer
 * What: Read-only views of batch progress
 * Why: pending_count is derived from the queue on every call, never cached on the batch row
 */
package com.example.hotelops.notification.service;

import com.example.hotelops.notification.config.BulkNotificationProperties;
import com.example.hotelops.notification.model.NotificationBatchRecord;
import com.example.hotelops.notification.repository.NotificationBatchRepository;
import com.example.hotelops.notification.repository.NotificationQueueRepository;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class BatchStatusService {

  static final int DEFAULT_LIST_LIMIT = 20;

  private final NotificationBatchRepository batchRepository;
  private final NotificationQueueRepository queueRepository;
  private final BulkNotificationProperties properties;

  public BatchStatusView getStatus(UUID batchId) {
    if (batchId == null) {
      throw new InvalidBatchRequestException("batchId required");
    }
    final NotificationBatchRecord batch =
        batchRepository.findById(batchId).orElseThrow(() -> new BatchNotFoundException(batchId));
    return new BatchStatusView(batch, queueRepository.countPending(batchId));
  }

  /** Most recent batches first; the limit defaults to 20 and is capped by configuration. */
  public List<NotificationBatchRecord> listRecent(Integer limit) {
    if (limit != null && limit <= 0) {
      throw new InvalidBatchRequestException("limit must be positive");
    }
    final int effective =
        limit == null ? DEFAULT_LIST_LIMIT : Math.min(limit, properties.listLimitMax());
    return batchRepository.findRecent(effective);
  }
}
