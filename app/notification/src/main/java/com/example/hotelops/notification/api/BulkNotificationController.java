/*
 * Where: Notification bulk dispatch API
 * What: Single POST endpoint that routes on the "action" field
 * Why: Schedulers and the back office call one internal URL for every batch operation
 */
package com.example.hotelops.notification.api;

import com.example.hotelops.notification.config.BulkNotificationProperties;
import com.example.hotelops.notification.model.NotificationBatchRecord;
import com.example.hotelops.notification.service.BatchCreationResult;
import com.example.hotelops.notification.service.BatchCreationService;
import com.example.hotelops.notification.service.BatchProcessingService;
import com.example.hotelops.notification.service.BatchStatusService;
import com.example.hotelops.notification.service.BatchStatusView;
import com.example.hotelops.notification.service.CreateBatchCommand;
import com.example.hotelops.notification.service.InvalidBatchRequestException;
import com.example.hotelops.notification.service.NotificationPayloads;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/bulk-notifications")
@RequiredArgsConstructor
public class BulkNotificationController {

  private final BatchCreationService creationService;
  private final BatchProcessingService processingService;
  private final BatchStatusService statusService;
  private final NotificationPayloads payloads;
  private final BulkNotificationProperties properties;

  @PostMapping
  public Object dispatch(@Valid @RequestBody BulkNotificationRequest request) {
    final BulkNotificationAction action =
        BulkNotificationAction.fromWire(request.action())
            .orElseThrow(() -> new InvalidBatchRequestException("Invalid action"));
    return switch (action) {
      case CREATE_BATCH -> createBatch(request);
      case PROCESS_BATCH ->
          ProcessBatchResponse.from(
              processingService.process(
                  request.batchId(), properties.resolveBatchSize(request.batchSize())));
      case GET_STATUS -> toResponse(statusService.getStatus(request.batchId()));
      case LIST_BATCHES ->
          new BatchListResponse(
              statusService.listRecent(request.limit()).stream()
                  .map(batch -> toResponse(batch, null))
                  .toList());
    };
  }

  private CreateBatchResponse createBatch(BulkNotificationRequest request) {
    final BatchCreationResult result =
        creationService.create(
            new CreateBatchCommand(
                request.userIds(),
                request.notificationType(),
                request.notificationData(),
                request.batchSize(),
                request.createdBy()));
    return new CreateBatchResponse(
        true, result.batchId(), result.totalQueued(), result.processed());
  }

  private BatchResponse toResponse(BatchStatusView view) {
    return toResponse(view.batch(), view.pendingCount());
  }

  private BatchResponse toResponse(NotificationBatchRecord batch, Integer pendingCount) {
    return new BatchResponse(
        batch.batchId(),
        batch.jobType(),
        batch.totalCount(),
        batch.processedCount(),
        batch.failedCount(),
        batch.status().wireName(),
        payloads.readTree(batch.metadataJson()),
        batch.createdBy(),
        batch.createdAt(),
        batch.startedAt(),
        batch.completedAt(),
        pendingCount);
  }
}
