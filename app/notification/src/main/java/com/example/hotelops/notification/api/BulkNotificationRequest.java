/*
 * Where: Notification API model
 * What: Body of the single bulk dispatch endpoint
 * Why: Each action reads only the fields it needs; the rest are ignored
 */
package com.example.hotelops.notification.api;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.Positive;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

public record BulkNotificationRequest(
    String action,
    List<String> userIds,
    String notificationType,
    JsonNode notificationData,
    UUID batchId,
    @Positive Integer batchSize,
    String createdBy,
    @Positive Integer limit) {

  public BulkNotificationRequest {
    if (userIds != null) {
      userIds = Collections.unmodifiableList(new ArrayList<>(userIds));
    }
  }
}
