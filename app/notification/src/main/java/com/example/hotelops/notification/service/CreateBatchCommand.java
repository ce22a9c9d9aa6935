/*
 * Where: Notification service layer
 * What: Input of a batch creation, already decoupled from the HTTP request shape
 */
package com.example.hotelops.notification.service;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record CreateBatchCommand(
    List<String> userIds,
    String notificationType,
    JsonNode notificationData,
    Integer batchSize,
    String createdBy) {

  public CreateBatchCommand {
    // null elements are kept so validation can report them
    if (userIds != null) {
      userIds = Collections.unmodifiableList(new ArrayList<>(userIds));
    }
  }
}
