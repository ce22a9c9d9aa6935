package com.example.hotelops.notification.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationInboxResponse(String userId, List<NotificationSummary> notifications) {
  public NotificationInboxResponse {
    // EI_EXPOSE_REP: keep an immutable copy of the caller's list
    if (notifications != null) {
      notifications = Collections.unmodifiableList(new ArrayList<>(notifications));
    }
  }
}
