package com.example.hotelops.notification.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationSummary(
    UUID notificationId,
    String type,
    String title,
    String message,
    Instant createdAt,
    Instant readAt,
    JsonNode metadata) {}
