/*
 * Where: Notification service layer
 * What: Converts notification payload objects to and from their JSONB text form
 * Why: Creator, sender and API all share one interpretation of title/message defaults
 */
package com.example.hotelops.notification.service;

import com.example.hotelops.notification.config.BulkNotificationProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class NotificationPayloads {

  private static final String EMPTY_OBJECT = "{}";

  private final ObjectMapper objectMapper;
  private final BulkNotificationProperties properties;

  public record Content(String title, String message) {}

  /** Serializes a request payload; absent means an empty object, anything but an object is rejected. */
  public String toJson(JsonNode payload) {
    if (payload == null || payload.isNull() || payload.isMissingNode()) {
      return EMPTY_OBJECT;
    }
    if (!payload.isObject()) {
      throw new InvalidBatchRequestException("notificationData must be a JSON object");
    }
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException ex) {
      throw new InvalidBatchRequestException("notificationData is not serializable");
    }
  }

  /** Parses a stored payload; blank means an empty object. */
  public JsonNode readTree(String json) {
    if (json == null || json.isBlank()) {
      return objectMapper.createObjectNode();
    }
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException ex) {
      throw new CorruptPayloadException("stored notification payload is not valid JSON", ex);
    }
  }

  public Content resolveContent(String notificationDataJson) {
    final JsonNode data = readTree(notificationDataJson);
    return new Content(
        textOrDefault(data, "title", properties.defaultTitle()),
        textOrDefault(data, "message", properties.defaultMessage()));
  }

  private String textOrDefault(JsonNode data, String field, String fallback) {
    final JsonNode value = data.get(field);
    if (value == null || !value.isTextual() || value.asText().isBlank()) {
      return fallback;
    }
    return value.asText();
  }
}
