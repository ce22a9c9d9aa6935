/*
 * Where: Notification domain model
 * What: A materialized, user-visible notification (notifications table)
 */
package com.example.hotelops.notification.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationRecord(
    UUID notificationId,
    String userId,
    String type,
    String title,
    String message,
    String metadataJson,
    Instant readAt,
    Instant createdAt) {}
