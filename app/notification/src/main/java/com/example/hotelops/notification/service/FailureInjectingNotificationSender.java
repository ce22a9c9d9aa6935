/*
 * Where: Notification service layer
 * What: CI/test-only sender that fails deliveries for matching user ids
 * Why: Reproduces retry and terminal failure end to end without touching the real path
 */
package com.example.hotelops.notification.service;

import com.example.hotelops.notification.model.QueueItemRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Primary
@RequiredArgsConstructor
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "notification.bulk.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingNotificationSender implements NotificationSender {

  private final InboxNotificationSender delegate;

  @Value("${notification.bulk.failure-injection.user-id-prefix:}")
  private String userIdPrefix;

  @Override
  public void send(QueueItemRecord item) {
    if (shouldInjectFailure(item.userId())) {
      throw new DeliveryFailureException(
          "notification delivery failure injection matched userId=" + item.userId());
    }
    delegate.send(item);
  }

  private boolean shouldInjectFailure(String userId) {
    if (userIdPrefix == null || userIdPrefix.isBlank()) {
      return false;
    }
    return userId.startsWith(userIdPrefix);
  }
}
