/*
 * Where: Notification service layer
 * What: Materializes a queue item into the user's inbox (notifications table)
 * Why: The in-app inbox is the delivery channel of the intranet
 */
package com.example.hotelops.notification.service;

import com.example.hotelops.notification.model.NotificationRecord;
import com.example.hotelops.notification.model.QueueItemRecord;
import com.example.hotelops.notification.repository.NotificationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class InboxNotificationSender implements NotificationSender {

  private static final Logger logger = LoggerFactory.getLogger(InboxNotificationSender.class);

  private final NotificationRepository notificationRepository;
  private final NotificationPayloads payloads;
  private final Clock clock;

  @Override
  public void send(QueueItemRecord item) {
    final NotificationPayloads.Content content = payloads.resolveContent(item.notificationDataJson());
    final NotificationRecord notification =
        new NotificationRecord(
            UUID.randomUUID(),
            item.userId(),
            item.notificationType(),
            content.title(),
            content.message(),
            item.notificationDataJson(),
            null,
            Instant.now(clock));
    try {
      notificationRepository.insert(notification);
    } catch (DataAccessException ex) {
      throw new DeliveryFailureException("inbox insert failed for userId=" + item.userId(), ex);
    }
    logger.debug(
        "notification materialized id={} itemId={} userId={}",
        notification.notificationId(),
        item.itemId(),
        item.userId());
  }
}
