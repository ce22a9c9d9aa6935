/*
 * Where: Notification service layer
 * What: Delivery channel abstraction for one claimed queue item
 * Why: The inbox writer is the production channel; tests and CI swap in failing senders
 */
package com.example.hotelops.notification.service;

import com.example.hotelops.notification.model.QueueItemRecord;

public interface NotificationSender {

  /**
   * Delivers one queue item. Any runtime exception counts as a failed attempt.
   *
   * @throws DeliveryFailureException when the channel rejects the notification
   */
  void send(QueueItemRecord item);
}
