/*
 * Where: Notification debug API
 * What: Lists the inbox notifications a user has received
 * Why: Lets operators confirm that a batch actually reached its recipients
 */
package com.example.hotelops.notification.api;

import com.example.hotelops.notification.model.NotificationRecord;
import com.example.hotelops.notification.repository.NotificationRepository;
import com.example.hotelops.notification.service.NotificationPayloads;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/debug/notification")
@RequiredArgsConstructor
public class NotificationDebugController {

  private final NotificationRepository notificationRepository;
  private final NotificationPayloads payloads;

  @GetMapping("/inbox/{userId}")
  public NotificationInboxResponse inbox(@PathVariable("userId") String userId) {
    final List<NotificationSummary> items =
        notificationRepository.findByUserId(userId).stream().map(this::toSummary).toList();
    return new NotificationInboxResponse(userId, items);
  }

  private NotificationSummary toSummary(NotificationRecord record) {
    return new NotificationSummary(
        record.notificationId(),
        record.type(),
        record.title(),
        record.message(),
        record.createdAt(),
        record.readAt(),
        payloads.readTree(record.metadataJson()));
  }
}
