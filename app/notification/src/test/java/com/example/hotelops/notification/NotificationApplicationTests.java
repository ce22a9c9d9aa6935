package com.example.hotelops.notification;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.hotelops.notification.service.BatchProcessingWorker;
import com.example.hotelops.notification.service.InboxNotificationSender;
import com.example.hotelops.notification.service.NotificationSender;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class NotificationApplicationTests extends AbstractPostgresContainerTest {

  @Autowired private ApplicationContext context;

  @Test
  void contextLoadsWithInboxSenderAndWithoutWorker() {
    // failure injection is opt-in and the worker is disabled for tests
    assertThat(context.getBean(NotificationSender.class))
        .isInstanceOf(InboxNotificationSender.class);
    assertThat(context.getBeansOfType(BatchProcessingWorker.class)).isEmpty();
  }
}
