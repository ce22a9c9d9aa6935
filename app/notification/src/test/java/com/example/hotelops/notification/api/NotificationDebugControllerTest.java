package com.example.hotelops.notification.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.hotelops.notification.config.BulkNotificationProperties;
import com.example.hotelops.notification.config.NotificationSecurityConfig;
import com.example.hotelops.notification.model.NotificationRecord;
import com.example.hotelops.notification.repository.NotificationRepository;
import com.example.hotelops.notification.service.NotificationPayloads;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(NotificationDebugController.class)
@Import({NotificationSecurityConfig.class, ApiExceptionHandler.class, NotificationPayloads.class})
@EnableConfigurationProperties(BulkNotificationProperties.class)
@TestPropertySource(properties = "notification.internal-api.token=test-internal-token")
class NotificationDebugControllerTest {

  private static final Instant CREATED_AT = Instant.parse("2026-03-02T09:00:05Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private NotificationRepository notificationRepository;

  @Test
  void inboxListsMaterializedNotifications() throws Exception {
    final NotificationRecord record =
        new NotificationRecord(
            UUID.randomUUID(),
            "user-1",
            "training_assigned",
            "New Training Assigned",
            "You have been assigned a new training module",
            "{\"moduleId\":\"m-1\"}",
            null,
            CREATED_AT);
    when(notificationRepository.findByUserId("user-1")).thenReturn(List.of(record));

    mockMvc
        .perform(
            get("/debug/notification/inbox/user-1")
                .header("Authorization", "Bearer test-internal-token"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.user_id").value("user-1"))
        .andExpect(jsonPath("$.notifications[0].title").value("New Training Assigned"))
        .andExpect(jsonPath("$.notifications[0].metadata.moduleId").value("m-1"));
  }

  @Test
  void inboxRequiresInternalToken() throws Exception {
    mockMvc.perform(get("/debug/notification/inbox/user-1")).andExpect(status().isUnauthorized());
  }

  @Test
  void corruptMetadataIsReportedAsBadRequest() throws Exception {
    final NotificationRecord record =
        new NotificationRecord(
            UUID.randomUUID(), "user-2", "t", "title", "msg", "{invalid-json", null, CREATED_AT);
    when(notificationRepository.findByUserId("user-2")).thenReturn(List.of(record));

    mockMvc
        .perform(
            get("/debug/notification/inbox/user-2")
                .header("Authorization", "Bearer test-internal-token"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
  }
}
