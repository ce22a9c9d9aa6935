/*
 * Where: Notification application configuration binding
 * What: Holds the schedule of the background drain worker
 */
package com.example.hotelops.notification.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.worker")
public record NotificationWorkerProperties(boolean enabled, Duration pollInterval, int batchSize) {

  public NotificationWorkerProperties {
    pollInterval = pollInterval == null ? Duration.ofSeconds(5) : pollInterval;
    batchSize = batchSize <= 0 ? 50 : batchSize;
  }
}
