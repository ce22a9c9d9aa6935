package com.example.hotelops.notification.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.internal-api")
public record InternalApiProperties(String headerName, String token) {

  public InternalApiProperties {
    headerName = headerName == null || headerName.isBlank() ? "Authorization" : headerName;
    token = token == null ? "" : token;
  }
}
