package com.example.hotelops.notification.service;

import java.util.UUID;

public class BatchNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public BatchNotFoundException(UUID batchId) {
    super("notification batch not found: " + batchId);
  }
}
