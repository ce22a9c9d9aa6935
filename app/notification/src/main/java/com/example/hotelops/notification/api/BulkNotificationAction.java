package com.example.hotelops.notification.api;

import java.util.Arrays;
import java.util.Optional;

/** Operations of the bulk dispatch surface, keyed by the wire value of the "action" field. */
public enum BulkNotificationAction {
  CREATE_BATCH("create_batch"),
  PROCESS_BATCH("process_batch"),
  GET_STATUS("get_status"),
  LIST_BATCHES("list_batches");

  private final String wireName;

  BulkNotificationAction(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static Optional<BulkNotificationAction> fromWire(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(action -> action.wireName.equals(value)).findFirst();
  }
}
