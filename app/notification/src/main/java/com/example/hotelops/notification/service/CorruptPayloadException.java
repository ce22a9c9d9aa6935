/*
 * Where: Notification service layer
 * What: A JSONB payload read back from the store could not be parsed
 * Why: Damaged stored data is a store error, not a caller mistake
 */
package com.example.hotelops.notification.service;

public class CorruptPayloadException extends BatchStoreException {

  private static final long serialVersionUID = 1L;

  public CorruptPayloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
