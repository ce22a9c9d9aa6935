/*
 * Where: Notification service layer
 * What: A single delivery attempt failed; the item is retried until max_attempts
 */
package com.example.hotelops.notification.service;

public class DeliveryFailureException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public DeliveryFailureException(String message) {
    super(message);
  }

  public DeliveryFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
