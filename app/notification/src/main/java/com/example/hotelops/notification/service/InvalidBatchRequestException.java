/*
 * Where: Notification service layer
 * What: Malformed bulk request, raised before any row is written
 */
package com.example.hotelops.notification.service;

public class InvalidBatchRequestException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public InvalidBatchRequestException(String message) {
    super(message);
  }
}
