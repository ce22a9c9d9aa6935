/*
 * Where: Notification domain model
 * What: Raised when code asks for a transition the state machine does not allow
 */
package com.example.hotelops.notification.model;

public class InvalidStatusTransitionException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public InvalidStatusTransitionException(String entity, String from, String to) {
    super(entity + " status transition " + from + " -> " + to + " is not allowed");
  }
}
