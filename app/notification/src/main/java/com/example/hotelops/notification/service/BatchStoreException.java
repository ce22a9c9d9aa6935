/*
 * Where: Notification service layer
 * What: Persistence failure detected by the service itself rather than thrown by JDBC
 * Why: Lets the API map both this and DataAccessException to the same store error
 */
package com.example.hotelops.notification.service;

public class BatchStoreException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public BatchStoreException(String message) {
    super(message);
  }

  public BatchStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
