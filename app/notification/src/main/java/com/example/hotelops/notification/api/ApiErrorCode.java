package com.example.hotelops.notification.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  NOT_FOUND,
  STORE_ERROR
}
