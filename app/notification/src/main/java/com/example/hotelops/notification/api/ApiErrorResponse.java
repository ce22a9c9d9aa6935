package com.example.hotelops.notification.api;

public record ApiErrorResponse(ApiErrorCode code, String message) {}
