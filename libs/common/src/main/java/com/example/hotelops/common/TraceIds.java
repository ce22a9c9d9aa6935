package com.example.hotelops.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }

  public static String orNew(String candidate) {
    return candidate == null || candidate.isBlank() ? newRequestId() : candidate;
  }
}
