package com.example.hotelops.notification.model;

/** Outcome of one processing pass; callers schedule another pass while remaining is positive. */
public record ProcessResult(int processed, int remaining, int failed) {

  public static ProcessResult empty() {
    return new ProcessResult(0, 0, 0);
  }
}
