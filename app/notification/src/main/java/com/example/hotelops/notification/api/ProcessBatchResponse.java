package com.example.hotelops.notification.api;

import com.example.hotelops.notification.model.ProcessResult;

public record ProcessBatchResponse(int processed, int remaining, int failed) {

  static ProcessBatchResponse from(ProcessResult result) {
    return new ProcessBatchResponse(result.processed(), result.remaining(), result.failed());
  }
}
