package com.example.hotelops.notification.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record BatchListResponse(List<BatchResponse> batches) {
  public BatchListResponse {
    if (batches != null) {
      batches = Collections.unmodifiableList(new ArrayList<>(batches));
    }
  }
}
