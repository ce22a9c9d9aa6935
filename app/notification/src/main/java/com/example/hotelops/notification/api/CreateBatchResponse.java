package com.example.hotelops.notification.api;

import java.util.UUID;

public record CreateBatchResponse(boolean success, UUID batchId, int totalQueued, int processed) {}
