package com.example.hotelops.notification.service;

import java.util.UUID;

/** totalQueued counts queue rows actually written; processed comes from the immediate pass. */
public record BatchCreationResult(UUID batchId, int totalQueued, int processed) {}
