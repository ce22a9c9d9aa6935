/*
 * Where: Notification API model
 * What: Wire view of a batch row, optionally with its pending item count
 * Why: Status values go out in lowercase; pending_count only appears on get_status
 */
package com.example.hotelops.notification.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BatchResponse(
    @JsonProperty("id") UUID batchId,
    String jobType,
    int totalCount,
    int processedCount,
    int failedCount,
    String status,
    JsonNode metadata,
    String createdBy,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    @JsonInclude(JsonInclude.Include.NON_NULL) Integer pendingCount) {}
