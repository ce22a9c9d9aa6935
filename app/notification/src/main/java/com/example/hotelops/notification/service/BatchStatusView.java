package com.example.hotelops.notification.service;

import com.example.hotelops.notification.model.NotificationBatchRecord;

/** A batch row together with its live count of pending queue items. */
public record BatchStatusView(NotificationBatchRecord batch, int pendingCount) {}
