/*
 * Where: Notification data access
 * What: Inserts and lists materialized inbox notifications
 */
package com.example.hotelops.notification.repository;

import static com.example.hotelops.common.JdbcTimestampUtils.getInstant;
import static com.example.hotelops.common.JdbcTimestampUtils.toTimestamp;

import com.example.hotelops.notification.model.NotificationRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(NotificationRecord record) {
    final String sql =
        """
        INSERT INTO notifications (
          notification_id,
          user_id,
          type,
          title,
          message,
          metadata,
          read_at,
          created_at
        ) VALUES (
          :notificationId,
          :userId,
          :type,
          :title,
          :message,
          :metadata::jsonb,
          :readAt,
          :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", record.notificationId())
            .addValue("userId", record.userId())
            .addValue("type", record.type())
            .addValue("title", record.title())
            .addValue("message", record.message())
            .addValue("metadata", record.metadataJson())
            .addValue("readAt", toTimestamp(record.readAt()))
            .addValue("createdAt", toTimestamp(record.createdAt()));
    jdbcTemplate.update(sql, params);
    return record.notificationId();
  }

  public List<NotificationRecord> findByUserId(String userId) {
    final String sql =
        """
        SELECT notification_id, user_id, type, title, message, metadata::text AS metadata_text,
               read_at, created_at
        FROM notifications
        WHERE user_id = :userId
        ORDER BY created_at DESC
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationRecord(
        UUID.fromString(rs.getString("notification_id")),
        rs.getString("user_id"),
        rs.getString("type"),
        rs.getString("title"),
        rs.getString("message"),
        rs.getString("metadata_text"),
        getInstant(rs, "read_at"),
        getInstant(rs, "created_at"));
  }
}
