/*
 * Where: Notification data access
 * What: Inserts, claims and settles notification_queue rows
 * Why: The claim is one UPDATE ... RETURNING over a SKIP LOCKED selection, so two
 *      concurrent passes never hold the same item and attempts are committed
 *      before any delivery side effect happens
 */
package com.example.hotelops.notification.repository;

import static com.example.hotelops.common.JdbcTimestampUtils.getInstant;
import static com.example.hotelops.common.JdbcTimestampUtils.toTimestamp;

import com.example.hotelops.notification.model.QueueItemRecord;
import com.example.hotelops.notification.model.QueueItemStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationQueueRepository {

  private static final String RETURNING_COLUMNS =
      """
      q.item_id, q.batch_id, q.user_id, q.notification_type,
      q.notification_data::text AS notification_data_text, q.status,
      q.attempts, q.max_attempts, q.error_message, q.locked_by, q.lease_until,
      q.created_at, q.processed_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Inserts one chunk with a single JDBC batch; the whole chunk fails or succeeds. */
  public int insertChunk(List<QueueItemRecord> chunk) {
    final String sql =
        """
        INSERT INTO notification_queue (
          item_id,
          batch_id,
          user_id,
          notification_type,
          notification_data,
          status,
          attempts,
          max_attempts,
          created_at
        ) VALUES (
          :itemId,
          :batchId,
          :userId,
          :notificationType,
          :notificationData::jsonb,
          :status,
          :attempts,
          :maxAttempts,
          :createdAt
        )
        """;
    final SqlParameterSource[] batch =
        chunk.stream().map(this::insertParams).toArray(SqlParameterSource[]::new);
    jdbcTemplate.batchUpdate(sql, batch);
    return batch.length;
  }

  /**
   * Claims up to {@code limit} items, oldest first. PENDING items and PROCESSING items whose
   * lease has expired are eligible as long as attempts remain; the claim increments attempts.
   */
  public List<QueueItemRecord> claimPending(
      UUID batchId, int limit, Instant now, Instant leaseUntil, String lockedBy) {
    final String sql =
        """
        WITH cte AS (
          SELECT item_id
          FROM notification_queue
          WHERE (
            status = 'PENDING'
            OR (status = 'PROCESSING' AND lease_until <= :now)
          )
          AND attempts < max_attempts
          %s
          ORDER BY created_at, item_id
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE notification_queue q
        SET status = 'PROCESSING',
            attempts = q.attempts + 1,
            locked_by = :lockedBy,
            lease_until = :leaseUntil
        FROM cte
        WHERE q.item_id = cte.item_id
        RETURNING %s
        """
            .formatted(batchScope(batchId, "batch_id"), RETURNING_COLUMNS);
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("batchId", batchId)
            .addValue("limit", limit)
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy);
    // RETURNING does not preserve the CTE ordering
    return jdbcTemplate.query(sql, params, this::mapRow).stream()
        .sorted(
            Comparator.comparing(QueueItemRecord::createdAt)
                .thenComparing(QueueItemRecord::itemId))
        .toList();
  }

  public int markSent(UUID itemId, Instant processedAt, String lockedBy) {
    final String sql =
        """
        UPDATE notification_queue
        SET status = 'SENT',
            processed_at = :processedAt,
            locked_by = NULL,
            lease_until = NULL
        WHERE item_id = :itemId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("itemId", itemId)
            .addValue("processedAt", toTimestamp(processedAt))
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markRetry(UUID itemId, String errorMessage, String lockedBy) {
    final String sql =
        """
        UPDATE notification_queue
        SET status = 'PENDING',
            error_message = :errorMessage,
            locked_by = NULL,
            lease_until = NULL
        WHERE item_id = :itemId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("itemId", itemId)
            .addValue("errorMessage", errorMessage)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markFailed(UUID itemId, String errorMessage, Instant processedAt, String lockedBy) {
    final String sql =
        """
        UPDATE notification_queue
        SET status = 'FAILED',
            error_message = :errorMessage,
            processed_at = :processedAt,
            locked_by = NULL,
            lease_until = NULL
        WHERE item_id = :itemId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("itemId", itemId)
            .addValue("errorMessage", errorMessage)
            .addValue("processedAt", toTimestamp(processedAt))
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  /**
   * Fails PROCESSING items whose lease expired after their last allowed attempt. Such an item
   * can never be claimed again, so without this it would hold its batch open forever.
   */
  public List<QueueItemRecord> failExpiredExhausted(
      UUID batchId, Instant now, String errorMessage) {
    final String sql =
        """
        UPDATE notification_queue q
        SET status = 'FAILED',
            error_message = :errorMessage,
            processed_at = :now,
            locked_by = NULL,
            lease_until = NULL
        WHERE q.status = 'PROCESSING'
          AND q.lease_until <= :now
          AND q.attempts >= q.max_attempts
          %s
        RETURNING %s
        """
            .formatted(batchScope(batchId, "q.batch_id"), RETURNING_COLUMNS);
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("batchId", batchId)
            .addValue("now", toTimestamp(now))
            .addValue("errorMessage", errorMessage);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int countPending(UUID batchId) {
    final String sql =
        "SELECT COUNT(*) FROM notification_queue WHERE status = 'PENDING' %s"
            .formatted(batchScope(batchId, "batch_id"));
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("batchId", batchId);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  public List<QueueItemRecord> findByBatchId(UUID batchId) {
    final String sql =
        """
        SELECT %s
        FROM notification_queue q
        WHERE q.batch_id = :batchId
        ORDER BY q.created_at, q.item_id
        """
            .formatted(RETURNING_COLUMNS);
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("batchId", batchId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  // A null batch id means system-wide; binding NULL into "batch_id = :batchId" would match nothing
  private String batchScope(UUID batchId, String column) {
    return batchId == null ? "" : "AND " + column + " = :batchId";
  }

  private MapSqlParameterSource insertParams(QueueItemRecord record) {
    return new MapSqlParameterSource()
        .addValue("itemId", record.itemId())
        .addValue("batchId", record.batchId())
        .addValue("userId", record.userId())
        .addValue("notificationType", record.notificationType())
        .addValue("notificationData", record.notificationDataJson())
        .addValue("status", record.status().name())
        .addValue("attempts", record.attempts())
        .addValue("maxAttempts", record.maxAttempts())
        .addValue("createdAt", toTimestamp(record.createdAt()));
  }

  private QueueItemRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String batchId = rs.getString("batch_id");
    return new QueueItemRecord(
        UUID.fromString(rs.getString("item_id")),
        batchId == null ? null : UUID.fromString(batchId),
        rs.getString("user_id"),
        rs.getString("notification_type"),
        rs.getString("notification_data_text"),
        QueueItemStatus.valueOf(rs.getString("status")),
        rs.getInt("attempts"),
        rs.getInt("max_attempts"),
        rs.getString("error_message"),
        rs.getString("locked_by"),
        getInstant(rs, "lease_until"),
        getInstant(rs, "created_at"),
        getInstant(rs, "processed_at"));
  }
}
