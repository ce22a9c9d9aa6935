/*
 * Where: Notification data access
 * What: Reads and writes notification_batches, including atomic counter increments
 * Why: Every counter and status change is a single-row UPDATE so concurrent passes
 *      never lose an increment or double-stamp a lifecycle timestamp
 */
package com.example.hotelops.notification.repository;

import static com.example.hotelops.common.JdbcTimestampUtils.getInstant;
import static com.example.hotelops.common.JdbcTimestampUtils.toTimestamp;

import com.example.hotelops.notification.model.BatchStatus;
import com.example.hotelops.notification.model.NotificationBatchRecord;
import com.example.hotelops.notification.model.StatusTransitions;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationBatchRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT batch_id, job_type, total_count, processed_count, failed_count, status,
             metadata::text AS metadata_text, created_by, created_at, started_at, completed_at
      FROM notification_batches
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(NotificationBatchRecord record) {
    final String sql =
        """
        INSERT INTO notification_batches (
          batch_id,
          job_type,
          total_count,
          processed_count,
          failed_count,
          status,
          metadata,
          created_by,
          created_at
        ) VALUES (
          :batchId,
          :jobType,
          :totalCount,
          :processedCount,
          :failedCount,
          :status,
          :metadata::jsonb,
          :createdBy,
          :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("batchId", record.batchId())
            .addValue("jobType", record.jobType())
            .addValue("totalCount", record.totalCount())
            .addValue("processedCount", record.processedCount())
            .addValue("failedCount", record.failedCount())
            .addValue("status", record.status().name())
            .addValue("metadata", record.metadataJson())
            .addValue("createdBy", record.createdBy())
            .addValue("createdAt", toTimestamp(record.createdAt()));
    jdbcTemplate.update(sql, params);
    return record.batchId();
  }

  public Optional<NotificationBatchRecord> findById(UUID batchId) {
    final String sql = SELECT_COLUMNS + "WHERE batch_id = :batchId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("batchId", batchId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<NotificationBatchRecord> findRecent(int limit) {
    final String sql = SELECT_COLUMNS + "ORDER BY created_at DESC, batch_id LIMIT :limit";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** PENDING -> PROCESSING; zero rows when another pass already started the batch. */
  public int markProcessingIfPending(UUID batchId, Instant startedAt) {
    final String sql =
        """
        UPDATE notification_batches
        SET status = :toStatus,
            started_at = :startedAt
        WHERE batch_id = :batchId
          AND status = :fromStatus
        """;
    final MapSqlParameterSource params =
        transitionParams(BatchStatus.PENDING, BatchStatus.PROCESSING)
            .addValue("batchId", batchId)
            .addValue("startedAt", toTimestamp(startedAt));
    return jdbcTemplate.update(sql, params);
  }

  /**
   * PROCESSING -> COMPLETED, only while no queue item of the batch is PENDING or held by
   * another pass. The check and the update run as one statement.
   */
  public int markCompletedIfDrained(UUID batchId, Instant completedAt) {
    final String sql =
        """
        UPDATE notification_batches b
        SET status = :toStatus,
            completed_at = :completedAt
        WHERE b.batch_id = :batchId
          AND b.status = :fromStatus
          AND NOT EXISTS (
            SELECT 1
            FROM notification_queue q
            WHERE q.batch_id = b.batch_id
              AND q.status IN ('PENDING', 'PROCESSING')
          )
        """;
    final MapSqlParameterSource params =
        transitionParams(BatchStatus.PROCESSING, BatchStatus.COMPLETED)
            .addValue("batchId", batchId)
            .addValue("completedAt", toTimestamp(completedAt));
    return jdbcTemplate.update(sql, params);
  }

  /**
   * Set-based form of {@link #markCompletedIfDrained} for passes that are not scoped to a batch.
   *
   * @return ids of the batches completed by this statement
   */
  public List<UUID> completeDrainedBatches(Instant completedAt) {
    final String sql =
        """
        UPDATE notification_batches b
        SET status = :toStatus,
            completed_at = :completedAt
        WHERE b.status = :fromStatus
          AND NOT EXISTS (
            SELECT 1
            FROM notification_queue q
            WHERE q.batch_id = b.batch_id
              AND q.status IN ('PENDING', 'PROCESSING')
          )
        RETURNING b.batch_id
        """;
    final MapSqlParameterSource params =
        transitionParams(BatchStatus.PROCESSING, BatchStatus.COMPLETED)
            .addValue("completedAt", toTimestamp(completedAt));
    return jdbcTemplate.query(
        sql, params, (rs, rowNum) -> UUID.fromString(rs.getString("batch_id")));
  }

  public int incrementProcessed(UUID batchId) {
    final String sql =
        """
        UPDATE notification_batches
        SET processed_count = processed_count + 1
        WHERE batch_id = :batchId
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("batchId", batchId));
  }

  public int incrementFailed(UUID batchId) {
    final String sql =
        """
        UPDATE notification_batches
        SET failed_count = failed_count + 1
        WHERE batch_id = :batchId
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("batchId", batchId));
  }

  /** Lowers total_count to what was actually queued; only legal before processing starts. */
  public int reconcileTotalCount(UUID batchId, int queuedCount) {
    final String sql =
        """
        UPDATE notification_batches
        SET total_count = :queuedCount
        WHERE batch_id = :batchId
          AND status = 'PENDING'
          AND total_count > :queuedCount
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("batchId", batchId)
            .addValue("queuedCount", queuedCount);
    return jdbcTemplate.update(sql, params);
  }

  /** Removes a batch row that never received a single queue item. */
  public int deleteIfEmpty(UUID batchId) {
    final String sql =
        """
        DELETE FROM notification_batches b
        WHERE b.batch_id = :batchId
          AND b.status = 'PENDING'
          AND NOT EXISTS (SELECT 1 FROM notification_queue q WHERE q.batch_id = b.batch_id)
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("batchId", batchId));
  }

  private static MapSqlParameterSource transitionParams(BatchStatus from, BatchStatus to) {
    StatusTransitions.requireBatchTransition(from, to);
    return new MapSqlParameterSource()
        .addValue("fromStatus", from.name())
        .addValue("toStatus", to.name());
  }

  private NotificationBatchRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationBatchRecord(
        UUID.fromString(rs.getString("batch_id")),
        rs.getString("job_type"),
        rs.getInt("total_count"),
        rs.getInt("processed_count"),
        rs.getInt("failed_count"),
        BatchStatus.valueOf(rs.getString("status")),
        rs.getString("metadata_text"),
        rs.getString("created_by"),
        getInstant(rs, "created_at"),
        getInstant(rs, "started_at"),
        getInstant(rs, "completed_at"));
  }
}
