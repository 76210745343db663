/*
 * どこで: Incident データアクセス
 * 何を: incidents テーブルの登録/取得/条件付き更新を担う
 * なぜ: 状態更新を compare-and-set の単一 SQL に限定し、同時書き込みの上書きを防ぐため
 */
package com.incidentdesk.incident.repository;

import static com.incidentdesk.common.JdbcTimestampUtils.toInstant;
import static com.incidentdesk.common.JdbcTimestampUtils.toTimestamp;

import com.incidentdesk.incident.model.IncidentRecord;
import com.incidentdesk.incident.model.IncidentStatus;
import com.incidentdesk.incident.model.UpdateResult;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class IncidentRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT ticket_key, channel_id, thread_ts, author_id, assigned_to, status,
             created_at, last_notification
      FROM incidents
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(IncidentRecord record) {
    final String sql =
        """
        INSERT INTO incidents (
          ticket_key,
          channel_id,
          thread_ts,
          author_id,
          assigned_to,
          status,
          created_at,
          last_notification
        ) VALUES (
          :ticketKey,
          :channelId,
          :threadTs,
          :authorId,
          :assignedTo,
          :status,
          :createdAt,
          :lastNotification
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ticketKey", record.ticketKey())
            .addValue("channelId", record.channelId())
            .addValue("threadTs", record.threadTs())
            .addValue("authorId", record.authorId())
            .addValue("assignedTo", record.assignedTo())
            .addValue("status", record.status().name())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("lastNotification", toTimestamp(record.lastNotification()));
    try {
      jdbcTemplate.update(sql, params);
    } catch (DuplicateKeyException ex) {
      // PK(ticket_key) と UNIQUE(channel_id, thread_ts) のどちらの違反もここに来る
      throw new DuplicateIncidentException(
          "incident already exists ticketKey=" + record.ticketKey(), ex);
    }
  }

  public Optional<IncidentRecord> findByTicketKey(String ticketKey) {
    final String sql = SELECT_COLUMNS + "WHERE ticket_key = :ticketKey";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("ticketKey", ticketKey);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<IncidentRecord> findByThread(String channelId, String threadTs) {
    final String sql = SELECT_COLUMNS + "WHERE channel_id = :channelId AND thread_ts = :threadTs";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("channelId", channelId).addValue("threadTs", threadTs);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * 役割: 保存済みの status が expectedStatus と一致する場合に限り status/assigned_to を書き換える。
   * 動作: 更新件数 0 は「他の書き込みが先行した」ことを意味し CONFLICT を返す。再読込と判断は呼び出し側が行う。
   */
  public UpdateResult compareAndUpdate(IncidentRecord record, IncidentStatus expectedStatus) {
    final String sql =
        """
        UPDATE incidents
        SET status = :status,
            assigned_to = :assignedTo
        WHERE ticket_key = :ticketKey
          AND status = :expectedStatus
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", record.status().name())
            .addValue("assignedTo", record.assignedTo())
            .addValue("ticketKey", record.ticketKey())
            .addValue("expectedStatus", expectedStatus.name());
    return jdbcTemplate.update(sql, params) == 1 ? UpdateResult.UPDATED : UpdateResult.CONFLICT;
  }

  public int touchLastNotification(String ticketKey, Instant notifiedAt) {
    final String sql =
        """
        UPDATE incidents
        SET last_notification = :notifiedAt
        WHERE ticket_key = :ticketKey
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notifiedAt", toTimestamp(notifiedAt))
            .addValue("ticketKey", ticketKey);
    return jdbcTemplate.update(sql, params);
  }

  public List<IncidentRecord> findAll() {
    final String sql = SELECT_COLUMNS + "ORDER BY created_at DESC";
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public List<IncidentRecord> findActive() {
    final String sql = SELECT_COLUMNS + "WHERE status <> :closed ORDER BY created_at DESC";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("closed", IncidentStatus.CLOSED.name());
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private IncidentRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new IncidentRecord(
        rs.getString("ticket_key"),
        rs.getString("channel_id"),
        rs.getString("thread_ts"),
        rs.getString("author_id"),
        rs.getString("assigned_to"),
        IncidentStatus.valueOf(rs.getString("status")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("last_notification")));
  }
}
