package com.labelrun.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC-backed progress ledger on the embedded H2 database (schema.sql). Upserts use H2 MERGE ... KEY so repeated
 * writes for one identity never create a second row.
 */
@Repository
@RequiredArgsConstructor
public class JdbcProgressEntryRepository implements ProgressEntryRepository {

    static final int MAX_ERROR_MESSAGE_LENGTH = 4000;

    private static final String COLUMNS = "source_id, record_id, status, label, attempt_count, error_message, updated_at";

    private static final RowMapper<ProgressEntry> ROW_MAPPER = JdbcProgressEntryRepository::mapRow;

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<ProgressEntry> findBySourceIdAndRecordId(String sourceId, long recordId) {
        List<ProgressEntry> rows = jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM progress_entry WHERE source_id = ? AND record_id = ?",
                ROW_MAPPER, sourceId, recordId);
        return rows.stream().findFirst();
    }

    @Override
    public boolean existsBySourceIdAndRecordIdAndStatus(String sourceId, long recordId, ProgressStatus status) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM progress_entry WHERE source_id = ? AND record_id = ? AND status = ?",
                Integer.class, sourceId, recordId, status.name());
        return count != null && count > 0;
    }

    @Override
    public void upsert(ProgressEntry entry) {
        jdbcTemplate.update("""
                MERGE INTO progress_entry (source_id, record_id, status, label, attempt_count, error_message, updated_at)
                KEY (source_id, record_id)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """,
                entry.getSourceId(),
                entry.getRecordId(),
                entry.getStatus().name(),
                entry.getLabel() != null ? entry.getLabel().name() : null,
                entry.getAttemptCount(),
                truncate(entry.getErrorMessage()),
                Timestamp.from(entry.getUpdatedAt()));
    }

    @Override
    public Map<ProgressStatus, Long> countByStatus() {
        Map<ProgressStatus, Long> counts = new EnumMap<>(ProgressStatus.class);
        jdbcTemplate.query("SELECT status, COUNT(*) AS cnt FROM progress_entry GROUP BY status",
                rs -> {
                    counts.put(ProgressStatus.valueOf(rs.getString("status")), rs.getLong("cnt"));
                });
        return counts;
    }

    @Override
    public Map<ProgressStatus, Long> countByStatusForSource(String sourceId) {
        Map<ProgressStatus, Long> counts = new EnumMap<>(ProgressStatus.class);
        jdbcTemplate.query("SELECT status, COUNT(*) AS cnt FROM progress_entry WHERE source_id = ? GROUP BY status",
                rs -> {
                    counts.put(ProgressStatus.valueOf(rs.getString("status")), rs.getLong("cnt"));
                }, sourceId);
        return counts;
    }

    @Override
    public List<ProgressEntry> findBySourceIdAndStatus(String sourceId, ProgressStatus status) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM progress_entry WHERE source_id = ? AND status = ? ORDER BY record_id",
                ROW_MAPPER, sourceId, status.name());
    }

    @Override
    public List<ProgressEntry> findRecentByStatus(ProgressStatus status, int limit) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM progress_entry WHERE status = ? ORDER BY updated_at DESC, record_id LIMIT ?",
                ROW_MAPPER, status.name(), Math.max(1, limit));
    }

    private static ProgressEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
        ProgressEntry e = new ProgressEntry();
        e.setSourceId(rs.getString("source_id"));
        e.setRecordId(rs.getLong("record_id"));
        e.setStatus(ProgressStatus.valueOf(rs.getString("status")));
        String label = rs.getString("label");
        e.setLabel(label != null ? Label.valueOf(label) : null);
        e.setAttemptCount(rs.getInt("attempt_count"));
        e.setErrorMessage(rs.getString("error_message"));
        Timestamp updatedAt = rs.getTimestamp("updated_at");
        e.setUpdatedAt(updatedAt != null ? updatedAt.toInstant() : null);
        return e;
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_MESSAGE_LENGTH);
    }
}
