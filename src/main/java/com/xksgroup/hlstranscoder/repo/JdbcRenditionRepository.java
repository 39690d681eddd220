package com.xksgroup.hlstranscoder.repo;

import com.xksgroup.hlstranscoder.exception.NotFoundException;
import com.xksgroup.hlstranscoder.exception.StateConflictException;
import com.xksgroup.hlstranscoder.model.Rendition;
import com.xksgroup.hlstranscoder.model.RenditionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
@Slf4j
public class JdbcRenditionRepository implements RenditionRepository {

    private static final String SELECT_COLUMNS =
            "SELECT id, video_id, job_id, height, width, bitrate_kbps, status, storage_key, codecs, error, created_at, updated_at " +
                    "FROM renditions ";

    private static final RowMapper<Rendition> ROW_MAPPER = new RenditionRowMapper();

    private final JdbcTemplate jdbcTemplate;

    public JdbcRenditionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void insertAll(List<Rendition> renditions) {
        LocalDateTime now = LocalDateTime.now();
        for (Rendition r : renditions) {
            if (r.getId() == null) {
                r.setId(UUID.randomUUID().toString());
            }
            if (r.getStatus() == null) {
                r.setStatus(RenditionStatus.QUEUED);
            }
            r.setCreatedAt(now);
            r.setUpdatedAt(now);
        }
        jdbcTemplate.batchUpdate(
                "INSERT INTO renditions (id, video_id, job_id, height, bitrate_kbps, status, created_at, updated_at) " +
                        "VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                renditions,
                renditions.size(),
                (ps, r) -> {
                    ps.setString(1, r.getId());
                    ps.setString(2, r.getVideoId());
                    ps.setString(3, r.getJobId());
                    ps.setInt(4, r.getHeight());
                    if (r.getBitrateKbps() != null) {
                        ps.setInt(5, r.getBitrateKbps());
                    } else {
                        ps.setNull(5, Types.INTEGER);
                    }
                    ps.setString(6, r.getStatus().dbValue());
                    ps.setTimestamp(7, Timestamp.valueOf(now));
                    ps.setTimestamp(8, Timestamp.valueOf(now));
                });
    }

    @Override
    public List<Rendition> findByJobId(String jobId) {
        return jdbcTemplate.query(SELECT_COLUMNS + "WHERE job_id = ? ORDER BY height", ROW_MAPPER, jobId);
    }

    @Override
    public void markRunning(String jobId, int height) {
        int updated = jdbcTemplate.update(
                "UPDATE renditions SET status = 'running', updated_at = ? " +
                        "WHERE job_id = ? AND height = ? AND status IN ('queued', 'running')",
                now(), jobId, height);
        checkUpdated(updated, jobId, height, RenditionStatus.RUNNING);
    }

    @Override
    public void markReady(String jobId, int height, String key, int width, String codecs) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("ready rendition needs a storage key");
        }
        int updated = jdbcTemplate.update(
                "UPDATE renditions SET status = 'ready', storage_key = ?, width = ?, codecs = ?, error = NULL, " +
                        "updated_at = ? WHERE job_id = ? AND height = ? AND status = 'running'",
                key, width, codecs, now(), jobId, height);
        checkUpdated(updated, jobId, height, RenditionStatus.READY);
    }

    @Override
    public void markFailed(String jobId, int height, String error) {
        int updated = jdbcTemplate.update(
                "UPDATE renditions SET status = 'failed', error = ?, updated_at = ? " +
                        "WHERE job_id = ? AND height = ? AND status IN ('queued', 'running')",
                JdbcJobRepository.truncate(error), now(), jobId, height);
        checkUpdated(updated, jobId, height, RenditionStatus.FAILED);
    }

    private void checkUpdated(int updated, String jobId, int height, RenditionStatus target) {
        if (updated > 0) {
            log.debug("Rendition {}/{}p -> {}", jobId, height, target.dbValue());
            return;
        }
        List<String> current = jdbcTemplate.queryForList(
                "SELECT status FROM renditions WHERE job_id = ? AND height = ?", String.class, jobId, height);
        if (current.isEmpty()) {
            throw new NotFoundException("rendition not found: job " + jobId + ", " + height + "p");
        }
        throw new StateConflictException("rendition " + height + "p of job " + jobId + " is " + current.get(0)
                + ", cannot move to " + target.dbValue());
    }

    private static Timestamp now() {
        return Timestamp.valueOf(LocalDateTime.now());
    }

    private static class RenditionRowMapper implements RowMapper<Rendition> {
        @Override
        public Rendition mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp createdAt = rs.getTimestamp("created_at");
            Timestamp updatedAt = rs.getTimestamp("updated_at");
            int width = rs.getInt("width");
            Integer widthValue = rs.wasNull() ? null : width;
            int bitrate = rs.getInt("bitrate_kbps");
            Integer bitrateValue = rs.wasNull() ? null : bitrate;
            return Rendition.builder()
                    .id(rs.getString("id"))
                    .videoId(rs.getString("video_id"))
                    .jobId(rs.getString("job_id"))
                    .height(rs.getInt("height"))
                    .width(widthValue)
                    .bitrateKbps(bitrateValue)
                    .status(RenditionStatus.fromDb(rs.getString("status")))
                    .key(rs.getString("storage_key"))
                    .codecs(rs.getString("codecs"))
                    .error(rs.getString("error"))
                    .createdAt(createdAt != null ? createdAt.toLocalDateTime() : null)
                    .updatedAt(updatedAt != null ? updatedAt.toLocalDateTime() : null)
                    .build();
        }
    }
}
