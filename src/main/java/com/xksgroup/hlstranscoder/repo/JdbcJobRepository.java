package com.xksgroup.hlstranscoder.repo;

import com.xksgroup.hlstranscoder.exception.NotFoundException;
import com.xksgroup.hlstranscoder.exception.StateConflictException;
import com.xksgroup.hlstranscoder.model.Job.Job;
import com.xksgroup.hlstranscoder.model.Job.JobStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Repository
@Slf4j
public class JdbcJobRepository implements JobRepository {

    static final int MAX_ERROR_LENGTH = 8000;

    private static final String SELECT_COLUMNS =
            "SELECT id, video_id, profiles, status, error, created_at, updated_at FROM jobs ";

    private static final RowMapper<Job> ROW_MAPPER = new JobRowMapper();

    private final JdbcTemplate jdbcTemplate;

    public JdbcJobRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void insert(Job job) {
        LocalDateTime now = LocalDateTime.now();
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        if (job.getStatus() == null) {
            job.setStatus(JobStatus.QUEUED);
        }
        jdbcTemplate.update(
                "INSERT INTO jobs (id, video_id, type, profiles, status, error, created_at, updated_at) " +
                        "VALUES (?, ?, 'transcode', ?, ?, ?, ?, ?)",
                job.getId(), job.getVideoId(), joinProfiles(job.getProfiles()), job.getStatus().dbValue(),
                truncate(job.getError()), Timestamp.valueOf(now), Timestamp.valueOf(now));
    }

    @Override
    public Optional<Job> findById(String id) {
        return jdbcTemplate.query(SELECT_COLUMNS + "WHERE id = ?", ROW_MAPPER, id).stream().findFirst();
    }

    @Override
    public Optional<Job> findLatestByVideoId(String videoId) {
        return jdbcTemplate.query(SELECT_COLUMNS + "WHERE video_id = ? ORDER BY created_at DESC, id DESC LIMIT 1",
                ROW_MAPPER, videoId).stream().findFirst();
    }

    @Override
    public void markRunning(String id, boolean redelivery) {
        if (redelivery) {
            transition(id, JobStatus.RUNNING, null, JobStatus.QUEUED, JobStatus.RUNNING);
        } else {
            transition(id, JobStatus.RUNNING, null, JobStatus.QUEUED);
        }
    }

    @Override
    public void markDone(String id) {
        transition(id, JobStatus.DONE, null, JobStatus.RUNNING);
    }

    @Override
    public void markFailed(String id, String error) {
        transition(id, JobStatus.FAILED, error, JobStatus.QUEUED, JobStatus.RUNNING);
    }

    private void transition(String id, JobStatus target, String error, JobStatus... allowedFrom) {
        List<Object> args = new ArrayList<>();
        args.add(target.dbValue());
        args.add(truncate(error));
        args.add(Timestamp.valueOf(LocalDateTime.now()));
        args.add(id);
        Arrays.stream(allowedFrom).map(JobStatus::dbValue).forEach(args::add);

        String placeholders = String.join(", ", Collections.nCopies(allowedFrom.length, "?"));
        int updated = jdbcTemplate.update(
                "UPDATE jobs SET status = ?, error = ?, updated_at = ? WHERE id = ? AND status IN (" + placeholders + ")",
                args.toArray());

        if (updated == 0) {
            JobStatus current = findById(id)
                    .map(Job::getStatus)
                    .orElseThrow(() -> NotFoundException.job(id));
            throw new StateConflictException("job " + id + " is " + current.dbValue()
                    + ", cannot move to " + target.dbValue());
        }
        log.debug("Job {} -> {}", id, target.dbValue());
    }

    static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        // Keep the tail, encoder diagnostics put the cause last
        return error.substring(error.length() - MAX_ERROR_LENGTH);
    }

    static String joinProfiles(List<Integer> profiles) {
        return profiles == null ? "" : profiles.stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    static List<Integer> splitProfiles(String profiles) {
        if (profiles == null || profiles.isBlank()) {
            return List.of();
        }
        return Arrays.stream(profiles.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(Integer::valueOf)
                .toList();
    }

    private static class JobRowMapper implements RowMapper<Job> {
        @Override
        public Job mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp createdAt = rs.getTimestamp("created_at");
            Timestamp updatedAt = rs.getTimestamp("updated_at");
            return Job.builder()
                    .id(rs.getString("id"))
                    .videoId(rs.getString("video_id"))
                    .profiles(splitProfiles(rs.getString("profiles")))
                    .status(JobStatus.fromDb(rs.getString("status")))
                    .error(rs.getString("error"))
                    .createdAt(createdAt != null ? createdAt.toLocalDateTime() : null)
                    .updatedAt(updatedAt != null ? updatedAt.toLocalDateTime() : null)
                    .build();
        }
    }
}
