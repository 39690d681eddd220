package com.xksgroup.hlstranscoder.repo;

import com.xksgroup.hlstranscoder.model.Video;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
@Slf4j
public class JdbcVideoRepository implements VideoRepository {

    private static final RowMapper<Video> ROW_MAPPER = new VideoRowMapper();

    private final JdbcTemplate jdbcTemplate;

    public JdbcVideoRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void insert(Video video) {
        LocalDateTime createdAt = video.getCreatedAt() != null ? video.getCreatedAt() : LocalDateTime.now();
        jdbcTemplate.update("INSERT INTO videos (id, source_key, created_at) VALUES (?, ?, ?)",
                video.getId(), video.getSourceKey(), Timestamp.valueOf(createdAt));
        video.setCreatedAt(createdAt);
        log.debug("Inserted video {} ({})", video.getId(), video.getSourceKey());
    }

    @Override
    public Optional<Video> findById(String id) {
        List<Video> rows = jdbcTemplate.query(
                "SELECT id, source_key, created_at FROM videos WHERE id = ?", ROW_MAPPER, id);
        return rows.stream().findFirst();
    }

    @Override
    public boolean existsById(String id) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM videos WHERE id = ?", Integer.class, id);
        return count != null && count > 0;
    }

    @Override
    public List<Video> findRecent(int limit) {
        return jdbcTemplate.query(
                "SELECT id, source_key, created_at FROM videos ORDER BY created_at DESC, id LIMIT ?",
                ROW_MAPPER, limit);
    }

    private static class VideoRowMapper implements RowMapper<Video> {
        @Override
        public Video mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp createdAt = rs.getTimestamp("created_at");
            return Video.builder()
                    .id(rs.getString("id"))
                    .sourceKey(rs.getString("source_key"))
                    .createdAt(createdAt != null ? createdAt.toLocalDateTime() : null)
                    .build();
        }
    }
}
