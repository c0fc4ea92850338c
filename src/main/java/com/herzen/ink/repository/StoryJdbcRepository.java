package com.herzen.ink.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class StoryJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public StoryJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void saveSource(String storyId, String content) {
        jdbcTemplate.update(
                "MERGE INTO stories(story_id, content, imported_at) KEY(story_id) VALUES (?,?,?)",
                storyId, content, Instant.now().toString());
    }

    public Optional<String> loadSource(String storyId) {
        List<String> rows = jdbcTemplate.query(
                "SELECT content FROM stories WHERE story_id = ?",
                (rs, rowNum) -> rs.getString(1),
                storyId);
        return rows.stream().findFirst();
    }
}
