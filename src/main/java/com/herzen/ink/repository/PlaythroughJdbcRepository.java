package com.herzen.ink.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class PlaythroughJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public PlaythroughJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void save(SavedPlaythroughRow row) {
        jdbcTemplate.update(
                "MERGE INTO saved_playthroughs(save_id, story_id, state_json, saved_at) KEY(save_id) VALUES (?,?,?,?)",
                row.saveId(), row.storyId(), row.stateJson(), row.savedAt().toString());
    }

    public Optional<SavedPlaythroughRow> load(String saveId) {
        List<SavedPlaythroughRow> rows = jdbcTemplate.query(
                "SELECT save_id, story_id, state_json, saved_at FROM saved_playthroughs WHERE save_id = ?",
                (rs, rowNum) -> new SavedPlaythroughRow(rs.getString(1), rs.getString(2), rs.getString(3), Instant.parse(rs.getString(4))),
                saveId);
        return rows.stream().findFirst();
    }

    public record SavedPlaythroughRow(String saveId, String storyId, String stateJson, Instant savedAt) {}
}
