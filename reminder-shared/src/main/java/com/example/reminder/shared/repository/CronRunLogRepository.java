package com.example.reminder.shared.repository;

import com.example.reminder.shared.model.CronRunLog;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.Optional;

@Repository
public class CronRunLogRepository {

    private final JdbcTemplate jdbcTemplate;

    public CronRunLogRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private final RowMapper<CronRunLog> rowMapper = (rs, rowNum) -> CronRunLog.builder()
            .id(rs.getLong("id"))
            .timestamp(rs.getTimestamp("run_at").toInstant())
            .intervalMs(rs.getObject("interval_ms", Long.class))
            .checked(rs.getInt("checked"))
            .sent(rs.getInt("sent"))
            .skipped(rs.getInt("skipped"))
            .errors(rs.getInt("errors"))
            .build();

    public Optional<CronRunLog> findLatest() {
        String sql = "SELECT * FROM cron_logs ORDER BY run_at DESC, id DESC LIMIT 1";
        return jdbcTemplate.query(sql, rowMapper).stream().findFirst();
    }

    public void save(CronRunLog entry) {
        String sql = "INSERT INTO cron_logs (run_at, interval_ms, checked, sent, skipped, errors) VALUES (?, ?, ?, ?, ?, ?)";
        jdbcTemplate.update(sql,
                Timestamp.from(entry.getTimestamp()),
                entry.getIntervalMs(),
                entry.getChecked(),
                entry.getSent(),
                entry.getSkipped(),
                entry.getErrors());
    }
}
