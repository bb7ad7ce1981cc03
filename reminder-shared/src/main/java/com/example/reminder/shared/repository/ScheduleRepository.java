package com.example.reminder.shared.repository;

import com.example.reminder.shared.aspect.Monitored;
import com.example.reminder.shared.exception.StoreException;
import com.example.reminder.shared.model.RecurrenceRule;
import com.example.reminder.shared.model.ReminderRule;
import com.example.reminder.shared.model.ScheduleDefinition;
import com.example.reminder.shared.service.cache.SourceStore;
import com.example.reminder.shared.util.Constants.ScheduleStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Schedules table. Recurrence and reminder rules are JSON text columns carrying a
 * {@code type} tag. A row whose rules cannot be parsed is still returned, with
 * {@link ScheduleDefinition#getRuleError()} set, so that each tick reports it as an error.
 * Rows with an unknown status are skipped.
 */
@Repository
@Slf4j
@Monitored("repository")
public class ScheduleRepository implements SourceStore {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public ScheduleRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    private final RowMapper<Optional<ScheduleDefinition>> rowMapper = (rs, rowNum) -> mapRow(rs);

    @Override
    public List<ScheduleDefinition> listActive() {
        String sql = "SELECT * FROM schedules WHERE status = ? ORDER BY created_at";
        try {
            return jdbcTemplate.query(sql, rowMapper, ScheduleStatus.ACTIVE.name()).stream()
                    .filter(Optional::isPresent)
                    .map(Optional::get)
                    .collect(Collectors.toList());
        } catch (DataAccessException e) {
            throw new StoreException("Failed to list active schedules", e);
        }
    }

    public Optional<ScheduleDefinition> findById(String id) {
        String sql = "SELECT * FROM schedules WHERE id = ?";
        return jdbcTemplate.query(sql, rowMapper, id).stream()
                .filter(Optional::isPresent)
                .map(Optional::get)
                .findFirst();
    }

    public void save(ScheduleDefinition schedule) {
        String sql = """
            MERGE INTO schedules (id, owner_id, title, description, recurrence, reminder,
                                  assignee_name, assignee_email, status, created_at, updated_at)
            KEY (id) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        jdbcTemplate.update(sql,
                schedule.getId(),
                schedule.getOwnerId(),
                schedule.getTitle(),
                schedule.getDescription(),
                toJson(schedule.getRecurrence()),
                toJson(schedule.getReminder()),
                schedule.getAssigneeName(),
                schedule.getAssigneeEmail(),
                Objects.requireNonNullElse(schedule.getStatus(), ScheduleStatus.ACTIVE).name(),
                schedule.getCreatedAt() != null ? Timestamp.from(schedule.getCreatedAt()) : null,
                schedule.getUpdatedAt() != null ? Timestamp.from(schedule.getUpdatedAt()) : null);
    }

    private Optional<ScheduleDefinition> mapRow(ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        ScheduleStatus status;
        try {
            status = ScheduleStatus.valueOf(rs.getString("status"));
        } catch (IllegalArgumentException | NullPointerException e) {
            log.warn("Skipping schedule {} with unknown status '{}'", id, rs.getString("status"));
            return Optional.empty();
        }

        Timestamp createdAt = rs.getTimestamp("created_at");
        Timestamp updatedAt = rs.getTimestamp("updated_at");
        ScheduleDefinition.ScheduleDefinitionBuilder builder = ScheduleDefinition.builder()
                .id(id)
                .ownerId(rs.getString("owner_id"))
                .title(rs.getString("title"))
                .description(rs.getString("description"))
                .assigneeName(rs.getString("assignee_name"))
                .assigneeEmail(rs.getString("assignee_email"))
                .status(status)
                .createdAt(createdAt != null ? createdAt.toInstant() : null)
                .updatedAt(updatedAt != null ? updatedAt.toInstant() : null);
        try {
            builder.recurrence(objectMapper.readValue(rs.getString("recurrence"), RecurrenceRule.class))
                    .reminder(objectMapper.readValue(rs.getString("reminder"), ReminderRule.class));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            String reason = e instanceof JsonProcessingException
                    ? ((JsonProcessingException) e).getOriginalMessage()
                    : e.getMessage();
            log.warn("Schedule {} has unreadable rule data: {}", id, reason);
            builder.recurrence(null)
                    .reminder(null)
                    .ruleError("Unreadable rule data: " + reason);
        }
        return Optional.of(builder.build());
    }

    private String toJson(Object rule) {
        try {
            return objectMapper.writeValueAsString(rule);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize rule " + rule, e);
        }
    }
}
