package com.topolens.service.storage.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.topolens.core.deployment.DeploymentRepository;
import com.topolens.core.model.ApplicationDeployment;
import com.topolens.core.model.ApplicationDeploymentDetails;
import com.topolens.core.model.ApplicationDeploymentNotifications;
import com.topolens.core.model.ApplicationId;
import com.topolens.core.model.MetricsSnapshot;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Rollouts in {@code topolens.application_deployments}, one row per
 * {@code (project_id, application_id, name, started_at)}. Details, metrics snapshot and
 * notification state are {@code jsonb} columns, each written by its own statement.
 */
@Slf4j
@Repository
public class JdbcDeploymentRepository implements DeploymentRepository {

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper mapper;

    public JdbcDeploymentRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper mapper) {
        this.jdbc = jdbc;
        this.mapper = mapper;
    }

    @Override
    public List<ApplicationDeployment> findByProject(String projectId) {
        return jdbc.query(
                """
            select application_id, name, started_at, finished_at, details, metrics_snapshot, notifications
            from topolens.application_deployments
            where project_id = :project_id
            order by started_at
            """,
                new MapSqlParameterSource("project_id", projectId),
                (rs, rowNum) -> mapRow(rs));
    }

    @Override
    public void save(String projectId, ApplicationDeployment deployment) {
        MapSqlParameterSource params = key(projectId, deployment)
                .addValue("finished_at", timestamp(deployment.getFinishedAt()))
                .addValue("details", toJson(deployment.getDetails()))
                .addValue("notifications", toJson(deployment.getNotifications()));
        jdbc.update(
                """
            insert into topolens.application_deployments
                (project_id, application_id, name, started_at, finished_at, details, notifications)
            values (:project_id, :application_id, :name, :started_at, :finished_at,
                    cast(:details as jsonb), cast(:notifications as jsonb))
            on conflict (project_id, application_id, name, started_at)
            do update set finished_at = excluded.finished_at,
                          details = coalesce(excluded.details, topolens.application_deployments.details)
            """,
                params);
    }

    @Override
    public void saveMetricsSnapshot(String projectId, ApplicationDeployment deployment) {
        MapSqlParameterSource params =
                key(projectId, deployment).addValue("metrics_snapshot", toJson(deployment.getMetricsSnapshot()));
        int updated = jdbc.update(
                """
            update topolens.application_deployments
            set metrics_snapshot = cast(:metrics_snapshot as jsonb)
            where project_id = :project_id and application_id = :application_id
              and name = :name and started_at = :started_at
            """,
                params);
        if (updated == 0) {
            log.warn("[{}] no deployment row to attach the metrics snapshot to: {}", projectId, deployment);
        }
    }

    @Override
    public void saveNotifications(String projectId, ApplicationDeployment deployment) {
        MapSqlParameterSource params =
                key(projectId, deployment).addValue("notifications", toJson(deployment.getNotifications()));
        int updated = jdbc.update(
                """
            update topolens.application_deployments
            set notifications = cast(:notifications as jsonb)
            where project_id = :project_id and application_id = :application_id
              and name = :name and started_at = :started_at
            """,
                params);
        if (updated == 0) {
            log.warn("[{}] no deployment row to attach the notification state to: {}", projectId, deployment);
        }
    }

    private static MapSqlParameterSource key(String projectId, ApplicationDeployment deployment) {
        return new MapSqlParameterSource()
                .addValue("project_id", projectId)
                .addValue("application_id", deployment.getApplicationId().toString())
                .addValue("name", deployment.getName())
                .addValue("started_at", timestamp(deployment.getStartedAt()));
    }

    private ApplicationDeployment mapRow(ResultSet rs) throws SQLException {
        ApplicationDeployment d = new ApplicationDeployment(
                ApplicationId.parse(rs.getString("application_id")),
                rs.getString("name"),
                rs.getTimestamp("started_at").toInstant());
        Timestamp finishedAt = rs.getTimestamp("finished_at");
        d.setFinishedAt(finishedAt == null ? null : finishedAt.toInstant());
        d.setDetails(fromJson(rs.getString("details"), ApplicationDeploymentDetails.class));
        d.setMetricsSnapshot(fromJson(rs.getString("metrics_snapshot"), MetricsSnapshot.class));
        d.setNotifications(fromJson(rs.getString("notifications"), ApplicationDeploymentNotifications.class));
        return d;
    }

    private static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to parse " + type.getSimpleName() + ": " + json, e);
        }
    }
}
