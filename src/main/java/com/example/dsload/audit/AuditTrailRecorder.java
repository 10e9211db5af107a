package com.example.dsload.audit;

import com.example.dsload.model.AuditRun;
import com.example.dsload.model.AuditStatus;
import com.example.dsload.util.SqlIdentifierValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * START / END / ERROR rows of the audit table. Every write commits on its own.
 */
@Slf4j
public class AuditTrailRecorder {

    static final int MAX_MESSAGE_LENGTH = 4000;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final String auditTable;

    public AuditTrailRecorder(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager,
                              String auditTable) {
        SqlIdentifierValidator.validateQualified(auditTable);
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.auditTable = auditTable;
    }

    public long start(String jobName) {
        String sql = "INSERT INTO " + auditTable + " (job_name, status) VALUES (?, ?)";
        Long runId = transactionTemplate.execute(status -> {
            KeyHolder keyHolder = new GeneratedKeyHolder();
            jdbcTemplate.update(con -> {
                PreparedStatement ps = con.prepareStatement(sql, new String[]{"run_id"});
                ps.setString(1, jobName);
                ps.setString(2, AuditStatus.START.name());
                return ps;
            }, keyHolder);
            Number key = keyHolder.getKey();
            if (key == null) {
                throw new IllegalStateException("Audit table " + auditTable + " returned no run_id");
            }
            return key.longValue();
        });
        log.debug("Audit run {} started for job {}", runId, jobName);
        return runId;
    }

    public void end(long runId, long rowsProcessed, String message) {
        finish(runId, AuditStatus.END, rowsProcessed, message);
    }

    public void error(long runId, String message) {
        finish(runId, AuditStatus.ERROR, null, message);
    }

    public Optional<AuditRun> find(long runId) {
        List<AuditRun> runs = jdbcTemplate.query(
                "SELECT run_id, job_name, status, rows_processed, message, started_at, finished_at FROM "
                        + auditTable + " WHERE run_id = ?",
                (rs, rowNum) -> mapRun(rs), runId);
        return runs.stream().findFirst();
    }

    private void finish(long runId, AuditStatus status, Long rowsProcessed, String message) {
        String sql = "UPDATE " + auditTable
                + " SET status = ?, rows_processed = ?, finished_at = CURRENT_TIMESTAMP, message = ?"
                + " WHERE run_id = ? AND status = ?";
        Integer updated = transactionTemplate.execute(tx -> jdbcTemplate.update(sql,
                status.name(), rowsProcessed, truncate(message), runId, AuditStatus.START.name()));
        if (updated == null || updated != 1) {
            throw new IllegalStateException("Audit run " + runId + " is not open; cannot move it to " + status);
        }
        log.debug("Audit run {} -> {}", runId, status);
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_MESSAGE_LENGTH);
    }

    private static AuditRun mapRun(ResultSet rs) throws SQLException {
        long rows = rs.getLong("rows_processed");
        Long rowsProcessed = rs.wasNull() ? null : rows;
        return AuditRun.builder()
                .runId(rs.getLong("run_id"))
                .jobName(rs.getString("job_name"))
                .status(AuditStatus.valueOf(rs.getString("status")))
                .rowsProcessed(rowsProcessed)
                .message(rs.getString("message"))
                .startedAt(rs.getObject("started_at", OffsetDateTime.class))
                .finishedAt(rs.getObject("finished_at", OffsetDateTime.class))
                .build();
    }
}
