package com.example.dsload.writer;

import com.example.dsload.audit.AuditTrailRecorder;
import com.example.dsload.dialect.PostgresDialect;
import com.example.dsload.model.AuditStatus;
import com.example.dsload.model.Dataset;
import com.example.dsload.model.LoadSpec;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the staging load against a real PostgreSQL, exercising COPY and ON CONFLICT.
 */
@Testcontainers(disabledWithoutDocker = true)
public class StagingUpsertEnginePostgresTest {

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    private static final List<String> BALANCE_COLUMNS = List.of("on_date", "account_rk", "currency_rk", "balance_out");
    private static final LoadSpec BALANCE = LoadSpec.merge("ft_balance_f.csv", "ds.ft_balance_f",
            List.of("on_date", "account_rk"), List.of("on_date"), null);
    private static final LoadSpec POSTING = LoadSpec.replace("ft_posting_f.csv", "ds.ft_posting_f",
            List.of("oper_date"), null);

    private static DriverManagerDataSource dataSource;

    private JdbcTemplate jdbcTemplate;
    private DataSourceTransactionManager transactionManager;
    private StagingUpsertEngine engine;

    @BeforeAll
    public static void createSchema() {
        dataSource = new DriverManagerDataSource(POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("schema-postgresql.sql")).execute(dataSource);
    }

    @BeforeEach
    public void setUp() {
        jdbcTemplate = new JdbcTemplate(dataSource);
        transactionManager = new DataSourceTransactionManager(dataSource);
        engine = new StagingUpsertEngine(dataSource, new PostgresDialect());
        jdbcTemplate.update("DELETE FROM ds.ft_balance_f");
        jdbcTemplate.update("DELETE FROM ds.ft_posting_f");
    }

    @Test
    public void testCopyAndUpsert() throws Exception {
        LocalDate day = LocalDate.of(2018, 1, 31);
        load(new Dataset(BALANCE_COLUMNS, List.of(
                row(BALANCE_COLUMNS, day, "1", "643", "100.5"),
                row(BALANCE_COLUMNS, day, "2", "840", "7"))), BALANCE);
        load(new Dataset(BALANCE_COLUMNS, List.of(
                row(BALANCE_COLUMNS, day, "2", "840", "8"),
                row(BALANCE_COLUMNS, day, "3", "978", ""))), BALANCE);

        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
                "SELECT account_rk, balance_out FROM ds.ft_balance_f ORDER BY account_rk");
        assertThat(rows).hasSize(3);
        assertThat(((Number) rows.get(1).get("balance_out")).doubleValue()).isEqualTo(8.0);
        assertThat(rows.get(2).get("balance_out")).isNull();
    }

    @Test
    public void testReplaceRollsBackOnViolation() throws Exception {
        List<String> columns = List.of("oper_date", "credit_account_rk", "debet_account_rk", "credit_amount");
        load(new Dataset(columns, List.of(
                row(columns, LocalDate.of(2018, 1, 9), "1", "2", "3.5"),
                row(columns, LocalDate.of(2018, 1, 9), "1", "2", "3.5"))), POSTING);

        Dataset broken = new Dataset(columns, List.of(row(columns, null, "1", "2", "4")));

        assertThatThrownBy(() -> load(broken, POSTING)).isInstanceOf(DataIntegrityViolationException.class);
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM ds.ft_posting_f", Integer.class)).isEqualTo(2);
    }

    @Test
    public void testAuditRunIdsComeFromTheSequence() throws Exception {
        AuditTrailRecorder auditTrail = new AuditTrailRecorder(jdbcTemplate, transactionManager, "logs.etl_audit");

        long runId = auditTrail.start("pg_test");
        auditTrail.end(runId, 5, "deduped=0, date_err=0");

        assertThat(auditTrail.find(runId)).hasValueSatisfying(run -> {
            assertThat(run.getStatus()).isEqualTo(AuditStatus.END);
            assertThat(run.getRowsProcessed()).isEqualTo(5L);
        });
    }

    private void load(Dataset dataset, LoadSpec spec) {
        new TransactionTemplate(transactionManager).execute(status -> engine.load(dataset, spec));
    }

    private static Map<String, Object> row(List<String> columns, Object... values) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            row.put(columns.get(i), values[i]);
        }
        return row;
    }
}
