package com.example.dsload.writer;

import com.example.dsload.dialect.DatabaseDialect;
import com.example.dsload.model.Dataset;
import com.example.dsload.model.LoadMode;
import com.example.dsload.model.LoadSpec;
import com.example.dsload.util.SqlIdentifierValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads a dataset through a staging table, on the caller's transaction.
 */
@Slf4j
public class StagingUpsertEngine {

    private static final String STAGING_PREFIX = "stg_";

    private final JdbcTemplate jdbcTemplate;
    private final DatabaseDialect dialect;

    public StagingUpsertEngine(DataSource dataSource, DatabaseDialect dialect) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.dialect = dialect;
    }

    public int load(Dataset dataset, LoadSpec spec) {
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException("Staging load of " + spec.getTargetTable() + " requires an active transaction");
        }
        String table = spec.getTargetTable();
        SqlIdentifierValidator.validateQualified(table);
        List<String> columns = dataset.getColumns();
        columns.forEach(SqlIdentifierValidator::validate);
        String staging = STAGING_PREFIX + SqlIdentifierValidator.unqualified(table);

        for (String sql : dialect.createStagingTableSql(staging, table)) {
            log.debug("Executing DDL: {}", sql);
            jdbcTemplate.execute(sql);
        }

        List<Object[]> rows = toRows(dataset, columns);
        jdbcTemplate.execute((ConnectionCallback<Void>) con -> {
            dialect.bulkLoad(con, staging, columns, rows);
            return null;
        });
        log.debug("Staged {} rows in {}", rows.size(), staging);

        String sql;
        if (spec.getMode() == LoadMode.REPLACE) {
            int deleted = jdbcTemplate.update(dialect.deleteAllSql(table));
            log.debug("Deleted {} rows from {} before reload", deleted, table);
            sql = dialect.insertSql(table, staging, columns);
        } else {
            sql = dialect.upsertSql(table, staging, columns, spec.getPrimaryKey());
        }
        log.debug("Executing: {}", sql);
        int affected = jdbcTemplate.update(sql);
        log.debug("{} rows affected in {}", affected, table);
        return rows.size();
    }

    private static List<Object[]> toRows(Dataset dataset, List<String> columns) {
        List<Object[]> rows = new ArrayList<>(dataset.size());
        for (Map<String, Object> row : dataset.getRows()) {
            Object[] values = new Object[columns.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = toSqlValue(row.get(columns.get(i)));
            }
            rows.add(values);
        }
        return rows;
    }

    // Empty text loads as NULL, like an absent cell
    static Object toSqlValue(Object value) {
        if (value instanceof String && ((String) value).isBlank()) {
            return null;
        }
        return value;
    }
}
