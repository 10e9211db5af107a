package com.example.dsload.dialect;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.postgresql.PGConnection;
import org.postgresql.copy.CopyManager;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
public class PostgresDialect implements DatabaseDialect {

    // Unquoted empty fields are read back as NULL by COPY ... (FORMAT csv)
    private static final CSVFormat COPY_FORMAT = CSVFormat.DEFAULT.builder()
            .setRecordSeparator('\n')
            .build();

    @Override
    public List<String> createStagingTableSql(String stagingTable, String targetTable) {
        return List.of("CREATE TEMP TABLE " + stagingTable + " (LIKE " + targetTable + " INCLUDING DEFAULTS) ON COMMIT DROP");
    }

    @Override
    public void bulkLoad(Connection connection, String stagingTable, List<String> columns, List<Object[]> rows)
            throws SQLException {
        StringWriter buffer = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(buffer, COPY_FORMAT)) {
            for (Object[] row : rows) {
                printer.printRecord(row);
            }
        } catch (IOException e) {
            throw new SQLException("Cannot render rows for COPY into " + stagingTable, e);
        }

        String sql = copySql(stagingTable, columns);
        CopyManager copyManager = connection.unwrap(PGConnection.class).getCopyAPI();
        try {
            long copied = copyManager.copyIn(sql, new StringReader(buffer.toString()));
            log.debug("COPY into {} loaded {} rows", stagingTable, copied);
        } catch (IOException e) {
            throw new SQLException("COPY into " + stagingTable + " failed", e);
        }
    }

    String copySql(String stagingTable, List<String> columns) {
        return "COPY " + stagingTable + " (" + String.join(", ", columns) + ") FROM STDIN WITH (FORMAT csv)";
    }

    @Override
    public String upsertSql(String table, String stagingTable, List<String> columns, List<String> primaryKeys) {
        String cols = String.join(", ", columns);

        StringBuilder sb = new StringBuilder();
        sb.append("INSERT INTO ").append(table).append(" (").append(cols).append(")\n");
        sb.append("SELECT ").append(cols).append(" FROM ").append(stagingTable).append("\n");
        sb.append("ON CONFLICT (").append(String.join(", ", primaryKeys)).append(")\n");
        sb.append("DO ");

        String updateSet = columns.stream()
                .filter(c -> !primaryKeys.contains(c))
                .map(c -> c + " = EXCLUDED." + c)
                .collect(Collectors.joining(",\n"));

        if (updateSet.isEmpty()) {
            sb.append("NOTHING");
        } else {
            sb.append("UPDATE SET\n").append(updateSet);
        }

        return sb.toString();
    }

    @Override
    public String insertSql(String table, String stagingTable, List<String> columns) {
        String cols = String.join(", ", columns);
        return "INSERT INTO " + table + " (" + cols + ")\nSELECT " + cols + " FROM " + stagingTable;
    }

    @Override
    public String deleteAllSql(String table) {
        return "DELETE FROM " + table;
    }
}
