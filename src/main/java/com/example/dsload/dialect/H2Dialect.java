package com.example.dsload.dialect;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.stream.Collectors;

// H2 commits on DDL, so the staging table is (re)created before the target is touched
public class H2Dialect implements DatabaseDialect {

    @Override
    public List<String> createStagingTableSql(String stagingTable, String targetTable) {
        return List.of(
                "DROP TABLE IF EXISTS " + stagingTable,
                "CREATE LOCAL TEMPORARY TABLE " + stagingTable + " AS SELECT * FROM " + targetTable + " WHERE 1 = 0");
    }

    @Override
    public void bulkLoad(Connection connection, String stagingTable, List<String> columns, List<Object[]> rows)
            throws SQLException {
        String placeholders = columns.stream().map(c -> "?").collect(Collectors.joining(", "));
        String sql = "INSERT INTO " + stagingTable + " (" + String.join(", ", columns) + ") VALUES (" + placeholders + ")";
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            for (Object[] row : rows) {
                for (int i = 0; i < row.length; i++) {
                    ps.setObject(i + 1, row[i]);
                }
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    @Override
    public String upsertSql(String table, String stagingTable, List<String> columns, List<String> primaryKeys) {
        String cols = String.join(", ", columns);
        return "MERGE INTO " + table + " (" + cols + ") KEY (" + String.join(", ", primaryKeys) + ")\n"
                + "SELECT " + cols + " FROM " + stagingTable;
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
