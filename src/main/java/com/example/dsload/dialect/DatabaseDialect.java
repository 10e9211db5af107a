package com.example.dsload.dialect;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

public interface DatabaseDialect {
    List<String> createStagingTableSql(String stagingTable, String targetTable);

    /**
     * Loads {@code rows} into the staging table through the database's bulk path, on the
     * connection of the current transaction.
     */
    void bulkLoad(Connection connection, String stagingTable, List<String> columns, List<Object[]> rows)
        throws SQLException;

    String upsertSql(String table, String stagingTable, List<String> columns, List<String> primaryKeys);

    String insertSql(String table, String stagingTable, List<String> columns);

    String deleteAllSql(String table);
}
