package com.example.filedrop.store;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

public class Schema {

    public static void createTables(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            // One row per stored file, keyed by absolute path
            stmt.execute("CREATE TABLE IF NOT EXISTS uploads (" +
                    "path TEXT PRIMARY KEY, " +
                    "name TEXT NOT NULL, " +
                    "size INTEGER, " +
                    "uploader_name TEXT, " +
                    "targets TEXT" +
                    ")");
        }
    }
}
