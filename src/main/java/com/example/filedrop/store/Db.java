package com.example.filedrop.store;

import com.example.filedrop.core.Settings;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public class Db {

    private static Connection connection;
    private static String currentDbName;

    public static synchronized void init(String dbName) throws SQLException {
        currentDbName = dbName;
        try {
            Class.forName("org.sqlite.JDBC");
        } catch (ClassNotFoundException e) {
            throw new SQLException("SQLite JDBC Driver not found", e);
        }

        String url = "jdbc:sqlite:" + dbName;
        connection = DriverManager.getConnection(url);

        if (!Settings.DEFAULT_INDEX_DB.equals(dbName)) {
            try (Statement stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL;");
                stmt.execute("PRAGMA busy_timeout=5000;");
            }
        }

        Schema.createTables(connection);
    }

    public static synchronized Connection getConnection() throws SQLException {
        if (connection == null || connection.isClosed()) {
            init(currentDbName == null ? Settings.DEFAULT_INDEX_DB : currentDbName);
        }
        return connection;
    }

    public static synchronized void close() {
        if (connection != null) {
            try {
                connection.close();
            } catch (SQLException e) {
                System.err.println("Failed to close index DB: " + e.getMessage());
            }
            connection = null;
        }
    }
}
