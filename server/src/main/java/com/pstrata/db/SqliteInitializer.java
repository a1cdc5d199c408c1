package com.pstrata.db;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public class SqliteInitializer {

    public static void initialize(String dbPath) throws SQLException {
        String url = "jdbc:sqlite:" + dbPath;
        try (Connection conn = DriverManager.getConnection(url)) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA journal_mode = WAL;");

                stmt.execute("CREATE TABLE IF NOT EXISTS posterior_fit (" +
                        "fit_id TEXT PRIMARY KEY, " +
                        "family TEXT NOT NULL, " +
                        "link TEXT NOT NULL, " +
                        "group_count INTEGER NOT NULL, " +
                        "iteration_count INTEGER NOT NULL, " +
                        "request_json TEXT, " +
                        "created_ts INTEGER NOT NULL" +
                        ");");

                stmt.execute("CREATE TABLE IF NOT EXISTS posterior_draws (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
                        "fit_id TEXT NOT NULL, " +
                        "parameter_name TEXT NOT NULL, " +
                        "dims TEXT NOT NULL, " +
                        "draws_blob BLOB NOT NULL, " +
                        "UNIQUE (fit_id, parameter_name), " +
                        "FOREIGN KEY (fit_id) REFERENCES posterior_fit(fit_id) ON DELETE CASCADE" +
                        ");");

                stmt.execute("CREATE INDEX IF NOT EXISTS idx_draws_fit " +
                        "ON posterior_draws (fit_id);");
            }
        }
    }
}
