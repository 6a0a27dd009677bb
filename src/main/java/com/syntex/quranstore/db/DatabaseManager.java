package com.syntex.quranstore.db;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Hands out connections to one SQLite store. Every connection enforces
 * foreign keys; the caller owns and closes it.
 */
public class DatabaseManager {

    public static final String DEFAULT_URL = "jdbc:sqlite:quran_arabic.db";

    private final String url;

    public DatabaseManager(String url) {
        this.url = url;
    }

    public static DatabaseManager forFile(String path) {
        return new DatabaseManager("jdbc:sqlite:" + path);
    }

    public Connection getConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(url);
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("PRAGMA foreign_keys=ON");
            stmt.execute("PRAGMA busy_timeout=5000");
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    public String getUrl() {
        return url;
    }
}
