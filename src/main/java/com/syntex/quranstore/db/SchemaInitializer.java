package com.syntex.quranstore.db;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates the store schema and adds derived columns missing from stores
 * built by older versions. Safe to run repeatedly.
 */
public class SchemaInitializer {

    public static void init(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("PRAGMA journal_mode=WAL");
            stmt.execute("PRAGMA synchronous=NORMAL");

            stmt.executeUpdate("""
            CREATE TABLE IF NOT EXISTS Suras (
                sura_id INTEGER PRIMARY KEY,
                name_arabic TEXT NOT NULL,
                revelation_order INTEGER NOT NULL,
                ayat_count INTEGER NOT NULL,
                page_number INTEGER,
                line_number INTEGER
            );""");

            stmt.executeUpdate("""
            CREATE TABLE IF NOT EXISTS Juzs (
                juz_id INTEGER PRIMARY KEY,
                juz_number INTEGER NOT NULL UNIQUE,
                verses_count INTEGER,
                first_ayat_id INTEGER,
                last_ayat_id INTEGER,
                page_number INTEGER
            );""");

            stmt.executeUpdate("""
            CREATE TABLE IF NOT EXISTS Hezbs (
                hezb_id INTEGER PRIMARY KEY,
                hezb_number INTEGER NOT NULL UNIQUE,
                juz_id INTEGER NOT NULL,
                page_number INTEGER,
                FOREIGN KEY (juz_id) REFERENCES Juzs(juz_id)
            );""");

            stmt.executeUpdate("""
            CREATE TABLE IF NOT EXISTS Pages (
                page_id INTEGER PRIMARY KEY,
                page_number INTEGER NOT NULL UNIQUE
            );""");

            stmt.executeUpdate("""
            CREATE TABLE IF NOT EXISTS Ayats (
                ayat_id INTEGER PRIMARY KEY,
                sura_id INTEGER NOT NULL,
                ayat_number INTEGER NOT NULL,
                text_uthmani TEXT NOT NULL,
                juz_id INTEGER NOT NULL,
                hezb_id INTEGER NOT NULL,
                page_id INTEGER NOT NULL,
                sajdah_number INTEGER,
                audio_url TEXT,
                audio_segments TEXT,
                FOREIGN KEY (sura_id) REFERENCES Suras(sura_id),
                FOREIGN KEY (juz_id) REFERENCES Juzs(juz_id),
                FOREIGN KEY (hezb_id) REFERENCES Hezbs(hezb_id),
                FOREIGN KEY (page_id) REFERENCES Pages(page_id)
            );""");

            stmt.executeUpdate("""
            CREATE TABLE IF NOT EXISTS Words (
                word_id INTEGER PRIMARY KEY,
                ayat_id INTEGER NOT NULL,
                word_number INTEGER NOT NULL,
                text_uthmani TEXT NOT NULL,
                type TEXT NOT NULL,
                page_number INTEGER,
                line_number INTEGER,
                audio_url TEXT,
                FOREIGN KEY (ayat_id) REFERENCES Ayats(ayat_id)
            );""");

            ensureDerivedColumns(conn);
            ensureColumn(conn, "Ayats", "audio_segments", "TEXT");

            stmt.executeUpdate("CREATE INDEX IF NOT EXISTS idx_ayats_sura_number ON Ayats(sura_id, ayat_number)");
            stmt.executeUpdate("CREATE INDEX IF NOT EXISTS idx_ayat_juz ON Ayats(juz_id)");
            stmt.executeUpdate("CREATE INDEX IF NOT EXISTS idx_ayat_hezb ON Ayats(hezb_id)");
            stmt.executeUpdate("CREATE INDEX IF NOT EXISTS idx_ayat_page ON Ayats(page_id)");
            stmt.executeUpdate("CREATE INDEX IF NOT EXISTS idx_word_ayat ON Words(ayat_id)");
        }
    }

    /**
     * Adds the columns the enrichment passes write to, for stores created
     * before those columns existed.
     */
    public static void ensureDerivedColumns(Connection conn) throws SQLException {
        ensureColumn(conn, "Suras", "page_number", "INTEGER");
        ensureColumn(conn, "Suras", "line_number", "INTEGER");
        ensureColumn(conn, "Juzs", "verses_count", "INTEGER");
        ensureColumn(conn, "Juzs", "first_ayat_id", "INTEGER");
        ensureColumn(conn, "Juzs", "last_ayat_id", "INTEGER");
        ensureColumn(conn, "Juzs", "page_number", "INTEGER");
        ensureColumn(conn, "Hezbs", "page_number", "INTEGER");
    }

    static void ensureColumn(Connection conn, String table, String column, String type) throws SQLException {
        if (!columnExists(conn, table, column)) {
            try (Statement stmt = conn.createStatement()) {
                stmt.executeUpdate("ALTER TABLE " + table + " ADD COLUMN " + column + " " + type);
            }
        }
    }

    public static boolean columnExists(Connection conn, String table, String column) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("PRAGMA table_info(" + table + ")")) {
            while (rs.next()) {
                if (column.equalsIgnoreCase(rs.getString("name"))) {
                    return true;
                }
            }
            return false;
        }
    }
}
