package com.syntex.quranstore.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;

import com.syntex.quranstore.db.model.ChapterRecord;

/**
 * Seeds the fixed structural tables (Juzs, Hezbs, Pages) and the chapter list.
 * Rows that already exist are left alone, so re-seeding never disturbs derived
 * columns.
 */
public class StaticSeeder {

    public static final int JUZ_COUNT = 30;

    private final int hezbsPerJuz;
    private final int pageCount;

    public StaticSeeder(int hezbsPerJuz, int pageCount) {
        if (hezbsPerJuz < 1 || pageCount < 1) {
            throw new IllegalArgumentException("hezbsPerJuz and pageCount must be positive");
        }
        this.hezbsPerJuz = hezbsPerJuz;
        this.pageCount = pageCount;
    }

    public SeedCounts seed(Connection conn, List<ChapterRecord> chapters) throws SQLException {
        boolean autoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);
        try {
            int juzs = seedJuzs(conn);
            int hezbs = seedHezbs(conn);
            int pages = seedPages(conn);
            int suras = seedSuras(conn, chapters);
            conn.commit();
            return new SeedCounts(suras, juzs, hezbs, pages);
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }

    private int seedJuzs(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR IGNORE INTO Juzs (juz_id, juz_number) VALUES (?, ?)")) {
            for (int juz = 1; juz <= JUZ_COUNT; juz++) {
                ps.setInt(1, juz);
                ps.setInt(2, juz);
                ps.addBatch();
            }
            return sum(ps.executeBatch());
        }
    }

    private int seedHezbs(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR IGNORE INTO Hezbs (hezb_id, hezb_number, juz_id) VALUES (?, ?, ?)")) {
            for (int hezb = 1; hezb <= JUZ_COUNT * hezbsPerJuz; hezb++) {
                ps.setInt(1, hezb);
                ps.setInt(2, hezb);
                ps.setInt(3, juzOfHezb(hezb));
                ps.addBatch();
            }
            return sum(ps.executeBatch());
        }
    }

    private int seedPages(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR IGNORE INTO Pages (page_id, page_number) VALUES (?, ?)")) {
            for (int page = 1; page <= pageCount; page++) {
                ps.setInt(1, page);
                ps.setInt(2, page);
                ps.addBatch();
            }
            return sum(ps.executeBatch());
        }
    }

    private int seedSuras(Connection conn, List<ChapterRecord> chapters) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("""
            INSERT OR IGNORE INTO Suras (sura_id, name_arabic, revelation_order, ayat_count)
            VALUES (?, ?, ?, ?)
        """)) {
            for (ChapterRecord chapter : chapters) {
                ps.setInt(1, chapter.getSuraId());
                ps.setString(2, chapter.getNameArabic());
                ps.setInt(3, chapter.getRevelationOrder());
                ps.setInt(4, chapter.getAyatCount());
                ps.addBatch();
            }
            return sum(ps.executeBatch());
        }
    }

    /** Hezbs 1..n go to Juz 1, n+1..2n to Juz 2, and so on. */
    public int juzOfHezb(int hezbNumber) {
        return ((hezbNumber - 1) / hezbsPerJuz) + 1;
    }

    private static int sum(int[] counts) {
        int total = 0;
        for (int c : counts) {
            if (c > 0) {
                total += c;
            }
        }
        return total;
    }

    public record SeedCounts(int suras, int juzs, int hezbs, int pages) {
    }
}
