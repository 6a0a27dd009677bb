package com.syntex.quranstore.enrich;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.syntex.quranstore.db.DatabaseManager;
import com.syntex.quranstore.db.SchemaInitializer;

/**
 * Derives structural metadata from the verses already in the store. Each pass
 * reads and writes inside a single transaction, only touches derived columns,
 * and gives the same result however many times it runs over the same data.
 * <p>
 * A group no verse references is reported and keeps whatever values it had.
 */
public class EnrichmentEngine {

    private final DatabaseManager databaseManager;

    public EnrichmentEngine(DatabaseManager databaseManager) {
        this.databaseManager = databaseManager;
    }

    public EnrichmentReport runAll() throws SQLException {
        EnrichmentReport report = new EnrichmentReport();
        report.add(updateJuzRanges());
        report.add(updatePageNumbers());
        report.add(updateSuraPageLines());
        return report;
    }

    /**
     * first_ayat_id / last_ayat_id / verses_count for every Juz.
     */
    public PassResult updateJuzRanges() throws SQLException {
        return inTransaction("juz ranges", conn -> {
            Map<Integer, int[]> ranges = new HashMap<>();
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("""
                     SELECT juz_id, MIN(ayat_id) AS first_id, MAX(ayat_id) AS last_id, COUNT(*) AS owned
                       FROM Ayats
                      GROUP BY juz_id
                 """)) {
                while (rs.next()) {
                    ranges.put(rs.getInt("juz_id"),
                            new int[]{rs.getInt("first_id"), rs.getInt("last_id"), rs.getInt("owned")});
                }
            }

            int updated = 0;
            List<GroupFailure> failures = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE Juzs SET first_ayat_id = ?, last_ayat_id = ?, verses_count = ? WHERE juz_id = ?")) {
                for (int juzId : ids(conn, "SELECT juz_id FROM Juzs ORDER BY juz_id")) {
                    int[] range = ranges.get(juzId);
                    if (range == null) {
                        failures.add(new GroupFailure("Juz", juzId, "no verses reference it"));
                        continue;
                    }
                    int span = range[1] - range[0] + 1;
                    if (span != range[2]) {
                        System.err.println("⚠ Juz " + juzId + " spans " + span + " ids but owns "
                                + range[2] + " verses; the store is missing verses in that range");
                    }
                    ps.setInt(1, range[0]);
                    ps.setInt(2, range[1]);
                    ps.setInt(3, span);
                    ps.setInt(4, juzId);
                    updated += ps.executeUpdate();
                }
            }
            return new PassResult("juz ranges", updated, failures);
        });
    }

    /**
     * page_number on every Juz and Hezb: the smallest page among the verses
     * that reference that group directly.
     */
    public PassResult updatePageNumbers() throws SQLException {
        return inTransaction("juz/hezb pages", conn -> {
            List<GroupFailure> failures = new ArrayList<>();
            int updated = propagateMinPage(conn, "Juz", "Juzs", "juz_id", failures)
                    + propagateMinPage(conn, "Hezb", "Hezbs", "hezb_id", failures);
            return new PassResult("juz/hezb pages", updated, failures);
        });
    }

    private int propagateMinPage(Connection conn, String group, String table, String key,
                                 List<GroupFailure> failures) throws SQLException {
        Map<Integer, Integer> minPages = new HashMap<>();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(
                     "SELECT a." + key + " AS group_id, MIN(p.page_number) AS min_page"
                     + " FROM Ayats a JOIN Pages p ON p.page_id = a.page_id"
                     + " GROUP BY a." + key)) {
            while (rs.next()) {
                minPages.put(rs.getInt("group_id"), rs.getInt("min_page"));
            }
        }

        int updated = 0;
        try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE " + table + " SET page_number = ? WHERE " + key + " = ?")) {
            for (int id : ids(conn, "SELECT " + key + " FROM " + table + " ORDER BY " + key)) {
                Integer page = minPages.get(id);
                if (page == null) {
                    failures.add(new GroupFailure(group, id, "no verses reference it"));
                    continue;
                }
                ps.setInt(1, page);
                ps.setInt(2, id);
                updated += ps.executeUpdate();
            }
        }
        return updated;
    }

    /**
     * page_number / line_number on every Sura, copied from the first word of
     * its first verse.
     */
    public PassResult updateSuraPageLines() throws SQLException {
        return inTransaction("sura page/line", conn -> {
            Map<Integer, Integer> firstAyat = new HashMap<>();
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery(
                         "SELECT sura_id, MIN(ayat_id) AS first_id FROM Ayats GROUP BY sura_id")) {
                while (rs.next()) {
                    firstAyat.put(rs.getInt("sura_id"), rs.getInt("first_id"));
                }
            }

            int updated = 0;
            List<GroupFailure> failures = new ArrayList<>();
            try (PreparedStatement firstWord = conn.prepareStatement("""
                     SELECT page_number, line_number
                       FROM Words
                      WHERE ayat_id = ?
                      ORDER BY word_number
                      LIMIT 1
                 """);
                 PreparedStatement update = conn.prepareStatement(
                         "UPDATE Suras SET page_number = ?, line_number = ? WHERE sura_id = ?")) {
                for (int suraId : ids(conn, "SELECT sura_id FROM Suras ORDER BY sura_id")) {
                    Integer ayatId = firstAyat.get(suraId);
                    if (ayatId == null) {
                        failures.add(new GroupFailure("Sura", suraId, "no verses reference it"));
                        continue;
                    }
                    firstWord.setInt(1, ayatId);
                    try (ResultSet rs = firstWord.executeQuery()) {
                        if (!rs.next()) {
                            failures.add(new GroupFailure("Sura", suraId, "first verse " + ayatId + " has no words"));
                            continue;
                        }
                        int page = rs.getInt("page_number");
                        boolean pageMissing = rs.wasNull();
                        int line = rs.getInt("line_number");
                        if (pageMissing || rs.wasNull()) {
                            failures.add(new GroupFailure("Sura", suraId,
                                    "first word of verse " + ayatId + " has no page/line layout"));
                            continue;
                        }
                        update.setInt(1, page);
                        update.setInt(2, line);
                        update.setInt(3, suraId);
                        updated += update.executeUpdate();
                    }
                }
            }
            return new PassResult("sura page/line", updated, failures);
        });
    }

    private PassResult inTransaction(String pass, PassWork work) throws SQLException {
        System.out.println("⏳ Enrichment pass: " + pass);
        try (Connection conn = databaseManager.getConnection()) {
            SchemaInitializer.ensureDerivedColumns(conn);
            conn.setAutoCommit(false);
            try {
                PassResult result = work.run(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        }
    }

    private static List<Integer> ids(Connection conn, String sql) throws SQLException {
        List<Integer> ids = new ArrayList<>();
        try (Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                ids.add(rs.getInt(1));
            }
        }
        return ids;
    }

    @FunctionalInterface
    private interface PassWork {
        PassResult run(Connection conn) throws SQLException;
    }
}
