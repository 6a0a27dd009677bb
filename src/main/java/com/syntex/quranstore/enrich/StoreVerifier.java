package com.syntex.quranstore.enrich;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import com.syntex.quranstore.db.DatabaseManager;

/**
 * Read-only consistency checks over an ingested and enriched store. Each
 * check returns human readable violations; an empty list means it holds.
 */
public class StoreVerifier {

    private final DatabaseManager databaseManager;

    public StoreVerifier(DatabaseManager databaseManager) {
        this.databaseManager = databaseManager;
    }

    public List<String> verifyAll(int hezbsPerJuz) throws SQLException {
        List<String> violations = new ArrayList<>();
        violations.addAll(checkMonotonicPages());
        violations.addAll(checkJuzCoverage());
        violations.addAll(checkHezbsPerJuz(hezbsPerJuz));
        return violations;
    }

    /** Page numbers never go down as ayat ids go up. */
    public List<String> checkMonotonicPages() throws SQLException {
        List<String> violations = new ArrayList<>();
        try (Connection conn = databaseManager.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("""
                 SELECT a.ayat_id, p.page_number
                   FROM Ayats a JOIN Pages p ON p.page_id = a.page_id
                  ORDER BY a.ayat_id
             """)) {
            int previousPage = Integer.MIN_VALUE;
            int previousId = 0;
            while (rs.next()) {
                int ayatId = rs.getInt("ayat_id");
                int page = rs.getInt("page_number");
                if (page < previousPage) {
                    violations.add("Ayat " + ayatId + " is on page " + page
                            + " but ayat " + previousId + " is on page " + previousPage);
                }
                previousPage = page;
                previousId = ayatId;
            }
        }
        return violations;
    }

    /**
     * Juz ranges, taken in juz_number order, tile the ayat id space from the
     * smallest to the largest stored id with no gap or overlap.
     */
    public List<String> checkJuzCoverage() throws SQLException {
        List<String> violations = new ArrayList<>();
        try (Connection conn = databaseManager.getConnection();
             Statement stmt = conn.createStatement()) {
            int minId;
            int maxId;
            try (ResultSet rs = stmt.executeQuery("SELECT MIN(ayat_id), MAX(ayat_id), COUNT(*) FROM Ayats")) {
                rs.next();
                if (rs.getInt(3) == 0) {
                    return List.of("No verses in the store");
                }
                minId = rs.getInt(1);
                maxId = rs.getInt(2);
            }

            Integer expectedFirst = minId;
            try (ResultSet rs = stmt.executeQuery("""
                SELECT juz_number, first_ayat_id, last_ayat_id, verses_count
                  FROM Juzs
                 ORDER BY juz_number
            """)) {
                while (rs.next()) {
                    int juz = rs.getInt("juz_number");
                    int first = rs.getInt("first_ayat_id");
                    boolean firstMissing = rs.wasNull();
                    int last = rs.getInt("last_ayat_id");
                    if (firstMissing || rs.wasNull()) {
                        violations.add("Juz " + juz + " has no range");
                        expectedFirst = null;
                        continue;
                    }
                    if (expectedFirst != null && first != expectedFirst) {
                        violations.add("Juz " + juz + " starts at " + first + ", expected " + expectedFirst
                                + (first > expectedFirst ? " (gap)" : " (overlap)"));
                    }
                    int count = rs.getInt("verses_count");
                    if (count != last - first + 1) {
                        violations.add("Juz " + juz + " verses_count " + count + " != " + (last - first + 1));
                    }
                    expectedFirst = last + 1;
                }
            }
            if (expectedFirst != null && expectedFirst != maxId + 1) {
                violations.add("Last juz ends at " + (expectedFirst - 1) + ", expected " + maxId);
            }
        }
        return violations;
    }

    /** Every Juz owns the same configured number of Hezbs. */
    public List<String> checkHezbsPerJuz(int expected) throws SQLException {
        List<String> violations = new ArrayList<>();
        try (Connection conn = databaseManager.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("""
                 SELECT j.juz_id, COUNT(h.hezb_id) AS hezbs
                   FROM Juzs j LEFT JOIN Hezbs h ON h.juz_id = j.juz_id
                  GROUP BY j.juz_id
                  ORDER BY j.juz_id
             """)) {
            while (rs.next()) {
                int count = rs.getInt("hezbs");
                if (count != expected) {
                    violations.add("Juz " + rs.getInt("juz_id") + " owns " + count + " hezbs, expected " + expected);
                }
            }
        }
        return violations;
    }
}
