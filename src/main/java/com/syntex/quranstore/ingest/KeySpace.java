package com.syntex.quranstore.ingest;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import com.syntex.quranstore.db.model.VerseKey;

/**
 * The ordered list of verse keys a run walks over. Ayat ids are the running
 * index over (sura_id, ayat_number) in canonical order, matching the ids the
 * remote API assigns.
 */
public final class KeySpace {

    private KeySpace() {
    }

    public static List<VerseKey> fromStore(Connection conn) throws SQLException {
        List<VerseKey> keys = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT sura_id, ayat_count FROM Suras ORDER BY sura_id")) {
            int ayatId = 1;
            while (rs.next()) {
                int suraId = rs.getInt("sura_id");
                int count = rs.getInt("ayat_count");
                for (int ayatNumber = 1; ayatNumber <= count; ayatNumber++) {
                    keys.add(new VerseKey(ayatId++, suraId, ayatNumber));
                }
            }
        }
        return keys;
    }

    /** Keeps keys whose ayat id lies in [from, to]; a null bound is open. */
    public static List<VerseKey> slice(List<VerseKey> keys, Integer from, Integer to) {
        List<VerseKey> out = new ArrayList<>();
        for (VerseKey key : keys) {
            if ((from == null || key.ayatId() >= from) && (to == null || key.ayatId() <= to)) {
                out.add(key);
            }
        }
        return out;
    }
}
