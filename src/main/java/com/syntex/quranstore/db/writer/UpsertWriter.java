package com.syntex.quranstore.db.writer;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.concurrent.locks.ReentrantLock;

import com.syntex.quranstore.db.DatabaseManager;
import com.syntex.quranstore.db.model.VerseRecord;
import com.syntex.quranstore.db.model.WordRecord;

/**
 * Idempotent insert-or-update of Ayats and Words keyed by their upstream ids.
 * <p>
 * Each verse is written together with its words in one transaction, after its
 * Sura, Juz, Hezb and Page have been checked inside that same transaction. A
 * failed write rolls back completely and comes back as a {@link WriteFailure}.
 * Optional columns are merged: a blank incoming value never replaces a stored
 * one. Derived columns on Suras, Juzs and Hezbs are never touched here.
 */
public class UpsertWriter implements AutoCloseable {

    private static final String UPSERT_AYAT = """
        INSERT INTO Ayats (
            ayat_id, sura_id, ayat_number, text_uthmani, juz_id, hezb_id, page_id,
            sajdah_number, audio_url, audio_segments
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT(ayat_id) DO UPDATE SET
            sura_id = excluded.sura_id,
            ayat_number = excluded.ayat_number,
            text_uthmani = COALESCE(NULLIF(excluded.text_uthmani, ''), Ayats.text_uthmani),
            juz_id = excluded.juz_id,
            hezb_id = excluded.hezb_id,
            page_id = excluded.page_id,
            sajdah_number = COALESCE(excluded.sajdah_number, Ayats.sajdah_number),
            audio_url = COALESCE(NULLIF(excluded.audio_url, ''), Ayats.audio_url),
            audio_segments = COALESCE(NULLIF(excluded.audio_segments, ''), Ayats.audio_segments)
    """;

    private static final String UPSERT_WORD = """
        INSERT INTO Words (
            word_id, ayat_id, word_number, text_uthmani, type, page_number, line_number, audio_url
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT(word_id) DO UPDATE SET
            ayat_id = excluded.ayat_id,
            word_number = excluded.word_number,
            text_uthmani = COALESCE(NULLIF(excluded.text_uthmani, ''), Words.text_uthmani),
            type = COALESCE(NULLIF(excluded.type, ''), Words.type),
            page_number = COALESCE(excluded.page_number, Words.page_number),
            line_number = COALESCE(excluded.line_number, Words.line_number),
            audio_url = COALESCE(NULLIF(excluded.audio_url, ''), Words.audio_url)
    """;

    private final Connection conn;
    private final ReentrantLock writeLock = new ReentrantLock();

    public UpsertWriter(DatabaseManager databaseManager) throws SQLException {
        this.conn = databaseManager.getConnection();
    }

    public WriteResult upsertVerse(VerseRecord verse) {
        writeLock.lock();
        try {
            return inTransaction("verse " + verse.getSuraId() + ":" + verse.getAyatNumber(), () -> {
                String missing = missingVerseReference(verse);
                if (missing != null) {
                    return WriteResult.failed(WriteFailure.constraint(missing));
                }
                writeAyat(verse);
                try (PreparedStatement ps = conn.prepareStatement(UPSERT_WORD)) {
                    for (WordRecord word : verse.getWords()) {
                        if (word.getAyatId() != verse.getAyatId()) {
                            return WriteResult.failed(WriteFailure.constraint("Word " + word.getWordId()
                                    + " claims ayat " + word.getAyatId() + " inside ayat " + verse.getAyatId()));
                        }
                        bindWord(ps, word);
                        ps.addBatch();
                    }
                    ps.executeBatch();
                }
                return WriteResult.ok(1 + verse.getWords().size());
            });
        } finally {
            writeLock.unlock();
        }
    }

    public WriteResult upsertWord(WordRecord word) {
        writeLock.lock();
        try {
            return inTransaction("word " + word.getWordId(), () -> {
                if (!exists("SELECT 1 FROM Ayats WHERE ayat_id = ?", word.getAyatId())) {
                    return WriteResult.failed(WriteFailure.constraint(
                            "Ayats row " + word.getAyatId() + " does not exist for word " + word.getWordId()));
                }
                try (PreparedStatement ps = conn.prepareStatement(UPSERT_WORD)) {
                    bindWord(ps, word);
                    ps.executeUpdate();
                }
                return WriteResult.ok(1);
            });
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * A verse counts as complete once it has text and at least one word.
     */
    public boolean isComplete(int ayatId) throws SQLException {
        writeLock.lock();
        try (PreparedStatement ps = conn.prepareStatement("""
            SELECT a.text_uthmani,
                   (SELECT COUNT(*) FROM Words w WHERE w.ayat_id = a.ayat_id) AS word_count
              FROM Ayats a
             WHERE a.ayat_id = ?
        """)) {
            ps.setInt(1, ayatId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return false;
                }
                String text = rs.getString("text_uthmani");
                return text != null && !text.isBlank() && rs.getInt("word_count") > 0;
            }
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * True when the structural tables a verse must reference all have rows.
     */
    public boolean isSeeded() throws SQLException {
        writeLock.lock();
        try {
            for (String table : new String[]{"Suras", "Juzs", "Hezbs", "Pages"}) {
                if (!exists("SELECT 1 FROM " + table + " LIMIT 1")) {
                    return false;
                }
            }
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    private String missingVerseReference(VerseRecord verse) throws SQLException {
        if (!exists("SELECT 1 FROM Suras WHERE sura_id = ?", verse.getSuraId())) {
            return "Suras row " + verse.getSuraId() + " does not exist";
        }
        if (!exists("SELECT 1 FROM Juzs WHERE juz_id = ?", verse.getJuzId())) {
            return "Juzs row " + verse.getJuzId() + " does not exist";
        }
        if (!exists("SELECT 1 FROM Pages WHERE page_id = ?", verse.getPageId())) {
            return "Pages row " + verse.getPageId() + " does not exist";
        }
        try (PreparedStatement ps = conn.prepareStatement("SELECT juz_id FROM Hezbs WHERE hezb_id = ?")) {
            ps.setInt(1, verse.getHezbId());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return "Hezbs row " + verse.getHezbId() + " does not exist";
                }
                int owner = rs.getInt(1);
                if (owner != verse.getJuzId()) {
                    return "Hezb " + verse.getHezbId() + " belongs to juz " + owner + ", not juz " + verse.getJuzId();
                }
            }
        }
        return null;
    }

    private void writeAyat(VerseRecord verse) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(UPSERT_AYAT)) {
            ps.setInt(1, verse.getAyatId());
            ps.setInt(2, verse.getSuraId());
            ps.setInt(3, verse.getAyatNumber());
            ps.setString(4, verse.getTextUthmani());
            ps.setInt(5, verse.getJuzId());
            ps.setInt(6, verse.getHezbId());
            ps.setInt(7, verse.getPageId());
            setNullableInt(ps, 8, verse.getSajdahNumber());
            ps.setString(9, blankToNull(verse.getAudioUrl()));
            ps.setString(10, blankToNull(verse.getAudioSegments()));
            ps.executeUpdate();
        }
    }

    private static void bindWord(PreparedStatement ps, WordRecord word) throws SQLException {
        ps.setInt(1, word.getWordId());
        ps.setInt(2, word.getAyatId());
        ps.setInt(3, word.getWordNumber());
        ps.setString(4, word.getTextUthmani() == null ? "" : word.getTextUthmani());
        ps.setString(5, word.getType() == null ? "" : word.getType());
        setNullableInt(ps, 6, word.getPageNumber());
        setNullableInt(ps, 7, word.getLineNumber());
        ps.setString(8, blankToNull(word.getAudioUrl()));
    }

    private WriteResult inTransaction(String label, SqlWork work) {
        try {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                WriteResult result = work.run();
                if (result.isSuccess()) {
                    conn.commit();
                } else {
                    conn.rollback();
                }
                return result;
            } catch (SQLException e) {
                rollback(label, e);
                return WriteResult.failed(WriteFailure.constraint(label + ": " + e.getMessage()));
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            return WriteResult.failed(WriteFailure.constraint(label + ": " + e.getMessage()));
        }
    }

    private void rollback(String label, SQLException cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
            System.err.println("⚠ Rollback failed for " + label + ": " + e.getMessage());
        }
    }

    private boolean exists(String sql, int... params) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                ps.setInt(i + 1, params[i]);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private static void setNullableInt(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    @Override
    public void close() throws SQLException {
        conn.close();
    }

    @FunctionalInterface
    private interface SqlWork {
        WriteResult run() throws SQLException;
    }
}
