package com.syntex.quranstore.ingest;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.syntex.quranstore.TestStore;
import com.syntex.quranstore.db.DatabaseManager;
import com.syntex.quranstore.db.StaticSeeder;
import com.syntex.quranstore.db.model.ChapterRecord;
import com.syntex.quranstore.db.model.VerseKey;
import com.syntex.quranstore.db.model.VerseRecord;
import com.syntex.quranstore.db.writer.UpsertWriter;
import com.syntex.quranstore.enrich.EnrichmentEngine;
import com.syntex.quranstore.enrich.EnrichmentReport;
import com.syntex.quranstore.enrich.StoreVerifier;
import com.syntex.quranstore.fetch.ResourceFetcher;
import com.syntex.quranstore.net.FailureKind;
import com.syntex.quranstore.net.FetchFailure;
import com.syntex.quranstore.net.FetchResult;

/**
 * Ingest, enrich and verify against a real store, with 4 verses per juz and
 * 2 per hezb and page.
 */
class IngestionPipelineTest {

    private static final int VERSES = 120;

    @TempDir
    Path dir;

    private DatabaseManager db;
    private List<VerseKey> keys;

    @BeforeEach
    void setUp() throws Exception {
        db = TestStore.empty(dir);
        try (Connection conn = db.getConnection()) {
            new StaticSeeder(2, 60).seed(conn, List.of(
                    new ChapterRecord(1, "الفاتحة", 5, 7),
                    new ChapterRecord(2, "البقرة", 87, VERSES - 7)));
            keys = KeySpace.fromStore(conn);
        }
    }

    private static VerseRecord layout(VerseKey key) {
        int i = key.ayatId() - 1;
        VerseRecord verse = TestStore.verse(key.ayatId(), key.suraId(), key.ayatNumber(),
                i / 4 + 1, i / 2 + 1, i / 2 + 1);
        verse.getWords().add(TestStore.word(key.ayatId() * 10, key.ayatId(), 1, i / 2 + 1, 1 + i % 15));
        verse.getWords().add(TestStore.word(key.ayatId() * 10 + 1, key.ayatId(), 2, i / 2 + 1, 1 + i % 15));
        return verse;
    }

    private static ResourceFetcher failingOn(Set<Integer> failing) {
        return key -> failing.contains(key.ayatId())
                ? FetchResult.failure(new FetchFailure(FailureKind.SERVER_ERROR, 6, "HTTP 503"))
                : FetchResult.success(layout(key), 1);
    }

    @Test
    void fullRunProducesAConsistentStore() throws Exception {
        try (UpsertWriter writer = new UpsertWriter(db)) {
            IngestReport report = new IngestionOrchestrator(failingOn(Set.of()), writer)
                    .run(keys, new IngestOptions(RefreshMode.FORCE_REFRESH, 3, 50));
            assertThat(report.getSucceeded()).isEqualTo(VERSES);
            assertThat(report.hasFailures()).isFalse();
        }

        EnrichmentReport enrichment = new EnrichmentEngine(db).runAll();

        assertThat(enrichment.getFailures()).isEmpty();
        assertThat(TestStore.dump(db, "SELECT first_ayat_id, last_ayat_id, verses_count FROM Juzs WHERE juz_id = 30"))
                .containsExactly("117|120|4|");
        assertThat(TestStore.queryInt(db, "SELECT page_number FROM Hezbs WHERE hezb_id = 60")).isEqualTo(60);
        assertThat(TestStore.dump(db, "SELECT page_number, line_number FROM Suras WHERE sura_id = 2"))
                .containsExactly("4|8|");
        assertThat(new StoreVerifier(db).verifyAll(2)).isEmpty();
    }

    @Test
    void rerunFillsOnlyTheUnitsThatFailed() throws Exception {
        IngestReport first;
        IngestReport second;
        List<VerseKey> fetchedOnRerun = new ArrayList<>();
        try (UpsertWriter writer = new UpsertWriter(db)) {
            first = new IngestionOrchestrator(failingOn(Set.of(5, 77)), writer)
                    .run(keys, IngestOptions.defaults());

            ResourceFetcher recording = key -> {
                fetchedOnRerun.add(key);
                return FetchResult.success(layout(key), 1);
            };
            second = new IngestionOrchestrator(recording, writer).run(keys, IngestOptions.defaults());
        }

        assertThat(first.getFailures()).extracting(f -> f.key().ayatId()).containsExactly(5, 77);
        assertThat(first.getFailures()).allMatch(f -> f.kind() == FailureKind.SERVER_ERROR && f.attempts() == 6);
        assertThat(second.getSkipped()).isEqualTo(VERSES - 2);
        assertThat(fetchedOnRerun).extracting(VerseKey::ayatId).containsExactly(5, 77);
        assertThat(TestStore.queryInt(db, "SELECT COUNT(*) FROM Ayats")).isEqualTo(VERSES);
        assertThat(TestStore.queryInt(db, "SELECT COUNT(*) FROM Words")).isEqualTo(VERSES * 2);
    }

    @Test
    void forceRefreshRewritesWithoutDuplicating() throws Exception {
        try (UpsertWriter writer = new UpsertWriter(db)) {
            IngestionOrchestrator orchestrator = new IngestionOrchestrator(failingOn(Set.of()), writer);
            orchestrator.run(keys, new IngestOptions(RefreshMode.FORCE_REFRESH, 2, 100));
            List<String> before = TestStore.dump(db, "SELECT * FROM Ayats ORDER BY ayat_id");

            IngestReport again = orchestrator.run(keys, new IngestOptions(RefreshMode.FORCE_REFRESH, 2, 100));

            assertThat(again.getSucceeded()).isEqualTo(VERSES);
            assertThat(TestStore.dump(db, "SELECT * FROM Ayats ORDER BY ayat_id")).isEqualTo(before);
        }
        assertThat(TestStore.queryInt(db, "SELECT COUNT(*) FROM Words")).isEqualTo(VERSES * 2);
    }

    @Test
    void interruptedRunLeavesOnlyWholeUnits() throws Exception {
        Thread runner = Thread.currentThread();
        ResourceFetcher interrupting = key -> {
            if (key.ayatId() == 60) {
                runner.interrupt();
            }
            return FetchResult.success(layout(key), 1);
        };

        IngestReport report;
        try (UpsertWriter writer = new UpsertWriter(db)) {
            report = new IngestionOrchestrator(interrupting, writer)
                    .run(keys, new IngestOptions(RefreshMode.FORCE_REFRESH, 3, 50));
        } finally {
            Thread.interrupted();
        }

        assertThat(report.isCancelled()).isTrue();
        assertThat(report.getSucceeded()).isLessThan(VERSES);
        assertThat(TestStore.queryInt(db, "SELECT COUNT(*) FROM Ayats")).isEqualTo(report.getSucceeded());
        assertThat(TestStore.queryInt(db, "SELECT COUNT(*) FROM Words")).isEqualTo(report.getSucceeded() * 2);
        assertThat(TestStore.queryInt(db, "SELECT COUNT(*) FROM Ayats a "
                + "WHERE (SELECT COUNT(*) FROM Words w WHERE w.ayat_id = a.ayat_id) <> 2")).isZero();
    }
}
