package com.syntex.quranstore.ingest;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import com.syntex.quranstore.db.model.VerseKey;
import com.syntex.quranstore.db.model.VerseRecord;
import com.syntex.quranstore.db.writer.UpsertWriter;
import com.syntex.quranstore.db.writer.WriteResult;
import com.syntex.quranstore.fetch.ResourceFetcher;
import com.syntex.quranstore.net.FetchFailure;
import com.syntex.quranstore.net.FetchResult;

/**
 * Walks a key space once in ascending ayat id order: fetch, write, record.
 * <p>
 * With more than one worker, fetches run on a pool while this thread stays the
 * only writer and applies results in key order. A failed unit is recorded and
 * the run moves on. Interrupting the calling thread, or {@link #cancel()}, stops
 * the run between units; everything written so far stays committed.
 */
public class IngestionOrchestrator {

    private final ResourceFetcher fetcher;
    private final UpsertWriter writer;
    private final AtomicBoolean cancelRequested = new AtomicBoolean();

    public IngestionOrchestrator(ResourceFetcher fetcher, UpsertWriter writer) {
        this.fetcher = fetcher;
        this.writer = writer;
    }

    public IngestReport run(List<VerseKey> keySpace, IngestOptions options) throws SQLException {
        if (!writer.isSeeded()) {
            throw new StoreNotSeededException(
                    "Store is not seeded: Suras, Juzs, Hezbs and Pages must have rows before ingestion");
        }

        List<VerseKey> keys = new ArrayList<>(keySpace);
        Collections.sort(keys);
        IngestReport report = new IngestReport(keys.size());
        long start = System.nanoTime();

        ExecutorService pool = options.workers() > 1
                ? Executors.newFixedThreadPool(options.workers(), fetcherThreads())
                : null;
        int window = options.workers() > 1 ? options.workers() * 2 : 1;
        Deque<PendingUnit> pending = new ArrayDeque<>();

        System.out.println("⏳ Ingesting " + keys.size() + " verses with " + options.workers()
                + " fetch worker(s), mode " + options.refreshMode());
        try {
            for (VerseKey key : keys) {
                if (isCancelled()) {
                    break;
                }
                if (options.refreshMode() == RefreshMode.FILL_MISSING && writer.isComplete(key.ayatId())) {
                    report.recordSkip();
                    progress(report, options);
                    continue;
                }
                pending.addLast(submit(pool, key));
                while (pending.size() >= window && !isCancelled()) {
                    complete(pending.removeFirst(), report, options);
                }
            }
            while (!pending.isEmpty() && !isCancelled()) {
                complete(pending.removeFirst(), report, options);
            }
        } finally {
            if (isCancelled()) {
                report.markCancelled();
                pending.forEach(p -> p.future().cancel(true));
            }
            cancelRequested.set(false);
            if (pool != null) {
                pool.shutdownNow();
            }
            report.setElapsed(Duration.ofNanos(System.nanoTime() - start));
        }
        return report;
    }

    /**
     * Stops the current run before its next unit. A cancel issued before
     * {@link #run} starts stops that run before its first unit.
     */
    public void cancel() {
        cancelRequested.set(true);
    }

    private boolean isCancelled() {
        return cancelRequested.get() || Thread.currentThread().isInterrupted();
    }

    private PendingUnit submit(ExecutorService pool, VerseKey key) {
        if (pool == null) {
            return new PendingUnit(key, CompletableFuture.completedFuture(fetchSafely(key)));
        }
        return new PendingUnit(key, pool.submit(() -> fetchSafely(key)));
    }

    private FetchResult<VerseRecord> fetchSafely(VerseKey key) {
        try {
            return fetcher.fetchUnit(key);
        } catch (RuntimeException e) {
            return FetchResult.failure(FetchFailure.permanent(1, "Unexpected fetch error: " + e));
        }
    }

    private void complete(PendingUnit unit, IngestReport report, IngestOptions options) {
        FetchResult<VerseRecord> result;
        try {
            result = unit.future().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        } catch (ExecutionException e) {
            result = FetchResult.failure(FetchFailure.permanent(1, "Fetch task failed: " + e.getCause()));
        }

        if (!result.isSuccess()) {
            FetchFailure failure = result.failure();
            fail(report, new UnitFailure(unit.key(), failure.kind(), failure.attempts(), failure.lastError()));
        } else {
            WriteResult written = writer.upsertVerse(result.value());
            if (written.isSuccess()) {
                report.recordSuccess();
            } else {
                fail(report, new UnitFailure(unit.key(), written.failure().kind(), result.attempts(),
                        written.failure().reason()));
            }
        }
        progress(report, options);
    }

    private static void fail(IngestReport report, UnitFailure failure) {
        report.recordFailure(failure);
        System.err.println("❌ " + failure);
    }

    private static void progress(IngestReport report, IngestOptions options) {
        int attempted = report.getAttempted();
        if (attempted % options.progressEvery() == 0 || attempted == report.getTotal()) {
            System.out.println("⏳ Processed " + attempted + "/" + report.getTotal()
                    + " (" + report.getSucceeded() + " written, " + report.getSkipped() + " skipped, "
                    + report.getFailures().size() + " failed)");
        }
    }

    private static ThreadFactory fetcherThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, "ayah-fetch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private record PendingUnit(VerseKey key, Future<FetchResult<VerseRecord>> future) {
    }
}
