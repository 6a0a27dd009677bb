package com.syntex.quranstore.commands;

import java.sql.Connection;
import java.util.List;
import java.util.concurrent.Callable;

import com.syntex.quranstore.Config;
import com.syntex.quranstore.StoreContext;
import com.syntex.quranstore.db.DatabaseManager;
import com.syntex.quranstore.db.SchemaInitializer;
import com.syntex.quranstore.db.model.VerseKey;
import com.syntex.quranstore.db.writer.UpsertWriter;
import com.syntex.quranstore.ingest.IngestOptions;
import com.syntex.quranstore.ingest.IngestReport;
import com.syntex.quranstore.ingest.IngestionOrchestrator;
import com.syntex.quranstore.ingest.KeySpace;
import com.syntex.quranstore.ingest.RefreshMode;
import com.syntex.quranstore.ingest.StoreNotSeededException;
import com.syntex.quranstore.net.RetryClient;

import picocli.CommandLine;

@CommandLine.Command(
        name = "ingest",
        description = "Download verses and words into a seeded store"
)
public class IngestCommand implements Callable<Integer> {

    private static final long SHUTDOWN_GRACE_MILLIS = 30_000;

    @CommandLine.Mixin
    private StoreOptions store = new StoreOptions();

    @CommandLine.Option(names = {"--from"}, description = "First ayat id to process")
    private Integer from;

    @CommandLine.Option(names = {"--to"}, description = "Last ayat id to process")
    private Integer to;

    @CommandLine.Option(
            names = {"--force"},
            description = "Re-fetch verses already complete in the store"
    )
    private boolean force = false;

    @CommandLine.Option(
            names = {"--workers"},
            description = "Parallel fetchers (default: ingest.workers / QURAN_MAX_WORKERS)"
    )
    private Integer workers;

    @CommandLine.Option(
            names = {"--max-attempts"},
            description = "Attempts per request before giving up (default: retry.max-attempts)"
    )
    private Integer maxAttempts;

    @Override
    public Integer call() {
        StoreContext context = new StoreContext(new Config());
        Config config = context.getConfig();
        DatabaseManager db = context.databaseManager(store.db);
        RetryClient client = context.retryClient(maxAttempts);

        IngestOptions options = new IngestOptions(
                force ? RefreshMode.FORCE_REFRESH : RefreshMode.FILL_MISSING,
                workers != null ? workers : config.getInt("ingest.workers", 1),
                config.getInt("ingest.progress-every", 250));

        try (Connection conn = db.getConnection(); UpsertWriter writer = new UpsertWriter(db)) {
            SchemaInitializer.init(conn);
            List<VerseKey> keys = KeySpace.slice(KeySpace.fromStore(conn), from, to);

            IngestionOrchestrator orchestrator = new IngestionOrchestrator(context.fetcher(client), writer);
            // the hook is released only once the summary is printed
            try (CancelOnShutdown ignored = CancelOnShutdown.install(orchestrator::cancel, SHUTDOWN_GRACE_MILLIS)) {
                IngestReport report = orchestrator.run(keys, options);
                report.print(System.out);
                System.out.println("HTTP requests: " + client.getRequestCount() + ", retries: "
                        + client.getRetryCount() + ", rate limited: " + client.getRateLimitedCount());
                return report.hasFailures() || report.isCancelled() ? 1 : 0;
            }
        } catch (StoreNotSeededException e) {
            System.err.println("❌ " + e.getMessage() + " (run 'seed' first)");
            return 2;
        } catch (Exception e) {
            System.err.println("❌ Ingestion aborted: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }
}
