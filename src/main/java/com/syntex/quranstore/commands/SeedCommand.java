package com.syntex.quranstore.commands;

import java.sql.Connection;
import java.util.List;
import java.util.concurrent.Callable;

import com.syntex.quranstore.Config;
import com.syntex.quranstore.StoreContext;
import com.syntex.quranstore.db.DatabaseManager;
import com.syntex.quranstore.db.SchemaInitializer;
import com.syntex.quranstore.db.StaticSeeder;
import com.syntex.quranstore.db.model.ChapterRecord;
import com.syntex.quranstore.net.FetchResult;
import com.syntex.quranstore.net.RetryClient;

import picocli.CommandLine;

@CommandLine.Command(
        name = "seed",
        description = "Create the schema and seed Suras, Juzs, Hezbs and Pages"
)
public class SeedCommand implements Callable<Integer> {

    @CommandLine.Mixin
    private StoreOptions store = new StoreOptions();

    @CommandLine.Option(
            names = {"--hezbs-per-juz"},
            description = "Hezbs owned by each Juz (default: seed.hezbs-per-juz, 2)"
    )
    private Integer hezbsPerJuz;

    @CommandLine.Option(
            names = {"--pages"},
            description = "Number of mushaf pages (default: seed.page-count, 604)"
    )
    private Integer pageCount;

    @Override
    public Integer call() {
        StoreContext context = new StoreContext(new Config());
        Config config = context.getConfig();
        DatabaseManager db = context.databaseManager(store.db);

        RetryClient client = context.retryClient(null);
        System.out.println("⏳ Fetching chapter list...");
        FetchResult<List<ChapterRecord>> chapters = context.fetcher(client).fetchChapters();
        if (!chapters.isSuccess()) {
            System.err.println("❌ Could not fetch chapters: " + chapters.failure());
            return 1;
        }

        StaticSeeder seeder = new StaticSeeder(
                hezbsPerJuz != null ? hezbsPerJuz : config.getInt("seed.hezbs-per-juz", 2),
                pageCount != null ? pageCount : config.getInt("seed.page-count", 604));
        try (Connection conn = db.getConnection()) {
            SchemaInitializer.init(conn);
            StaticSeeder.SeedCounts counts = seeder.seed(conn, chapters.value());
            System.out.println("✅ Seeded " + counts.suras() + " suras, " + counts.juzs() + " juzs, "
                    + counts.hezbs() + " hezbs, " + counts.pages() + " pages (existing rows kept)");
            return 0;
        } catch (Exception e) {
            System.err.println("❌ Seeding failed: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }
}
