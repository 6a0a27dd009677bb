package com.syntex.quranstore.commands;

import java.util.concurrent.Callable;

import com.syntex.quranstore.Config;
import com.syntex.quranstore.StoreContext;
import com.syntex.quranstore.enrich.EnrichmentEngine;
import com.syntex.quranstore.enrich.EnrichmentReport;

import picocli.CommandLine;

@CommandLine.Command(
        name = "enrich",
        description = "Derive juz ranges, juz/hezb pages and sura page/line from ingested verses"
)
public class EnrichCommand implements Callable<Integer> {

    enum Pass { ALL, JUZ_RANGES, PAGES, SURA_LINES }

    @CommandLine.Mixin
    private StoreOptions store = new StoreOptions();

    @CommandLine.Option(
            names = {"--pass"},
            description = "Pass to run: ${COMPLETION-CANDIDATES} (default: ALL)"
    )
    private Pass pass = Pass.ALL;

    @Override
    public Integer call() {
        StoreContext context = new StoreContext(new Config());
        EnrichmentEngine engine = new EnrichmentEngine(context.databaseManager(store.db));
        try {
            EnrichmentReport report = new EnrichmentReport();
            switch (pass) {
                case JUZ_RANGES -> report.add(engine.updateJuzRanges());
                case PAGES -> report.add(engine.updatePageNumbers());
                case SURA_LINES -> report.add(engine.updateSuraPageLines());
                default -> report = engine.runAll();
            }
            report.print(System.out);
            return report.getFailures().isEmpty() ? 0 : 1;
        } catch (Exception e) {
            System.err.println("❌ Enrichment failed: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }
}
