package com.syntex.quranstore.ingest;

import java.io.PrintStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one ingestion run. Failed units are listed with their failure
 * kind so an operator can re-run just those ids.
 */
public class IngestReport {

    private final int total;
    private int succeeded;
    private int skipped;
    private boolean cancelled;
    private Duration elapsed = Duration.ZERO;
    private final List<UnitFailure> failures = new ArrayList<>();

    IngestReport(int total) {
        this.total = total;
    }

    void recordSuccess() {
        succeeded++;
    }

    void recordSkip() {
        skipped++;
    }

    void recordFailure(UnitFailure failure) {
        failures.add(failure);
    }

    void markCancelled() {
        cancelled = true;
    }

    void setElapsed(Duration elapsed) {
        this.elapsed = elapsed;
    }

    public int getTotal() {
        return total;
    }

    public int getSucceeded() {
        return succeeded;
    }

    public int getSkipped() {
        return skipped;
    }

    public int getAttempted() {
        return succeeded + skipped + failures.size();
    }

    public List<UnitFailure> getFailures() {
        return Collections.unmodifiableList(failures);
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public void print(PrintStream out) {
        out.printf("%s Ingestion %s: %d succeeded, %d skipped, %d failed of %d units in %.1fs%n",
                cancelled ? "⚠" : (failures.isEmpty() ? "✅" : "⚠"),
                cancelled ? "cancelled" : "finished",
                succeeded, skipped, failures.size(), total, elapsed.toMillis() / 1000.0);
        for (UnitFailure failure : failures) {
            out.println("  ❌ " + failure);
        }
        if (!failures.isEmpty()) {
            out.println("Re-run the same key space to retry failed units; writes are idempotent.");
        }
    }
}
