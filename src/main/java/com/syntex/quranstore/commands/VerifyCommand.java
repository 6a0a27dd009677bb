package com.syntex.quranstore.commands;

import java.util.List;
import java.util.concurrent.Callable;

import com.syntex.quranstore.Config;
import com.syntex.quranstore.StoreContext;
import com.syntex.quranstore.enrich.StoreVerifier;

import picocli.CommandLine;

@CommandLine.Command(
        name = "verify",
        description = "Check page ordering, juz coverage and hezbs per juz"
)
public class VerifyCommand implements Callable<Integer> {

    @CommandLine.Mixin
    private StoreOptions store = new StoreOptions();

    @Override
    public Integer call() {
        StoreContext context = new StoreContext(new Config());
        StoreVerifier verifier = new StoreVerifier(context.databaseManager(store.db));
        try {
            List<String> violations = verifier.verifyAll(context.getConfig().getInt("seed.hezbs-per-juz", 2));
            if (violations.isEmpty()) {
                System.out.println("✅ Store is consistent");
                return 0;
            }
            violations.forEach(v -> System.out.println("❌ " + v));
            System.out.println("⚠ " + violations.size() + " violation(s)");
            return 1;
        } catch (Exception e) {
            System.err.println("❌ Verification failed: " + e.getMessage());
            return 1;
        }
    }
}
