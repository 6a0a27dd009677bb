package com.syntex.quranstore.enrich;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

public class EnrichmentReport {

    private final List<PassResult> passes = new ArrayList<>();

    public void add(PassResult pass) {
        passes.add(pass);
    }

    public List<PassResult> getPasses() {
        return List.copyOf(passes);
    }

    public List<GroupFailure> getFailures() {
        List<GroupFailure> all = new ArrayList<>();
        passes.forEach(p -> all.addAll(p.failures()));
        return all;
    }

    public void print(PrintStream out) {
        for (PassResult pass : passes) {
            out.println((pass.isClean() ? "✅ " : "⚠ ") + pass.pass() + ": " + pass.updated() + " row(s) updated"
                    + (pass.isClean() ? "" : ", " + pass.failures().size() + " group(s) left untouched"));
            pass.failures().forEach(f -> out.println("  ❌ " + f));
        }
    }
}
