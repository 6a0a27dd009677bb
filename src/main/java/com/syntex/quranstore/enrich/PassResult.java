package com.syntex.quranstore.enrich;

import java.util.List;

public record PassResult(String pass, int updated, List<GroupFailure> failures) {

    public PassResult {
        failures = List.copyOf(failures);
    }

    public boolean isClean() {
        return failures.isEmpty();
    }
}
