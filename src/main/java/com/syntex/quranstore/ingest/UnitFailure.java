package com.syntex.quranstore.ingest;

import com.syntex.quranstore.db.model.VerseKey;
import com.syntex.quranstore.net.FailureKind;

public record UnitFailure(VerseKey key, FailureKind kind, int attempts, String reason) {

    @Override
    public String toString() {
        return key + " " + kind + " after " + attempts + " attempt(s): " + reason;
    }
}
