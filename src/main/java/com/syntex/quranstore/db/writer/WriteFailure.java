package com.syntex.quranstore.db.writer;

import com.syntex.quranstore.net.FailureKind;

public record WriteFailure(FailureKind kind, String reason) {

    public static WriteFailure constraint(String reason) {
        return new WriteFailure(FailureKind.WRITE_CONSTRAINT_VIOLATION, reason);
    }
}
